package com.flowsentinel.core.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Ordered, named numeric features passed to a scorer.
 *
 * <p>
 * Order and membership are fixed by the column list the vector was built
 * against; position {@code i} of {@link #values()} always belongs to
 * {@code names().get(i)}. Instances are immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class FeatureVector {

    private final List<String> names;
    private final double[] values;

    private FeatureVector(List<String> names, double[] values) {
        this.names = names;
        this.values = values;
    }

    /**
     * @param names  column names in scoring order; must not be {@code null}
     * @param values one value per column
     * @return a new vector
     * @throws IllegalArgumentException if the two lengths differ
     */
    public static FeatureVector of(List<String> names, double[] values) {
        Objects.requireNonNull(names, "Feature names must not be null");
        Objects.requireNonNull(values, "Feature values must not be null");
        if (names.size() != values.length) {
            throw new IllegalArgumentException("Expected " + names.size()
                    + " feature values, got " + values.length);
        }
        return new FeatureVector(List.copyOf(names), values.clone());
    }

    public List<String> names() {
        return names;
    }

    /**
     * @return a copy of the values in column order
     */
    public double[] values() {
        return values.clone();
    }

    public double get(int index) {
        return values[index];
    }

    /**
     * @param name column name
     * @return the value for {@code name}
     * @throws IllegalArgumentException if the vector has no such column
     */
    public double get(String name) {
        int index = names.indexOf(name);
        if (index < 0) {
            throw new IllegalArgumentException("No feature named '" + name + "' in " + names);
        }
        return values[index];
    }

    public int size() {
        return values.length;
    }

    /**
     * @return unmodifiable name-to-value view in column order
     */
    public Map<String, Double> asMap() {
        Map<String, Double> map = new LinkedHashMap<>();
        for (int i = 0; i < values.length; i++) {
            map.put(names.get(i), values[i]);
        }
        return Collections.unmodifiableMap(map);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof FeatureVector that))
            return false;
        return names.equals(that.names) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * names.hashCode() + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        return "FeatureVector" + asMap();
    }
}
