package com.flowsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should load every key from a classpath YAML file")
    void shouldLoadFromClasspath() {
        DetectorConfig config = ConfigLoader.fromClasspath("test-flow-sentinel.yml");

        assertThat(config.getEvePath()).isEqualTo(Path.of("/tmp/flow-sentinel-test/eve.json"));
        assertThat(config.getModelPath()).isEqualTo(Path.of("/tmp/flow-sentinel-test/model.json"));
        assertThat(config.getFeatureColumnsPath()).isEqualTo(Path.of("/tmp/flow-sentinel-test/columns.json"));
        assertThat(config.getAnomaliesPath()).isEqualTo(Path.of("/tmp/flow-sentinel-test/anomalies.json"));
        assertThat(config.getFeatureColumns()).containsExactly("total_packets", "total_bytes", "duration", "proto");
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(config.getFlushInterval()).isEqualTo(Duration.ofSeconds(2));
        assertThat(config.getStoreCapacity()).isEqualTo(500);
        assertThat(config.getWakeUpMode()).isEqualTo(WakeUpMode.WATCH);
        assertThat(config.getStatusPort()).isZero();
    }

    @Test
    @DisplayName("Should read the file named by the environment and apply variable overrides")
    void shouldApplyEnvironmentOverrides() throws IOException {
        Path yml = write("suricata:\n  eve_json_path: /from/yaml/eve.json\ndetection:\n  store_capacity: 20\n");
        Map<String, String> env = new HashMap<>();
        env.put(ConfigLoader.ENV_CONFIG_PATH, yml.toString());
        env.put(ConfigLoader.ENV_EVE_PATH, "/from/env/eve.json");
        env.put(ConfigLoader.ENV_POLL_INTERVAL_MS, "50");
        env.put(ConfigLoader.ENV_WAKE_UP, "watch");
        env.put(ConfigLoader.ENV_STATUS_PORT, "-1");

        DetectorConfig config = ConfigLoader.load(env);

        assertThat(config.getEvePath()).isEqualTo(Path.of("/from/env/eve.json"));
        assertThat(config.getStoreCapacity()).isEqualTo(20);
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofMillis(50));
        assertThat(config.getWakeUpMode()).isEqualTo(WakeUpMode.WATCH);
        assertThat(config.isStatusEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should fall back to defaults for keys the file leaves out")
    void shouldUseDefaultsForMissingKeys() throws IOException {
        DetectorConfig config = ConfigLoader.fromFile(write("model_path: m.json\n"));

        assertThat(config.getModelPath()).isEqualTo(Path.of("m.json"));
        assertThat(config.getStoreCapacity()).isEqualTo(1000);
        assertThat(config.getFlushInterval()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Should accept an empty file")
    void shouldAcceptEmptyFile() throws IOException {
        DetectorConfig config = ConfigLoader.fromFile(write(""));

        assertThat(config.getStatusPort()).isEqualTo(3001);
    }

    @Test
    @DisplayName("Should fail when a numeric value has the wrong type")
    void shouldRejectWrongTypes() throws IOException {
        Path yml = write("detection:\n  poll_interval_ms: soon\n");

        assertThatThrownBy(() -> ConfigLoader.fromFile(yml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("poll_interval_ms");
    }

    @Test
    @DisplayName("Should fail when a section is not a mapping")
    void shouldRejectScalarSection() throws IOException {
        Path yml = write("detection: fast\n");

        assertThatThrownBy(() -> ConfigLoader.fromFile(yml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("detection");
    }

    @Test
    @DisplayName("Should fail on a key the detector does not know")
    void shouldRejectUnknownKeys() throws IOException {
        Path yml = write("detection:\n  poll_interval: 5\n");

        assertThatThrownBy(() -> ConfigLoader.fromFile(yml))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("poll_interval");
    }

    @Test
    @DisplayName("Should disable the feature-column artifact when its path is blank")
    void shouldDisableColumnArtifactWhenBlank() throws IOException {
        DetectorConfig config = ConfigLoader.fromFile(write("feature_columns_path: \"\"\n"));

        assertThat(config.getFeatureColumnsPath()).isNull();
    }

    @Test
    @DisplayName("Should fail on duplicate keys")
    void shouldRejectDuplicateKeys() throws IOException {
        Path yml = write("model_path: a.json\nmodel_path: b.json\n");

        assertThatThrownBy(() -> ConfigLoader.fromFile(yml))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Should fail on an unparseable numeric environment variable")
    void shouldRejectBadEnvironmentNumber() throws IOException {
        Map<String, String> env = Map.of(
                ConfigLoader.ENV_CONFIG_PATH, write("{}\n").toString(),
                ConfigLoader.ENV_STORE_CAPACITY, "many");

        assertThatThrownBy(() -> ConfigLoader.load(env))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("many");
    }

    @Test
    @DisplayName("Should fail validation for out-of-range values")
    void shouldValidateRanges() throws IOException {
        Path yml = write("detection:\n  store_capacity: 0\n");

        assertThatThrownBy(() -> ConfigLoader.fromFile(yml))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("store_capacity");
    }

    @Test
    @DisplayName("Should report missing files and resources")
    void shouldReportMissingSources() {
        assertThatThrownBy(() -> ConfigLoader.fromFile(dir.resolve("absent.yml")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("absent.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private Path write(String content) throws IOException {
        Path file = Files.createTempFile(dir, "config", ".yml");
        Files.writeString(file, content);
        return file;
    }
}
