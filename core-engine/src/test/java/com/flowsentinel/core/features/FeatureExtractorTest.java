package com.flowsentinel.core.features;

import com.flowsentinel.core.model.FeatureVector;
import com.flowsentinel.core.model.FlowRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link FeatureExtractor}.
 */
class FeatureExtractorTest {

    @Test
    @DisplayName("Should extract the default columns in order")
    void shouldExtractDefaultColumns() {
        FeatureExtractor extractor = new FeatureExtractor(FeatureColumns.DEFAULT);

        FeatureVector vector = extractor.extract(sampleFlow());

        assertThat(vector.names()).containsExactly("total_packets", "total_bytes", "duration", "proto");
        assertThat(vector.values()).containsExactly(180.0, 70_000.0, 2.0, 6.0);
    }

    @Test
    @DisplayName("Should follow the configured column order")
    void shouldFollowConfiguredOrder() {
        FeatureExtractor extractor = new FeatureExtractor(List.of("proto", "bytes_per_packet"));

        FeatureVector vector = extractor.extract(sampleFlow());

        assertThat(vector.get(0)).isEqualTo(6.0);
        assertThat(vector.get("bytes_per_packet")).isCloseTo(70_000.0 / 180.0, within(1e-9));
    }

    @Test
    @DisplayName("Should compute rate features over the flow duration")
    void shouldComputeRates() {
        Map<String, Double> all = FeatureExtractor.computeAll(sampleFlow());

        assertThat(all.get("bytes_per_sec")).isCloseTo(35_000.0, within(1e-9));
        assertThat(all.get("pkts_per_sec")).isCloseTo(90.0, within(1e-9));
        assertThat(all.get("client_server_ratio")).isCloseTo(2.5, within(1e-9));
        assertThat(all.keySet()).containsExactlyElementsOf(FeatureColumns.ALL);
    }

    @Test
    @DisplayName("Should produce zero rates when duration or packet count is zero")
    void shouldGuardZeroDivisors() {
        FlowRecord empty = FlowRecord.builder().proto("UDP").bytesToClient(10).build();

        Map<String, Double> all = FeatureExtractor.computeAll(empty);

        assertThat(all.get("bytes_per_packet")).isZero();
        assertThat(all.get("bytes_per_sec")).isZero();
        assertThat(all.get("pkts_per_sec")).isZero();
        assertThat(all.get("proto")).isEqualTo(17.0);
    }

    @Test
    @DisplayName("Should report an infinite client/server ratio when no bytes went to the client")
    void shouldReportInfiniteRatio() {
        FlowRecord oneWay = FlowRecord.builder().bytesToServer(500).build();

        assertThat(FeatureExtractor.computeAll(oneWay).get("client_server_ratio"))
                .isEqualTo(Double.POSITIVE_INFINITY);
    }

    @Test
    @DisplayName("Should compute fractional durations from microsecond timestamps")
    void shouldComputeFractionalDuration() {
        FlowRecord flow = FlowRecord.builder().start(1_000_000).end(3_500_000).build();

        assertThat(new FeatureExtractor(List.of("duration")).extract(flow).get(0))
                .isCloseTo(2.5, within(1e-9));
    }

    @Test
    @DisplayName("Should reject unknown or empty column lists")
    void shouldRejectUnknownColumns() {
        assertThatThrownBy(() -> new FeatureExtractor(List.of("total_packets", "entropy")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("entropy");
        assertThatThrownBy(() -> new FeatureExtractor(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static FlowRecord sampleFlow() {
        return FlowRecord.builder()
                .flowId("123").proto("TCP")
                .pktsToServer(100).pktsToClient(80)
                .bytesToServer(50_000).bytesToClient(20_000)
                .start(1_000_000).end(3_000_000)
                .build();
    }
}
