package com.flowsentinel.core.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectorConfig}.
 */
class DetectorConfigTest {

    @Test
    @DisplayName("Should apply documented defaults")
    void shouldApplyDefaults() {
        DetectorConfig config = DetectorConfig.builder().build();

        assertThat(config.getEvePath()).isEqualTo(Path.of("/var/log/suricata/eve.json"));
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.getFlushInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getStoreCapacity()).isEqualTo(1000);
        assertThat(config.getWakeUpMode()).isEqualTo(WakeUpMode.POLL);
        assertThat(config.getStatusPort()).isEqualTo(3001);
        assertThat(config.getFeatureColumns()).isEmpty();
        assertThat(config.isStatusEnabled()).isTrue();
    }

    @Test
    @DisplayName("Should treat a blank feature-columns path as absent")
    void shouldTreatBlankColumnsPathAsAbsent() {
        DetectorConfig config = DetectorConfig.builder().featureColumnsPath(" ").build();

        assertThat(config.getFeatureColumnsPath()).isNull();
    }

    @Test
    @DisplayName("Should disable the status server with port -1")
    void shouldDisableStatus() {
        DetectorConfig config = DetectorConfig.builder().statusPort(DetectorConfig.STATUS_DISABLED).build();

        assertThat(config.isStatusEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should report every invalid value in one exception")
    void shouldCollectAllErrors() {
        DetectorConfig.Builder builder = DetectorConfig.builder()
                .evePath(" ")
                .pollIntervalMs(0)
                .flushIntervalSeconds(-1)
                .storeCapacity(0)
                .statusPort(70_000);

        assertThatThrownBy(builder::build)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("eve_json_path")
                .hasMessageContaining("poll_interval_ms")
                .hasMessageContaining("flush_interval_seconds")
                .hasMessageContaining("store_capacity")
                .hasMessageContaining("status port");
    }

    @Test
    @DisplayName("Should reject blank feature column names")
    void shouldRejectBlankColumnNames() {
        assertThatThrownBy(() -> DetectorConfig.builder().featureColumns(List.of("proto", "")).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("feature_columns");
    }

    @Test
    @DisplayName("Should parse wake-up modes case-insensitively")
    void shouldParseWakeUpMode() {
        assertThat(WakeUpMode.fromName("Watch")).isEqualTo(WakeUpMode.WATCH);
        assertThat(WakeUpMode.fromName("poll")).isEqualTo(WakeUpMode.POLL);
        assertThatThrownBy(() -> WakeUpMode.fromName("inotify"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
