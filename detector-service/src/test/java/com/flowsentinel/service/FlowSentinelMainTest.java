package com.flowsentinel.service;

import com.flowsentinel.core.config.ConfigLoader;
import com.flowsentinel.core.config.DetectorConfig;
import com.flowsentinel.core.config.WakeUpMode;
import com.flowsentinel.core.tail.FileWatchWakeUpSource;
import com.flowsentinel.core.tail.PollingWakeUpSource;
import com.flowsentinel.core.tail.WakeUpSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the wiring in {@link FlowSentinelMain}.
 */
class FlowSentinelMainTest {

    @Test
    @DisplayName("Should load the bundled configuration when no override is set")
    void shouldLoadBundledConfiguration() {
        DetectorConfig config = ConfigLoader.load(Map.of());

        assertThat(config.getEvePath()).isEqualTo(Path.of("/var/log/suricata/eve.json"));
        assertThat(config.getPollInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(config.getFlushInterval()).isEqualTo(Duration.ofSeconds(5));
        assertThat(config.getStoreCapacity()).isEqualTo(1000);
        assertThat(config.getStatusPort()).isEqualTo(3001);
    }

    @Test
    @DisplayName("Should choose the wake-up source from the configured mode")
    void shouldChooseWakeUpSource() {
        DetectorConfig poll = DetectorConfig.builder().wakeUpMode(WakeUpMode.POLL).build();
        DetectorConfig watch = DetectorConfig.builder().wakeUpMode(WakeUpMode.WATCH).build();

        try (WakeUpSource source = FlowSentinelMain.wakeUpSource(poll)) {
            assertThat(source).isInstanceOf(PollingWakeUpSource.class);
        }
        try (WakeUpSource source = FlowSentinelMain.wakeUpSource(watch)) {
            assertThat(source).isInstanceOf(FileWatchWakeUpSource.class);
        }
    }
}
