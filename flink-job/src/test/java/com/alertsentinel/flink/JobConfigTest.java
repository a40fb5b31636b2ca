package com.alertsentinel.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder defaults should be a valid local configuration")
    void defaultsShouldBuild() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaTickTopic()).isEqualTo("market-ticks");
        assertThat(config.getKafkaTriggerTopic()).isEqualTo("alert-triggers");
        assertThat(config.getKafkaGroupId()).isEqualTo("alert-sentinel");
        assertThat(config.getHistoryCapacity()).isEqualTo(50);
        assertThat(config.getDefaultZone()).isEqualTo(ZoneId.of("UTC"));
        assertThat(config.getAlertsConfigPath()).isEmpty();
    }

    @Test
    @DisplayName("Should reject a history too short for the anomaly statistics")
    void shouldRejectShortHistory() {
        assertThatThrownBy(() -> new JobConfig.Builder().historyCapacity(JobConfig.MIN_HISTORY_CAPACITY - 1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("historyCapacity");
    }

    @Test
    @DisplayName("Should reject out-of-range values and blank topics")
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().healthPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().kafkaTriggerTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("kafkaTriggerTopic");
    }
}
