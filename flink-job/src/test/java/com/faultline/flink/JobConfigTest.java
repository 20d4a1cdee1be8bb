package com.faultline.flink;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Builder should apply defaults")
    void shouldApplyDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getKafkaBootstrapServers()).isEqualTo("localhost:9092");
        assertThat(config.getSignalTopic()).isEqualTo("error-signals");
        assertThat(config.getResultTopic()).isEqualTo("aggregated-errors");
        assertThat(config.getNotificationTopic()).isEqualTo("error-notifications");
        assertThat(config.getKafkaGroupId()).isEqualTo("faultline");
        assertThat(config.getParallelism()).isEqualTo(1);
        assertThat(config.getCheckpointIntervalMs()).isEqualTo(60_000L);
        assertThat(config.getFaultlineConfigPath()).isEmpty();
        assertThat(config.getAnalysisIntervalMinutes()).isEqualTo(15);
    }

    @Test
    @DisplayName("Builder should reject blank topics")
    void shouldRejectBlankTopics() {
        assertThatThrownBy(() -> new JobConfig.Builder().signalTopic(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("signalTopic");
        assertThatThrownBy(() -> new JobConfig.Builder().notificationTopic(null).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("notificationTopic");
    }

    @Test
    @DisplayName("Builder should reject non-positive numbers")
    void shouldRejectNonPositiveNumbers() {
        assertThatThrownBy(() -> new JobConfig.Builder().parallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().checkpointIntervalMs(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().analysisIntervalMinutes(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("analysisIntervalMinutes");
    }

    @Test
    @DisplayName("A null config path should become empty")
    void shouldNormalizeNullConfigPath() {
        assertThat(new JobConfig.Builder().faultlineConfigPath(null).build().getFaultlineConfigPath()).isEmpty();
    }
}
