package com.faultline.flink;

import java.io.Serializable;
import java.util.Objects;

/**
 * Typed, immutable configuration for the Faultline Flink job.
 *
 * <p>
 * Values are resolved from environment variables with defaults suitable for
 * a local Kafka. Faultline's own settings (filtering, throttling, baselines)
 * live in the YAML file named by {@code FAULTLINE_CONFIG_PATH}.
 * </p>
 *
 * <p>
 * Use {@link #fromEnvironment()} in production and the {@link Builder} in
 * tests. The builder validates at {@link Builder#build()}.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    // Kafka
    private final String kafkaBootstrapServers;
    private final String signalTopic;
    private final String resultTopic;
    private final String notificationTopic;
    private final String kafkaGroupId;

    // Flink
    private final int parallelism;
    private final long checkpointIntervalMs;

    // Faultline
    private final String faultlineConfigPath;
    private final int analysisIntervalMinutes;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.signalTopic = b.signalTopic;
        this.resultTopic = b.resultTopic;
        this.notificationTopic = b.notificationTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.faultlineConfigPath = b.faultlineConfigPath;
        this.analysisIntervalMinutes = b.analysisIntervalMinutes;
    }

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @throws IllegalStateException    if a numeric variable cannot be parsed
     * @throws IllegalArgumentException if a value is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .signalTopic(env("KAFKA_SIGNAL_TOPIC", "error-signals"))
                    .resultTopic(env("KAFKA_RESULT_TOPIC", "aggregated-errors"))
                    .notificationTopic(env("KAFKA_NOTIFICATION_TOPIC", "error-notifications"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "faultline"))
                    .parallelism(Integer.parseInt(env("FLINK_PARALLELISM", "1")))
                    .checkpointIntervalMs(Long.parseLong(env("FLINK_CHECKPOINT_INTERVAL_MS", "60000")))
                    .faultlineConfigPath(env("FAULTLINE_CONFIG_PATH", ""))
                    .analysisIntervalMinutes(Integer.parseInt(env("ANALYSIS_INTERVAL_MINUTES", "15")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getSignalTopic() {
        return signalTopic;
    }

    public String getResultTopic() {
        return resultTopic;
    }

    public String getNotificationTopic() {
        return notificationTopic;
    }

    public String getKafkaGroupId() {
        return kafkaGroupId;
    }

    public int getParallelism() {
        return parallelism;
    }

    public long getCheckpointIntervalMs() {
        return checkpointIntervalMs;
    }

    /** Empty when unset. */
    public String getFaultlineConfigPath() {
        return faultlineConfigPath;
    }

    public int getAnalysisIntervalMinutes() {
        return analysisIntervalMinutes;
    }

    /**
     * Fluent builder for {@link JobConfig}.
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String signalTopic = "error-signals";
        private String resultTopic = "aggregated-errors";
        private String notificationTopic = "error-notifications";
        private String kafkaGroupId = "faultline";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String faultlineConfigPath = "";
        private int analysisIntervalMinutes = 15;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder signalTopic(String v) {
            this.signalTopic = v;
            return this;
        }

        public Builder resultTopic(String v) {
            this.resultTopic = v;
            return this;
        }

        public Builder notificationTopic(String v) {
            this.notificationTopic = v;
            return this;
        }

        public Builder kafkaGroupId(String v) {
            this.kafkaGroupId = v;
            return this;
        }

        public Builder parallelism(int v) {
            this.parallelism = v;
            return this;
        }

        public Builder checkpointIntervalMs(long v) {
            this.checkpointIntervalMs = v;
            return this;
        }

        public Builder faultlineConfigPath(String v) {
            this.faultlineConfigPath = v == null ? "" : v;
            return this;
        }

        public Builder analysisIntervalMinutes(int v) {
            this.analysisIntervalMinutes = v;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            requireNonBlank(signalTopic, "signalTopic");
            requireNonBlank(resultTopic, "resultTopic");
            requireNonBlank(notificationTopic, "notificationTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (analysisIntervalMinutes < 1) {
                throw new IllegalArgumentException(
                        "analysisIntervalMinutes must be >= 1, got: " + analysisIntervalMinutes);
            }
            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", signalTopic='" + signalTopic + '\'' +
                ", resultTopic='" + resultTopic + '\'' +
                ", notificationTopic='" + notificationTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", faultlineConfigPath='" + faultlineConfigPath + '\'' +
                ", analysisIntervalMinutes=" + analysisIntervalMinutes +
                '}';
    }
}
