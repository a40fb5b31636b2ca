package com.alertsentinel.flink;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Typed, immutable configuration object for the Alert Sentinel Flink job.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults.
 * This makes the job fully configurable via Kubernetes Deployment env vars,
 * Docker {@code -e} flags, or a shell environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class JobConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Smallest history that still lets the statistical-outlier signal run. */
    public static final int MIN_HISTORY_CAPACITY = 20;

    // ---------------------------------------------------------------
    // Kafka
    // ---------------------------------------------------------------
    private final String kafkaBootstrapServers;
    private final String kafkaTickTopic;
    private final String kafkaTriggerTopic;
    private final String kafkaGroupId;

    // ---------------------------------------------------------------
    // Flink
    // ---------------------------------------------------------------
    private final int parallelism;
    private final long checkpointIntervalMs;

    // ---------------------------------------------------------------
    // Alerts
    // ---------------------------------------------------------------
    private final String alertsConfigPath;
    private final int historyCapacity;
    private final ZoneId defaultZone;

    // ---------------------------------------------------------------
    // Health / Metrics
    // ---------------------------------------------------------------
    private final int healthPort;

    private JobConfig(Builder b) {
        this.kafkaBootstrapServers = b.kafkaBootstrapServers;
        this.kafkaTickTopic = b.kafkaTickTopic;
        this.kafkaTriggerTopic = b.kafkaTriggerTopic;
        this.kafkaGroupId = b.kafkaGroupId;
        this.parallelism = b.parallelism;
        this.checkpointIntervalMs = b.checkpointIntervalMs;
        this.alertsConfigPath = b.alertsConfigPath;
        this.historyCapacity = b.historyCapacity;
        this.defaultZone = b.defaultZone;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory, resolved from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link JobConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static JobConfig fromEnvironment() {
        try {
            return new Builder()
                    .kafkaBootstrapServers(env("KAFKA_BOOTSTRAP_SERVERS", "localhost:9092"))
                    .kafkaTickTopic(env("KAFKA_TICK_TOPIC", "market-ticks"))
                    .kafkaTriggerTopic(env("KAFKA_TRIGGER_TOPIC", "alert-triggers"))
                    .kafkaGroupId(env("KAFKA_GROUP_ID", "alert-sentinel"))
                    .parallelism(parseIntEnv("FLINK_PARALLELISM", "1"))
                    .checkpointIntervalMs(parseLongEnv("FLINK_CHECKPOINT_INTERVAL_MS", "60000"))
                    .alertsConfigPath(env("ALERTS_CONFIG_PATH", ""))
                    .historyCapacity(parseIntEnv("PRICE_HISTORY_CAPACITY", "50"))
                    .defaultZone(ZoneId.of(env("DEFAULT_TIME_ZONE", "UTC")))
                    .healthPort(parseIntEnv("HEALTH_PORT", "8080"))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        } catch (DateTimeException e) {
            throw new IllegalStateException(
                    "Invalid DEFAULT_TIME_ZONE: " + e.getMessage(), e);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getKafkaBootstrapServers() {
        return kafkaBootstrapServers;
    }

    public String getKafkaTickTopic() {
        return kafkaTickTopic;
    }

    public String getKafkaTriggerTopic() {
        return kafkaTriggerTopic;
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

    public String getAlertsConfigPath() {
        return alertsConfigPath;
    }

    public int getHistoryCapacity() {
        return historyCapacity;
    }

    public ZoneId getDefaultZone() {
        return defaultZone;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link JobConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (parallelism &gt; 0, checkpoint interval &gt; 0, port in
     * [1, 65535], history capacity &gt;= {@value #MIN_HISTORY_CAPACITY},
     * non-blank topic names).
     * </p>
     */
    public static class Builder {
        private String kafkaBootstrapServers = "localhost:9092";
        private String kafkaTickTopic = "market-ticks";
        private String kafkaTriggerTopic = "alert-triggers";
        private String kafkaGroupId = "alert-sentinel";
        private int parallelism = 1;
        private long checkpointIntervalMs = 60_000;
        private String alertsConfigPath = "";
        private int historyCapacity = 50;
        private ZoneId defaultZone = ZoneId.of("UTC");
        private int healthPort = 8080;

        public Builder kafkaBootstrapServers(String v) {
            this.kafkaBootstrapServers = v;
            return this;
        }

        public Builder kafkaTickTopic(String v) {
            this.kafkaTickTopic = v;
            return this;
        }

        public Builder kafkaTriggerTopic(String v) {
            this.kafkaTriggerTopic = v;
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

        public Builder alertsConfigPath(String v) {
            this.alertsConfigPath = v;
            return this;
        }

        public Builder historyCapacity(int v) {
            this.historyCapacity = v;
            return this;
        }

        public Builder defaultZone(ZoneId v) {
            this.defaultZone = v;
            return this;
        }

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link JobConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public JobConfig build() {
            Objects.requireNonNull(kafkaBootstrapServers, "kafkaBootstrapServers required");
            Objects.requireNonNull(defaultZone, "defaultZone required");
            requireNonBlank(kafkaTickTopic, "kafkaTickTopic");
            requireNonBlank(kafkaTriggerTopic, "kafkaTriggerTopic");
            requireNonBlank(kafkaGroupId, "kafkaGroupId");

            if (parallelism < 1) {
                throw new IllegalArgumentException("parallelism must be >= 1, got: " + parallelism);
            }
            if (checkpointIntervalMs < 1) {
                throw new IllegalArgumentException(
                        "checkpointIntervalMs must be >= 1, got: " + checkpointIntervalMs);
            }
            if (historyCapacity < MIN_HISTORY_CAPACITY) {
                throw new IllegalArgumentException(
                        "historyCapacity must be >= " + MIN_HISTORY_CAPACITY + ", got: " + historyCapacity);
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            if (alertsConfigPath == null) {
                alertsConfigPath = "";
            }

            return new JobConfig(this);
        }

        private static void requireNonBlank(String value, String name) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(name + " must not be null or blank");
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String env(String name, String defaultValue) {
        String value = System.getenv(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    private static int parseIntEnv(String name, String defaultValue) {
        return Integer.parseInt(env(name, defaultValue));
    }

    private static long parseLongEnv(String name, String defaultValue) {
        return Long.parseLong(env(name, defaultValue));
    }

    @Override
    public String toString() {
        return "JobConfig{" +
                "kafkaBootstrapServers='" + kafkaBootstrapServers + '\'' +
                ", kafkaTickTopic='" + kafkaTickTopic + '\'' +
                ", kafkaTriggerTopic='" + kafkaTriggerTopic + '\'' +
                ", kafkaGroupId='" + kafkaGroupId + '\'' +
                ", parallelism=" + parallelism +
                ", checkpointIntervalMs=" + checkpointIntervalMs +
                ", alertsConfigPath='" + alertsConfigPath + '\'' +
                ", historyCapacity=" + historyCapacity +
                ", defaultZone=" + defaultZone +
                ", healthPort=" + healthPort +
                '}';
    }
}
