package com.alertsentinel.flink;

import com.alertsentinel.core.config.AlertsConfig;
import com.alertsentinel.core.config.AlertsLoader;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Main entry point for the Alert Sentinel Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (tick topic)
 *     → Deserialize JSON → MarketTick
 *     → Key by ticker
 *     → AlertEvaluationFunction (gate, evaluate, create triggers)
 *     → Key by ticker
 *     → TriggerBatchFunction (trailing-edge debounce)
 *     → Serialize TriggerBatch → JSON
 *     → Kafka (trigger topic)
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job settings are resolved from environment variables via {@link JobConfig};
 * alert definitions are loaded with {@link AlertsLoader}.
 * </p>
 *
 * <h3>Checkpointing</h3>
 * <p>
 * Exactly-once semantics are enabled. Price history, alert bookkeeping and
 * pending batches live in keyed state and survive failures.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertSentinelJob {

        private static final Logger LOG = LoggerFactory.getLogger(AlertSentinelJob.class);

        private AlertSentinelJob() {
                // entry-point class, not instantiable
        }

        public static void main(String[] args) throws Exception {
                // 1. Load configuration
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Alert Sentinel with config: {}", config);

                // 2. Load alert definitions
                AlertsConfig alertsConfig = loadAlerts(config);
                if (alertsConfig.getAlerts().isEmpty()) {
                        throw new IllegalStateException(
                                        "No alerts defined. Provide alerts via "
                                                        + AlertsLoader.ENV_ALERTS_PATH
                                                        + " or a classpath " + AlertsLoader.DEFAULT_RESOURCE + " file.");
                }

                // 3. Start health server (for K8s health checks) with shutdown hook
                HealthServer healthServer = new HealthServer(alertsConfig.getAlerts().size());
                healthServer.start(config.getHealthPort());
                Runtime.getRuntime().addShutdownHook(new Thread(healthServer::stop, "health-shutdown"));

                // 4. Set up Flink execution environment
                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                // 5. Build pipeline
                buildPipeline(env, config, alertsConfig);

                // 6. Execute
                env.execute("Alert Sentinel: Alert Evaluation");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        /**
         * Build the full Kafka → Flink → Kafka pipeline.
         */
        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        AlertsConfig alertsConfig) {
                KafkaSource<MarketTick> kafkaSource = KafkaSource.<MarketTick>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getKafkaTickTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.latest())
                                .setValueOnlyDeserializer(new MarketTickDeserializationSchema())
                                .build();

                DataStream<MarketTick> ticks = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.noWatermarks(),
                                "kafka-ticks-source");

                DataStream<TriggerBatch> batches = ticks
                                .filter(Objects::nonNull) // drop deserialization failures
                                .keyBy(MarketTick::getTicker)
                                .process(new AlertEvaluationFunction(
                                                alertsConfig.getAlerts(),
                                                alertsConfig.getSentiment(),
                                                config.getDefaultZone(),
                                                config.getHistoryCapacity()))
                                .name("alert-evaluation")
                                .keyBy(PendingTrigger::getTicker)
                                .process(new TriggerBatchFunction())
                                .name("trigger-batching");

                KafkaSink<TriggerBatch> kafkaSink = KafkaSink.<TriggerBatch>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(config.getKafkaTriggerTopic())
                                                                .setValueSerializationSchema(
                                                                                new TriggerBatchSerializationSchema())
                                                                .build())
                                .build();

                batches.sinkTo(kafkaSink).name("kafka-triggers-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static AlertsConfig loadAlerts(JobConfig config) {
                String alertsPath = config.getAlertsConfigPath();
                if (alertsPath != null && !alertsPath.isBlank()) {
                        return AlertsLoader.fromFile(alertsPath);
                }
                return AlertsLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                // Retain checkpoints on cancellation so state can be restored
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
