package com.faultline.flink;

import com.faultline.core.config.ConfigLoader;
import com.faultline.core.config.FaultlineConfig;
import com.faultline.core.model.AggregationResult;
import com.faultline.core.model.ErrorSignal;
import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.CheckpointingMode;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.CheckpointConfig;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;

/**
 * Main entry point for the Faultline Flink job.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   Kafka (error-signals)
 *     → Deserialize JSON → ErrorSignal
 *     → Gate: drop malformed and ignored signals
 *     → Key by tenant|fingerprint
 *     → AggregationProcessFunction (filter, aggregate, throttle, notify)
 *     → Kafka (aggregated-errors)          main output
 *     → Kafka (error-notifications)        side output
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * Job wiring comes from environment variables via {@link JobConfig};
 * Faultline behaviour from the YAML file loaded by {@link ConfigLoader}.
 * </p>
 *
 * @since 1.0.0
 */
public final class FaultlineJob {

        private static final Logger LOG = LoggerFactory.getLogger(FaultlineJob.class);

        private FaultlineJob() {
        }

        public static void main(String[] args) throws Exception {
                JobConfig config = JobConfig.fromEnvironment();
                LOG.info("Starting Faultline with config: {}", config);

                FaultlineConfig faultlineConfig = loadFaultlineConfig(config);
                LOG.info("Loaded Faultline settings: {}", faultlineConfig);

                StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();
                env.setParallelism(config.getParallelism());
                configureCheckpointing(env, config);

                buildPipeline(env, config, faultlineConfig);

                env.execute("Faultline - Error Aggregation");
        }

        // ---------------------------------------------------------------
        // Pipeline assembly
        // ---------------------------------------------------------------

        static void buildPipeline(StreamExecutionEnvironment env,
                        JobConfig config,
                        FaultlineConfig faultlineConfig) {
                KafkaSource<ErrorSignal> kafkaSource = KafkaSource.<ErrorSignal>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setTopics(config.getSignalTopic())
                                .setGroupId(config.getKafkaGroupId())
                                .setStartingOffsets(OffsetsInitializer.earliest())
                                .setValueOnlyDeserializer(new ErrorSignalDeserializationSchema())
                                .build();

                DataStream<ErrorSignal> signals = env.fromSource(
                                kafkaSource,
                                WatermarkStrategy.<ErrorSignal>forBoundedOutOfOrderness(Duration.ofSeconds(5))
                                                .withIdleness(Duration.ofMinutes(1)),
                                "kafka-signals-source");

                SingleOutputStreamOperator<AggregationResult> results = signals
                                .filter(Objects::nonNull)
                                .filter(new SignalGateFunction(faultlineConfig))
                                .name("signal-gate")
                                .keyBy(new FingerprintKeySelector(faultlineConfig.getLibraryPathMarkers()))
                                .process(new AggregationProcessFunction(faultlineConfig,
                                                config.getAnalysisIntervalMinutes()))
                                .uid("error-aggregation")
                                .name("error-aggregation")
                                // cross-key analysis needs every signal in one instance
                                .setParallelism(1)
                                .setMaxParallelism(1);

                results.sinkTo(jsonSink(config, config.getResultTopic(),
                                new JsonSerializationSchema<AggregationResult>()))
                                .name("kafka-results-sink");

                results.getSideOutput(AggregationProcessFunction.NOTIFICATIONS)
                                .sinkTo(jsonSink(config, config.getNotificationTopic(),
                                                new JsonSerializationSchema<ErrorNotification>()))
                                .name("kafka-notifications-sink");
        }

        // ---------------------------------------------------------------
        // Helpers
        // ---------------------------------------------------------------

        private static <T> KafkaSink<T> jsonSink(JobConfig config, String topic,
                        JsonSerializationSchema<T> schema) {
                return KafkaSink.<T>builder()
                                .setBootstrapServers(config.getKafkaBootstrapServers())
                                .setRecordSerializer(
                                                KafkaRecordSerializationSchema.builder()
                                                                .setTopic(topic)
                                                                .setValueSerializationSchema(schema)
                                                                .build())
                                .build();
        }

        static FaultlineConfig loadFaultlineConfig(JobConfig config) {
                String path = config.getFaultlineConfigPath();
                if (path != null && !path.isBlank()) {
                        return ConfigLoader.fromFile(path);
                }
                return ConfigLoader.load();
        }

        private static void configureCheckpointing(StreamExecutionEnvironment env, JobConfig config) {
                long interval = config.getCheckpointIntervalMs();
                env.enableCheckpointing(interval, CheckpointingMode.EXACTLY_ONCE);

                CheckpointConfig cpConfig = env.getCheckpointConfig();
                cpConfig.setMinPauseBetweenCheckpoints(interval / 2);
                cpConfig.setCheckpointTimeout(interval * 2);
                cpConfig.setMaxConcurrentCheckpoints(1);
                cpConfig.setExternalizedCheckpointCleanup(
                                CheckpointConfig.ExternalizedCheckpointCleanup.RETAIN_ON_CANCELLATION);
        }
}
