package com.hostledger.rentals.pipeline;

import org.apache.flink.api.common.eventtime.WatermarkStrategy;
import org.apache.flink.api.common.serialization.SimpleStringSchema;
import org.apache.flink.api.common.typeinfo.Types;
import org.apache.flink.connector.kafka.sink.KafkaRecordSerializationSchema;
import org.apache.flink.connector.kafka.sink.KafkaSink;
import org.apache.flink.connector.kafka.source.KafkaSource;
import org.apache.flink.connector.kafka.source.enumerator.initializer.OffsetsInitializer;
import org.apache.flink.streaming.api.datastream.DataStream;
import org.apache.flink.streaming.api.datastream.SingleOutputStreamOperator;
import org.apache.flink.streaming.api.environment.StreamExecutionEnvironment;
import org.apache.flink.util.OutputTag;

import com.hostledger.rentals.config.MonitorConfig;
import com.hostledger.rentals.model.InboundSnapshotRecord;
import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.RejectedSnapshotEnvelope;
import com.hostledger.rentals.model.RentalLifecycleEvent;
import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.notify.WebhookNotificationSink;
import com.hostledger.rentals.quality.SnapshotQualityGateProcessFunction;
import com.hostledger.rentals.registry.RegistryCodec;
import com.hostledger.rentals.util.BuildMetadata;
import com.hostledger.rentals.util.JsonSupport;

/**
 * Main Flink pipeline:
 * - Ingest machine snapshots from Kafka
 * - Validate and bind snapshots, rejects to DLQ
 * - Reconcile per machine (keyed by machine id) against the stored rental registry
 * - Publish lifecycle events to Kafka and webhooks, archived sessions and DLQ envelopes to Kafka
 */
public class RentalMonitorJob {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(RentalMonitorJob.class);

    static final OutputTag<RejectedSnapshotEnvelope> DLQ_TAG = new OutputTag<RejectedSnapshotEnvelope>("dlq"){};
    static final OutputTag<RentalSession> ARCHIVE_TAG = new OutputTag<RentalSession>("archive"){};

    public static void main(String[] args) throws Exception {
        final StreamExecutionEnvironment env = StreamExecutionEnvironment.getExecutionEnvironment();

        MonitorConfig config = MonitorConfig.fromEnv();
        env.enableCheckpointing(config.checkpointIntervalMs);
        LOG.info("Starting rental monitor {} with inputTopic={}, eventsTopic={}, archiveTopic={}, dlqTopic={}, targets={}",
                BuildMetadata.current().identity(),
                config.inputTopic, config.eventsTopic, config.archiveTopic, config.dlqTopic,
                config.notificationTargets.size());

        KafkaSource<InboundSnapshotRecord> kafkaSource = KafkaSource.<InboundSnapshotRecord>builder()
                .setBootstrapServers(config.kafkaBootstrap)
                .setTopics(config.inputTopic)
                .setGroupId(config.kafkaGroupId)
                .setStartingOffsets(OffsetsInitializer.earliest())
                .setDeserializer(new InboundSnapshotDeserializationSchema())
                .build();

        SingleOutputStreamOperator<MachineState> snapshots = env
                .fromSource(kafkaSource, WatermarkStrategy.noWatermarks(), "Kafka Source")
                .process(new SnapshotQualityGateProcessFunction(config, DLQ_TAG))
                .returns(MachineState.class)
                .name("Snapshot Quality Gate");

        // One registry per machine; snapshots of a machine are reconciled strictly in order.
        SingleOutputStreamOperator<RentalLifecycleEvent> events = snapshots
                .keyBy(state -> state.machineId, Types.LONG)
                .process(new MachineReconcileProcessFunction(config.reconcileSettings(), ARCHIVE_TAG, DLQ_TAG))
                .returns(RentalLifecycleEvent.class)
                .name("Reconcile: Machine Rentals");

        DataStream<RejectedSnapshotEnvelope> dlqStream = snapshots.getSideOutput(DLQ_TAG)
                .union(events.getSideOutput(DLQ_TAG));
        DataStream<RentalSession> archiveStream = events.getSideOutput(ARCHIVE_TAG);

        events.map(JsonSupport::toJson).sinkTo(kafkaSink(config, config.eventsTopic)).name("Kafka: Lifecycle Events");
        archiveStream.map(RegistryCodec::encodeArchive).sinkTo(kafkaSink(config, config.archiveTopic)).name("Kafka: Session Archive");
        dlqStream.map(JsonSupport::toJson).sinkTo(kafkaSink(config, config.dlqTopic)).name("Kafka: DLQ");

        if (!config.notificationTargets.isEmpty()) {
            events.addSink(new WebhookNotificationSink(config.notificationTargets, config.webhookSettings()))
                    .name("Webhooks: Lifecycle Events")
                    .setParallelism(1);
        } else {
            LOG.info("No notification targets configured; webhook delivery disabled");
        }

        env.execute("Rental Ledger Monitor");
    }

    private static KafkaSink<String> kafkaSink(MonitorConfig config, String topic) {
        return KafkaSink.<String>builder()
                .setBootstrapServers(config.kafkaBootstrap)
                .setRecordSerializer(KafkaRecordSerializationSchema.builder()
                        .setTopic(topic)
                        .setValueSerializationSchema(new SimpleStringSchema())
                        .build())
                .build();
    }
}
