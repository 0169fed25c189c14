package com.hostledger.rentals.quality;

import com.fasterxml.jackson.databind.JsonNode;
import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Meter;
import org.apache.flink.metrics.MeterView;
import org.apache.flink.streaming.api.functions.ProcessFunction;
import org.apache.flink.util.OutputTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.hostledger.rentals.config.MonitorConfig;
import com.hostledger.rentals.model.InboundSnapshotRecord;
import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.RejectedSnapshotEnvelope;
import com.hostledger.rentals.util.JsonSupport;

import java.nio.charset.StandardCharsets;

/**
 * Quality gate that deserializes raw snapshot records, validates them, and emits either a bound
 * {@link MachineState} or a DLQ envelope describing the failure.
 */
public class SnapshotQualityGateProcessFunction extends ProcessFunction<InboundSnapshotRecord, MachineState> {
    private static final Logger LOG = LoggerFactory.getLogger(SnapshotQualityGateProcessFunction.class);

    private final MonitorConfig config;
    private final OutputTag<RejectedSnapshotEnvelope> dlqTag;
    private transient SnapshotValidator validator;
    private transient Counter inputCounter;
    private transient Counter acceptedCounter;
    private transient Counter dlqCounter;
    private transient Meter inputRate;
    private transient Meter dlqRate;
    private transient long lastDlqLogMs;
    private transient long dlqSinceLastLog;

    public SnapshotQualityGateProcessFunction(MonitorConfig config, OutputTag<RejectedSnapshotEnvelope> dlqTag) {
        this.config = config;
        this.dlqTag = dlqTag;
    }

    @Override
    public void open(org.apache.flink.configuration.Configuration parameters) {
        this.validator = new SnapshotValidator();
        org.apache.flink.metrics.MetricGroup metrics = getRuntimeContext().getMetricGroup().addGroup("snapshot_gate");
        this.inputCounter = metrics.counter("input");
        this.acceptedCounter = metrics.counter("accepted");
        this.dlqCounter = metrics.counter("dlq");
        int window = (int) config.metricsRateWindow.getSeconds();
        this.inputRate = metrics.meter("input_rate", new MeterView(inputCounter, window));
        this.dlqRate = metrics.meter("dlq_rate", new MeterView(dlqCounter, window));
        this.lastDlqLogMs = System.currentTimeMillis();
        this.dlqSinceLastLog = 0;
        LOG.info("Snapshot quality gate initialized (inputTopic={}, metricsWindowSec={})", config.inputTopic, window);
    }

    @Override
    public void processElement(InboundSnapshotRecord record, Context ctx, org.apache.flink.util.Collector<MachineState> out) {
        inputCounter.inc();

        if (record == null || record.value == null) {
            LOG.debug("Rejecting record with null payload (topic={}, partition={}, offset={})",
                    record == null ? null : record.topic,
                    record == null ? null : record.partition,
                    record == null ? null : record.offset);
            emitDlq(ctx, RejectedSnapshotEnvelopeFactory.forRawRecord(
                    record, "DESERIALIZATION_FAILED", "null_payload", "Record value is null", null, null));
            return;
        }

        String rawJson = new String(record.value, StandardCharsets.UTF_8);
        JsonNode root;
        try {
            root = JsonSupport.MAPPER.readTree(rawJson);
        } catch (Exception ex) {
            LOG.warn("JSON parse failed (topic={}, partition={}, offset={}): {}",
                    record.topic, record.partition, record.offset, ex.getMessage());
            emitDlq(ctx, RejectedSnapshotEnvelopeFactory.forRawRecord(
                    record, "DESERIALIZATION_FAILED", "json_parse_error", ex.getMessage(), null, record.value));
            return;
        }

        SnapshotValidator.ValidationResult validation = validator.validate(root);
        if (!validation.valid) {
            LOG.debug("Snapshot validation failed (machine={}, reason={}, details={})",
                    root == null ? null : root.path("machine_id").asText(""), validation.reason, validation.details);
            emitDlq(ctx, RejectedSnapshotEnvelopeFactory.forValidationFailure(record, root, validation, rawJson));
            return;
        }

        MachineState state;
        try {
            state = JsonSupport.SNAKE_CASE_MAPPER.treeToValue(root, MachineState.class);
        } catch (Exception ex) {
            LOG.warn("Snapshot binding failed (topic={}, partition={}, offset={}): {}",
                    record.topic, record.partition, record.offset, ex.getMessage());
            emitDlq(ctx, RejectedSnapshotEnvelopeFactory.forRawRecord(
                    record, "DESERIALIZATION_FAILED", "binding_error", ex.getMessage(), rawJson, null));
            return;
        }
        if (!root.hasNonNull("observed_at")) {
            state.observedAt = record.recordTimestamp;
        }

        LOG.trace("Accepted snapshot (machine={}, observedAt={}, occupancy={})",
                state.machineId, state.observedAt, state.gpuOccupancy);
        acceptedCounter.inc();
        out.collect(state);
    }

    private void emitDlq(Context ctx, RejectedSnapshotEnvelope envelope) {
        dlqCounter.inc();
        dlqSinceLastLog++;
        long now = System.currentTimeMillis();
        if (now - lastDlqLogMs >= 60000) {
            LOG.warn("DLQ rate summary: {} rejected snapshots in last 60s", dlqSinceLastLog);
            lastDlqLogMs = now;
            dlqSinceLastLog = 0;
        }
        ctx.output(dlqTag, envelope);
    }
}
