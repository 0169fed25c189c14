package com.hostledger.rentals.quality;

import com.fasterxml.jackson.databind.JsonNode;

import com.hostledger.rentals.model.InboundSnapshotRecord;
import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.RejectedSnapshotEnvelope;
import com.hostledger.rentals.util.BuildMetadata;
import com.hostledger.rentals.util.JsonSupport;

import java.util.Base64;

/**
 * Builds DLQ envelopes for the failure modes of the snapshot pipeline.
 */
public final class RejectedSnapshotEnvelopeFactory {
    private static final org.slf4j.Logger LOG = org.slf4j.LoggerFactory.getLogger(RejectedSnapshotEnvelopeFactory.class);

    public static final String STAGE_DESERIALIZATION = "DESERIALIZATION";
    public static final String STAGE_VALIDATION = "SCHEMA_VALIDATION";
    public static final String STAGE_RECONCILE = "RECONCILE";

    private RejectedSnapshotEnvelopeFactory() {}

    public static RejectedSnapshotEnvelope forRawRecord(
            InboundSnapshotRecord record,
            String failureClass,
            String reason,
            String details,
            String rawJson,
            byte[] rawBytes) {
        RejectedSnapshotEnvelope envelope = baseEnvelope(record, rawJson, rawBytes);
        envelope.failure = buildFailure(STAGE_DESERIALIZATION, failureClass, reason, details);
        return envelope;
    }

    public static RejectedSnapshotEnvelope forValidationFailure(
            InboundSnapshotRecord record,
            JsonNode root,
            SnapshotValidator.ValidationResult validation,
            String rawJson) {
        RejectedSnapshotEnvelope envelope = baseEnvelope(record, rawJson, null);
        envelope.machineId = longOrNull(root, "machine_id");
        envelope.observedAt = longOrNull(root, "observed_at");
        envelope.failure = buildFailure(STAGE_VALIDATION, validation.failureClass, validation.reason, validation.details);
        return envelope;
    }

    /**
     * Envelope for a snapshot whose reconciliation threw; the payload is the bound snapshot.
     */
    public static RejectedSnapshotEnvelope forReconcileFailure(MachineState state, Exception ex) {
        RejectedSnapshotEnvelope envelope = baseEnvelope(null, snapshotJson(state), null);
        envelope.machineId = state.machineId;
        envelope.observedAt = state.observedAt;
        String details = ex == null ? "Unknown reconcile error"
                : (ex.getMessage() == null || ex.getMessage().isBlank()
                ? ex.getClass().getName()
                : ex.getClass().getName() + ": " + ex.getMessage());
        envelope.failure = buildFailure(STAGE_RECONCILE, "RECONCILE_FAILED", "reconcile_exception", details);
        return envelope;
    }

    private static RejectedSnapshotEnvelope baseEnvelope(InboundSnapshotRecord record, String rawJson, byte[] rawBytes) {
        RejectedSnapshotEnvelope envelope = new RejectedSnapshotEnvelope();
        envelope.schemaVersion = "v1";
        envelope.monitorBuild = BuildMetadata.current().identity();
        envelope.source = buildSourcePointer(record);
        envelope.payload = new RejectedSnapshotEnvelope.Payload();
        if (rawBytes != null) {
            envelope.payload.encoding = "base64";
            envelope.payload.body = Base64.getEncoder().encodeToString(rawBytes);
        } else {
            envelope.payload.encoding = "json";
            envelope.payload.body = rawJson;
        }
        envelope.ingestionTimestamp = System.currentTimeMillis();
        return envelope;
    }

    static RejectedSnapshotEnvelope.SourcePointer buildSourcePointer(InboundSnapshotRecord record) {
        RejectedSnapshotEnvelope.SourcePointer source = new RejectedSnapshotEnvelope.SourcePointer();
        if (record != null) {
            source.topic = record.topic;
            source.partition = record.partition;
            source.offset = record.offset;
            source.recordTimestamp = record.recordTimestamp;
        }
        return source;
    }

    private static RejectedSnapshotEnvelope.FailureDetails buildFailure(String stage, String failureClass, String reason, String details) {
        RejectedSnapshotEnvelope.FailureDetails failure = new RejectedSnapshotEnvelope.FailureDetails();
        failure.stage = stage;
        failure.failureClass = failureClass;
        failure.reason = reason;
        failure.details = details;
        return failure;
    }

    private static Long longOrNull(JsonNode root, String field) {
        if (root == null) {
            return null;
        }
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isIntegralNumber()) {
            return node.asLong();
        }
        try {
            return Long.parseLong(node.asText().trim());
        } catch (NumberFormatException ex) {
            return null;
        }
    }

    private static String snapshotJson(MachineState state) {
        try {
            return JsonSupport.SNAKE_CASE_MAPPER.writeValueAsString(state);
        } catch (Exception ex) {
            LOG.warn("Failed to serialize snapshot of machine {} for DLQ: {}", state.machineId, ex.getMessage());
            return "{\"machine_id\":" + state.machineId + "}";
        }
    }
}
