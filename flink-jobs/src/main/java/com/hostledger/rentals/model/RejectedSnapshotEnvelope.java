package com.hostledger.rentals.model;

import java.io.Serializable;

/**
 * DLQ envelope for snapshots that were not reconciled, with failure metadata and the raw payload.
 */
public class RejectedSnapshotEnvelope implements Serializable {
    private static final long serialVersionUID = 1L;

    public String schemaVersion;
    public SourcePointer source;
    public FailureDetails failure;
    public Long machineId;
    public Long observedAt;
    public Payload payload;
    public long ingestionTimestamp;
    public String monitorBuild;

    public RejectedSnapshotEnvelope() {}

    public static class SourcePointer implements Serializable {
        private static final long serialVersionUID = 1L;

        public String topic;
        public int partition;
        public long offset;
        public long recordTimestamp;

        public SourcePointer() {}
    }

    public static class FailureDetails implements Serializable {
        private static final long serialVersionUID = 1L;

        public String stage;
        public String failureClass;
        public String reason;
        public String details;

        public FailureDetails() {}
    }

    public static class Payload implements Serializable {
        private static final long serialVersionUID = 1L;

        public String encoding;
        public String body;

        public Payload() {}
    }
}
