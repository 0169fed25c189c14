package com.hostledger.rentals.model;

public enum SessionStatus {
    /** Holding GPUs and billed for compute and storage. */
    RUNNING,
    /** GPUs released, disk still resident and billed for storage. */
    STORED,
    /** Finalized; totals frozen and the session archived. */
    ENDED
}
