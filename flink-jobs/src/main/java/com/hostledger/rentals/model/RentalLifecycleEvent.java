package com.hostledger.rentals.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Typed lifecycle event produced by reconciliation. {@link #session} is a detached copy of the
 * session state at emission time and is {@code null} for machine-level alerts.
 */
public class RentalLifecycleEvent implements Serializable {
    private static final long serialVersionUID = 1L;

    public LifecycleEventType eventType;
    public long machineId;
    public long eventTs;
    public RentalSession session;
    public RentalCategory rentalType;
    public Double rate;
    public List<Integer> gpuIndices = new ArrayList<>();
    public String message;
    public MachineSummary machine;

    public RentalLifecycleEvent() {}

    public RentalLifecycleEvent(LifecycleEventType eventType, long machineId, long eventTs) {
        this.eventType = eventType;
        this.machineId = machineId;
        this.eventTs = eventTs;
    }

    public String sessionId() {
        return session == null ? null : session.sessionId;
    }
}
