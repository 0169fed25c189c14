package com.hostledger.rentals.reconcile;

import com.hostledger.rentals.model.LifecycleEventType;
import com.hostledger.rentals.model.RentalLifecycleEvent;
import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.registry.RentalRegistry;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one reconciliation pass: the registry to persist, the lifecycle events to publish
 * and the sessions finalized in this pass.
 */
public final class ReconcileResult {
    public final RentalRegistry registry;
    public final List<RentalLifecycleEvent> events = new ArrayList<>();
    public final List<RentalSession> archived = new ArrayList<>();
    public int ambiguousEnds;

    ReconcileResult(RentalRegistry registry) {
        this.registry = registry;
    }

    public long count(LifecycleEventType type) {
        return events.stream().filter(event -> event.eventType == type).count();
    }
}
