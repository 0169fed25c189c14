package com.hostledger.rentals.reconcile;

import org.junit.jupiter.api.Test;

import com.hostledger.rentals.model.LifecycleEventType;
import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.RentalLifecycleEvent;
import com.hostledger.rentals.registry.RentalRegistry;

import java.util.List;

import static com.hostledger.rentals.reconcile.Snapshots.HOUR;
import static com.hostledger.rentals.reconcile.Snapshots.T0;
import static com.hostledger.rentals.reconcile.Snapshots.snapshot;
import static org.junit.jupiter.api.Assertions.*;

class MachineAlertTrackerTest {
    private static final long PING_MS = HOUR;

    @Test
    void newErrorIsReportedOnceWhilePersisting() {
        RentalRegistry registry = new RentalRegistry(42L);

        List<RentalLifecycleEvent> first = MachineAlertTracker.evaluate(registry, error(T0, "disk failure"), PING_MS);
        List<RentalLifecycleEvent> again = MachineAlertTracker.evaluate(registry, error(T0 + 60_000L, "disk failure"), PING_MS);

        assertEquals(1, first.size());
        assertEquals(LifecycleEventType.MACHINE_ERROR, first.get(0).eventType);
        assertEquals("disk failure", first.get(0).message);
        assertTrue(again.isEmpty());
        assertEquals(Long.valueOf(T0), registry.lastErrorNotifiedAt);
    }

    @Test
    void changedErrorWithinPingIntervalIsThrottled() {
        RentalRegistry registry = new RentalRegistry(42L);
        MachineAlertTracker.evaluate(registry, error(T0, "disk failure"), PING_MS);

        List<RentalLifecycleEvent> throttled =
                MachineAlertTracker.evaluate(registry, error(T0 + 10 * 60_000L, "fan failure"), PING_MS);
        List<RentalLifecycleEvent> later =
                MachineAlertTracker.evaluate(registry, error(T0 + 2 * HOUR, "psu failure"), PING_MS);

        assertTrue(throttled.isEmpty());
        assertEquals(1, later.size());
        assertEquals("psu failure", later.get(0).message);
    }

    @Test
    void clearedErrorEmitsRecoveryAndResetsThrottle() {
        RentalRegistry registry = new RentalRegistry(42L);
        MachineAlertTracker.evaluate(registry, error(T0, "disk failure"), PING_MS);

        List<RentalLifecycleEvent> recovery = MachineAlertTracker.evaluate(registry, error(T0 + 60_000L, ""), PING_MS);
        assertEquals(1, recovery.size());
        assertEquals(LifecycleEventType.MACHINE_RECOVERY, recovery.get(0).eventType);
        assertEquals("Recovered from error", recovery.get(0).message);
        assertNull(registry.lastErrorDescription);
        assertNull(registry.lastErrorNotifiedAt);

        List<RentalLifecycleEvent> relapse =
                MachineAlertTracker.evaluate(registry, error(T0 + 120_000L, "disk failure"), PING_MS);
        assertEquals(1, relapse.size());
    }

    @Test
    void timeoutIsTrackedSeparately() {
        RentalRegistry registry = new RentalRegistry(42L);
        MachineState timedOut = snapshot("x x x x", T0, 0.0);
        timedOut.timeout = 30;

        List<RentalLifecycleEvent> events = MachineAlertTracker.evaluate(registry, timedOut, PING_MS);
        assertEquals(1, events.size());
        assertEquals("Timeout: 30s", events.get(0).message);

        List<RentalLifecycleEvent> cleared =
                MachineAlertTracker.evaluate(registry, snapshot("x x x x", T0 + 60_000L, 0.0), PING_MS);
        assertEquals(1, cleared.size());
        assertEquals("Recovered from timeout", cleared.get(0).message);
        assertEquals(0, registry.lastTimeout);
    }

    private static MachineState error(long ts, String description) {
        MachineState state = snapshot("x x x x", ts, 0.0);
        state.errorDescription = description;
        return state;
    }
}
