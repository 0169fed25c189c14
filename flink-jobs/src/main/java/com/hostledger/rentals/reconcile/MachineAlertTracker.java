package com.hostledger.rentals.reconcile;

import com.hostledger.rentals.model.LifecycleEventType;
import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.RentalLifecycleEvent;
import com.hostledger.rentals.registry.RentalRegistry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Error/timeout edge detection for a machine, throttled so a persisting error is re-announced at
 * most once per ping interval.
 */
public final class MachineAlertTracker {
    private static final Logger LOG = LoggerFactory.getLogger(MachineAlertTracker.class);

    private MachineAlertTracker() {}

    public static List<RentalLifecycleEvent> evaluate(
            RentalRegistry registry,
            MachineState state,
            long pingIntervalMs) {
        List<RentalLifecycleEvent> out = new ArrayList<>(2);
        long now = state.observedAt;

        String error = blankToNull(state.errorDescription);
        if (!Objects.equals(error, registry.lastErrorDescription)) {
            if (error != null) {
                if (allowed(registry.lastErrorNotifiedAt, now, pingIntervalMs)) {
                    LOG.error("Machine {} error: {}", state.machineId, error);
                    out.add(alert(LifecycleEventType.MACHINE_ERROR, state, error));
                    registry.lastErrorNotifiedAt = now;
                }
            } else {
                LOG.info("Machine {} recovered from error.", state.machineId);
                out.add(alert(LifecycleEventType.MACHINE_RECOVERY, state, "Recovered from error"));
                registry.lastErrorNotifiedAt = null;
            }
            registry.lastErrorDescription = error;
        }

        int timeout = Math.max(state.timeout, 0);
        if (timeout != registry.lastTimeout) {
            if (timeout > 0) {
                if (allowed(registry.lastTimeoutNotifiedAt, now, pingIntervalMs)) {
                    LOG.error("Machine {} timeout: {}s", state.machineId, timeout);
                    out.add(alert(LifecycleEventType.MACHINE_ERROR, state, "Timeout: " + timeout + "s"));
                    registry.lastTimeoutNotifiedAt = now;
                }
            } else {
                LOG.info("Machine {} recovered from timeout.", state.machineId);
                out.add(alert(LifecycleEventType.MACHINE_RECOVERY, state, "Recovered from timeout"));
                registry.lastTimeoutNotifiedAt = null;
            }
            registry.lastTimeout = timeout;
        }
        return out;
    }

    private static boolean allowed(Long lastNotifiedAt, long now, long pingIntervalMs) {
        return lastNotifiedAt == null || now - lastNotifiedAt >= pingIntervalMs;
    }

    private static RentalLifecycleEvent alert(LifecycleEventType type, MachineState state, String message) {
        RentalLifecycleEvent event = new RentalLifecycleEvent(type, state.machineId, state.observedAt);
        event.message = message;
        return event;
    }

    private static String blankToNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim();
    }
}
