package com.hostledger.rentals.reconcile;

import com.hostledger.rentals.ledger.SegmentLedger;
import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.MachineSummary;
import com.hostledger.rentals.model.RentalCategory;
import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.model.SessionStatus;
import com.hostledger.rentals.registry.RentalRegistry;

/**
 * Builds the machine context attached to lifecycle events.
 */
public final class MachineSummaries {
    private MachineSummaries() {}

    public static MachineSummary summarize(RentalRegistry registry, MachineState state) {
        MachineSummary summary = new MachineSummary();
        summary.machineId = state.machineId;
        summary.gpuName = state.gpuName == null ? "" : state.gpuName;
        summary.numGpus = state.numGpus;
        summary.gpuOccupancy = state.gpuOccupancy == null ? "" : state.gpuOccupancy;
        for (String code : state.slotCodes()) {
            if (RentalCategory.isOccupied(code)) {
                summary.occupiedGpus++;
            }
        }
        for (RentalSession session : registry.sessions.values()) {
            if (session.status == SessionStatus.RUNNING) {
                summary.runningSessions++;
            } else if (session.status == SessionStatus.STORED) {
                summary.storedSessions++;
            }
            double[] hourly = SegmentLedger.hourlyRate(session);
            summary.hourlyGpuEarnings += hourly[0];
            summary.hourlyStorageEarnings += hourly[1];
        }
        summary.hourlyTotalEarnings = summary.hourlyGpuEarnings + summary.hourlyStorageEarnings;
        return summary;
    }
}
