package com.hostledger.rentals.registry;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;

import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.model.SessionStatus;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-machine session registry: slot ownership, active sessions and the id sequence, plus the
 * last observation the next snapshot is diffed against.
 *
 * <p>Owned exclusively by one reconciliation pass at a time; the pass mutates a {@link #copy()}
 * and the caller persists the result.</p>
 */
public class RentalRegistry implements Serializable {
    private static final long serialVersionUID = 1L;

    public long machineId;
    @JsonDeserialize(as = TreeMap.class)
    public Map<Integer, String> slotToSession = new TreeMap<>();
    @JsonDeserialize(as = LinkedHashMap.class)
    public Map<String, RentalSession> sessions = new LinkedHashMap<>();
    public long nextSessionSeq = 1L;

    // Last observation.
    public String gpuOccupancy = "";
    public int numGpus;
    public String gpuName = "";
    public double allocDiskSpace;
    public int currentRentalsResident;
    public int currentRentalsOnDemand;
    public int currentRentalsRunning;
    public int currentRentalsRunningOnDemand;
    public long lastObservedAt;

    // Alert throttling.
    public String lastErrorDescription;
    public int lastTimeout;
    public Long lastErrorNotifiedAt;
    public Long lastTimeoutNotifiedAt;

    public RentalRegistry() {}

    public RentalRegistry(long machineId) {
        this.machineId = machineId;
    }

    /**
     * Allocates the next session id ({@code m<machine>-<seq>}); ids are strictly increasing.
     */
    public String allocateSessionId() {
        long seq = nextSessionSeq;
        nextSessionSeq = seq + 1;
        return String.format("m%d-%04d", machineId, seq);
    }

    public List<RentalSession> sessionsWithStatus(SessionStatus status) {
        List<RentalSession> out = new ArrayList<>();
        for (RentalSession session : sessions.values()) {
            if (session.status == status) {
                out.add(session);
            }
        }
        return out;
    }

    /**
     * Last-seen occupancy padded to the slot count of the incoming snapshot.
     */
    public String[] previousSlotCodes(int numGpus) {
        return MachineState.padCodes(gpuOccupancy, numGpus);
    }

    public void assignSlots(List<Integer> slots, String sessionId) {
        for (Integer slot : slots) {
            slotToSession.put(slot, sessionId);
        }
    }

    public void releaseSlotsOf(String sessionId) {
        slotToSession.values().removeIf(sessionId::equals);
    }

    /**
     * Records the snapshot as the baseline for the next diff.
     */
    public void recordObservation(MachineState state) {
        gpuOccupancy = state.gpuOccupancy == null ? "" : state.gpuOccupancy;
        numGpus = state.numGpus;
        gpuName = state.gpuName == null ? "" : state.gpuName;
        allocDiskSpace = state.allocDiskSpace;
        currentRentalsResident = state.currentRentalsResident;
        currentRentalsOnDemand = state.currentRentalsOnDemand;
        currentRentalsRunning = state.currentRentalsRunning;
        currentRentalsRunningOnDemand = state.currentRentalsRunningOnDemand;
        lastObservedAt = state.observedAt;
    }

    public RentalRegistry copy() {
        RentalRegistry copy = new RentalRegistry(machineId);
        copy.slotToSession = new TreeMap<>(slotToSession);
        for (Map.Entry<String, RentalSession> entry : sessions.entrySet()) {
            copy.sessions.put(entry.getKey(), entry.getValue().copy());
        }
        copy.nextSessionSeq = nextSessionSeq;
        copy.gpuOccupancy = gpuOccupancy;
        copy.numGpus = numGpus;
        copy.gpuName = gpuName;
        copy.allocDiskSpace = allocDiskSpace;
        copy.currentRentalsResident = currentRentalsResident;
        copy.currentRentalsOnDemand = currentRentalsOnDemand;
        copy.currentRentalsRunning = currentRentalsRunning;
        copy.currentRentalsRunningOnDemand = currentRentalsRunningOnDemand;
        copy.lastObservedAt = lastObservedAt;
        copy.lastErrorDescription = lastErrorDescription;
        copy.lastTimeout = lastTimeout;
        copy.lastErrorNotifiedAt = lastErrorNotifiedAt;
        copy.lastTimeoutNotifiedAt = lastTimeoutNotifiedAt;
        return copy;
    }
}
