package com.hostledger.rentals.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Inferred rental session on one machine together with its billing segments.
 *
 * <p>Contracted rates are the first-observed market rates and are never raised afterwards.
 * For {@link SessionStatus#STORED} sessions {@link #gpus} keeps the last held slot set so a
 * later claim of the same slots can resume the session in place.</p>
 */
public class RentalSession implements Serializable {
    private static final long serialVersionUID = 1L;

    public String sessionId = "";
    public SessionStatus status = SessionStatus.RUNNING;
    public List<Integer> gpus = new ArrayList<>();
    public RentalCategory category;

    public double gpuContractedRate;
    public double storageContractedRate;
    public double storageGb;

    public List<GpuSegment> gpuSegments = new ArrayList<>();
    public List<StorageSegment> storageSegments = new ArrayList<>();

    public long startTs;
    public long lastStateChangeTs;
    public Long clientEndTs;
    // Upstream client id when the session was sized from a client hint.
    public String clientRef;

    // Populated on finalize.
    public Long endTs;
    public Long durationMs;
    public Double earnedGpu;
    public Double earnedStorage;
    public Double earnedTotal;

    public RentalSession() {}

    @JsonIgnore
    public GpuSegment openGpuSegment() {
        if (gpuSegments.isEmpty()) {
            return null;
        }
        GpuSegment last = gpuSegments.get(gpuSegments.size() - 1);
        return last.isOpen() ? last : null;
    }

    @JsonIgnore
    public StorageSegment openStorageSegment() {
        if (storageSegments.isEmpty()) {
            return null;
        }
        StorageSegment last = storageSegments.get(storageSegments.size() - 1);
        return last.isOpen() ? last : null;
    }

    /**
     * Effective GPU rate: the observed rate capped by the contracted ceiling. An unset (zero)
     * ceiling leaves the observed rate unchanged.
     */
    public double cappedGpuRate(double observedRate) {
        return gpuContractedRate > 0.0 ? Math.min(observedRate, gpuContractedRate) : observedRate;
    }

    public RentalSession copy() {
        RentalSession copy = new RentalSession();
        copy.sessionId = sessionId;
        copy.status = status;
        copy.gpus = new ArrayList<>(gpus);
        copy.category = category;
        copy.gpuContractedRate = gpuContractedRate;
        copy.storageContractedRate = storageContractedRate;
        copy.storageGb = storageGb;
        for (GpuSegment segment : gpuSegments) {
            copy.gpuSegments.add(segment.copy());
        }
        for (StorageSegment segment : storageSegments) {
            copy.storageSegments.add(segment.copy());
        }
        copy.startTs = startTs;
        copy.lastStateChangeTs = lastStateChangeTs;
        copy.clientEndTs = clientEndTs;
        copy.clientRef = clientRef;
        copy.endTs = endTs;
        copy.durationMs = durationMs;
        copy.earnedGpu = earnedGpu;
        copy.earnedStorage = earnedStorage;
        copy.earnedTotal = earnedTotal;
        return copy;
    }
}
