package com.hostledger.rentals.model;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * One polled snapshot of a host machine as published by the upstream poller.
 *
 * <p>Field names map to the upstream snake_case keys (e.g. {@code current_rentals_on_demand}).
 * {@code currentRentalsOnDemand} counts resident on-demand rentals, running or not.</p>
 */
public class MachineState implements Serializable {
    private static final long serialVersionUID = 1L;

    public long machineId;
    public long observedAt;

    public String gpuOccupancy = "";
    public int numGpus;
    public String gpuName = "";

    public int currentRentalsResident;
    public int currentRentalsOnDemand;
    public int currentRentalsRunning;
    public int currentRentalsRunningOnDemand;

    public double allocDiskSpace;

    public double listedGpuCost;
    public double minBidPrice;
    public double bidGpuCost;
    public double listedStorageCost;

    public List<ClientHint> clients = new ArrayList<>();

    public String errorDescription;
    public int timeout;

    /**
     * Occupancy tokens padded with the free code up to {@link #numGpus}.
     */
    public String[] slotCodes() {
        return padCodes(gpuOccupancy, numGpus);
    }

    /**
     * Occupancy tokens exactly as reported, without padding.
     */
    public String[] reportedCodes() {
        return padCodes(gpuOccupancy, 0);
    }

    public static String[] padCodes(String occupancy, int minLength) {
        String trimmed = occupancy == null ? "" : occupancy.trim();
        String[] tokens = trimmed.isEmpty() ? new String[0] : trimmed.split("\\s+");
        if (tokens.length >= minLength) {
            return tokens;
        }
        String[] padded = Arrays.copyOf(tokens, minLength);
        Arrays.fill(padded, tokens.length, minLength, RentalCategory.FREE_CODE);
        return padded;
    }

    /**
     * Per-client details the host API sometimes attaches to a snapshot.
     */
    public static class ClientHint implements Serializable {
        private static final long serialVersionUID = 1L;

        public String clientId;
        public Double storageGb;
        public Long clientEndTs;

        public ClientHint() {}

        public ClientHint(String clientId, Double storageGb, Long clientEndTs) {
            this.clientId = clientId;
            this.storageGb = storageGb;
            this.clientEndTs = clientEndTs;
        }
    }
}
