package com.hostledger.rentals.model;

import java.io.Serializable;

/**
 * Machine-level occupancy and earnings context attached to every lifecycle event.
 */
public class MachineSummary implements Serializable {
    private static final long serialVersionUID = 1L;

    public long machineId;
    public String gpuName = "";
    public int numGpus;
    public String gpuOccupancy = "";
    public int occupiedGpus;
    public int runningSessions;
    public int storedSessions;
    // Full precision; rounded only by notification formatting.
    public double hourlyGpuEarnings;
    public double hourlyStorageEarnings;
    public double hourlyTotalEarnings;
}
