package com.hostledger.rentals.reconcile;

import java.io.Serializable;

/**
 * Tunables of the reconciliation heuristics.
 */
public final class ReconcileSettings implements Serializable {
    private static final long serialVersionUID = 1L;

    public static final double DEFAULT_DISK_TOLERANCE_GB = 1.0;
    // Smaller drops are treated as allocation noise, not a teardown.
    public static final double DEFAULT_DISK_DROP_NOISE_GB = 0.1;
    public static final long DEFAULT_ALERT_PING_INTERVAL_MS = 60L * 60L * 1000L;

    public final double diskToleranceGb;
    public final double diskDropNoiseGb;
    public final long alertPingIntervalMs;

    public ReconcileSettings(double diskToleranceGb, double diskDropNoiseGb, long alertPingIntervalMs) {
        if (diskToleranceGb <= 0.0) {
            throw new IllegalArgumentException("diskToleranceGb must be positive: " + diskToleranceGb);
        }
        this.diskToleranceGb = diskToleranceGb;
        this.diskDropNoiseGb = Math.max(0.0, diskDropNoiseGb);
        this.alertPingIntervalMs = Math.max(0L, alertPingIntervalMs);
    }

    public static ReconcileSettings defaults() {
        return new ReconcileSettings(DEFAULT_DISK_TOLERANCE_GB, DEFAULT_DISK_DROP_NOISE_GB, DEFAULT_ALERT_PING_INTERVAL_MS);
    }
}
