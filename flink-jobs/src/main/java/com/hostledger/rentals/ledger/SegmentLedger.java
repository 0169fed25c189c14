package com.hostledger.rentals.ledger;

import com.hostledger.rentals.model.GpuSegment;
import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.model.SessionStatus;
import com.hostledger.rentals.model.StorageSegment;

/**
 * Segment bookkeeping for the two billing dimensions of a session.
 *
 * <p>Invariants maintained here:
 * - at most one open segment per dimension, always the last one;
 * - a new segment starts exactly where the previous one was closed, so a dimension the session
 *   keeps holding has a gapless timeline;
 * - storage rates only ever move down while a storage segment is open.
 * </p>
 */
public final class SegmentLedger {
    public static final double HOURS_PER_MONTH = 730.0;
    private static final double MS_PER_HOUR = 3_600_000.0;

    private SegmentLedger() {}

    public static void openGpuSegment(RentalSession session, double ratePerGpuHour, int gpuCount, long ts) {
        closeGpuSegment(session, ts);
        session.gpuSegments.add(new GpuSegment(ts, ratePerGpuHour, gpuCount));
        session.lastStateChangeTs = ts;
        session.status = SessionStatus.RUNNING;
    }

    public static void closeGpuSegment(RentalSession session, long ts) {
        GpuSegment open = session.openGpuSegment();
        if (open != null) {
            open.endTs = Math.max(ts, open.startTs);
            session.lastStateChangeTs = ts;
        }
    }

    /**
     * Opens a storage segment unless one is already open at an equal or lower rate; a price rise
     * never replaces the open segment.
     *
     * @return true when a new segment was appended
     */
    public static boolean openStorageSegment(RentalSession session, double ratePerGbMonth, long ts) {
        StorageSegment open = session.openStorageSegment();
        if (open != null) {
            if (ratePerGbMonth >= open.ratePerGbMonth) {
                return false;
            }
            open.endTs = Math.max(ts, open.startTs);
        }
        session.storageSegments.add(new StorageSegment(ts, ratePerGbMonth));
        return true;
    }

    public static void closeStorageSegment(RentalSession session, long ts) {
        StorageSegment open = session.openStorageSegment();
        if (open != null) {
            open.endTs = Math.max(ts, open.startTs);
        }
    }

    /**
     * Totals as of {@code asOf}; open segments are billed up to {@code asOf}, closed ones up to
     * their end. Storage converts $/GB/month with a fixed 730-hour month.
     */
    public static EarningsTotals totals(RentalSession session, long asOf) {
        long sessionEnd = session.endTs != null ? session.endTs : asOf;
        long durationMs = Math.max(0L, sessionEnd - session.startTs);

        double gpu = 0.0;
        for (GpuSegment segment : session.gpuSegments) {
            gpu += segment.rate * segment.gpuCount * elapsedHours(segment.startTs, segment.endTs, asOf);
        }

        double storage = 0.0;
        for (StorageSegment segment : session.storageSegments) {
            double hours = elapsedHours(segment.startTs, segment.endTs, asOf);
            storage += segment.ratePerGbMonth * session.storageGb * hours / HOURS_PER_MONTH;
        }
        return new EarningsTotals(durationMs, gpu, storage);
    }

    /**
     * Closes all open segments at {@code ts} and freezes duration and earnings on the session.
     */
    public static EarningsTotals finalizeSession(RentalSession session, long ts) {
        closeGpuSegment(session, ts);
        closeStorageSegment(session, ts);
        session.endTs = ts;
        session.status = SessionStatus.ENDED;
        session.lastStateChangeTs = ts;
        EarningsTotals totals = totals(session, ts);
        session.durationMs = totals.durationMs;
        session.earnedGpu = totals.gpu;
        session.earnedStorage = totals.storage;
        session.earnedTotal = totals.total();
        return totals;
    }

    /**
     * Current hourly run-rate of the open segments, split as {gpu, storage}.
     */
    public static double[] hourlyRate(RentalSession session) {
        double gpu = 0.0;
        GpuSegment gpuSegment = session.openGpuSegment();
        if (gpuSegment != null) {
            gpu = gpuSegment.rate * gpuSegment.gpuCount;
        }
        double storage = 0.0;
        StorageSegment storageSegment = session.openStorageSegment();
        if (storageSegment != null) {
            storage = storageSegment.ratePerGbMonth * session.storageGb / HOURS_PER_MONTH;
        }
        return new double[] {gpu, storage};
    }

    private static double elapsedHours(long start, Long end, long asOf) {
        long effectiveEnd = end != null ? end : asOf;
        return Math.max(0L, effectiveEnd - start) / MS_PER_HOUR;
    }
}
