package com.hostledger.rentals.notify;

import com.hostledger.rentals.ledger.SegmentLedger;
import com.hostledger.rentals.model.MachineSummary;
import com.hostledger.rentals.model.RentalLifecycleEvent;
import com.hostledger.rentals.model.RentalSession;
import com.hostledger.rentals.model.StorageSegment;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

/**
 * Renders lifecycle events as plain-text notifications. Money amounts are rounded to cents and
 * rates to four decimals here only; the ledger keeps full precision.
 */
public final class EventMessageFormatter {
    static final String RULE = "~~                                                 ~~";

    private EventMessageFormatter() {}

    public static NotificationMessage format(RentalLifecycleEvent event) {
        String title = title(event);
        List<String> lines = new ArrayList<>();
        lines.add("## " + title);
        lines.add("Machine " + event.machineId);
        switch (event.eventType) {
            case START:
                startLines(event, lines);
                break;
            case END:
                endLines(event, lines);
                break;
            case PAUSE:
                pauseLines(event, lines);
                break;
            case RESUME:
                resumeLines(event, lines);
                break;
            case MACHINE_ERROR:
                lines.add("Error: " + nullToEmpty(event.message));
                break;
            case MACHINE_RECOVERY:
                lines.add("Status: OK");
                if (event.message != null) {
                    lines.add(event.message);
                }
                break;
            default:
                break;
        }
        if (event.machine != null && event.session != null) {
            lines.addAll(machineLines(event.machine));
        }
        String body = RULE + "\n" + String.join("\n", lines);
        return new NotificationMessage(title, body, NotificationTarget.eventKey(event.eventType));
    }

    static String title(RentalLifecycleEvent event) {
        switch (event.eventType) {
            case START:
                return "New Rental";
            case END:
                return "Rental Ended";
            case PAUSE:
                return "Session Paused";
            case RESUME:
                return "Session Resumed";
            case MACHINE_ERROR:
                return "Machine Error";
            case MACHINE_RECOVERY:
                return "Machine Recovered";
            default:
                return String.valueOf(event.eventType);
        }
    }

    private static void startLines(RentalLifecycleEvent event, List<String> lines) {
        RentalSession session = event.session;
        double rate = event.rate == null ? 0.0 : event.rate;
        double[] hourly = SegmentLedger.hourlyRate(session);
        lines.add("- " + session.sessionId + ":");
        lines.add(String.format(Locale.ROOT, "  - %s @ $%.4f/gpu (est hourly %s (GPUs) + %s (disk) = %s)",
                event.rentalType, rate, money(hourly[0]), money(hourly[1]), money(hourly[0] + hourly[1])));
        lines.add("  - x" + session.gpus.size() + " GPUs allocated: " + sorted(session.gpus));
        if (session.storageGb > 0.0) {
            lines.add(String.format(Locale.ROOT, "  - Storage: %.2f GB @ $%.4f/GB/mo",
                    session.storageGb, currentStorageRate(session)));
        }
        lines.add("  - Start: " + iso(session.startTs));
    }

    private static void endLines(RentalLifecycleEvent event, List<String> lines) {
        RentalSession session = event.session;
        double gpu = session.earnedGpu == null ? 0.0 : session.earnedGpu;
        double storage = session.earnedStorage == null ? 0.0 : session.earnedStorage;
        long durationMs = session.durationMs == null ? 0L : session.durationMs;
        lines.add("- " + session.sessionId + ":");
        lines.add("  - x" + session.gpus.size() + " GPUs released: " + sorted(session.gpus));
        lines.add("  - Duration: " + humanizeDuration(durationMs));
        lines.add(String.format(Locale.ROOT, "  - Total earned: %s (GPUs) + %s (disk) = %s",
                money(gpu), money(storage), money(gpu + storage)));
        lines.add("  - Start: " + iso(session.startTs));
        if (session.endTs != null) {
            lines.add("  - End: " + iso(session.endTs));
        }
        if (event.message != null) {
            lines.add("  - Note: " + event.message);
        }
    }

    private static void pauseLines(RentalLifecycleEvent event, List<String> lines) {
        RentalSession session = event.session;
        lines.add("- " + session.sessionId + ":");
        lines.add("  - x" + event.gpuIndices.size() + " GPUs released: " + sorted(event.gpuIndices));
        lines.add(String.format(Locale.ROOT, "  - Storage: %.2f GB continues", session.storageGb));
    }

    private static void resumeLines(RentalLifecycleEvent event, List<String> lines) {
        RentalSession session = event.session;
        double rate = event.rate == null ? 0.0 : event.rate;
        lines.add("- " + session.sessionId + ":");
        lines.add("  - x" + event.gpuIndices.size() + " GPUs allocated: " + sorted(event.gpuIndices));
        lines.add(String.format(Locale.ROOT, "  - GPU rate: $%.4f/gpu/hr", rate));
    }

    private static List<String> machineLines(MachineSummary machine) {
        List<String> lines = new ArrayList<>();
        int pct = machine.numGpus > 0 ? (int) Math.round(machine.occupiedGpus * 100.0 / machine.numGpus) : 0;
        lines.add("### Machine " + machine.machineId);
        lines.add(String.format(Locale.ROOT, "Occupancy: %d/%d GPUs (%d%%)", machine.occupiedGpus, machine.numGpus, pct));
        lines.add(String.format(Locale.ROOT, "Total est hourly: %s (GPUs) + %s (disk) = %s",
                money(machine.hourlyGpuEarnings), money(machine.hourlyStorageEarnings), money(machine.hourlyTotalEarnings)));
        lines.add(String.format(Locale.ROOT, "Tracked sessions: %d running, %d stored",
                machine.runningSessions, machine.storedSessions));
        return lines;
    }

    private static double currentStorageRate(RentalSession session) {
        StorageSegment open = session.openStorageSegment();
        return open == null ? session.storageContractedRate : open.ratePerGbMonth;
    }

    static String money(double amount) {
        return String.format(Locale.ROOT, "$%.2f", amount);
    }

    /**
     * Compact duration such as {@code 45s}, {@code 3m 5s}, {@code 2h 0m 7s} or {@code 1d 2h 3m}.
     */
    public static String humanizeDuration(long durationMs) {
        long secs = Math.round(Math.max(0L, durationMs) / 1000.0);
        if (secs < 60) {
            return secs + "s";
        }
        long minutes = secs / 60;
        long s = secs % 60;
        if (minutes < 60) {
            return minutes + "m " + s + "s";
        }
        long hours = minutes / 60;
        long m = minutes % 60;
        if (hours < 24) {
            return hours + "h " + m + "m " + s + "s";
        }
        long days = hours / 24;
        long h = hours % 24;
        return days + "d " + h + "h " + m + "m";
    }

    private static List<Integer> sorted(List<Integer> values) {
        List<Integer> copy = new ArrayList<>(values);
        Collections.sort(copy);
        return copy;
    }

    private static String iso(long epochMs) {
        return Instant.ofEpochMilli(epochMs).toString();
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
