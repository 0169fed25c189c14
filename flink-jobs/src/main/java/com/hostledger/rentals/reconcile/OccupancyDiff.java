package com.hostledger.rentals.reconcile;

import com.hostledger.rentals.model.RentalCategory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Slot-level diff between two occupancy observations.
 *
 * <p>A slot is ended when it was occupied and is now free or carries a different code; it is
 * started when it is now occupied and was free or carried a different code. A code change on an
 * occupied slot is therefore reported on both sides as a reassignment.</p>
 *
 * <p>Only slots present in both observations are compared; a slot missing from either side is
 * never reported.</p>
 */
public final class OccupancyDiff {
    public final List<Integer> ended;
    public final List<Integer> started;

    private OccupancyDiff(List<Integer> ended, List<Integer> started) {
        this.ended = Collections.unmodifiableList(ended);
        this.started = Collections.unmodifiableList(started);
    }

    public static OccupancyDiff compute(String[] oldCodes, String[] newCodes) {
        int length = Math.min(oldCodes.length, newCodes.length);
        List<Integer> ended = new ArrayList<>();
        List<Integer> started = new ArrayList<>();
        for (int i = 0; i < length; i++) {
            String before = codeAt(oldCodes, i);
            String after = codeAt(newCodes, i);
            boolean wasOccupied = RentalCategory.isOccupied(before);
            boolean isOccupied = RentalCategory.isOccupied(after);
            boolean reassigned = wasOccupied && isOccupied && !before.equals(after);
            if ((wasOccupied && !isOccupied) || reassigned) {
                ended.add(i);
            }
            if ((!wasOccupied && isOccupied) || reassigned) {
                started.add(i);
            }
        }
        return new OccupancyDiff(ended, started);
    }

    public boolean isEmpty() {
        return ended.isEmpty() && started.isEmpty();
    }

    private static String codeAt(String[] codes, int index) {
        if (codes[index] == null) {
            return RentalCategory.FREE_CODE;
        }
        return codes[index].trim();
    }
}
