package com.hostledger.rentals.reconcile;

import com.hostledger.rentals.model.MachineState;
import com.hostledger.rentals.model.RentalCategory;
import com.hostledger.rentals.registry.RentalRegistry;

/**
 * Number of sessions expected to enter the stored (resident but not running) state this cycle,
 * split into the on-demand class and the combined interruptible/reserved class.
 *
 * <p>Derived purely from counter deltas: {@code budget = max(newStored - oldStored, 0)} with
 * {@code stored = resident - running} per class. This is the only evidence that separates a
 * pause from an end when a session frees all of its GPUs.</p>
 */
public final class PauseBudget {
    private int onDemand;
    private int other;

    PauseBudget(int onDemand, int other) {
        this.onDemand = onDemand;
        this.other = other;
    }

    public static PauseBudget estimate(RentalRegistry previous, MachineState current) {
        int oldStoredOnDemand = storedOnDemand(
                previous.currentRentalsOnDemand, previous.currentRentalsRunningOnDemand);
        int newStoredOnDemand = storedOnDemand(
                current.currentRentalsOnDemand, current.currentRentalsRunningOnDemand);
        int oldStoredOther = storedOther(
                previous.currentRentalsResident,
                previous.currentRentalsOnDemand,
                previous.currentRentalsRunning,
                previous.currentRentalsRunningOnDemand);
        int newStoredOther = storedOther(
                current.currentRentalsResident,
                current.currentRentalsOnDemand,
                current.currentRentalsRunning,
                current.currentRentalsRunningOnDemand);
        return new PauseBudget(
                Math.max(newStoredOnDemand - oldStoredOnDemand, 0),
                Math.max(newStoredOther - oldStoredOther, 0));
    }

    static int storedOnDemand(int residentOnDemand, int runningOnDemand) {
        return Math.max(residentOnDemand - runningOnDemand, 0);
    }

    static int storedOther(int resident, int residentOnDemand, int running, int runningOnDemand) {
        int residentOther = Math.max(resident - residentOnDemand, 0);
        int runningOther = Math.max(running - runningOnDemand, 0);
        return Math.max(residentOther - runningOther, 0);
    }

    public int onDemand() {
        return onDemand;
    }

    public int other() {
        return other;
    }

    /**
     * Takes one unit from the class of {@code category}.
     *
     * @return false when that class has no budget left
     */
    public boolean tryConsume(RentalCategory category) {
        if (isOnDemandClass(category)) {
            if (onDemand <= 0) {
                return false;
            }
            onDemand--;
            return true;
        }
        if (other <= 0) {
            return false;
        }
        other--;
        return true;
    }

    private static boolean isOnDemandClass(RentalCategory category) {
        return category != null && category.isOnDemand();
    }

    @Override
    public String toString() {
        return "PauseBudget{onDemand=" + onDemand + ", other=" + other + "}";
    }
}
