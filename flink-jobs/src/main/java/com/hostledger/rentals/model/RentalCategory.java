package com.hostledger.rentals.model;

/**
 * Demand class a GPU slot is rented under, keyed by the occupancy code the host reports.
 *
 * <p>{@code x} (or an empty token) marks a free slot and has no category.</p>
 */
public enum RentalCategory {
    ON_DEMAND("D"),
    INTERRUPTIBLE("I"),
    RESERVED("R");

    public static final String FREE_CODE = "x";

    private final String code;

    RentalCategory(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }

    public boolean isOnDemand() {
        return this == ON_DEMAND;
    }

    /**
     * Current market rate in $/GPU/hour for this category on the given machine.
     */
    public double marketRate(MachineState state) {
        switch (this) {
            case ON_DEMAND:
                return state.listedGpuCost;
            case INTERRUPTIBLE:
                return state.minBidPrice;
            case RESERVED:
                return state.bidGpuCost;
            default:
                return 0.0;
        }
    }

    public static boolean isOccupied(String code) {
        return code != null && !code.trim().isEmpty() && !FREE_CODE.equals(code.trim());
    }

    public static boolean isKnownCode(String code) {
        return FREE_CODE.equals(code) || fromCode(code) != null;
    }

    /**
     * @return the category for an occupied code, or {@code null} for free or unrecognized codes
     */
    public static RentalCategory fromCode(String code) {
        if (code == null) {
            return null;
        }
        String trimmed = code.trim();
        for (RentalCategory category : values()) {
            if (category.code.equals(trimmed)) {
                return category;
            }
        }
        return null;
    }
}
