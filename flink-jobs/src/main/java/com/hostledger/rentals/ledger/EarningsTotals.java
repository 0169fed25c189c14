package com.hostledger.rentals.ledger;

import java.io.Serializable;

/**
 * Point-in-time billing totals for one session, in full precision.
 */
public final class EarningsTotals implements Serializable {
    private static final long serialVersionUID = 1L;

    public final long durationMs;
    public final double gpu;
    public final double storage;

    public EarningsTotals(long durationMs, double gpu, double storage) {
        this.durationMs = durationMs;
        this.gpu = gpu;
        this.storage = storage;
    }

    public double total() {
        return gpu + storage;
    }

    @Override
    public String toString() {
        return "EarningsTotals{durationMs=" + durationMs + ", gpu=" + gpu + ", storage=" + storage + "}";
    }
}
