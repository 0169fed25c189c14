package com.hostledger.rentals.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * Interval during which one $/GB/month storage rate applied.
 */
public class StorageSegment implements Serializable {
    private static final long serialVersionUID = 1L;

    public long startTs;
    public Long endTs;
    public double ratePerGbMonth;

    public StorageSegment() {}

    public StorageSegment(long startTs, double ratePerGbMonth) {
        this.startTs = startTs;
        this.ratePerGbMonth = ratePerGbMonth;
    }

    @JsonIgnore
    public boolean isOpen() {
        return endTs == null;
    }

    public StorageSegment copy() {
        StorageSegment copy = new StorageSegment(startTs, ratePerGbMonth);
        copy.endTs = endTs;
        return copy;
    }
}
