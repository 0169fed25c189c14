package com.hostledger.rentals.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;

/**
 * Interval during which one $/GPU/hour rate applied to a fixed GPU count.
 */
public class GpuSegment implements Serializable {
    private static final long serialVersionUID = 1L;

    public long startTs;
    public Long endTs;
    public double rate;
    public int gpuCount;

    public GpuSegment() {}

    public GpuSegment(long startTs, double rate, int gpuCount) {
        this.startTs = startTs;
        this.rate = rate;
        this.gpuCount = gpuCount;
    }

    @JsonIgnore
    public boolean isOpen() {
        return endTs == null;
    }

    public GpuSegment copy() {
        GpuSegment copy = new GpuSegment(startTs, rate, gpuCount);
        copy.endTs = endTs;
        return copy;
    }
}
