package com.hostledger.rentals.model;

import java.io.Serializable;

/**
 * Raw machine snapshot record as read from Kafka, before validation.
 */
public class InboundSnapshotRecord implements Serializable {
    private static final long serialVersionUID = 1L;

    public String topic;
    public int partition;
    public long offset;
    public long recordTimestamp;
    public String key;
    public byte[] value;

    public InboundSnapshotRecord() {}
}
