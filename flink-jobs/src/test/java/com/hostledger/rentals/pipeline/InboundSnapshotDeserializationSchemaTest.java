package com.hostledger.rentals.pipeline;

import org.apache.flink.api.common.functions.util.ListCollector;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;

import com.hostledger.rentals.model.InboundSnapshotRecord;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class InboundSnapshotDeserializationSchemaTest {

    @Test
    void keepsKafkaCoordinatesAndRawBytes() throws Exception {
        byte[] value = "{\"machine_id\":42}".getBytes(StandardCharsets.UTF_8);
        ConsumerRecord<byte[], byte[]> record = new ConsumerRecord<>(
                "machine_snapshots", 3, 17L, "42".getBytes(StandardCharsets.UTF_8), value);
        List<InboundSnapshotRecord> out = new ArrayList<>();

        new InboundSnapshotDeserializationSchema().deserialize(record, new ListCollector<>(out));

        assertEquals(1, out.size());
        InboundSnapshotRecord inbound = out.get(0);
        assertEquals("machine_snapshots", inbound.topic);
        assertEquals(3, inbound.partition);
        assertEquals(17L, inbound.offset);
        assertEquals("42", inbound.key);
        assertArrayEquals(value, inbound.value);
    }

    @Test
    void nullKeyAndValuePassThrough() throws Exception {
        ConsumerRecord<byte[], byte[]> record = new ConsumerRecord<>("machine_snapshots", 0, 1L, null, null);
        List<InboundSnapshotRecord> out = new ArrayList<>();

        new InboundSnapshotDeserializationSchema().deserialize(record, new ListCollector<>(out));

        assertNull(out.get(0).key);
        assertNull(out.get(0).value);
    }
}
