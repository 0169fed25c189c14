package com.hostledger.rentals.pipeline;

import org.apache.flink.api.common.typeinfo.TypeInformation;
import org.apache.flink.connector.kafka.source.reader.deserializer.KafkaRecordDeserializationSchema;
import org.apache.flink.util.Collector;
import org.apache.kafka.clients.consumer.ConsumerRecord;

import com.hostledger.rentals.model.InboundSnapshotRecord;

import java.nio.charset.StandardCharsets;

/**
 * Wraps raw snapshot bytes with their Kafka coordinates; parsing happens in the quality gate so
 * malformed payloads can still be routed to the DLQ.
 */
public class InboundSnapshotDeserializationSchema implements KafkaRecordDeserializationSchema<InboundSnapshotRecord> {
    private static final long serialVersionUID = 1L;

    @Override
    public void deserialize(ConsumerRecord<byte[], byte[]> record, Collector<InboundSnapshotRecord> out) {
        InboundSnapshotRecord inbound = new InboundSnapshotRecord();
        inbound.topic = record.topic();
        inbound.partition = record.partition();
        inbound.offset = record.offset();
        inbound.recordTimestamp = record.timestamp();
        inbound.value = record.value();
        inbound.key = record.key() == null ? null : new String(record.key(), StandardCharsets.UTF_8);
        out.collect(inbound);
    }

    @Override
    public TypeInformation<InboundSnapshotRecord> getProducedType() {
        return TypeInformation.of(InboundSnapshotRecord.class);
    }
}
