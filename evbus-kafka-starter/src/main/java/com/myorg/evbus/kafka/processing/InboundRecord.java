package com.myorg.evbus.kafka.processing;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.header.Header;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A consumed record, decoupled from the Kafka client types. Header values are UTF-8 text.
 */
public record InboundRecord(String topic, int partition, long offset, String value, Map<String, String> headers) {

    public InboundRecord {
        headers = headers == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public static InboundRecord from(ConsumerRecord<String, String> rec) {
        Map<String, String> headers = new LinkedHashMap<>();
        for (Header h : rec.headers()) {
            // last value wins for repeated keys
            headers.put(h.key(), h.value() == null ? "" : new String(h.value(), StandardCharsets.UTF_8));
        }
        return new InboundRecord(rec.topic(), rec.partition(), rec.offset(), rec.value(), headers);
    }
}
