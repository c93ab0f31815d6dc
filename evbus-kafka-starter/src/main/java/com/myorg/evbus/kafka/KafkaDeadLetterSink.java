package com.myorg.evbus.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evbus.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evbus.contracts.core.exception.BusTransportException;
import com.myorg.evbus.kafka.processing.DeadLetterSink;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.springframework.kafka.core.KafkaTemplate;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Publishes dead-letter records as JSON through the transport's producer.
 */
public class KafkaDeadLetterSink implements DeadLetterSink {

    private final Supplier<KafkaTemplate<String, String>> template;
    private final ObjectMapper mapper;
    private final Duration sendTimeout;

    public KafkaDeadLetterSink(Supplier<KafkaTemplate<String, String>> template, ObjectMapper mapper, Duration sendTimeout) {
        this.template = template;
        this.mapper = mapper;
        this.sendTimeout = sendTimeout;
    }

    @Override
    public void send(String topic, DeadLetterRecord record, Map<String, String> headers) {
        String value;
        try {
            value = mapper.writeValueAsString(record);
        } catch (JsonProcessingException e) {
            throw new BusTransportException("Cannot serialize dead-letter record for topic=" + topic, e);
        }
        ProducerRecord<String, String> rec = new ProducerRecord<>(topic, value);
        headers.forEach((k, v) -> rec.headers().add(k, (v == null ? "" : v).getBytes(StandardCharsets.UTF_8)));
        KafkaSends.sendAndWait(template.get(), rec, sendTimeout);
    }
}
