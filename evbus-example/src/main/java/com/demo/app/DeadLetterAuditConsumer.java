package com.demo.app;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evbus.contracts.core.envelope.BusMessage;
import com.myorg.evbus.eventing.EventConsumer;
import com.myorg.evbus.kafka.DlqHeaders;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;

/**
 * Demo dead-letter consumer so you can see when an order ends up in the DLQ just by looking at logs.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DeadLetterAuditConsumer {

    private static final int KEEP = 50;

    private final ObjectMapper mapper;
    private final Deque<Map<String, Object>> recent = new ArrayDeque<>();

    @EventConsumer(topic = DemoTopics.ORDERS_DLQ)
    public void onDeadLetter(BusMessage message, JsonNode record) {
        log.error("DLQ RECEIVED attempts={} error={} original={} reason={}",
                record.path("attempts").asInt(), record.path("error").asText(),
                record.path("original"), message.header(DlqHeaders.REASON));

        Map<String, Object> entry = mapper.convertValue(record, new TypeReference<Map<String, Object>>() {});
        synchronized (recent) {
            recent.addFirst(entry);
            while (recent.size() > KEEP) recent.removeLast();
        }
    }

    public List<Map<String, Object>> recent() {
        synchronized (recent) {
            return new ArrayList<>(recent);
        }
    }
}
