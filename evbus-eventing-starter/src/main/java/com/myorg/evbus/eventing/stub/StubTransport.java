package com.myorg.evbus.eventing.stub;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evbus.contracts.core.bus.BusTransport;
import com.myorg.evbus.contracts.core.bus.ConsumerRegistration;
import com.myorg.evbus.contracts.core.bus.MessageHandler;
import com.myorg.evbus.contracts.core.conventions.TopicNames;
import com.myorg.evbus.contracts.core.envelope.BusHealth;
import com.myorg.evbus.contracts.core.envelope.BusMessage;
import com.myorg.evbus.contracts.core.exception.BusTransportException;
import com.myorg.evbus.contracts.core.spi.RecordProcessingListener;
import com.myorg.evbus.contracts.core.trace.TraceContextHolder;
import com.myorg.evbus.contracts.core.trace.TracePropagator;
import com.myorg.evbus.eventing.HandlerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process transport for environments without a broker.
 *
 * <p>With loopback on, {@code publish} runs the local handlers of the topic synchronously on the
 * caller's thread before returning: delivery is in-process and synchronous instead of
 * asynchronous and at-least-once. Handler failures are logged and never fail the publisher.
 * There is nothing to retry and no dead-letter topic.
 */
@Slf4j
public class StubTransport implements BusTransport {

    private final HandlerRegistry registry = new HandlerRegistry();
    private final ObjectMapper mapper;
    private final String clientId;
    private final boolean loopback;
    private final RecordProcessingListener listener;

    public StubTransport(ObjectMapper mapper, String clientId, boolean loopback, RecordProcessingListener listener) {
        this.mapper = mapper;
        this.clientId = clientId;
        this.loopback = loopback;
        this.listener = listener != null ? listener : RecordProcessingListener.NOOP;
    }

    @Override
    public String name() {
        return "stub";
    }

    @Override
    public void start() {
        log.debug("Stub transport ready loopback={}", loopback);
    }

    @Override
    public void publish(String topic, JsonNode payload) {
        // same text encoding as the broker path, so non-serializable payloads fail here too
        String wire;
        try {
            wire = mapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new BusTransportException("Cannot serialize payload for topic=" + topic, e);
        }

        List<MessageHandler> handlers = registry.get(topic);
        if (!loopback || handlers.isEmpty()) {
            log.debug("Stub publish accepted topic={} handlers={} loopback={}", topic, handlers.size(), loopback);
            return;
        }

        Map<String, String> headers = TracePropagator.outboundHeaders();
        for (MessageHandler handler : handlers) {
            deliver(topic, wire, headers, handler);
        }
    }

    private void deliver(String topic, String wire, Map<String, String> headers, MessageHandler handler) {
        long t0 = System.nanoTime();
        try (TraceContextHolder.Scope ignored = TraceContextHolder.open(TracePropagator.inboundContext(headers))) {
            MDC.put("topic", topic);
            BusMessage message = BusMessage.builder()
                    .topic(topic)
                    .payload(mapper.readTree(wire))
                    .headers(new LinkedHashMap<>(headers))
                    .build();
            handler.handle(message);
            listener.onHandled(topic, 1, System.nanoTime() - t0);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("Stub handler failed topic={} handler={} error={}", topic, handler, e.toString(), e);
            listener.onAttemptFailed(topic, 1, e);
        } finally {
            MDC.remove("topic");
        }
    }

    @Override
    public ConsumerRegistration subscribe(String topic, MessageHandler handler) {
        if (!registry.register(topic, handler)) {
            log.debug("Handler already registered topic={}", topic);
        }
        return new ConsumerRegistration(topic, TopicNames.consumerGroup(clientId, topic));
    }

    @Override
    public BusHealth health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("transport", name());
        details.put("loopback", loopback);
        return BusHealth.up(details);
    }

    @Override
    public void close() {
        registry.clear();
    }

    HandlerRegistry registry() {
        return registry;
    }
}
