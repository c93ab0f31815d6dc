package com.myorg.evbus.eventing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.myorg.evbus.contracts.core.bus.BusTransport;
import com.myorg.evbus.contracts.core.bus.ConsumerRegistration;
import com.myorg.evbus.contracts.core.bus.EventBus;
import com.myorg.evbus.contracts.core.bus.MessageHandler;
import com.myorg.evbus.contracts.core.bus.PayloadHandler;
import com.myorg.evbus.contracts.core.conventions.TopicNames;
import com.myorg.evbus.contracts.core.envelope.BusHealth;
import com.myorg.evbus.contracts.core.exception.BusTransportException;
import com.myorg.evbus.contracts.core.spi.RecordProcessingListener;
import lombok.extern.slf4j.Slf4j;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The facade services depend on. Bound to one {@link BusTransport} for its whole life.
 */
@Slf4j
public class DefaultEventBus implements EventBus {

    private final BusTransport transport;
    private final ObjectMapper mapper;
    private final RecordProcessingListener listener;

    private final Object lifecycleLock = new Object();
    private volatile boolean started;
    private volatile boolean closed;

    public DefaultEventBus(BusTransport transport, ObjectMapper mapper, RecordProcessingListener listener) {
        this.transport = transport;
        this.mapper = mapper;
        this.listener = listener != null ? listener : RecordProcessingListener.NOOP;
    }

    public BusTransport transport() {
        return transport;
    }

    @Override
    public void start() {
        ensureOpen();
        if (started) return;
        synchronized (lifecycleLock) {
            if (started) return;
            transport.start();
            started = true;
            log.info("Event bus started transport={}", transport.name());
        }
    }

    @Override
    public void publish(String topic, Object payload) {
        ensureOpen();
        TopicNames.requireValid(topic);
        JsonNode node = toTree(topic, payload);
        try {
            transport.publish(topic, node);
        } catch (BusTransportException e) {
            listener.onPublishFailed(topic, e);
            throw e;
        } catch (RuntimeException e) {
            listener.onPublishFailed(topic, e);
            throw new BusTransportException("Publish to topic=" + topic + " failed: " + e.getMessage(), e);
        }
        listener.onPublished(topic);
    }

    @Override
    public ConsumerRegistration registerConsumer(String topic, MessageHandler handler) {
        ensureOpen();
        TopicNames.requireValid(topic);
        if (handler == null) {
            throw new IllegalArgumentException("handler must not be null");
        }
        ConsumerRegistration reg = transport.subscribe(topic, handler);
        log.info("Consumer registered topic={} groupId={} transport={}", reg.topic(), reg.groupId(), transport.name());
        return reg;
    }

    @Override
    public <T> ConsumerRegistration registerConsumer(String topic, Class<T> payloadType, PayloadHandler<T> handler) {
        if (payloadType == null || handler == null) {
            throw new IllegalArgumentException("payloadType and handler must not be null");
        }
        return registerConsumer(topic, new TypedMessageHandler<>(payloadType, handler, mapper));
    }

    @Override
    public BusHealth health() {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("transport", transport.name());
        if (closed) {
            details.put("error", "event bus is closed");
            return new BusHealth(false, details);
        }
        BusHealth h;
        try {
            h = transport.health();
        } catch (RuntimeException e) {
            log.warn("Health check of transport={} threw: {}", transport.name(), e.toString());
            h = BusHealth.down(e);
        }
        details.putAll(h.details());
        return new BusHealth(h.ok(), details);
    }

    @Override
    public void close() {
        synchronized (lifecycleLock) {
            if (closed) return;
            closed = true;
        }
        transport.close();
        log.info("Event bus closed transport={}", transport.name());
    }

    public boolean isStarted() {
        return started && !closed;
    }

    private JsonNode toTree(String topic, Object payload) {
        if (payload == null) return NullNode.getInstance();
        if (payload instanceof JsonNode node) return node;
        try {
            return mapper.valueToTree(payload);
        } catch (IllegalArgumentException e) {
            throw new BusTransportException("Payload for topic=" + topic + " is not serializable: " + e.getMessage(), e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Event bus is closed");
        }
    }
}
