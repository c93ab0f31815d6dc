package com.myorg.evbus.contracts.core.bus;

import com.myorg.evbus.contracts.core.envelope.BusHealth;

/**
 * The one contract application services use to exchange events, whatever transport sits behind it.
 *
 * <p>Implementations pick their transport once, at construction. Callers never branch on it.
 */
public interface EventBus extends AutoCloseable {

    /**
     * Warm up the transport (e.g. open the producer connection). Idempotent.
     *
     * @throws com.myorg.evbus.contracts.core.exception.BusTransportException if the broker cannot be reached
     */
    void start();

    /**
     * Send {@code payload} to {@code topic}. Returns once the transport accepted the message.
     *
     * @throws com.myorg.evbus.contracts.core.exception.BusTransportException on serialization or transport failure
     */
    void publish(String topic, Object payload);

    /**
     * Subscribe {@code handler} to {@code topic}. Registering the same handler twice is a no-op.
     */
    ConsumerRegistration registerConsumer(String topic, MessageHandler handler);

    /**
     * Same as {@link #registerConsumer(String, MessageHandler)}, converting the payload to {@code payloadType}.
     */
    <T> ConsumerRegistration registerConsumer(String topic, Class<T> payloadType, PayloadHandler<T> handler);

    /**
     * Readiness of the transport, without a publish/consume round trip. Never throws.
     */
    BusHealth health();

    /**
     * Release every connection held by the bus. Safe to call more than once.
     */
    @Override
    void close();
}
