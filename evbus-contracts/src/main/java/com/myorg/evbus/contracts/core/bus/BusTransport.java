package com.myorg.evbus.contracts.core.bus;

import com.fasterxml.jackson.databind.JsonNode;
import com.myorg.evbus.contracts.core.envelope.BusHealth;

/**
 * SPI behind {@link EventBus}: one implementation per way of moving messages.
 */
public interface BusTransport {

    /** Short name reported in health details and logs, e.g. "stub" or "kafka". */
    String name();

    void start();

    void publish(String topic, JsonNode payload);

    ConsumerRegistration subscribe(String topic, MessageHandler handler);

    BusHealth health();

    void close();
}
