package com.myorg.evbus.contracts.core.bus;

import com.myorg.evbus.contracts.core.envelope.BusMessage;

/**
 * Consumer callback. Returning normally means the message was handled; throwing means it was not.
 */
@FunctionalInterface
public interface MessageHandler {
    void handle(BusMessage message) throws Exception;
}
