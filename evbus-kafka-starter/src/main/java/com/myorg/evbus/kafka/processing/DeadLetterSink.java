package com.myorg.evbus.kafka.processing;

import com.myorg.evbus.contracts.core.envelope.DeadLetterRecord;

import java.util.Map;

/**
 * Where permanently failed records end up.
 */
@FunctionalInterface
public interface DeadLetterSink {

    /**
     * Blocks until the record is accepted.
     *
     * @throws com.myorg.evbus.contracts.core.exception.BusTransportException when it could not be published
     */
    void send(String topic, DeadLetterRecord record, Map<String, String> headers);
}
