package com.myorg.evbus.kafka.processing;

import java.time.Duration;

/**
 * A handler attempt ran past its deadline. Counts as a failed attempt.
 */
public class AttemptTimeoutException extends RuntimeException {
    public AttemptTimeoutException(String topic, Duration timeout) {
        super("Handler attempt on topic=" + topic + " exceeded " + timeout.toMillis() + "ms");
    }
}
