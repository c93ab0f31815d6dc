package com.myorg.evbus.eventing;

public enum TransportMode {
    /** In-process, no broker. Local development and tests. */
    STUB,
    /** Real broker (Kafka). */
    DURABLE
}
