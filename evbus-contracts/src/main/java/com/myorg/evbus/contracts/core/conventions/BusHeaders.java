package com.myorg.evbus.contracts.core.conventions;

public final class BusHeaders {
    private BusHeaders() {}

    // W3C trace context: 00-<trace-id>-<span-id>-<flags>
    public static final String TRACEPARENT = "traceparent";
    public static final String CORRELATION_ID = "evbus-correlation-id";
}
