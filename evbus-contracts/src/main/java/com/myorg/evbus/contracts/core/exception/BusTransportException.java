package com.myorg.evbus.contracts.core.exception;

/**
 * The transport could not accept a message or reach the broker.
 * Raised to the caller of publish/start; never caused by a consumer's handler.
 */
public class BusTransportException extends RuntimeException {
    public BusTransportException(String msg) { super(msg); }
    public BusTransportException(String msg, Throwable cause) { super(msg, cause); }
}
