package com.myorg.evbus.kafka.processing;

/**
 * Processing of a record stopped before reaching an outcome (thread interrupted, or the transport shutting down).
 * The record is neither committed nor dead-lettered, so it is redelivered later.
 */
public class ProcessingAbortedException extends RuntimeException {
    public ProcessingAbortedException(String msg) { super(msg); }
    public ProcessingAbortedException(String msg, Throwable cause) { super(msg, cause); }
}
