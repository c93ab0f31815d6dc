package com.myorg.evbus.kafka;

/**
 * Headers added to a dead-letter record on top of the original trace headers.
 */
public final class DlqHeaders {
    private DlqHeaders() {}

    public static final String REASON = "evbus.dlq.reason";
    public static final String NON_RETRYABLE = "evbus.dlq.non_retryable";

    public static final String EXCEPTION_CLASS = "evbus.dlq.exception_class";
    public static final String EXCEPTION_MESSAGE = "evbus.dlq.exception_message";

    public static final String SERVICE = "evbus.dlq.service";
    public static final String HANDLER = "evbus.dlq.handler";

    public static final String SOURCE_TOPIC = "evbus.dlq.source_topic";
    public static final String SOURCE_PARTITION = "evbus.dlq.source_partition";
    public static final String SOURCE_OFFSET = "evbus.dlq.source_offset";

    public static final String TS_MS = "evbus.dlq.ts_ms";
}
