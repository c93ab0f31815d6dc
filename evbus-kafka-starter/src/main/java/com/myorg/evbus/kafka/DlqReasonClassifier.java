package com.myorg.evbus.kafka;

import com.myorg.evbus.kafka.processing.InboundRecord;

/**
 * Decides whether a handler failure is worth another attempt and which reason the dead-letter record carries.
 */
public interface DlqReasonClassifier {

    record Decision(String reason, boolean nonRetryable) {}

    Decision classify(InboundRecord record, Throwable ex);
}
