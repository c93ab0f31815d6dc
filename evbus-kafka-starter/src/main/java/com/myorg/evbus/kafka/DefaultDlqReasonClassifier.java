package com.myorg.evbus.kafka;

import com.myorg.evbus.contracts.core.exception.NonRetryableException;
import com.myorg.evbus.kafka.processing.InboundRecord;
import org.apache.kafka.common.errors.SerializationException;

/**
 * {@link NonRetryableException} anywhere in the cause chain: dead-letter now, with its reason.
 * Serialization errors: dead-letter now. Anything else: retry until the ceiling.
 */
public class DefaultDlqReasonClassifier implements DlqReasonClassifier {

    @Override
    public Decision classify(InboundRecord record, Throwable ex) {
        for (Throwable t = ex; t != null; t = t.getCause() == t ? null : t.getCause()) {
            if (t instanceof NonRetryableException nre) {
                return new Decision(nre.getReason(), true);
            }
            if (t instanceof SerializationException) {
                return new Decision(DlqReason.DESERIALIZATION.code(), true);
            }
        }
        return new Decision(DlqReason.RETRY_EXHAUSTED.code(), false);
    }
}
