package com.myorg.evbus.kafka;

public enum DlqReason {
    RETRY_EXHAUSTED("RETRY_EXHAUSTED"),
    DESERIALIZATION("DESERIALIZATION"),
    NON_RETRYABLE("NON_RETRYABLE");

    private final String code;

    DlqReason(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
