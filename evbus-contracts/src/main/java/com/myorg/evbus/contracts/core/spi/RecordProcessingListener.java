package com.myorg.evbus.contracts.core.spi;

import java.util.List;

/**
 * Callbacks fired by transports while publishing and processing records (metrics, audit logs...).
 * Implementations must be cheap and must not throw.
 */
public interface RecordProcessingListener {

    RecordProcessingListener NOOP = new RecordProcessingListener() {};

    default void onPublished(String topic) {}

    default void onPublishFailed(String topic, Throwable error) {}

    default void onHandled(String topic, int attempts, long durationNanos) {}

    default void onAttemptFailed(String topic, int attempt, Throwable error) {}

    default void onDeadLettered(String topic, String reason, int attempts, Throwable error) {}

    default void onDeadLetterFailed(String topic, Throwable error) {}

    static RecordProcessingListener composite(List<? extends RecordProcessingListener> listeners) {
        if (listeners == null || listeners.isEmpty()) return NOOP;
        if (listeners.size() == 1) return listeners.get(0);
        List<RecordProcessingListener> all = List.copyOf(listeners);
        return new RecordProcessingListener() {
            @Override public void onPublished(String topic) {
                all.forEach(l -> l.onPublished(topic));
            }
            @Override public void onPublishFailed(String topic, Throwable error) {
                all.forEach(l -> l.onPublishFailed(topic, error));
            }
            @Override public void onHandled(String topic, int attempts, long durationNanos) {
                all.forEach(l -> l.onHandled(topic, attempts, durationNanos));
            }
            @Override public void onAttemptFailed(String topic, int attempt, Throwable error) {
                all.forEach(l -> l.onAttemptFailed(topic, attempt, error));
            }
            @Override public void onDeadLettered(String topic, String reason, int attempts, Throwable error) {
                all.forEach(l -> l.onDeadLettered(topic, reason, attempts, error));
            }
            @Override public void onDeadLetterFailed(String topic, Throwable error) {
                all.forEach(l -> l.onDeadLetterFailed(topic, error));
            }
        };
    }
}
