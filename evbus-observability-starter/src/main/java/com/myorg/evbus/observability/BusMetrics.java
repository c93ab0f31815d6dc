package com.myorg.evbus.observability;

import com.myorg.evbus.contracts.core.spi.RecordProcessingListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import lombok.RequiredArgsConstructor;

import java.util.concurrent.TimeUnit;

/**
 * Micrometer meters fed by the transports through {@link RecordProcessingListener}.
 */
@RequiredArgsConstructor
public class BusMetrics implements RecordProcessingListener {

    public static final String PUBLISH = "evbus.publish";
    public static final String PUBLISH_FAILED = "evbus.publish.failed";
    public static final String HANDLED_SUCCESS = "evbus.handled.success";
    public static final String RETRY = "evbus.retry";
    public static final String DLQ = "evbus.dlq";
    public static final String DLQ_FAILED = "evbus.dlq.failed";
    public static final String PROCESSING = "evbus.processing";

    private final MeterRegistry registry;
    private final String serviceName;
    private final ObservabilityProperties props;

    /** Call once on startup, so /actuator/metrics/evbus.* exists before the first message. */
    public void preRegisterBaseMeters() {
        for (String name : new String[]{PUBLISH, PUBLISH_FAILED, HANDLED_SUCCESS, RETRY, DLQ, DLQ_FAILED}) {
            Counter.builder(name).tag("service", serviceName).register(registry);
        }
        Timer.builder(PROCESSING).tag("service", serviceName).register(registry);
    }

    @Override
    public void onPublished(String topic) {
        count(PUBLISH, topic, null);
    }

    @Override
    public void onPublishFailed(String topic, Throwable error) {
        count(PUBLISH_FAILED, topic, error);
    }

    @Override
    public void onHandled(String topic, int attempts, long durationNanos) {
        count(HANDLED_SUCCESS, topic, null);
        Timer.builder(PROCESSING)
                .tags(tags(topic, null))
                .tag("outcome", attempts > 1 ? "success_after_retry" : "success")
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    @Override
    public void onAttemptFailed(String topic, int attempt, Throwable error) {
        count(RETRY, topic, error);
    }

    @Override
    public void onDeadLettered(String topic, String reason, int attempts, Throwable error) {
        Counter.builder(DLQ)
                .tags(tags(topic, error))
                .tag("reason", reason == null ? "UNKNOWN" : reason)
                .register(registry)
                .increment();
    }

    @Override
    public void onDeadLetterFailed(String topic, Throwable error) {
        count(DLQ_FAILED, topic, error);
    }

    private void count(String name, String topic, Throwable error) {
        Counter.builder(name).tags(tags(topic, error)).register(registry).increment();
    }

    private Tags tags(String topic, Throwable error) {
        Tags tags = Tags.of("service", serviceName);
        if (props.isTagTopic() && topic != null) tags = tags.and("topic", topic);
        if (props.isTagException() && error != null) tags = tags.and("exception", error.getClass().getSimpleName());
        return tags;
    }
}
