package com.myorg.evbus.kafka.processing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.TextNode;
import com.myorg.evbus.contracts.core.bus.MessageHandler;
import com.myorg.evbus.contracts.core.conventions.TopicNames;
import com.myorg.evbus.contracts.core.envelope.BusMessage;
import com.myorg.evbus.contracts.core.envelope.DeadLetterRecord;
import com.myorg.evbus.contracts.core.spi.RecordProcessingListener;
import com.myorg.evbus.contracts.core.trace.TraceContext;
import com.myorg.evbus.contracts.core.trace.TraceContextHolder;
import com.myorg.evbus.contracts.core.trace.TracePropagator;
import com.myorg.evbus.kafka.DlqHeaders;
import com.myorg.evbus.kafka.DlqReason;
import com.myorg.evbus.kafka.DlqReasonClassifier;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.util.backoff.BackOffExecution;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Drives one consumed record to a terminal outcome for every handler of its topic:
 * handled, or published to the dead-letter topic.
 *
 * <p>Each handler gets its own attempt counter and backoff. A failed attempt is retried after
 * {@code backoff * 2^(attempt-1)} until {@link RetryPolicy#maxAttempts()} attempts failed, unless the
 * {@link DlqReasonClassifier} marks the failure non-retryable. A payload that is not valid JSON
 * never reaches a handler and is dead-lettered with {@code attempts = 0}.
 *
 * <p>Returning normally means the record may be committed. {@link ProcessingAbortedException}
 * means it must not be. After {@link #stop()} no new attempt starts and no record is committed
 * without an outcome: work still in progress aborts instead.
 *
 * <p>An attempt that exceeds its timeout is cancelled with an interrupt. A handler that ignores
 * interrupts keeps its worker thread until it returns, and may still be running while the next
 * attempt of the same record starts. Handlers used with an attempt timeout should be interruptible.
 */
@Slf4j
public class RecordProcessor {

    private final ObjectMapper mapper;
    private final RetryPolicy policy;
    private final DeadLetterSink sink;
    private final String dlqSuffix;
    private final String service;
    private final DlqReasonClassifier classifier;
    private final RecordProcessingListener listener;
    private final Sleeper sleeper;
    private final ExecutorService attemptExecutor;
    private final Clock clock;

    private volatile boolean stopped;

    public RecordProcessor(ObjectMapper mapper,
                           RetryPolicy policy,
                           DeadLetterSink sink,
                           String dlqSuffix,
                           String service,
                           DlqReasonClassifier classifier,
                           RecordProcessingListener listener,
                           Sleeper sleeper,
                           ExecutorService attemptExecutor,
                           Clock clock) {
        this.mapper = mapper;
        this.policy = policy;
        this.sink = sink;
        this.dlqSuffix = dlqSuffix;
        this.service = service;
        this.classifier = classifier;
        this.listener = listener != null ? listener : RecordProcessingListener.NOOP;
        this.sleeper = sleeper != null ? sleeper : Sleeper.THREAD;
        this.attemptExecutor = attemptExecutor;
        this.clock = clock != null ? clock : Clock.systemUTC();
    }

    /**
     * Refuse further work; called when the owning transport shuts down.
     */
    public void stop() {
        stopped = true;
    }

    public void process(InboundRecord record, List<MessageHandler> handlers) {
        ensureRunning(record);
        TraceContext ctx = TracePropagator.inboundContext(record.headers());
        try (TraceContextHolder.Scope ignored = TraceContextHolder.open(ctx)) {
            MDC.put("topic", record.topic());
            MDC.put("partition", String.valueOf(record.partition()));
            MDC.put("offset", String.valueOf(record.offset()));

            JsonNode payload = parse(record);
            if (payload == null) return;

            if (handlers.isEmpty()) {
                log.warn("No handler for topic={} partition={} offset={}, record skipped",
                        record.topic(), record.partition(), record.offset());
                return;
            }
            for (MessageHandler handler : handlers) {
                handleWithRetries(record, payload, handler);
            }
        } finally {
            MDC.remove("topic");
            MDC.remove("partition");
            MDC.remove("offset");
        }
    }

    private JsonNode parse(InboundRecord record) {
        Exception error;
        try {
            if (record.value() == null) {
                error = new IllegalArgumentException("Record has no value");
            } else {
                JsonNode node = mapper.readTree(record.value());
                if (node != null && !node.isMissingNode()) return node;
                error = new IllegalArgumentException("Record value is empty");
            }
        } catch (JsonProcessingException e) {
            error = e;
        }
        log.warn("Malformed payload topic={} partition={} offset={} error={}",
                record.topic(), record.partition(), record.offset(), error.getMessage());
        TextNode raw = record.value() == null ? null : TextNode.valueOf(record.value());
        deadLetter(record, null, raw, 0, error, DlqReason.DESERIALIZATION.code(), true);
        return null;
    }

    private void handleWithRetries(InboundRecord record, JsonNode payload, MessageHandler handler) {
        BackOffExecution backOff = policy.newBackOff();
        long t0 = System.nanoTime();
        int attempt = 0;
        while (true) {
            ensureRunning(record);
            attempt++;
            BusMessage message = BusMessage.builder()
                    .topic(record.topic())
                    .payload(payload.deepCopy())
                    .headers(new LinkedHashMap<>(record.headers()))
                    .build();
            try {
                invoke(handler, message);
                listener.onHandled(record.topic(), attempt, System.nanoTime() - t0);
                if (attempt > 1) {
                    log.info("Handled topic={} partition={} offset={} handler={} after {} attempts",
                            record.topic(), record.partition(), record.offset(), handler, attempt);
                }
                return;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ProcessingAbortedException("Interrupted while processing topic=" + record.topic()
                        + " partition=" + record.partition() + " offset=" + record.offset(), e);
            } catch (ProcessingAbortedException e) {
                throw e;
            } catch (Exception e) {
                listener.onAttemptFailed(record.topic(), attempt, e);
                DlqReasonClassifier.Decision decision = classifier.classify(record, e);

                if (decision.nonRetryable() || attempt >= policy.maxAttempts()) {
                    deadLetter(record, handler, payload, attempt, e, decision.reason(), decision.nonRetryable());
                    return;
                }

                long delay = backOff.nextBackOff();
                log.warn("Retrying topic={} partition={} offset={} attempt={}/{} in {}ms error={}",
                        record.topic(), record.partition(), record.offset(), attempt, policy.maxAttempts(),
                        delay, e.toString());
                pause(record, delay);
            }
        }
    }

    private void pause(InboundRecord record, long delay) {
        if (delay <= 0) return;
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProcessingAbortedException("Interrupted during backoff topic=" + record.topic()
                    + " offset=" + record.offset(), ie);
        }
    }

    private void ensureRunning(InboundRecord record) {
        if (stopped) {
            throw new ProcessingAbortedException("Processor stopped before topic=" + record.topic()
                    + " partition=" + record.partition() + " offset=" + record.offset() + " reached an outcome");
        }
    }

    private void invoke(MessageHandler handler, BusMessage message) throws Exception {
        if (attemptExecutor == null || !policy.hasAttemptTimeout()) {
            handler.handle(message);
            return;
        }

        TraceContext ctx = TraceContextHolder.current();
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        Future<Object> future;
        try {
            future = attemptExecutor.submit(() -> {
                if (mdc != null) MDC.setContextMap(mdc);
                try (TraceContextHolder.Scope ignored = TraceContextHolder.open(ctx)) {
                    handler.handle(message);
                    return null;
                } finally {
                    MDC.clear();
                }
            });
        } catch (RejectedExecutionException e) {
            // executor already shut down: the handler never ran
            throw new ProcessingAbortedException("Handler executor rejected attempt on topic=" + message.getTopic(), e);
        }

        try {
            future.get(policy.attemptTimeout().toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new AttemptTimeoutException(message.getTopic(), policy.attemptTimeout());
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception ex) throw ex;
            if (cause instanceof Error err) throw err;
            throw e;
        }
    }

    private void deadLetter(InboundRecord record, MessageHandler handler, JsonNode original,
                            int attempts, Throwable error, String reason, boolean nonRetryable) {
        String dlqTopic = TopicNames.deadLetterTopic(record.topic(), dlqSuffix);
        DeadLetterRecord body = DeadLetterRecord.of(error, original, attempts, clock.instant());

        // original trace headers first, so the dead-letter record stays in the same trace
        Map<String, String> headers = new LinkedHashMap<>(record.headers());
        headers.put(DlqHeaders.REASON, reason);
        headers.put(DlqHeaders.NON_RETRYABLE, String.valueOf(nonRetryable));
        headers.put(DlqHeaders.EXCEPTION_CLASS, error.getClass().getName());
        headers.put(DlqHeaders.EXCEPTION_MESSAGE, truncate(error.getMessage(), 512));
        headers.put(DlqHeaders.SERVICE, service);
        headers.put(DlqHeaders.HANDLER, handler == null ? "" : String.valueOf(handler));
        headers.put(DlqHeaders.SOURCE_TOPIC, record.topic());
        headers.put(DlqHeaders.SOURCE_PARTITION, String.valueOf(record.partition()));
        headers.put(DlqHeaders.SOURCE_OFFSET, String.valueOf(record.offset()));
        headers.put(DlqHeaders.TS_MS, String.valueOf(clock.millis()));

        try {
            sink.send(dlqTopic, body, headers);
            listener.onDeadLettered(record.topic(), reason, attempts, error);
            log.error("Dead-lettered topic={} partition={} offset={} dlq={} reason={} attempts={} error={}",
                    record.topic(), record.partition(), record.offset(), dlqTopic, reason, attempts, error.toString());
        } catch (RuntimeException e) {
            if (stopped) {
                throw new ProcessingAbortedException("Dead-letter publish interrupted by shutdown topic=" + record.topic()
                        + " partition=" + record.partition() + " offset=" + record.offset(), e);
            }
            listener.onDeadLetterFailed(record.topic(), e);
            // the record is still committed: one permanently failing message must not block its partition
            log.error("Dead-letter publish FAILED topic={} partition={} offset={} dlq={} payload={} originalError={}",
                    record.topic(), record.partition(), record.offset(), dlqTopic,
                    truncate(record.value(), 1024), error.toString(), e);
        }
    }

    private static String truncate(String s, int maxLen) {
        if (s == null) return "";
        return s.length() <= maxLen ? s : s.substring(0, maxLen);
    }
}
