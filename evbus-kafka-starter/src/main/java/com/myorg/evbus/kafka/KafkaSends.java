package com.myorg.evbus.kafka;

import com.myorg.evbus.contracts.core.exception.BusTransportException;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

final class KafkaSends {
    private KafkaSends() {}

    /**
     * Send and wait for the broker ack; every failure becomes a {@link BusTransportException}.
     */
    static <K, V> SendResult<K, V> sendAndWait(KafkaTemplate<K, V> template, ProducerRecord<K, V> rec, Duration timeout) {
        CompletableFuture<SendResult<K, V>> future;
        try {
            future = template.send(rec);
        } catch (KafkaException e) {
            // e.g. metadata not available within max.block.ms
            throw new BusTransportException("Publish to topic=" + rec.topic() + " failed: " + e.getMessage(), e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw new BusTransportException("Publish to topic=" + rec.topic() + " failed: " + cause.getMessage(), cause);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new BusTransportException("Publish to topic=" + rec.topic() + " not acknowledged within "
                    + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BusTransportException("Interrupted while publishing to topic=" + rec.topic(), e);
        }
    }
}
