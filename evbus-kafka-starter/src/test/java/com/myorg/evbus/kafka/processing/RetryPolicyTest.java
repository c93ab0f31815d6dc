package com.myorg.evbus.kafka.processing;

import com.myorg.evbus.kafka.KafkaProperties;
import org.junit.jupiter.api.Test;
import org.springframework.util.backoff.BackOffExecution;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryPolicyTest {

    @Test
    void defaultsFromProperties() {
        RetryPolicy p = RetryPolicy.from(new KafkaProperties().getConsumer().getRetry());

        assertThat(p.maxAttempts()).isEqualTo(RetryPolicy.DEFAULT_MAX_ATTEMPTS);
        assertThat(p.backoff()).isEqualTo(Duration.ofMillis(300));
        assertThat(p.hasBackoffCap()).isFalse();
        assertThat(p.hasAttemptTimeout()).isTrue();
    }

    @Test
    void delaysDoubleUntilTheCap() {
        BackOffExecution b = new RetryPolicy(10, Duration.ofMillis(100), Duration.ofMillis(500), Duration.ZERO).newBackOff();

        assertThat(b.nextBackOff()).isEqualTo(100L);
        assertThat(b.nextBackOff()).isEqualTo(200L);
        assertThat(b.nextBackOff()).isEqualTo(400L);
        assertThat(b.nextBackOff()).isEqualTo(500L);
        assertThat(b.nextBackOff()).isEqualTo(500L);
    }

    @Test
    void defaultDelaysKeepDoublingPastAnyFixedCap() {
        KafkaProperties.Retry retry = new KafkaProperties().getConsumer().getRetry();
        retry.setMaxAttempts(12);
        BackOffExecution b = RetryPolicy.from(retry).newBackOff();

        // delay before attempt k is base * 2^(k-2)
        for (int k = 2; k <= 12; k++) {
            assertThat(b.nextBackOff()).as("delay before attempt %d", k).isEqualTo(300L << (k - 2));
        }
    }

    @Test
    void maxBackoffBelowBaseIsRaisedToBase() {
        RetryPolicy p = new RetryPolicy(3, Duration.ofSeconds(2), Duration.ofSeconds(1), null);

        assertThat(p.maxBackoff()).isEqualTo(Duration.ofSeconds(2));
        assertThat(p.hasAttemptTimeout()).isFalse();
    }

    @Test
    void rejectsCeilingBelowOne() {
        assertThatThrownBy(() -> new RetryPolicy(0, Duration.ZERO, Duration.ZERO, Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
