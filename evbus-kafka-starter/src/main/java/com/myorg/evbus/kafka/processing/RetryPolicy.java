package com.myorg.evbus.kafka.processing;

import com.myorg.evbus.kafka.KafkaProperties;
import org.springframework.util.backoff.BackOffExecution;
import org.springframework.util.backoff.ExponentialBackOff;

import java.time.Duration;

/**
 * Retry ceiling and exponential backoff for one handler on one record.
 *
 * @param maxAttempts    total attempts, the first one included
 * @param backoff        delay after the first failed attempt; doubles after each further failure
 * @param maxBackoff     upper bound of a single delay; null means uncapped
 * @param attemptTimeout deadline of one attempt; zero or negative disables it
 */
public record RetryPolicy(int maxAttempts, Duration backoff, Duration maxBackoff, Duration attemptTimeout) {

    public static final int DEFAULT_MAX_ATTEMPTS = 5;

    public RetryPolicy {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (backoff == null || backoff.isNegative()) backoff = Duration.ZERO;
        if (maxBackoff != null && maxBackoff.compareTo(backoff) < 0) maxBackoff = backoff;
        if (attemptTimeout == null) attemptTimeout = Duration.ZERO;
    }

    public static RetryPolicy from(KafkaProperties.Retry retry) {
        return new RetryPolicy(retry.getMaxAttempts(), retry.getBackoff(), retry.getMaxBackoff(), retry.getAttemptTimeout());
    }

    public boolean hasAttemptTimeout() {
        return !attemptTimeout.isZero() && !attemptTimeout.isNegative();
    }

    public boolean hasBackoffCap() {
        return maxBackoff != null;
    }

    /**
     * Fresh backoff sequence: backoff, 2*backoff, 4*backoff... capped at maxBackoff only when one is set.
     */
    public BackOffExecution newBackOff() {
        ExponentialBackOff b = new ExponentialBackOff(backoff.toMillis(), 2.0);
        // ExponentialBackOff caps at 30s unless told otherwise
        b.setMaxInterval(hasBackoffCap() ? maxBackoff.toMillis() : Long.MAX_VALUE);
        // attempts are counted by the caller
        b.setMaxElapsedTime(Long.MAX_VALUE);
        return b.start();
    }
}
