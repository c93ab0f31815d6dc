package com.myorg.evbus.kafka;

import com.myorg.evbus.contracts.core.conventions.TopicNames;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Durable transport settings, bound from {@code evbus.kafka.*}
 * (or the matching environment variables, e.g. {@code EVBUS_KAFKA_BOOTSTRAP_SERVERS}).
 */
@Data
@ConfigurationProperties(prefix = "evbus.kafka")
public class KafkaProperties {
    // host:port,host:port
    private String bootstrapServers;
    private Duration healthTimeout = Duration.ofSeconds(5);
    private final Security security = new Security();
    private final Producer producer = new Producer();
    private final Consumer consumer = new Consumer();
    private final Dlq dlq = new Dlq();

    @Data
    public static class Security {
        private boolean tls = false;
        // PLAIN, SCRAM-SHA-256, SCRAM-SHA-512; empty = no SASL
        private String saslMechanism;
        private String username;
        private String password;
    }

    @Data
    public static class Producer {
        private String acks = "all";
        private boolean idempotence = true;
        private int retries = 10;
        private int lingerMs = 5;
        private String compression = "none";
        // how long publish waits for the broker ack
        private Duration sendTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Consumer {
        private int concurrency = 1;
        // latest: a fresh group starts at the end of the log and does not replay history
        private String autoOffsetReset = "latest";
        // how long close() waits for an in-flight record per container
        private Duration shutdownTimeout = Duration.ofSeconds(10);
        private final Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        // retry ceiling: total handler attempts per record
        private int maxAttempts = 5;
        // delay after failed attempt n = backoff * 2^(n-1); maxBackoff, when set, caps it
        private Duration backoff = Duration.ofMillis(300);
        private Duration maxBackoff;
        // zero disables the per-attempt deadline
        private Duration attemptTimeout = Duration.ofSeconds(30);
    }

    @Data
    public static class Dlq {
        private String suffix = TopicNames.DEFAULT_DLQ_SUFFIX;
    }

    public List<String> brokers() {
        if (!StringUtils.hasText(bootstrapServers)) return List.of();
        return Arrays.stream(bootstrapServers.split(","))
                .map(String::trim)
                .filter(StringUtils::hasText)
                .toList();
    }

    /**
     * Fail startup on settings the durable transport cannot run with.
     */
    public void validate() {
        List<String> brokers = brokers();
        if (brokers.isEmpty()) {
            throw new IllegalStateException("evbus.mode=durable requires evbus.kafka.bootstrap-servers");
        }
        for (String b : brokers) {
            int idx = b.lastIndexOf(':');
            if (idx <= 0 || idx == b.length() - 1 || !b.substring(idx + 1).chars().allMatch(Character::isDigit)) {
                throw new IllegalStateException("Invalid broker endpoint '" + b + "', expected host:port");
            }
        }
        if (consumer.getRetry().getMaxAttempts() < 1) {
            throw new IllegalStateException("evbus.kafka.consumer.retry.max-attempts must be >= 1");
        }
        if (consumer.getConcurrency() < 1) {
            throw new IllegalStateException("evbus.kafka.consumer.concurrency must be >= 1");
        }
        if (StringUtils.hasText(security.getSaslMechanism()) && !StringUtils.hasText(security.getUsername())) {
            throw new IllegalStateException("evbus.kafka.security.username is required when a SASL mechanism is set");
        }
        if (!StringUtils.hasText(dlq.getSuffix())) {
            throw new IllegalStateException("evbus.kafka.dlq.suffix must not be empty");
        }
    }
}
