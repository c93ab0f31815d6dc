package com.myorg.evbus.kafka;

import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class KafkaClientConfigsTest {

    private static KafkaProperties props(boolean tls, String mechanism) {
        KafkaProperties p = new KafkaProperties();
        p.setBootstrapServers("k1:9092, k2:9092");
        p.getSecurity().setTls(tls);
        p.getSecurity().setSaslMechanism(mechanism);
        p.getSecurity().setUsername("svc");
        p.getSecurity().setPassword("s\"cret");
        return p;
    }

    @Test
    void securityProtocolFollowsTlsAndSasl() {
        assertThat(KafkaClientConfigs.common(props(false, null)))
                .containsEntry(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, "PLAINTEXT")
                .doesNotContainKey(SaslConfigs.SASL_MECHANISM);
        assertThat(KafkaClientConfigs.common(props(true, null)))
                .containsEntry(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, "SSL");
        assertThat(KafkaClientConfigs.common(props(false, "plain")))
                .containsEntry(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, "SASL_PLAINTEXT")
                .containsEntry(SaslConfigs.SASL_MECHANISM, "PLAIN");
        assertThat(KafkaClientConfigs.common(props(true, "SCRAM-SHA-512")))
                .containsEntry(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, "SASL_SSL");
    }

    @Test
    void jaasConfigPicksLoginModuleAndEscapesCredentials() {
        Map<String, Object> scram = KafkaClientConfigs.common(props(true, "SCRAM-SHA-256"));

        assertThat((String) scram.get(SaslConfigs.SASL_JAAS_CONFIG))
                .startsWith("org.apache.kafka.common.security.scram.ScramLoginModule required")
                .contains("username=\"svc\"")
                .contains("password=\"s\\\"cret\"");
        assertThat((String) KafkaClientConfigs.common(props(true, "PLAIN")).get(SaslConfigs.SASL_JAAS_CONFIG))
                .startsWith("org.apache.kafka.common.security.plain.PlainLoginModule required");
    }

    @Test
    void producerAndConsumerDefaults() {
        KafkaProperties p = props(false, null);

        Map<String, Object> producer = KafkaClientConfigs.producer(p, "orders-service");
        assertThat(producer)
                .containsEntry(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, "k1:9092,k2:9092")
                .containsEntry(ProducerConfig.CLIENT_ID_CONFIG, "orders-service")
                .containsEntry(ProducerConfig.ACKS_CONFIG, "all")
                .containsEntry(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);

        Map<String, Object> consumer = KafkaClientConfigs.consumer(p);
        assertThat(consumer)
                .containsEntry(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false)
                .containsEntry(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest")
                .doesNotContainKey(ConsumerConfig.GROUP_ID_CONFIG);
    }
}
