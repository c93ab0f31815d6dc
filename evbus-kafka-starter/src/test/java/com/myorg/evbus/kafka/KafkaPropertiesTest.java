package com.myorg.evbus.kafka;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KafkaPropertiesTest {

    @Test
    void brokersAreSplitAndTrimmed() {
        KafkaProperties p = new KafkaProperties();
        p.setBootstrapServers(" k1:9092 ,k2:9093,, ");

        assertThat(p.brokers()).containsExactly("k1:9092", "k2:9093");
        assertThatCode(p::validate).doesNotThrowAnyException();
    }

    @Test
    void missingBrokersFailValidation() {
        assertThatThrownBy(new KafkaProperties()::validate)
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("bootstrap-servers");
    }

    @Test
    void brokerWithoutPortFailsValidation() {
        KafkaProperties p = new KafkaProperties();
        p.setBootstrapServers("k1:9092,k2");

        assertThatThrownBy(p::validate).hasMessageContaining("'k2'");
    }

    @Test
    void saslWithoutUsernameFailsValidation() {
        KafkaProperties p = new KafkaProperties();
        p.setBootstrapServers("k1:9092");
        p.getSecurity().setSaslMechanism("PLAIN");

        assertThatThrownBy(p::validate).hasMessageContaining("username");
    }
}
