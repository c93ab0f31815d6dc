package com.myorg.evbus.kafka;

import lombok.experimental.UtilityClass;
import org.apache.kafka.clients.CommonClientConfigs;
import org.apache.kafka.clients.admin.AdminClientConfig;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.config.SaslConfigs;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.util.StringUtils;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Raw Kafka client configs built from {@link KafkaProperties}. Payloads travel as JSON text.
 */
@UtilityClass
public class KafkaClientConfigs {

    public static Map<String, Object> common(KafkaProperties props) {
        Map<String, Object> c = new HashMap<>();
        c.put(CommonClientConfigs.BOOTSTRAP_SERVERS_CONFIG, String.join(",", props.brokers()));
        c.put(CommonClientConfigs.SECURITY_PROTOCOL_CONFIG, securityProtocol(props.getSecurity()));

        KafkaProperties.Security sec = props.getSecurity();
        if (StringUtils.hasText(sec.getSaslMechanism())) {
            String mechanism = sec.getSaslMechanism().trim().toUpperCase(Locale.ROOT);
            c.put(SaslConfigs.SASL_MECHANISM, mechanism);
            c.put(SaslConfigs.SASL_JAAS_CONFIG, jaasConfig(mechanism, sec.getUsername(), sec.getPassword()));
        }
        return c;
    }

    public static Map<String, Object> producer(KafkaProperties props, String clientId) {
        Map<String, Object> p = common(props);
        p.put(ProducerConfig.CLIENT_ID_CONFIG, clientId);
        p.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        p.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, StringSerializer.class);

        KafkaProperties.Producer pp = props.getProducer();
        p.put(ProducerConfig.ACKS_CONFIG, pp.getAcks());
        p.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, pp.isIdempotence());
        p.put(ProducerConfig.RETRIES_CONFIG, pp.getRetries());
        p.put(ProducerConfig.LINGER_MS_CONFIG, pp.getLingerMs());
        p.put(ProducerConfig.COMPRESSION_TYPE_CONFIG, pp.getCompression());
        // a send must not block longer than publish is willing to wait
        p.put(ProducerConfig.MAX_BLOCK_MS_CONFIG, pp.getSendTimeout().toMillis());
        return p;
    }

    /**
     * Group id and client id are set per listener container, not here.
     */
    public static Map<String, Object> consumer(KafkaProperties props) {
        Map<String, Object> c = common(props);
        c.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        c.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG, StringDeserializer.class);
        // the container commits after each record reaches a terminal outcome
        c.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        c.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, props.getConsumer().getAutoOffsetReset());
        return c;
    }

    public static Map<String, Object> admin(KafkaProperties props, String clientId) {
        Map<String, Object> a = common(props);
        a.put(AdminClientConfig.CLIENT_ID_CONFIG, clientId + "-admin");
        int timeoutMs = (int) Math.min(Integer.MAX_VALUE, props.getHealthTimeout().toMillis());
        a.put(AdminClientConfig.REQUEST_TIMEOUT_MS_CONFIG, timeoutMs);
        a.put(AdminClientConfig.DEFAULT_API_TIMEOUT_MS_CONFIG, timeoutMs);
        return a;
    }

    static String securityProtocol(KafkaProperties.Security sec) {
        boolean sasl = StringUtils.hasText(sec.getSaslMechanism());
        if (sec.isTls()) return sasl ? "SASL_SSL" : "SSL";
        return sasl ? "SASL_PLAINTEXT" : "PLAINTEXT";
    }

    static String jaasConfig(String mechanism, String username, String password) {
        String module = mechanism.startsWith("SCRAM-")
                ? "org.apache.kafka.common.security.scram.ScramLoginModule"
                : "org.apache.kafka.common.security.plain.PlainLoginModule";
        return module + " required username=\"" + escape(username) + "\" password=\"" + escape(password) + "\";";
    }

    private static String escape(String v) {
        if (v == null) return "";
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
