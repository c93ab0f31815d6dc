package com.myorg.evbus.kafka.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evbus.contracts.core.bus.BusTransport;
import com.myorg.evbus.contracts.core.spi.RecordProcessingListener;
import com.myorg.evbus.eventing.EventBusProperties;
import com.myorg.evbus.eventing.autoconfig.EventBusAutoConfiguration;
import com.myorg.evbus.kafka.DefaultDlqReasonClassifier;
import com.myorg.evbus.kafka.DlqReasonClassifier;
import com.myorg.evbus.kafka.KafkaClientConfigs;
import com.myorg.evbus.kafka.KafkaDurableTransport;
import com.myorg.evbus.kafka.KafkaProperties;
import com.myorg.evbus.kafka.processing.Sleeper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaAdmin;
import org.springframework.kafka.core.KafkaTemplate;

/**
 * Active only with {@code evbus.mode=durable}. Contributes the Kafka {@link BusTransport};
 * the facade itself still comes from {@link EventBusAutoConfiguration}.
 */
@Slf4j
@AutoConfiguration(
        after = JacksonAutoConfiguration.class,
        before = {EventBusAutoConfiguration.class, org.springframework.boot.autoconfigure.kafka.KafkaAutoConfiguration.class})
@ConditionalOnClass(KafkaTemplate.class)
@ConditionalOnProperty(prefix = "evbus", name = "mode", havingValue = "durable")
@EnableConfigurationProperties({KafkaProperties.class, EventBusProperties.class})
public class KafkaBusAutoConfiguration {

    /**
     * KafkaAdmin wired to evbus.kafka.bootstrap-servers, so the application's NewTopic beans are applied
     * to the same cluster (Spring Boot's default one reads spring.kafka.bootstrap-servers).
     */
    @Bean
    @ConditionalOnMissingBean
    public KafkaAdmin kafkaAdmin(KafkaProperties props, EventBusProperties busProps, Environment env) {
        props.validate();
        return new KafkaAdmin(KafkaClientConfigs.admin(props, busProps.effectiveClientId(env)));
    }

    @Bean
    @ConditionalOnMissingBean
    public DlqReasonClassifier dlqReasonClassifier() {
        return new DefaultDlqReasonClassifier();
    }

    @Bean
    @ConditionalOnMissingBean(BusTransport.class)
    public KafkaDurableTransport kafkaDurableTransport(KafkaProperties props,
                                                       EventBusProperties busProps,
                                                       Environment env,
                                                       KafkaAdmin kafkaAdmin,
                                                       DlqReasonClassifier classifier,
                                                       ObjectProvider<ObjectMapper> mapperProvider,
                                                       ObjectProvider<RecordProcessingListener> listeners) {
        props.validate();
        String clientId = busProps.effectiveClientId(env);
        log.info("Event bus transport=kafka clientId={} brokers={} security={}",
                clientId, props.brokers(), KafkaClientConfigs.common(props).get("security.protocol"));

        return new KafkaDurableTransport(
                props,
                clientId,
                mapperProvider.getIfAvailable(ObjectMapper::new),
                new DefaultKafkaProducerFactory<>(KafkaClientConfigs.producer(props, clientId)),
                new DefaultKafkaConsumerFactory<>(KafkaClientConfigs.consumer(props)),
                kafkaAdmin.getConfigurationProperties(),
                classifier,
                RecordProcessingListener.composite(listeners.orderedStream().toList()),
                Sleeper.THREAD
        );
    }
}
