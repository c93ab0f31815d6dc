package com.myorg.evbus.eventing.autoconfig;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evbus.contracts.core.bus.BusTransport;
import com.myorg.evbus.contracts.core.bus.EventBus;
import com.myorg.evbus.contracts.core.spi.RecordProcessingListener;
import com.myorg.evbus.eventing.DefaultEventBus;
import com.myorg.evbus.eventing.EventBusProperties;
import com.myorg.evbus.eventing.stub.StubTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jackson.JacksonAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

/**
 * Picks the transport once, from {@code evbus.mode}, and exposes the {@link EventBus} facade.
 * The durable transport bean comes from evbus-kafka-starter.
 */
@Slf4j
@AutoConfiguration(after = JacksonAutoConfiguration.class)
@EnableConfigurationProperties(EventBusProperties.class)
public class EventBusAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean(BusTransport.class)
    @ConditionalOnProperty(prefix = "evbus", name = "mode", havingValue = "stub", matchIfMissing = true)
    public StubTransport stubTransport(EventBusProperties props,
                                       Environment env,
                                       ObjectProvider<ObjectMapper> mapperProvider,
                                       ObjectProvider<RecordProcessingListener> listeners) {
        String clientId = props.effectiveClientId(env);
        log.info("Event bus transport=stub clientId={} loopback={}", clientId, props.getStub().isLoopback());
        return new StubTransport(
                mapperProvider.getIfAvailable(ObjectMapper::new),
                clientId,
                props.getStub().isLoopback(),
                RecordProcessingListener.composite(listeners.orderedStream().toList())
        );
    }

    @Bean
    @ConditionalOnMissingBean(EventBus.class)
    public DefaultEventBus eventBus(BusTransport transport,
                                    ObjectProvider<ObjectMapper> mapperProvider,
                                    ObjectProvider<RecordProcessingListener> listeners) {
        return new DefaultEventBus(
                transport,
                mapperProvider.getIfAvailable(ObjectMapper::new),
                RecordProcessingListener.composite(listeners.orderedStream().toList())
        );
    }

    @Bean
    @ConditionalOnMissingBean
    public EventConsumerRegistrar eventConsumerRegistrar(ApplicationContext ctx,
                                                         EventBus bus,
                                                         ObjectProvider<ObjectMapper> mapperProvider,
                                                         EventBusProperties props) {
        return new EventConsumerRegistrar(ctx, bus, mapperProvider.getIfAvailable(ObjectMapper::new), props.isAutoStart());
    }

    /**
     * mode=durable but the Kafka starter is not on the classpath -> fail fast.
     */
    @Configuration
    @ConditionalOnProperty(prefix = "evbus", name = "mode", havingValue = "durable")
    @ConditionalOnMissingClass("com.myorg.evbus.kafka.KafkaDurableTransport")
    static class MissingDurableTransportFailFastConfig {
        @Bean
        public Object failFastDurableTransportMissing() {
            throw new IllegalStateException(
                    "evbus.mode=durable but evbus-kafka-starter is not on the classpath. " +
                            "Add the dependency or set evbus.mode=stub.");
        }
    }
}
