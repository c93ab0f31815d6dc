package com.myorg.evbus.observability;

import com.myorg.evbus.contracts.core.bus.EventBus;
import com.myorg.evbus.eventing.EventBusProperties;
import com.myorg.evbus.eventing.autoconfig.EventBusAutoConfiguration;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.actuate.autoconfigure.health.ConditionalOnEnabledHealthIndicator;
import org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration;
import org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.SmartLifecycle;
import org.springframework.context.annotation.Bean;
import org.springframework.core.env.Environment;

@AutoConfiguration(after = {
        CompositeMeterRegistryAutoConfiguration.class,
        SimpleMetricsExportAutoConfiguration.class,
        EventBusAutoConfiguration.class})
@ConditionalOnProperty(prefix = "evbus.observability", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties({ObservabilityProperties.class, EventBusProperties.class})
public class EvbusObservabilityAutoConfiguration {

    @Bean
    @ConditionalOnClass(MeterRegistry.class)
    @ConditionalOnBean(MeterRegistry.class)
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "evbus.observability", name = "metrics-enabled", havingValue = "true", matchIfMissing = true)
    public BusMetrics busMetrics(MeterRegistry registry, Environment env,
                                 EventBusProperties busProps, ObservabilityProperties props) {
        return new BusMetrics(registry, busProps.effectiveClientId(env), props);
    }

    /**
     * Pre-register meters at startup so /actuator/metrics/evbus.* never returns 404.
     */
    @Bean
    public SmartLifecycle busMetricsPreRegisterLifecycle(ObjectProvider<BusMetrics> metricsProvider) {
        return new SmartLifecycle() {
            private volatile boolean running = false;

            @Override public void start() {
                BusMetrics m = metricsProvider.getIfAvailable();
                if (m != null) m.preRegisterBaseMeters();
                running = true;
            }

            @Override public void stop() { running = false; }
            @Override public boolean isRunning() { return running; }
            @Override public int getPhase() { return Integer.MIN_VALUE; }
        };
    }

    @Bean(name = "eventBusHealthIndicator")
    @ConditionalOnBean(EventBus.class)
    @ConditionalOnMissingBean(name = "eventBusHealthIndicator")
    @ConditionalOnEnabledHealthIndicator("eventBus")
    @ConditionalOnProperty(prefix = "evbus.observability", name = "health-enabled", havingValue = "true", matchIfMissing = true)
    public HealthIndicator eventBusHealthIndicator(EventBus bus) {
        return new EventBusHealthIndicator(bus);
    }
}
