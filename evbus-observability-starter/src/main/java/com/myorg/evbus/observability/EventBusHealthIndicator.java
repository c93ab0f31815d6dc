package com.myorg.evbus.observability;

import com.myorg.evbus.contracts.core.bus.EventBus;
import com.myorg.evbus.contracts.core.envelope.BusHealth;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

/**
 * Exposes {@link EventBus#health()} as the {@code eventBus} health component.
 */
@Slf4j
@RequiredArgsConstructor
public class EventBusHealthIndicator implements HealthIndicator {

    private final EventBus bus;

    @Override
    public Health health() {
        try {
            BusHealth h = bus.health();
            Health.Builder builder = h.ok() ? Health.up() : Health.down();
            return builder.withDetails(h.details()).build();
        } catch (Exception e) {
            log.error("Event bus health check failed", e);
            return Health.down().withDetail("error", String.valueOf(e.getMessage())).build();
        }
    }
}
