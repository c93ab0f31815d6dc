package com.demo.app;

import com.myorg.evbus.contracts.core.conventions.BusHeaders;
import com.myorg.evbus.contracts.core.envelope.BusMessage;
import com.myorg.evbus.eventing.EventConsumer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Audits every created order. Orders flagged {@code fail=true} are rejected,
 * which exercises the retry / dead-letter path.
 */
@Slf4j
@Component
public class OrderAuditConsumer {

    private final List<String> audited = new CopyOnWriteArrayList<>();

    @EventConsumer(topic = DemoTopics.ORDERS, payload = OrderCreated.class)
    public void onOrderCreated(BusMessage message, OrderCreated order) {
        if (order.isFail()) {
            log.warn("FORCED FAIL audit id={}", order.getId());
            throw new IllegalStateException("Audit rejected order " + order.getId());
        }
        audited.add(order.getId());
        log.info("AUDITED id={} amount={} corrId={}",
                order.getId(), order.getAmount(), message.header(BusHeaders.CORRELATION_ID));
    }

    public List<String> auditedIds() {
        return List.copyOf(audited);
    }
}
