package com.demo.app;

import com.myorg.evbus.contracts.core.bus.EventBus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Slf4j
@RestController
@RequiredArgsConstructor
public class OrderController {

    private final EventBus eventBus;
    private final OrderAuditConsumer auditConsumer;
    private final DeadLetterAuditConsumer deadLetterConsumer;

    @PostMapping("/orders")
    public ResponseEntity<Map<String, Object>> create(@RequestBody(required = false) OrderCreated request) {
        OrderCreated order = request != null ? request : new OrderCreated();
        order.setType(DemoTopics.ORDER_CREATED);
        if (order.getId() == null || order.getId().isBlank()) {
            order.setId("ord-" + UUID.randomUUID());
        }

        eventBus.publish(DemoTopics.ORDERS, order);
        log.info("Order published id={} fail={}", order.getId(), order.isFail());

        return ResponseEntity.status(HttpStatus.ACCEPTED)
                .body(Map.of("id", order.getId(), "topic", DemoTopics.ORDERS));
    }

    @GetMapping("/orders/audited")
    public List<String> audited() {
        return auditConsumer.auditedIds();
    }

    @GetMapping("/orders/dead-letters")
    public List<Map<String, Object>> deadLetters() {
        return deadLetterConsumer.recent();
    }
}
