package com.myorg.evbus.eventing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.myorg.evbus.contracts.core.bus.ConsumerRegistration;
import com.myorg.evbus.contracts.core.bus.MessageHandler;
import com.myorg.evbus.contracts.core.conventions.BusHeaders;
import com.myorg.evbus.contracts.core.envelope.BusHealth;
import com.myorg.evbus.contracts.core.envelope.BusMessage;
import com.myorg.evbus.contracts.core.exception.BusTransportException;
import com.myorg.evbus.contracts.core.spi.RecordProcessingListener;
import com.myorg.evbus.contracts.core.trace.TraceContext;
import com.myorg.evbus.contracts.core.trace.TraceContextHolder;
import com.myorg.evbus.eventing.stub.StubTransport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DefaultEventBusTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private final List<String> events = new ArrayList<>();
    private DefaultEventBus bus;

    @BeforeEach
    void setUp() {
        RecordProcessingListener recorder = new RecordProcessingListener() {
            @Override public void onPublished(String topic) { events.add("published:" + topic); }
            @Override public void onAttemptFailed(String topic, int attempt, Throwable error) { events.add("failed:" + topic); }
            @Override public void onHandled(String topic, int attempts, long durationNanos) { events.add("handled:" + topic); }
        };
        bus = new DefaultEventBus(new StubTransport(mapper, "orders-service", true, recorder), mapper, recorder);
        bus.start();
    }

    @Test
    void publish_shouldDeliverOriginalPayload_toRegisteredHandler() {
        AtomicReference<BusMessage> received = new AtomicReference<>();
        bus.registerConsumer("orders", received::set);

        Map<String, Object> order = new LinkedHashMap<>();
        order.put("type", "order.created");
        order.put("id", 42);
        bus.publish("orders", order);

        JsonNode payload = received.get().getPayload();
        assertThat(payload).isEqualTo(mapper.valueToTree(order));
        assertThat(payload.get("id").isInt()).isTrue();
        assertThat(received.get().getTopic()).isEqualTo("orders");
        assertThat(events).containsExactly("handled:orders", "published:orders");
    }

    @Test
    void registerConsumer_shouldDeriveGroupFromClientIdAndTopic() {
        ConsumerRegistration reg = bus.registerConsumer("orders", m -> {});

        assertThat(reg.groupId()).isEqualTo("orders-service-orders");
    }

    @Test
    void registerConsumer_sameHandlerTwice_shouldBeNoOp() {
        AtomicInteger calls = new AtomicInteger();
        MessageHandler handler = m -> calls.incrementAndGet();

        bus.registerConsumer("orders", handler);
        bus.registerConsumer("orders", handler);
        bus.publish("orders", Map.of("id", 1));

        assertThat(calls).hasValue(1);
    }

    @Test
    void registerConsumer_distinctHandlers_shouldFanOutInRegistrationOrder() {
        List<String> order = new ArrayList<>();
        bus.registerConsumer("orders", m -> order.add("audit"));
        bus.registerConsumer("orders", m -> order.add("mailer"));

        bus.publish("orders", Map.of("id", 1));

        assertThat(order).containsExactly("audit", "mailer");
    }

    @Test
    void typedConsumer_shouldReceiveConvertedPayload() {
        AtomicReference<OrderCreated> received = new AtomicReference<>();
        bus.registerConsumer("orders", OrderCreated.class, received::set);

        bus.publish("orders", new OrderCreated("order.created", 42));

        assertThat(received.get().type).isEqualTo("order.created");
        assertThat(received.get().id).isEqualTo(42);
    }

    @Test
    void handlerFailure_shouldNeverFailPublisher() {
        bus.registerConsumer("orders", m -> { throw new IllegalStateException("downstream down"); });

        bus.publish("orders", Map.of("id", 1));

        assertThat(events).containsExactly("failed:orders", "published:orders");
    }

    @Test
    void handler_shouldRunInChildOfPublisherTrace() {
        AtomicReference<TraceContext> seen = new AtomicReference<>();
        AtomicReference<String> traceparent = new AtomicReference<>();
        bus.registerConsumer("orders", m -> {
            seen.set(TraceContextHolder.current());
            traceparent.set(m.header(BusHeaders.TRACEPARENT));
        });

        TraceContext request = TraceContext.newRoot("req-7");
        try (TraceContextHolder.Scope ignored = TraceContextHolder.open(request)) {
            bus.publish("orders", Map.of("id", 1));
        }

        assertThat(seen.get().traceId()).isEqualTo(request.traceId());
        assertThat(seen.get().correlationId()).isEqualTo("req-7");
        assertThat(traceparent.get()).contains(request.traceId());
    }

    @Test
    void publish_nonSerializablePayload_shouldRaiseTransportError() {
        assertThatThrownBy(() -> bus.publish("orders", new Object()))
                .isInstanceOf(BusTransportException.class)
                .hasMessageContaining("orders");
    }

    @Test
    void blankTopicOrNullHandler_shouldBeRejected() {
        assertThatThrownBy(() -> bus.publish(" ", Map.of())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> bus.registerConsumer("orders", (MessageHandler) null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void close_shouldBeIdempotent_andRejectFurtherUse() {
        bus.close();
        bus.close();

        assertThatThrownBy(() -> bus.publish("orders", Map.of())).isInstanceOf(IllegalStateException.class);
        BusHealth health = bus.health();
        assertThat(health.ok()).isFalse();
        assertThat(health.details()).containsEntry("transport", "stub");
    }

    @Test
    void health_shouldReportReadyStub() {
        BusHealth health = bus.health();

        assertThat(health.ok()).isTrue();
        assertThat(health.details()).containsEntry("transport", "stub").containsEntry("loopback", true);
    }

    static class OrderCreated {
        public String type;
        public int id;

        OrderCreated() {}

        OrderCreated(String type, int id) {
            this.type = type;
            this.id = id;
        }
    }
}
