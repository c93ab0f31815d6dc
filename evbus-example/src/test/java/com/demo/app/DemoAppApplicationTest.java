package com.demo.app;

import com.myorg.evbus.contracts.core.bus.EventBus;
import com.myorg.evbus.contracts.core.conventions.BusHeaders;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Stub mode end to end: publish is delivered in-process and synchronously, so no waiting is needed.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
        properties = "evbus.mode=stub")
class DemoAppApplicationTest {

    private static final ParameterizedTypeReference<Map<String, Object>> JSON_MAP = new ParameterizedTypeReference<>() {};

    @Autowired
    TestRestTemplate rest;

    @Autowired
    EventBus eventBus;

    @Autowired
    MeterRegistry meterRegistry;

    private ResponseEntity<Map<String, Object>> postOrder(String json, HttpHeaders extra) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        if (extra != null) headers.addAll(extra);
        return rest.exchange("/orders", HttpMethod.POST, new HttpEntity<>(json, headers), JSON_MAP);
    }

    @Test
    void createdOrderIsAudited() {
        ResponseEntity<Map<String, Object>> res = postOrder("{\"id\":\"ord-stub-1\",\"amount\":12.50}", null);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(res.getBody()).containsEntry("id", "ord-stub-1").containsEntry("topic", "orders");

        List<String> audited = rest.exchange("/orders/audited", HttpMethod.GET, null,
                new ParameterizedTypeReference<List<String>>() {}).getBody();
        assertThat(audited).contains("ord-stub-1");
    }

    @Test
    void orderWithoutIdGetsOne() {
        ResponseEntity<Map<String, Object>> res = postOrder("{}", null);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat((String) res.getBody().get("id")).startsWith("ord-");
    }

    @Test
    void rejectedOrderDoesNotFailThePublisher() {
        double before = retries();

        ResponseEntity<Map<String, Object>> res = postOrder("{\"id\":\"ord-stub-bad\",\"fail\":true}", null);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.ACCEPTED);
        assertThat(rest.getForObject("/orders/audited", List.class)).doesNotContain("ord-stub-bad");
        assertThat(retries()).isEqualTo(before + 1);
    }

    private double retries() {
        var counter = meterRegistry.find("evbus.retry").tag("topic", "orders").counter();
        return counter == null ? 0 : counter.count();
    }

    @Test
    void correlationIdFromRequestReachesConsumers() {
        List<String> seen = new CopyOnWriteArrayList<>();
        eventBus.registerConsumer("orders", m -> seen.add(m.header(BusHeaders.CORRELATION_ID)));

        HttpHeaders headers = new HttpHeaders();
        headers.set(CorrelationIdFilter.HEADER, "corr-stub-42");
        ResponseEntity<Map<String, Object>> res = postOrder("{\"id\":\"ord-stub-2\"}", headers);

        assertThat(res.getHeaders().getFirst(CorrelationIdFilter.HEADER)).isEqualTo("corr-stub-42");
        assertThat(seen).contains("corr-stub-42");
    }

    @Test
    @SuppressWarnings("unchecked")
    void readinessReportsChecksAndCorrelationId() {
        HttpHeaders headers = new HttpHeaders();
        headers.set(CorrelationIdFilter.HEADER, "corr-ready");

        ResponseEntity<Map<String, Object>> res = rest.exchange("/__ready", HttpMethod.GET,
                new HttpEntity<>(headers), JSON_MAP);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.OK);
        Map<String, Object> body = res.getBody();
        assertThat(body).containsEntry("ok", true).containsEntry("correlation_id", "corr-ready").containsKey("ts");
        Map<String, Object> checks = (Map<String, Object>) body.get("checks");
        assertThat((Map<String, Object>) checks.get("process")).containsEntry("ok", true);
        assertThat((Map<String, Object>) checks.get("event_bus"))
                .containsEntry("ok", true)
                .containsEntry("transport", "stub");
    }

    @Test
    @SuppressWarnings("unchecked")
    void actuatorHealthIncludesEventBus() {
        Map<String, Object> health = rest.getForObject("/actuator/health", Map.class);

        Map<String, Object> components = (Map<String, Object>) health.get("components");
        Map<String, Object> bus = (Map<String, Object>) components.get("eventBus");
        assertThat(bus).containsEntry("status", "UP");
    }
}
