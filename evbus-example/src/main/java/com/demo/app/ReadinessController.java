package com.demo.app;

import com.myorg.evbus.contracts.core.bus.EventBus;
import com.myorg.evbus.contracts.core.envelope.BusHealth;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.lang.management.ManagementFactory;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Readiness probe: 200 when every check passes, 503 otherwise or while draining.
 */
@Slf4j
@RestController
@RequiredArgsConstructor
public class ReadinessController {

    private final EventBus eventBus;
    private final ShutdownState shutdownState;

    @GetMapping("/__ready")
    public ResponseEntity<Map<String, Object>> ready(HttpServletRequest request) {
        Map<String, Object> checks = new LinkedHashMap<>();

        Map<String, Object> process = new LinkedHashMap<>();
        process.put("ok", true);
        process.put("uptime_s", ManagementFactory.getRuntimeMXBean().getUptime() / 1000);
        checks.put("process", process);

        Map<String, Object> bus = new LinkedHashMap<>();
        try {
            BusHealth h = eventBus.health();
            bus.put("ok", h.ok());
            bus.putAll(h.details());
        } catch (RuntimeException e) {
            log.warn("Event bus readiness check failed: {}", e.toString());
            bus.put("ok", false);
            bus.put("error", String.valueOf(e.getMessage()));
        }
        checks.put("event_bus", bus);

        Map<String, Object> body = new LinkedHashMap<>();
        boolean ok = checks.values().stream().allMatch(c -> Boolean.TRUE.equals(((Map<?, ?>) c).get("ok")));
        if (shutdownState.isDraining()) {
            ok = false;
            body.put("status", "draining");
        }
        body.put("ok", ok);
        body.put("checks", checks);
        body.put("ts", Instant.now().toString());
        body.put("correlation_id", request.getAttribute(CorrelationIdFilter.ATTRIBUTE));

        return ResponseEntity.status(ok ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
