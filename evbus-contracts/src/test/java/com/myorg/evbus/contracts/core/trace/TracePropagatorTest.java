package com.myorg.evbus.contracts.core.trace;

import com.myorg.evbus.contracts.core.conventions.BusHeaders;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TracePropagatorTest {

    @Test
    void outboundHeaders_withoutCurrentContext_shouldStartNewTrace() {
        Map<String, String> headers = TracePropagator.outboundHeaders();

        assertThat(headers.get(BusHeaders.TRACEPARENT)).matches("00-[0-9a-f]{32}-[0-9a-f]{16}-01");
        assertThat(headers.get(BusHeaders.CORRELATION_ID)).isNotBlank();
    }

    @Test
    void outboundHeaders_insideScope_shouldKeepTraceIdAndCorrelation() {
        TraceContext root = TraceContext.newRoot("corr-42");

        try (TraceContextHolder.Scope ignored = TraceContextHolder.open(root)) {
            Map<String, String> headers = TracePropagator.outboundHeaders();
            TraceContext sent = TracePropagator.extract(headers);

            assertThat(sent.traceId()).isEqualTo(root.traceId());
            assertThat(sent.spanId()).isNotEqualTo(root.spanId());
            assertThat(sent.correlationId()).isEqualTo("corr-42");
        }
        assertThat(TraceContextHolder.current()).isNull();
    }

    @Test
    void inboundContext_shouldBeChildOfProducerSpan() {
        TraceContext producer = TraceContext.newRoot("corr-1");
        Map<String, String> headers = new HashMap<>();
        TracePropagator.inject(producer, headers);

        TraceContext consumer = TracePropagator.inboundContext(headers);

        assertThat(consumer.traceId()).isEqualTo(producer.traceId());
        assertThat(consumer.parentSpanId()).isEqualTo(producer.spanId());
        assertThat(consumer.correlationId()).isEqualTo("corr-1");
    }

    @Test
    void extract_shouldRejectMalformedOrZeroTraceparent() {
        assertThat(TracePropagator.extract(Map.of(BusHeaders.TRACEPARENT, "garbage"))).isNull();
        assertThat(TracePropagator.extract(Map.of(BusHeaders.TRACEPARENT,
                "00-" + "0".repeat(32) + "-" + "1".repeat(16) + "-01"))).isNull();
        assertThat(TracePropagator.extract(Map.of())).isNull();
    }

    @Test
    void extract_withOnlyCorrelationId_shouldKeepIt() {
        TraceContext ctx = TracePropagator.extract(Map.of(BusHeaders.CORRELATION_ID, "corr-only"));

        assertThat(ctx).isNotNull();
        assertThat(ctx.correlationId()).isEqualTo("corr-only");
    }

    @Test
    void scope_shouldMirrorIntoMdc_andRestorePrevious() {
        TraceContext outer = TraceContext.newRoot("outer");
        TraceContext inner = outer.child();

        try (TraceContextHolder.Scope a = TraceContextHolder.open(outer)) {
            try (TraceContextHolder.Scope b = TraceContextHolder.open(inner)) {
                assertThat(MDC.get(TraceContextHolder.MDC_SPAN_ID)).isEqualTo(inner.spanId());
            }
            assertThat(TraceContextHolder.current()).isEqualTo(outer);
            assertThat(MDC.get(TraceContextHolder.MDC_SPAN_ID)).isEqualTo(outer.spanId());
        }
        assertThat(MDC.get(TraceContextHolder.MDC_TRACE_ID)).isNull();
    }
}
