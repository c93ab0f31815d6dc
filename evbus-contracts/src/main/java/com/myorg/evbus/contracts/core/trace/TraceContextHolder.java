package com.myorg.evbus.contracts.core.trace;

import org.slf4j.MDC;

/**
 * Thread-bound current {@link TraceContext}, mirrored into the SLF4J MDC.
 */
public final class TraceContextHolder {

    public static final String MDC_TRACE_ID = "traceId";
    public static final String MDC_SPAN_ID = "spanId";
    public static final String MDC_CORRELATION_ID = "corrId";

    private static final ThreadLocal<TraceContext> CURRENT = new ThreadLocal<>();

    private TraceContextHolder() {}

    public static TraceContext current() {
        return CURRENT.get();
    }

    /**
     * Make {@code ctx} current until the returned scope is closed; the previous context is restored then.
     */
    public static Scope open(TraceContext ctx) {
        TraceContext previous = CURRENT.get();
        set(ctx);
        return () -> set(previous);
    }

    private static void set(TraceContext ctx) {
        if (ctx == null) {
            CURRENT.remove();
            MDC.remove(MDC_TRACE_ID);
            MDC.remove(MDC_SPAN_ID);
            MDC.remove(MDC_CORRELATION_ID);
            return;
        }
        CURRENT.set(ctx);
        MDC.put(MDC_TRACE_ID, ctx.traceId());
        MDC.put(MDC_SPAN_ID, ctx.spanId());
        if (ctx.correlationId() != null) {
            MDC.put(MDC_CORRELATION_ID, ctx.correlationId());
        } else {
            MDC.remove(MDC_CORRELATION_ID);
        }
    }

    @FunctionalInterface
    public interface Scope extends AutoCloseable {
        @Override
        void close();
    }
}
