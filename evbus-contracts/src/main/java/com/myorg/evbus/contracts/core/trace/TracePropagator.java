package com.myorg.evbus.contracts.core.trace;

import com.myorg.evbus.contracts.core.conventions.BusHeaders;
import lombok.experimental.UtilityClass;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Writes/reads {@link TraceContext} to/from message headers.
 */
@UtilityClass
public class TracePropagator {

    private static final Pattern TRACEPARENT =
            Pattern.compile("^([0-9a-f]{2})-([0-9a-f]{32})-([0-9a-f]{16})-([0-9a-f]{2})$");
    private static final String ZERO_TRACE = "0".repeat(32);
    private static final String ZERO_SPAN = "0".repeat(16);

    public static void inject(TraceContext ctx, Map<String, String> headers) {
        if (ctx == null) return;
        headers.put(BusHeaders.TRACEPARENT, ctx.toTraceparent());
        if (ctx.correlationId() != null) {
            headers.put(BusHeaders.CORRELATION_ID, ctx.correlationId());
        }
    }

    /**
     * @return the context the headers were written with, or {@code null} when they carry none
     */
    public static TraceContext extract(Map<String, String> headers) {
        if (headers == null) return null;
        String corr = headers.get(BusHeaders.CORRELATION_ID);
        String tp = headers.get(BusHeaders.TRACEPARENT);
        if (tp != null) {
            Matcher m = TRACEPARENT.matcher(tp.trim());
            if (m.matches() && !"ff".equals(m.group(1))
                    && !ZERO_TRACE.equals(m.group(2)) && !ZERO_SPAN.equals(m.group(3))) {
                return new TraceContext(m.group(2), m.group(3), null, corr != null ? corr : m.group(2));
            }
        }
        // no usable traceparent: keep at least the correlation id
        return corr != null ? TraceContext.newRoot(corr) : null;
    }

    /**
     * Headers for a message published now: a child of the current context, or a fresh root trace.
     */
    public static Map<String, String> outboundHeaders() {
        TraceContext current = TraceContextHolder.current();
        TraceContext ctx = current != null ? current.child() : TraceContext.newRoot(null);
        Map<String, String> headers = new LinkedHashMap<>();
        inject(ctx, headers);
        return headers;
    }

    /**
     * Context to run a consumer in: a child of the producer's context, or a fresh root.
     */
    public static TraceContext inboundContext(Map<String, String> headers) {
        TraceContext parent = extract(headers);
        return parent != null ? parent.child() : TraceContext.newRoot(null);
    }
}
