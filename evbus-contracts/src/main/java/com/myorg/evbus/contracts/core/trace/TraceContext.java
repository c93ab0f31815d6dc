package com.myorg.evbus.contracts.core.trace;

import java.util.concurrent.ThreadLocalRandom;

/**
 * Causal context of one unit of work. Travels with every message so that processing on the
 * consumer side links back to the operation that published it.
 */
public record TraceContext(
        String traceId,       // 32 lowercase hex chars
        String spanId,        // 16 lowercase hex chars
        String parentSpanId,  // null for a root
        String correlationId
) {

    public static TraceContext newRoot(String correlationId) {
        String traceId = randomHex(2);
        String corr = (correlationId == null || correlationId.isBlank()) ? traceId : correlationId;
        return new TraceContext(traceId, randomHex(1), null, corr);
    }

    public TraceContext child() {
        return new TraceContext(traceId, randomHex(1), spanId, correlationId);
    }

    public String toTraceparent() {
        return "00-" + traceId + "-" + spanId + "-01";
    }

    private static String randomHex(int longs) {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        StringBuilder sb = new StringBuilder(longs * 16);
        for (int i = 0; i < longs; i++) {
            long v;
            do {
                v = rnd.nextLong();
            } while (v == 0L);
            sb.append(String.format("%016x", v));
        }
        return sb.toString();
    }
}
