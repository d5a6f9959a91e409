package com.costtracker.costs.web;

/**
 * Per-request trace id, bound by {@link TraceIdFilter} for the duration of the request.
 */
public final class RequestContextHolder {

    private static final ThreadLocal<String> TRACE_ID = new ThreadLocal<>();

    private RequestContextHolder() {
    }

    public static void setTraceId(String traceId) {
        TRACE_ID.set(traceId);
    }

    public static String currentTraceId() {
        return TRACE_ID.get();
    }

    public static void clear() {
        TRACE_ID.remove();
    }
}
