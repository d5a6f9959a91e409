package com.costtracker.costs.model;

import java.time.Instant;
import java.util.Map;

public record RequestLogRecord(
        Instant ts,
        String service,
        String type,
        String method,
        String path,
        Integer statusCode,
        Long responseTimeMs,
        String message,
        Map<String, Object> meta
) {
    public static RequestLogRecord request(Instant ts, String service, String method, String path, int statusCode, long responseTimeMs) {
        return new RequestLogRecord(ts, service, "request", method, path, statusCode, responseTimeMs, "request completed", Map.of());
    }
}
