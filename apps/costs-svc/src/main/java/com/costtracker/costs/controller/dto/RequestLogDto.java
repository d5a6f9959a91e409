package com.costtracker.costs.controller.dto;

import java.time.Instant;
import java.util.Map;

public record RequestLogDto(
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
}
