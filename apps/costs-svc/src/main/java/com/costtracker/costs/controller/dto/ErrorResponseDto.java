package com.costtracker.costs.controller.dto;

import java.util.Map;

/**
 * {@code id} is the numeric error code of the failing operation, {@code code} its symbolic class.
 */
public record ErrorResponseDto(Integer id, String code, String message, Map<String, Object> details, String traceId) {
}
