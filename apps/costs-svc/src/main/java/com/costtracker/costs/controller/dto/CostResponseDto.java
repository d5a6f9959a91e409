package com.costtracker.costs.controller.dto;

import java.math.BigDecimal;
import java.time.Instant;

public record CostResponseDto(String description, String category, long userid, BigDecimal sum, Instant createdAt) {
}
