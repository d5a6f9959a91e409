package com.costtracker.costs.controller.dto;

import jakarta.validation.constraints.Size;
import java.math.BigDecimal;

public record AddCostRequestDto(
        @Size(max = 255) String description,
        String category,
        Long userid,
        BigDecimal sum,
        String createdAt
) {
}
