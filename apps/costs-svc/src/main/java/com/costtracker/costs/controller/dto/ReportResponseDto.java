package com.costtracker.costs.controller.dto;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

/**
 * Wire shape of a monthly report: {@code costs} holds one single-key object per category,
 * always five, in display order.
 */
public record ReportResponseDto(
        long userid,
        int year,
        int month,
        List<Map<String, List<Entry>>> costs
) {
    public record Entry(BigDecimal sum, String description, int day) {
    }
}
