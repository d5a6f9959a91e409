package com.costtracker.costs.model;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A single expense entry. {@code category} is kept as stored so that report grouping can
 * skip values outside {@link Category}.
 */
public record CostRecord(
        UUID id,
        String description,
        String category,
        long userId,
        BigDecimal amount,
        Instant createdAt
) {
}
