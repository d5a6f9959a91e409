package com.costtracker.costs.repository;

import com.costtracker.costs.model.CostRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;

public interface CostRecordRepository {

    CostRecord save(CostRecord record);

    /**
     * Records of one user with {@code fromInclusive <= createdAt < toExclusive}, oldest first.
     */
    List<CostRecord> findByUserIdAndRange(long userId, Instant fromInclusive, Instant toExclusive);

    BigDecimal sumByUserId(long userId);
}
