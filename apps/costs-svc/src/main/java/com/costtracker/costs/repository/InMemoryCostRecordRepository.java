package com.costtracker.costs.repository;

import com.costtracker.costs.model.CostRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryCostRecordRepository implements CostRecordRepository {

    private final List<CostRecord> storage = new CopyOnWriteArrayList<>();

    @Override
    public CostRecord save(CostRecord record) {
        storage.add(record);
        return record;
    }

    @Override
    public List<CostRecord> findByUserIdAndRange(long userId, Instant fromInclusive, Instant toExclusive) {
        return storage.stream()
                .filter(record -> record.userId() == userId)
                .filter(record -> !record.createdAt().isBefore(fromInclusive) && record.createdAt().isBefore(toExclusive))
                .sorted(Comparator.comparing(CostRecord::createdAt))
                .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public BigDecimal sumByUserId(long userId) {
        return storage.stream()
                .filter(record -> record.userId() == userId)
                .map(CostRecord::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
