package com.costtracker.costs.repository;

import com.costtracker.costs.entity.CostEntity;
import com.costtracker.costs.model.CostRecord;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Repository;

@Repository
@Primary
public class PostgreSQLCostRecordRepository implements CostRecordRepository {

    private final JpaCostRepository jpaCostRepository;

    public PostgreSQLCostRecordRepository(JpaCostRepository jpaCostRepository) {
        this.jpaCostRepository = jpaCostRepository;
    }

    @Override
    public CostRecord save(CostRecord record) {
        UUID id = record.id() != null ? record.id() : UUID.randomUUID();
        CostEntity saved = jpaCostRepository.save(new CostEntity(
                id,
                record.userId(),
                record.description(),
                record.category(),
                record.amount(),
                record.createdAt()));
        return toModel(saved);
    }

    @Override
    public List<CostRecord> findByUserIdAndRange(long userId, Instant fromInclusive, Instant toExclusive) {
        return jpaCostRepository.findByUserIdAndRange(userId, fromInclusive, toExclusive).stream()
                .map(this::toModel)
                .toList();
    }

    @Override
    public BigDecimal sumByUserId(long userId) {
        BigDecimal total = jpaCostRepository.sumAmountByUserId(userId);
        return total != null ? total : BigDecimal.ZERO;
    }

    private CostRecord toModel(CostEntity entity) {
        return new CostRecord(
                entity.getId(),
                entity.getDescription(),
                entity.getCategory(),
                entity.getUserId(),
                entity.getAmount(),
                entity.getCreatedAt());
    }
}
