package com.costtracker.costs.repository;

import com.costtracker.costs.entity.CostEntity;
import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaCostRepository extends JpaRepository<CostEntity, UUID> {

    @Query("SELECT c FROM CostEntity c WHERE c.userId = :userId AND c.createdAt >= :from AND c.createdAt < :to ORDER BY c.createdAt ASC")
    List<CostEntity> findByUserIdAndRange(@Param("userId") long userId,
                                          @Param("from") Instant from,
                                          @Param("to") Instant to);

    @Query("SELECT SUM(c.amount) FROM CostEntity c WHERE c.userId = :userId")
    BigDecimal sumAmountByUserId(@Param("userId") long userId);
}
