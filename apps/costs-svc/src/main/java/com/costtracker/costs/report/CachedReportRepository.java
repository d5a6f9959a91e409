package com.costtracker.costs.report;

import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CachedReportRepository extends JpaRepository<CachedReportEntity, Long> {
    Optional<CachedReportEntity> findByUserIdAndYearAndMonth(long userId, int year, int month);
}
