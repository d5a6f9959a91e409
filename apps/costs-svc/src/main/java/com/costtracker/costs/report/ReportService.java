package com.costtracker.costs.report;

import com.costtracker.costs.exception.StorageUnavailableException;
import com.costtracker.costs.model.CostRecord;
import com.costtracker.costs.model.Report;
import com.costtracker.costs.model.ReportKey;
import com.costtracker.costs.repository.CostRecordRepository;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Serves monthly reports. Closed periods are answered from {@link ReportCache} when
 * possible and memoized after computation; the open month is always recomputed.
 */
@Service
public class ReportService {

    private static final Logger log = LoggerFactory.getLogger(ReportService.class);

    private final CostRecordRepository costRecordRepository;
    private final ReportCache reportCache;
    private final ReportBuilder reportBuilder;
    private final ReportPeriodPolicy periodPolicy;

    public ReportService(
            CostRecordRepository costRecordRepository,
            ReportCache reportCache,
            ReportBuilder reportBuilder,
            ReportPeriodPolicy periodPolicy
    ) {
        this.costRecordRepository = costRecordRepository;
        this.reportCache = reportCache;
        this.reportBuilder = reportBuilder;
        this.periodPolicy = periodPolicy;
    }

    public Report getReport(long userId, int year, int month) {
        return getReport(new ReportKey(userId, year, month));
    }

    public Report getReport(ReportKey key) {
        YearMonth period = key.period();
        boolean closed = periodPolicy.isClosed(period);

        if (closed) {
            Optional<Report> cached = reportCache.lookup(key);
            if (cached.isPresent()) {
                log.debug("Report cache hit for {}", key);
                return cached.get();
            }
            log.debug("Report cache miss for {}", key);
        }

        List<CostRecord> records = findRecords(key, period);
        Report report = reportBuilder.build(key.userId(), key.year(), key.month(), records);

        if (closed) {
            ReportCache.StoreResult result = reportCache.store(key, report);
            log.debug("Report {} persisted to cache: {}", key, result);
        }
        return report;
    }

    private List<CostRecord> findRecords(ReportKey key, YearMonth period) {
        try {
            return costRecordRepository.findByUserIdAndRange(key.userId(), periodPolicy.startOf(period), periodPolicy.endOf(period));
        } catch (DataAccessException ex) {
            log.error("Cost record query failed for {}", key, ex);
            throw new StorageUnavailableException("Cost records unavailable for " + key, ex);
        }
    }
}
