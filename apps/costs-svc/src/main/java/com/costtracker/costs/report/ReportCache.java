package com.costtracker.costs.report;

import com.costtracker.costs.exception.StorageUnavailableException;
import com.costtracker.costs.model.Report;
import com.costtracker.costs.model.ReportKey;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

/**
 * Write-once store of closed-period reports, keyed by {@link ReportKey}. There is no update
 * or delete: the first stored value for a key wins.
 */
@Component
public class ReportCache {

    private static final Logger log = LoggerFactory.getLogger(ReportCache.class);

    public enum StoreResult {
        STORED,
        ALREADY_EXISTS
    }

    private final CachedReportRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ReportCache(CachedReportRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public Optional<Report> lookup(ReportKey key) {
        Optional<CachedReportEntity> entity;
        try {
            entity = repository.findByUserIdAndYearAndMonth(key.userId(), key.year(), key.month());
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Report cache lookup failed for " + key, ex);
        }
        return entity.map(this::readReport);
    }

    /**
     * @return {@link StoreResult#ALREADY_EXISTS} when another request stored this key first;
     *         the stored value is left untouched
     * @throws StorageUnavailableException when the cache cannot be written for any other reason
     */
    public StoreResult store(ReportKey key, Report report) {
        String document = writeReport(key, report);
        try {
            repository.saveAndFlush(new CachedReportEntity(key.userId(), key.year(), key.month(), document, clock.instant()));
            return StoreResult.STORED;
        } catch (DataIntegrityViolationException ex) {
            log.debug("Report cache already holds {}; keeping the stored copy", key);
            return StoreResult.ALREADY_EXISTS;
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Report cache write failed for " + key, ex);
        }
    }

    private Report readReport(CachedReportEntity entity) {
        try {
            return objectMapper.readValue(entity.getReport(), Report.class);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Cached report " + entity.getId() + " is unreadable", ex);
        }
    }

    private String writeReport(ReportKey key, Report report) {
        try {
            return objectMapper.writeValueAsString(report);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Report " + key + " could not be serialized", ex);
        }
    }
}
