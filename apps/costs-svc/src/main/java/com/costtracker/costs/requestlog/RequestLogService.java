package com.costtracker.costs.requestlog;

import com.costtracker.costs.exception.InvalidInputException;
import com.costtracker.costs.exception.StorageUnavailableException;
import com.costtracker.costs.model.RequestLogRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

@Service
public class RequestLogService {

    private static final Logger log = LoggerFactory.getLogger(RequestLogService.class);

    static final int ERROR_MISSING_FIELDS = 30;
    static final int ERROR_INVALID_META = 31;

    private final RequestLogRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public RequestLogService(RequestLogRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    /**
     * Stores a record sent by a peer service. {@code ts} defaults to now.
     */
    public RequestLogRecord accept(RequestLogRecord record) {
        if (record.service() == null || record.service().isBlank() || record.type() == null || record.type().isBlank()) {
            throw new InvalidInputException(ERROR_MISSING_FIELDS, "Missing required fields: service, type");
        }
        RequestLogRecord stamped = record.ts() != null ? record : new RequestLogRecord(
                clock.instant(),
                record.service(),
                record.type(),
                record.method(),
                record.path(),
                record.statusCode(),
                record.responseTimeMs(),
                record.message(),
                record.meta());
        try {
            repository.save(toEntity(stamped));
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Log store unavailable", ex);
        }
        return stamped;
    }

    /**
     * Records this service's own request. Never throws: a lost log line must not fail the
     * request it describes.
     */
    public boolean recordOwn(RequestLogRecord record) {
        try {
            repository.save(toEntity(record));
            return true;
        } catch (RuntimeException ex) {
            log.warn("Request log not recorded for {} {}: {}", record.method(), record.path(), ex.getMessage());
            return false;
        }
    }

    public List<RequestLogRecord> listNewestFirst() {
        try {
            return repository.findAllByOrderByTsDescIdDesc().stream().map(this::toModel).toList();
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Log store unavailable", ex);
        }
    }

    private RequestLogEntity toEntity(RequestLogRecord record) {
        return new RequestLogEntity(
                record.ts(),
                record.service(),
                record.type(),
                record.method(),
                record.path(),
                record.statusCode(),
                record.responseTimeMs(),
                record.message(),
                writeMeta(record.meta()));
    }

    private RequestLogRecord toModel(RequestLogEntity entity) {
        return new RequestLogRecord(
                entity.getTs(),
                entity.getService(),
                entity.getType(),
                entity.getMethod(),
                entity.getPath(),
                entity.getStatusCode(),
                entity.getResponseTimeMs(),
                entity.getMessage(),
                readMeta(entity.getMeta()));
    }

    private String writeMeta(Map<String, Object> meta) {
        if (meta == null || meta.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(meta);
        } catch (JsonProcessingException ex) {
            throw new InvalidInputException(ERROR_INVALID_META, "meta must be a JSON object");
        }
    }

    private Map<String, Object> readMeta(String stored) {
        if (stored == null || stored.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(stored, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException ex) {
            log.warn("Stored log meta is not valid JSON, returning it as raw text");
            return Map.of("raw", stored);
        }
    }
}
