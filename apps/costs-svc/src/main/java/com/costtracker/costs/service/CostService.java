package com.costtracker.costs.service;

import com.costtracker.costs.exception.InvalidInputException;
import com.costtracker.costs.exception.StorageUnavailableException;
import com.costtracker.costs.model.Category;
import com.costtracker.costs.model.CostRecord;
import com.costtracker.costs.repository.CostRecordRepository;
import com.costtracker.costs.user.UserService;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

/**
 * Accepts new cost records. Records are immutable once saved; dates in the past are rejected.
 */
@Service
public class CostService {

    private static final Logger log = LoggerFactory.getLogger(CostService.class);

    static final int ERROR_MISSING_FIELDS = 1;
    static final int ERROR_DESCRIPTION = 2;
    static final int ERROR_CATEGORY = 3;
    static final int ERROR_USER_ID = 4;
    static final int ERROR_SUM = 5;
    static final int ERROR_CREATED_AT_FORMAT = 6;
    static final int ERROR_CREATED_AT_PAST = 7;
    static final int ERROR_UNKNOWN_USER = 8;

    // numeric(12,2)
    private static final int AMOUNT_SCALE = 2;
    private static final int AMOUNT_INTEGER_DIGITS = 10;

    private final CostRecordRepository costRecordRepository;
    private final UserService userService;
    private final Clock clock;

    public CostService(CostRecordRepository costRecordRepository, UserService userService, Clock clock) {
        this.costRecordRepository = costRecordRepository;
        this.userService = userService;
        this.clock = clock;
    }

    public record NewCost(String description, String category, Long userId, BigDecimal sum, String createdAt) {}

    public CostRecord addCost(NewCost request) {
        if (request.description() == null || request.category() == null || request.userId() == null || request.sum() == null) {
            throw new InvalidInputException(ERROR_MISSING_FIELDS, "Missing required fields: description, category, userid, sum");
        }
        if (request.description().isBlank()) {
            throw new InvalidInputException(ERROR_DESCRIPTION, "description must be a non-empty String");
        }
        if (!Category.isValid(request.category())) {
            throw new InvalidInputException(ERROR_CATEGORY, "category must be one of: food, health, housing, sports, education");
        }
        if (request.userId() <= 0) {
            throw new InvalidInputException(ERROR_USER_ID, "userid must be a positive Number");
        }
        if (request.sum().signum() < 0) {
            throw new InvalidInputException(ERROR_SUM, "sum must be a non-negative Number");
        }
        BigDecimal amount = request.sum().setScale(AMOUNT_SCALE, RoundingMode.HALF_UP);
        if (amount.precision() - amount.scale() > AMOUNT_INTEGER_DIGITS) {
            throw new InvalidInputException(ERROR_SUM, "sum must be less than 10000000000");
        }

        Instant now = clock.instant();
        Instant createdAt = parseCreatedAt(request.createdAt(), now);
        if (createdAt.isBefore(now)) {
            throw new InvalidInputException(ERROR_CREATED_AT_PAST, "Cannot add costs with dates in the past");
        }
        if (!userService.exists(request.userId())) {
            throw new InvalidInputException(ERROR_UNKNOWN_USER, "User " + request.userId() + " does not exist");
        }

        CostRecord record = new CostRecord(
                UUID.randomUUID(),
                request.description(),
                request.category(),
                request.userId(),
                amount,
                createdAt);
        try {
            CostRecord saved = costRecordRepository.save(record);
            log.info("Cost {} added for user {} in category {}", saved.id(), saved.userId(), saved.category());
            return saved;
        } catch (DataAccessException ex) {
            throw new StorageUnavailableException("Cost record store unavailable", ex);
        }
    }

    private Instant parseCreatedAt(String value, Instant now) {
        if (value == null || value.isBlank()) {
            return now;
        }
        try {
            return OffsetDateTime.parse(value.trim()).toInstant();
        } catch (DateTimeParseException ex) {
            throw new InvalidInputException(ERROR_CREATED_AT_FORMAT, "createdAt must be a valid Date if provided");
        }
    }
}
