package com.costtracker.costs.model;

import com.costtracker.costs.exception.InvalidInputException;
import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * One reporting period for one user. Construction validates, so a key that exists is
 * always well-formed.
 */
public record ReportKey(long userId, int year, int month) {

    public static final int ERROR_NOT_NUMERIC = 20;
    public static final int ERROR_MONTH_RANGE = 21;
    public static final int ERROR_YEAR_RANGE = 22;

    private static final int MIN_YEAR = 1;
    private static final int MAX_YEAR = 9999;

    public ReportKey {
        if (month < 1 || month > 12) {
            throw new InvalidInputException(ERROR_MONTH_RANGE, "month must be between 1 and 12");
        }
        if (year < MIN_YEAR || year > MAX_YEAR) {
            throw new InvalidInputException(ERROR_YEAR_RANGE, "year must be between " + MIN_YEAR + " and " + MAX_YEAR);
        }
    }

    /**
     * Parses raw query values. Blank values read as 0 and integral decimals such as
     * {@code 3.0} are accepted, so range errors are reported for them rather than a format
     * error.
     */
    public static ReportKey parse(String userId, String year, String month) {
        if (userId == null || year == null || month == null) {
            throw new InvalidInputException(ERROR_NOT_NUMERIC, "Query params must be Numbers: id, year, month");
        }
        try {
            return new ReportKey(
                    whole(userId).longValueExact(),
                    whole(year).intValueExact(),
                    whole(month).intValueExact());
        } catch (NumberFormatException | ArithmeticException ex) {
            throw new InvalidInputException(ERROR_NOT_NUMERIC, "Query params must be Numbers: id, year, month");
        }
    }

    private static BigDecimal whole(String raw) {
        String trimmed = raw.trim();
        return trimmed.isEmpty() ? BigDecimal.ZERO : new BigDecimal(trimmed);
    }

    public YearMonth period() {
        return YearMonth.of(year, month);
    }
}
