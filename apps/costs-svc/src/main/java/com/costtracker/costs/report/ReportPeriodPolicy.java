package com.costtracker.costs.report;

import java.time.Clock;
import java.time.Instant;
import java.time.YearMonth;
import org.springframework.stereotype.Component;

/**
 * Decides whether a period has fully elapsed and computes its instant range, both on the
 * application clock and its zone.
 */
@Component
public class ReportPeriodPolicy {

    private final Clock clock;

    public ReportPeriodPolicy(Clock clock) {
        this.clock = clock;
    }

    /**
     * Closed means strictly before the current calendar month. The current month stays open
     * until its last instant has passed.
     */
    public boolean isClosed(YearMonth period) {
        return period.isBefore(YearMonth.now(clock));
    }

    public Instant startOf(YearMonth period) {
        return period.atDay(1).atStartOfDay(clock.getZone()).toInstant();
    }

    public Instant endOf(YearMonth period) {
        return startOf(period.plusMonths(1));
    }
}
