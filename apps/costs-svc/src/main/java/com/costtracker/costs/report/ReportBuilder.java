package com.costtracker.costs.report;

import com.costtracker.costs.model.Category;
import com.costtracker.costs.model.CostRecord;
import com.costtracker.costs.model.Report;
import java.time.Clock;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Groups one user's cost records of one period into the fixed five-bucket report shape.
 * No I/O.
 */
@Component
public class ReportBuilder {

    private static final Logger log = LoggerFactory.getLogger(ReportBuilder.class);

    private final ZoneId zone;

    @Autowired
    public ReportBuilder(Clock clock) {
        this(clock.getZone());
    }

    ReportBuilder(ZoneId zone) {
        this.zone = zone;
    }

    public Report build(long userId, int year, int month, List<CostRecord> records) {
        Map<Category, List<Report.Entry>> grouped = new EnumMap<>(Category.class);
        for (Category category : Category.displayOrder()) {
            grouped.put(category, new ArrayList<>());
        }

        int skipped = 0;
        for (CostRecord record : records) {
            Optional<Category> category = Category.fromWireName(record.category());
            if (category.isEmpty()) {
                skipped++;
                continue;
            }
            int day = record.createdAt().atZone(zone).getDayOfMonth();
            grouped.get(category.get()).add(new Report.Entry(record.amount(), record.description(), day));
        }
        if (skipped > 0) {
            log.warn("Report {}-{} for user {}: skipped {} records with unknown category", year, month, userId, skipped);
        }

        List<Report.CategoryCosts> buckets = Category.displayOrder().stream()
                .map(category -> new Report.CategoryCosts(category, grouped.get(category)))
                .toList();
        return new Report(userId, year, month, buckets);
    }
}
