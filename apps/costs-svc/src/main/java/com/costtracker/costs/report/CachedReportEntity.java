package com.costtracker.costs.report;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import java.time.Instant;

/**
 * Permanently memoized report of a closed period. Rows are written once and never updated.
 */
@Entity
@Table(
        name = "cached_reports",
        uniqueConstraints = @UniqueConstraint(name = "cached_reports_user_year_month_unique", columnNames = {"user_id", "period_year", "period_month"})
)
public class CachedReportEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "user_id", nullable = false, updatable = false)
    private long userId;

    @Column(name = "period_year", nullable = false, updatable = false)
    private int year;

    @Column(name = "period_month", nullable = false, updatable = false)
    private int month;

    @Column(name = "report", nullable = false, updatable = false, columnDefinition = "text")
    private String report;

    @Column(name = "computed_at", nullable = false, updatable = false)
    private Instant computedAt;

    protected CachedReportEntity() {
    }

    public CachedReportEntity(long userId, int year, int month, String report, Instant computedAt) {
        this.userId = userId;
        this.year = year;
        this.month = month;
        this.report = report;
        this.computedAt = computedAt;
    }

    public Long getId() {
        return id;
    }

    public long getUserId() {
        return userId;
    }

    public int getYear() {
        return year;
    }

    public int getMonth() {
        return month;
    }

    public String getReport() {
        return report;
    }

    public Instant getComputedAt() {
        return computedAt;
    }
}
