package com.costtracker.costs.report;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.costtracker.costs.exception.InvalidInputException;
import com.costtracker.costs.exception.StorageUnavailableException;
import com.costtracker.costs.model.Category;
import com.costtracker.costs.model.CostRecord;
import com.costtracker.costs.model.Report;
import com.costtracker.costs.model.ReportKey;
import com.costtracker.costs.repository.CostRecordRepository;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

@ExtendWith(MockitoExtension.class)
class ReportServiceTest {

    private static final Instant NOW = Instant.parse("2025-04-10T09:00:00Z");

    @Mock
    private CostRecordRepository costRecordRepository;

    @Mock
    private ReportCache reportCache;

    private ReportService reportService;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
        reportService = new ReportService(
                costRecordRepository,
                reportCache,
                new ReportBuilder(ZoneOffset.UTC),
                new ReportPeriodPolicy(clock));
    }

    @Test
    void closedPeriodMissComputesAndStores() {
        ReportKey key = new ReportKey(123123L, 2025, 3);
        when(reportCache.lookup(key)).thenReturn(Optional.empty());
        when(costRecordRepository.findByUserIdAndRange(123123L, Instant.parse("2025-03-01T00:00:00Z"), Instant.parse("2025-04-01T00:00:00Z")))
                .thenReturn(List.of(
                        cost("lunch", "food", "12.50", "2025-03-05T12:00:00Z"),
                        cost("rent", "housing", "1500.00", "2025-03-01T08:00:00Z")));
        when(reportCache.store(eq(key), any(Report.class))).thenReturn(ReportCache.StoreResult.STORED);

        Report report = reportService.getReport(123123L, 2025, 3);

        assertThat(report.userId()).isEqualTo(123123L);
        assertThat(report.entriesFor(Category.FOOD)).singleElement()
                .satisfies(entry -> {
                    assertThat(entry.amount()).isEqualByComparingTo("12.50");
                    assertThat(entry.description()).isEqualTo("lunch");
                    assertThat(entry.dayOfMonth()).isEqualTo(5);
                });
        assertThat(report.entriesFor(Category.HOUSING)).singleElement()
                .satisfies(entry -> assertThat(entry.dayOfMonth()).isEqualTo(1));
        assertThat(report.entriesFor(Category.EDUCATION)).isEmpty();
        verify(reportCache).store(key, report);
    }

    @Test
    void cacheHitSkipsTheRecordStore() {
        ReportKey key = new ReportKey(5L, 2025, 1);
        Report cached = new ReportBuilder(ZoneOffset.UTC).build(5L, 2025, 1, List.of(cost("x", "food", "1.00", "2025-01-02T00:00:00Z")));
        when(reportCache.lookup(key)).thenReturn(Optional.of(cached));

        Report first = reportService.getReport(key);
        Report second = reportService.getReport(key);

        assertThat(first).isEqualTo(cached);
        assertThat(second).isEqualTo(first);
        verifyNoInteractions(costRecordRepository);
        verify(reportCache, never()).store(any(), any());
    }

    @Test
    void openPeriodIsNeverCachedOrLookedUp() {
        when(costRecordRepository.findByUserIdAndRange(anyLong(), any(), any())).thenReturn(List.of());

        Report current = reportService.getReport(5L, 2025, 4);
        Report future = reportService.getReport(5L, 2026, 1);

        assertThat(current.costsByCategory()).hasSize(5);
        assertThat(future.costsByCategory()).hasSize(5);
        verifyNoInteractions(reportCache);
    }

    @Test
    void cacheConflictStillReturnsTheFreshReport() {
        ReportKey key = new ReportKey(5L, 2024, 12);
        when(reportCache.lookup(key)).thenReturn(Optional.empty());
        when(costRecordRepository.findByUserIdAndRange(anyLong(), any(), any()))
                .thenReturn(List.of(cost("ball", "sports", "9.99", "2024-12-24T10:00:00Z")));
        when(reportCache.store(eq(key), any(Report.class))).thenReturn(ReportCache.StoreResult.ALREADY_EXISTS);

        Report report = reportService.getReport(key);

        assertThat(report.entriesFor(Category.SPORTS)).hasSize(1);
    }

    @Test
    void recordStoreFailureAbortsWithoutCaching() {
        ReportKey key = new ReportKey(5L, 2025, 2);
        when(reportCache.lookup(key)).thenReturn(Optional.empty());
        when(costRecordRepository.findByUserIdAndRange(anyLong(), any(), any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        assertThatThrownBy(() -> reportService.getReport(key))
                .isInstanceOf(StorageUnavailableException.class);
        verify(reportCache, never()).store(any(), any());
    }

    @Test
    void cacheLookupFailurePropagates() {
        ReportKey key = new ReportKey(5L, 2025, 2);
        when(reportCache.lookup(key)).thenThrow(new StorageUnavailableException("down", null));

        assertThatThrownBy(() -> reportService.getReport(key))
                .isInstanceOf(StorageUnavailableException.class);
        verifyNoInteractions(costRecordRepository);
    }

    @Test
    void invalidMonthIsRejectedBeforeAnyStorageAccess() {
        assertThatThrownBy(() -> reportService.getReport(5L, 2025, 13))
                .isInstanceOf(InvalidInputException.class);
        assertThatThrownBy(() -> reportService.getReport(5L, 2025, 0))
                .isInstanceOf(InvalidInputException.class);
        verifyNoInteractions(costRecordRepository, reportCache);
    }

    private CostRecord cost(String description, String category, String amount, String createdAt) {
        return new CostRecord(UUID.randomUUID(), description, category, 123123L, new BigDecimal(amount), Instant.parse(createdAt));
    }
}
