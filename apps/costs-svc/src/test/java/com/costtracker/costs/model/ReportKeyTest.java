package com.costtracker.costs.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.costtracker.costs.exception.InvalidInputException;
import java.time.YearMonth;
import org.junit.jupiter.api.Test;

class ReportKeyTest {

    @Test
    void parsesNumericParams() {
        ReportKey key = ReportKey.parse("123123", "2025", " 3 ");

        assertThat(key).isEqualTo(new ReportKey(123123L, 2025, 3));
        assertThat(key.period()).isEqualTo(YearMonth.of(2025, 3));
    }

    @Test
    void acceptsIntegralDecimals() {
        assertThat(ReportKey.parse("123123", "2025.0", "3.0")).isEqualTo(new ReportKey(123123L, 2025, 3));
    }

    @Test
    void blankValuesReadAsZeroAndFailTheRangeCheck() {
        assertThatThrownBy(() -> ReportKey.parse("1", "2025", ""))
                .isInstanceOf(InvalidInputException.class)
                .satisfies(ex -> assertThat(((InvalidInputException) ex).getErrorId()).isEqualTo(ReportKey.ERROR_MONTH_RANGE));
        assertThatThrownBy(() -> ReportKey.parse("1", " ", "3"))
                .isInstanceOf(InvalidInputException.class)
                .satisfies(ex -> assertThat(((InvalidInputException) ex).getErrorId()).isEqualTo(ReportKey.ERROR_YEAR_RANGE));
    }

    @Test
    void rejectsMonthOutsideRange() {
        assertThatThrownBy(() -> new ReportKey(1L, 2025, 13))
                .isInstanceOf(InvalidInputException.class)
                .satisfies(ex -> assertThat(((InvalidInputException) ex).getErrorId()).isEqualTo(ReportKey.ERROR_MONTH_RANGE));
        assertThatThrownBy(() -> new ReportKey(1L, 2025, 0))
                .isInstanceOf(InvalidInputException.class);
    }

    @Test
    void rejectsYearOutsideRange() {
        assertThatThrownBy(() -> new ReportKey(1L, 0, 5))
                .isInstanceOf(InvalidInputException.class)
                .satisfies(ex -> assertThat(((InvalidInputException) ex).getErrorId()).isEqualTo(ReportKey.ERROR_YEAR_RANGE));
    }

    @Test
    void rejectsMissingOrNonNumericParams() {
        assertThatThrownBy(() -> ReportKey.parse("abc", "2025", "3"))
                .isInstanceOf(InvalidInputException.class)
                .satisfies(ex -> assertThat(((InvalidInputException) ex).getErrorId()).isEqualTo(ReportKey.ERROR_NOT_NUMERIC));
        assertThatThrownBy(() -> ReportKey.parse("1", null, "3"))
                .isInstanceOf(InvalidInputException.class)
                .satisfies(ex -> assertThat(((InvalidInputException) ex).getErrorId()).isEqualTo(ReportKey.ERROR_NOT_NUMERIC));
        assertThatThrownBy(() -> ReportKey.parse("1", "2025", "3.5"))
                .isInstanceOf(InvalidInputException.class)
                .satisfies(ex -> assertThat(((InvalidInputException) ex).getErrorId()).isEqualTo(ReportKey.ERROR_NOT_NUMERIC));
    }
}
