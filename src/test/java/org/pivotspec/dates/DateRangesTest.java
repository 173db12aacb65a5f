package org.pivotspec.dates;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

@Tag("unit")
@DisplayName("DateRanges")
class DateRangesTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    @Nested
    @DisplayName("Presets")
    class Presets {

        @ParameterizedTest(name = "{0} -> [{1}, {2})")
        @CsvSource({
            "today,        2024-03-15, 2024-03-16",
            "yesterday,    2024-03-14, 2024-03-15",
            "this_week,    2024-03-11, 2024-03-18",
            "last_week,    2024-03-04, 2024-03-11",
            "this_month,   2024-03-01, 2024-04-01",
            "last_month,   2024-02-01, 2024-03-01",
            "this_quarter, 2024-01-01, 2024-04-01",
            "last_quarter, 2023-10-01, 2024-01-01",
            "this_year,    2024-01-01, 2025-01-01",
            "last_year,    2023-01-01, 2024-01-01",
            "last_7_days,  2024-03-09, 2024-03-16",
            "last_30_days, 2024-02-15, 2024-03-16"
        })
        @DisplayName("Resolve to half-open ranges")
        void presetRanges(String id, String gte, String lt) {
            DatePreset preset = DatePreset.fromId(id).orElseThrow();
            assertThat(DateRanges.resolvePreset(preset, TODAY)).isEqualTo(new DateRange(gte, lt));
        }

        @Test
        @DisplayName("Week presets honour a Sunday week start")
        void sundayWeek() {
            assertThat(DateRanges.resolvePreset(DatePreset.THIS_WEEK, TODAY, WeekStart.SUN))
                .isEqualTo(new DateRange("2024-03-10", "2024-03-17"));
        }

        @Test
        @DisplayName("Unknown preset ids are not resolved")
        void unknownPreset() {
            assertThat(DatePreset.fromId("next_week")).isEmpty();
        }
    }

    @Nested
    @DisplayName("Custom ranges")
    class CustomRanges {

        @Test
        @DisplayName("Between makes the end exclusive by adding a day")
        void between() {
            assertThat(DateRanges.resolveCustomRange(CustomRangeOp.BETWEEN, "2024-01-01", "2024-01-31"))
                .isEqualTo(new DateRange("2024-01-01", "2024-02-01"));
        }

        @Test
        @DisplayName("After sets only the lower bound")
        void after() {
            assertThat(DateRanges.resolveCustomRange(CustomRangeOp.AFTER, "2024-01-10", null))
                .isEqualTo(new DateRange("2024-01-10", null));
        }

        @Test
        @DisplayName("Before uses the second bound and falls back to the first")
        void before() {
            assertThat(DateRanges.resolveCustomRange(CustomRangeOp.BEFORE, null, "2024-01-10"))
                .isEqualTo(new DateRange(null, "2024-01-11"));
            assertThat(DateRanges.resolveCustomRange(CustomRangeOp.BEFORE, "2024-01-10", " "))
                .isEqualTo(new DateRange(null, "2024-01-11"));
        }

        @Test
        @DisplayName("Blank or unparseable bounds are omitted")
        void missingBounds() {
            assertThat(DateRanges.resolveCustomRange(CustomRangeOp.BETWEEN, "", "garbage").isUnbounded()).isTrue();
            assertThat(DateRanges.resolveCustomRange(CustomRangeOp.BETWEEN, "2024-01-01", ""))
                .isEqualTo(new DateRange("2024-01-01", null));
        }

        @Test
        @DisplayName("Other date encodings are accepted as bounds")
        void flexibleBounds() {
            assertThat(DateRanges.resolveCustomRange(CustomRangeOp.BETWEEN, "01/01/2024", "Jan-2024"))
                .isEqualTo(new DateRange("2024-01-01", "2024-01-02"));
        }
    }

    @Test
    @DisplayName("A resolved range maps back to its preset")
    void matchPreset() {
        DateRange lastMonth = DateRanges.resolvePreset(DatePreset.LAST_MONTH, TODAY);

        assertThat(DateRanges.matchPreset(lastMonth, TODAY, WeekStart.MON)).contains(DatePreset.LAST_MONTH);
        assertThat(DateRanges.matchPreset(new DateRange("2024-03-02", "2024-03-05"), TODAY, WeekStart.MON)).isEmpty();
        assertThat(DateRanges.matchPreset(new DateRange("2024-03-15", null), TODAY, WeekStart.MON)).isEmpty();
    }

    @Test
    @DisplayName("Quarter start")
    void quarterStart() {
        assertThat(DateRanges.quarterStart(LocalDate.of(2024, 8, 20))).isEqualTo(LocalDate.of(2024, 7, 1));
        assertThat(DateRanges.quarterStart(LocalDate.of(2024, 12, 31))).isEqualTo(LocalDate.of(2024, 10, 1));
    }
}
