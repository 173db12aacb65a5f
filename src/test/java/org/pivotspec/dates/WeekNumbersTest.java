package org.pivotspec.dates;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("WeekNumbers")
class WeekNumbersTest {

    @Test
    @DisplayName("ISO weeks across year boundaries")
    void isoWeekBoundaries() {
        assertThat(WeekNumbers.isoWeek(LocalDate.of(2024, 1, 1))).isEqualTo(1);
        assertThat(WeekNumbers.isoWeek(LocalDate.of(2023, 12, 31))).isEqualTo(52);
        assertThat(WeekNumbers.isoWeek(LocalDate.of(2021, 1, 3))).isEqualTo(53);
        assertThat(WeekNumbers.isoWeek(LocalDate.of(2024, 12, 30))).isEqualTo(1);
    }

    @Test
    @DisplayName("Sunday-start numbering begins a new week on each Sunday")
    void sundayWeeks() {
        assertThat(WeekNumbers.weekNumber(LocalDate.of(2024, 1, 1), WeekStart.SUN)).isEqualTo(1);
        assertThat(WeekNumbers.weekNumber(LocalDate.of(2024, 1, 6), WeekStart.SUN)).isEqualTo(1);
        assertThat(WeekNumbers.weekNumber(LocalDate.of(2024, 1, 7), WeekStart.SUN)).isEqualTo(2);
    }

    @Test
    @DisplayName("Monday start uses ISO numbering")
    void mondayIsIso() {
        LocalDate date = LocalDate.of(2023, 1, 1);
        assertThat(WeekNumbers.weekNumber(date, WeekStart.MON)).isEqualTo(WeekNumbers.isoWeek(date)).isEqualTo(52);
        assertThat(WeekNumbers.weekNumber(date, null)).isEqualTo(52);
    }

    @Test
    @DisplayName("Start of week honours the week start")
    void startOfWeek() {
        LocalDate friday = LocalDate.of(2024, 3, 15);
        assertThat(WeekNumbers.startOfWeek(friday, WeekStart.MON)).isEqualTo(LocalDate.of(2024, 3, 11));
        assertThat(WeekNumbers.startOfWeek(friday, WeekStart.SUN)).isEqualTo(LocalDate.of(2024, 3, 10));
        assertThat(WeekNumbers.startOfWeek(friday, WeekStart.SAT)).isEqualTo(LocalDate.of(2024, 3, 9));
    }
}
