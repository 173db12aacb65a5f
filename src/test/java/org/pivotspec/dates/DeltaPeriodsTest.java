package org.pivotspec.dates;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
@DisplayName("DeltaPeriods")
class DeltaPeriodsTest {

    private static final LocalDate TODAY = LocalDate.of(2024, 3, 15);

    @Test
    @DisplayName("Month to date compares with the same span of last month")
    void monthToDate() {
        DeltaPeriods periods = DeltaPeriods.resolve(DeltaMode.MTD_LMTD, TODAY, WeekStart.MON);

        assertThat(periods.current()).isEqualTo(new DateRange("2024-03-01", "2024-03-16"));
        assertThat(periods.previous()).isEqualTo(new DateRange("2024-02-01", "2024-02-16"));
    }

    @Test
    @DisplayName("A to-date comparison never overlaps the current period")
    void previousPeriodIsClamped() {
        DeltaPeriods periods = DeltaPeriods.resolve(DeltaMode.MTD_LMTD, LocalDate.of(2024, 3, 31), WeekStart.MON);

        assertThat(periods.previous()).isEqualTo(new DateRange("2024-02-01", "2024-03-01"));
    }

    @Test
    @DisplayName("Full-period comparisons")
    void fullPeriods() {
        assertThat(DeltaPeriods.resolve(DeltaMode.TD_YSTD, TODAY, WeekStart.MON).previous())
            .isEqualTo(new DateRange("2024-03-14", "2024-03-15"));
        assertThat(DeltaPeriods.resolve(DeltaMode.TW_LW, TODAY, WeekStart.SUN).current())
            .isEqualTo(new DateRange("2024-03-10", "2024-03-17"));
        assertThat(DeltaPeriods.resolve(DeltaMode.TQ_LQ, TODAY, WeekStart.MON).previous())
            .isEqualTo(new DateRange("2023-10-01", "2024-01-01"));
        assertThat(DeltaPeriods.resolve(DeltaMode.YTD_LYTD, TODAY, WeekStart.MON).previous())
            .isEqualTo(new DateRange("2023-01-01", "2023-03-17"));
    }

    @Test
    @DisplayName("Delta modes parse case-insensitively")
    void modeIds() {
        assertThat(DeltaMode.fromId("mtd_lmtd")).isEqualTo(DeltaMode.MTD_LMTD);
    }

    @Test
    @DisplayName("Stripping removes the date field's own constraints only")
    void stripDateConstraints() {
        Map<String, Object> where = new LinkedHashMap<>();
        where.put("order_date__gte", "2024-01-01");
        where.put("order_date__lt", "2024-02-01");
        where.put("order_date", "2024-01-05");
        where.put("region", "EU");

        assertThat(DeltaPeriods.stripDateConstraints(where, "order_date")).containsOnlyKeys("region");
        assertThat(DeltaPeriods.stripDateConstraints(null, "order_date")).isEmpty();
    }

    @Test
    @DisplayName("Change percent handles a zero baseline")
    void changePercent() {
        assertThat(DeltaPeriods.changePercent(150, 100)).isCloseTo(50.0, within(1e-9));
        assertThat(DeltaPeriods.changePercent(50, -100)).isCloseTo(150.0, within(1e-9));
        assertThat(DeltaPeriods.changePercent(5, 0)).isEqualTo(100.0);
        assertThat(DeltaPeriods.changePercent(0, 0)).isEqualTo(0.0);
    }
}
