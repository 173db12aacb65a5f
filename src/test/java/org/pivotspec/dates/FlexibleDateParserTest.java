package org.pivotspec.dates;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneId;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

@Tag("unit")
@DisplayName("FlexibleDateParser")
class FlexibleDateParserTest {

    @Nested
    @DisplayName("Text encodings")
    class TextEncodings {

        @Test
        @DisplayName("ISO date and date-time")
        void isoDates() {
            assertThat(FlexibleDateParser.parse("2024-03-15")).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
            assertThat(FlexibleDateParser.parse("2024-03-15T10:20:30")).isEqualTo(LocalDateTime.of(2024, 3, 15, 10, 20, 30));
            assertThat(FlexibleDateParser.parse("2024-03-15 10:20")).isEqualTo(LocalDateTime.of(2024, 3, 15, 10, 20));
            assertThat(FlexibleDateParser.parse("2024-03-15T10:20:30.123Z")).isEqualTo(LocalDateTime.of(2024, 3, 15, 10, 20, 30));
        }

        @Test
        @DisplayName("US month/day/year")
        void usDates() {
            assertThat(FlexibleDateParser.parseDate("03/15/2024")).isEqualTo(LocalDate.of(2024, 3, 15));
            assertThat(FlexibleDateParser.parse("3/5/2024 08:30")).isEqualTo(LocalDateTime.of(2024, 3, 5, 8, 30));
        }

        @Test
        @DisplayName("Year-month and month names map to the first of the month")
        void monthForms() {
            assertThat(FlexibleDateParser.parseDate("2024-02")).isEqualTo(LocalDate.of(2024, 2, 1));
            assertThat(FlexibleDateParser.parseDate("Jan-2024")).isEqualTo(LocalDate.of(2024, 1, 1));
            assertThat(FlexibleDateParser.parseDate("January 2024")).isEqualTo(LocalDate.of(2024, 1, 1));
            assertThat(FlexibleDateParser.parseDate("Sept 2023")).isEqualTo(LocalDate.of(2023, 9, 1));
        }

        @Test
        @DisplayName("Ten digits are epoch seconds, thirteen are milliseconds")
        void epochValues() {
            assertThat(FlexibleDateParser.parse("1710460800")).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
            assertThat(FlexibleDateParser.parse("1710460800000")).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
            assertThat(FlexibleDateParser.parse(1710460800L)).isEqualTo(LocalDateTime.of(2024, 3, 15, 0, 0));
        }

        @ParameterizedTest
        @ValueSource(strings = {"", "   ", "hello", "2024-13-01", "2023-02-30", "13/45/2024", "Foo 2024", "12345"})
        @DisplayName("Unrecognized or impossible values yield null")
        void invalidValues(String value) {
            assertThat(FlexibleDateParser.parse(value)).isNull();
        }
    }

    @Nested
    @DisplayName("Typed values")
    class TypedValues {

        @Test
        @DisplayName("java.time values pass through")
        void javaTime() {
            LocalDate date = LocalDate.of(2024, 1, 31);
            assertThat(FlexibleDateParser.parse(date)).isEqualTo(date.atStartOfDay());
            assertThat(FlexibleDateParser.parse(Instant.parse("2024-01-31T23:00:00Z"), ZoneId.of("Europe/Berlin")))
                .isEqualTo(LocalDateTime.of(2024, 2, 1, 0, 0));
        }

        @Test
        @DisplayName("Null and fractional numbers yield null")
        void nullAndFractions() {
            assertThat(FlexibleDateParser.parse(null)).isNull();
            assertThat(FlexibleDateParser.parse(1710460800.5)).isNull();
        }
    }
}
