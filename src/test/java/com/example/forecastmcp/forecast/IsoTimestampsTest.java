package com.example.forecastmcp.forecast;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IsoTimestampsTest {

    @Test
    void parsesDatesAndDateTimes() {
        assertThat(IsoTimestamps.parse("2021-01-01")).isEqualTo(LocalDateTime.of(2021, 1, 1, 0, 0));
        assertThat(IsoTimestamps.parse("2021-01-01T10:15")).isEqualTo(LocalDateTime.of(2021, 1, 1, 10, 15));
        assertThat(IsoTimestamps.parse("2021-01-01 10:15:30")).isEqualTo(LocalDateTime.of(2021, 1, 1, 10, 15, 30));
    }

    @Test
    void rejectsOtherFormats() {
        assertThatThrownBy(() -> IsoTimestamps.parse("01/02/2021")).isInstanceOf(DateTimeParseException.class);
        assertThatThrownBy(() -> IsoTimestamps.parse("2021-13-01")).isInstanceOf(DateTimeParseException.class);
    }

    @Test
    void formatsWithSeconds() {
        assertThat(IsoTimestamps.format(LocalDateTime.of(2021, 1, 1, 0, 0))).isEqualTo("2021-01-01T00:00:00");
    }
}
