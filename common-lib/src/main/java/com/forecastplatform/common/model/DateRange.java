package com.forecastplatform.common.model;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Closed calendar interval used for retrieval windows and forecast horizons.
 * Valid only when {@code end} is strictly after {@code start}.
 */
public record DateRange(LocalDate start, LocalDate end) {

    private static final DateTimeFormatter ISO = DateTimeFormatter.ISO_LOCAL_DATE;

    public static DateRange of(String start, String end) {
        return new DateRange(LocalDate.parse(start, ISO), LocalDate.parse(end, ISO));
    }

    public boolean isValid() {
        return start != null && end != null && end.isAfter(start);
    }

    public String startText() {
        return start == null ? "" : start.format(ISO);
    }

    public String endText() {
        return end == null ? "" : end.format(ISO);
    }

    @Override
    public String toString() {
        return startText() + ".." + endText();
    }
}
