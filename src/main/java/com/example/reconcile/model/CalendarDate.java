package com.example.reconcile.model;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Calendar date with the precision it was written with.
 * Month and year precision dates are anchored on the first day of the period.
 */
public record CalendarDate(LocalDate date, DateGranularity granularity) implements TypedValue {

    @Override
    public String canonical() {
        return switch (granularity) {
            case DAY -> date.toString();
            case MONTH -> YearMonth.from(date).toString();
            case YEAR -> String.valueOf(date.getYear());
        };
    }

    /** True when this (coarser or equal) date contains {@code other}. */
    public boolean covers(CalendarDate other) {
        if (granularity.ordinal() < other.granularity.ordinal()) return false;
        return switch (granularity) {
            case DAY -> date.equals(other.date);
            case MONTH -> YearMonth.from(date).equals(YearMonth.from(other.date));
            case YEAR -> date.getYear() == other.date.getYear();
        };
    }
}
