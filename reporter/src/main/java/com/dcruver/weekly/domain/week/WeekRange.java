package com.dcruver.weekly.domain.week;

import lombok.Value;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Inclusive date range of a week.
 */
@Value
public class WeekRange {

    private static final DateTimeFormatter SHORT = DateTimeFormatter.ofPattern("yyyy.MM.dd");

    LocalDate start;
    LocalDate end;

    public boolean contains(LocalDate date) {
        return !date.isBefore(start) && !date.isAfter(end);
    }

    public String format() {
        return start.format(SHORT) + " ~ " + end.format(SHORT);
    }
}
