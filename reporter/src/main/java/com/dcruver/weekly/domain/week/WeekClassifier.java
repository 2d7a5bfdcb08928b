package com.dcruver.weekly.domain.week;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.time.temporal.IsoFields;
import java.time.temporal.TemporalAdjusters;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps a date to a week number under a {@link WeekPolicy}.
 *
 * Stateless apart from the clock used for "current week" queries. Every call receives its
 * policy parameters explicitly.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class WeekClassifier {

    private static final DateTimeFormatter DISPLAY_FORMAT =
        DateTimeFormatter.ofPattern("MMM d (EEE)", Locale.ENGLISH);

    private final Clock clock;

    /**
     * Compute the week number of {@code date}.
     *
     * @throws InvalidPolicyException if the project policy is used without an anchor
     */
    public int weekNumber(LocalDate date, WeekPolicy policy, PolicyParameters params) {
        return switch (policy) {
            case PROJECT -> projectWeek(date, requireAnchor(params));
            case MONTHLY -> monthlyWeek(date);
            case ISO -> isoWeek(date);
        };
    }

    /**
     * Inclusive date range of a project week. Empty for other policies and for
     * weeks before the anchor (week &lt;= 0).
     */
    public Optional<WeekRange> weekRange(int weekNumber, WeekPolicy policy, PolicyParameters params) {
        if (policy != WeekPolicy.PROJECT || weekNumber <= 0) {
            return Optional.empty();
        }
        LocalDate start = requireAnchor(params).plusWeeks(weekNumber - 1L);
        return Optional.of(new WeekRange(start, start.plusDays(6)));
    }

    /**
     * Week containing today.
     */
    public int currentWeek(WeekPolicy policy, PolicyParameters params) {
        return weekNumber(LocalDate.now(clock), policy, params);
    }

    /**
     * Parse the date part of a store timestamp ({@code 2025-08-01} or
     * {@code 2025-08-01T09:00:00.000+09:00}). Blank or malformed input yields empty.
     */
    public Optional<LocalDate> parseDate(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        String datePart = value.trim();
        int timeSeparator = datePart.indexOf('T');
        if (timeSeparator >= 0) {
            datePart = datePart.substring(0, timeSeparator);
        }
        try {
            return Optional.of(LocalDate.parse(datePart));
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable date '{}'", value);
            return Optional.empty();
        }
    }

    public String formatDisplayDate(LocalDate date) {
        return date.format(DISPLAY_FORMAT);
    }

    public int isoYear(LocalDate date) {
        return date.get(IsoFields.WEEK_BASED_YEAR);
    }

    int projectWeek(LocalDate date, LocalDate anchor) {
        if (date.isBefore(anchor)) {
            return 0;
        }
        return (int) (ChronoUnit.DAYS.between(anchor, date) / 7) + 1;
    }

    /**
     * A month that opens mid-week counts those leading days as week 1, so its first
     * Monday starts week 2. A month that opens on a Monday starts week 1 there.
     */
    int monthlyWeek(LocalDate date) {
        LocalDate firstDay = date.withDayOfMonth(1);
        LocalDate firstMonday = firstDay.with(TemporalAdjusters.nextOrSame(DayOfWeek.MONDAY));
        if (firstMonday.getMonth() != firstDay.getMonth()) {
            firstMonday = firstDay;
        }

        if (date.isBefore(firstMonday)) {
            return 1;
        }

        int leadingPartialWeek = firstMonday.equals(firstDay) ? 0 : 1;
        return (int) (ChronoUnit.DAYS.between(firstMonday, date) / 7) + 1 + leadingPartialWeek;
    }

    int isoWeek(LocalDate date) {
        return date.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR);
    }

    private LocalDate requireAnchor(PolicyParameters params) {
        if (params == null || !params.hasAnchor()) {
            throw new InvalidPolicyException("Project week policy requires an anchor date");
        }
        return params.getAnchorDate();
    }
}
