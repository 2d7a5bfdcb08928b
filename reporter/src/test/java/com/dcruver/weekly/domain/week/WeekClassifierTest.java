package com.dcruver.weekly.domain.week;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class WeekClassifierTest {

    private static final LocalDate ANCHOR = LocalDate.of(2025, 7, 1);
    private static final PolicyParameters PROJECT = PolicyParameters.anchoredAt(ANCHOR);

    private WeekClassifier classifier;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2025-07-16T10:00:00Z"), ZoneOffset.UTC);
        classifier = new WeekClassifier(clock);
    }

    @Test
    void testProjectWeeksFromAnchor() {
        assertEquals(1, week(LocalDate.of(2025, 7, 1), WeekPolicy.PROJECT));
        assertEquals(1, week(LocalDate.of(2025, 7, 7), WeekPolicy.PROJECT));
        assertEquals(2, week(LocalDate.of(2025, 7, 8), WeekPolicy.PROJECT));
        assertEquals(0, week(LocalDate.of(2025, 6, 30), WeekPolicy.PROJECT));
        assertEquals(0, week(LocalDate.of(2024, 12, 31), WeekPolicy.PROJECT));
    }

    @Test
    void testProjectWeekIsZeroExactlyBeforeAnchor() {
        for (int offset = -30; offset <= 60; offset++) {
            LocalDate date = ANCHOR.plusDays(offset);
            int week = week(date, WeekPolicy.PROJECT);
            assertEquals(date.isBefore(ANCHOR), week == 0, date.toString());
        }
    }

    @Test
    void testProjectRange() {
        Optional<WeekRange> first = classifier.weekRange(1, WeekPolicy.PROJECT, PROJECT);
        assertEquals(Optional.of(new WeekRange(LocalDate.of(2025, 7, 1), LocalDate.of(2025, 7, 7))), first);

        WeekRange third = classifier.weekRange(3, WeekPolicy.PROJECT, PROJECT).orElseThrow();
        assertEquals(LocalDate.of(2025, 7, 15), third.getStart());
        assertEquals(LocalDate.of(2025, 7, 21), third.getEnd());
        assertEquals("2025.07.15 ~ 2025.07.21", third.format());
    }

    @Test
    void testRangeIsUndefinedOutsideProjectWeeks() {
        assertTrue(classifier.weekRange(0, WeekPolicy.PROJECT, PROJECT).isEmpty());
        assertTrue(classifier.weekRange(2, WeekPolicy.MONTHLY, PolicyParameters.none()).isEmpty());
        assertTrue(classifier.weekRange(2, WeekPolicy.ISO, PROJECT).isEmpty());
    }

    @Test
    void testEveryDateInProjectWeekFallsInsideItsRange() {
        for (int offset = 0; offset < 120; offset++) {
            LocalDate date = ANCHOR.plusDays(offset);
            int week = week(date, WeekPolicy.PROJECT);
            assertTrue(classifier.weekRange(week, WeekPolicy.PROJECT, PROJECT).orElseThrow().contains(date));
        }
    }

    @Test
    void testProjectPolicyWithoutAnchorIsRejected() {
        assertThrows(InvalidPolicyException.class, () ->
            classifier.weekNumber(ANCHOR, WeekPolicy.PROJECT, PolicyParameters.none()));
    }

    @Test
    void testMonthlyWhenMonthStartsMidWeek() {
        // May 2025 starts on a Thursday; first Monday is the 5th
        assertEquals(1, week(LocalDate.of(2025, 5, 1), WeekPolicy.MONTHLY));
        assertEquals(1, week(LocalDate.of(2025, 5, 4), WeekPolicy.MONTHLY));
        assertEquals(2, week(LocalDate.of(2025, 5, 5), WeekPolicy.MONTHLY));
        assertEquals(2, week(LocalDate.of(2025, 5, 11), WeekPolicy.MONTHLY));
        assertEquals(3, week(LocalDate.of(2025, 5, 12), WeekPolicy.MONTHLY));
        assertEquals(5, week(LocalDate.of(2025, 5, 31), WeekPolicy.MONTHLY));
    }

    @Test
    void testMonthlyWhenMonthStartsOnMonday() {
        // September 2025 starts on a Monday
        assertEquals(1, week(LocalDate.of(2025, 9, 1), WeekPolicy.MONTHLY));
        assertEquals(1, week(LocalDate.of(2025, 9, 7), WeekPolicy.MONTHLY));
        assertEquals(2, week(LocalDate.of(2025, 9, 8), WeekPolicy.MONTHLY));
        assertEquals(5, week(LocalDate.of(2025, 9, 30), WeekPolicy.MONTHLY));
    }

    @Test
    void testMonthlyIsAlwaysAtLeastOne() {
        LocalDate date = LocalDate.of(2024, 1, 1);
        while (date.getYear() < 2026) {
            assertTrue(week(date, WeekPolicy.MONTHLY) >= 1, date.toString());
            date = date.plusDays(1);
        }
    }

    @Test
    void testIsoWeekDropsYear() {
        assertEquals(1, week(LocalDate.of(2025, 1, 1), WeekPolicy.ISO));
        assertEquals(2, week(LocalDate.of(2025, 1, 6), WeekPolicy.ISO));
        // 2024-12-30 belongs to ISO week 2025-W01
        assertEquals(1, week(LocalDate.of(2024, 12, 30), WeekPolicy.ISO));
        assertEquals(2025, classifier.isoYear(LocalDate.of(2024, 12, 30)));
        // Same week number in different ISO years
        assertEquals(week(LocalDate.of(2024, 1, 10), WeekPolicy.ISO), week(LocalDate.of(2025, 1, 8), WeekPolicy.ISO));
    }

    @Test
    void testParseDateAcceptsDatesAndTimestamps() {
        assertEquals(Optional.of(LocalDate.of(2025, 8, 1)), classifier.parseDate("2025-08-01"));
        assertEquals(Optional.of(LocalDate.of(2025, 8, 1)), classifier.parseDate("2025-08-01T09:30:00.000+09:00"));
    }

    @Test
    void testParseDateIsLenientOnBadInput() {
        assertTrue(classifier.parseDate(null).isEmpty());
        assertTrue(classifier.parseDate("").isEmpty());
        assertTrue(classifier.parseDate("   ").isEmpty());
        assertTrue(classifier.parseDate("yesterday").isEmpty());
        assertTrue(classifier.parseDate("2025-13-01").isEmpty());
    }

    @Test
    void testCurrentWeekUsesClock() {
        assertEquals(3, classifier.currentWeek(WeekPolicy.PROJECT, PROJECT));
        assertEquals(29, classifier.currentWeek(WeekPolicy.ISO, PolicyParameters.none()));
    }

    @Test
    void testDisplayDate() {
        assertEquals("Aug 1 (Fri)", classifier.formatDisplayDate(LocalDate.of(2025, 8, 1)));
    }

    @Test
    void testPolicyLookup() {
        assertEquals(WeekPolicy.ISO, WeekPolicy.fromKey("iso"));
        assertEquals(WeekPolicy.MONTHLY, WeekPolicy.fromKey(" Monthly "));
        InvalidPolicyException thrown = assertThrows(InvalidPolicyException.class, () -> WeekPolicy.fromKey("fortnight"));
        assertTrue(thrown.getMessage().contains("project, monthly, iso"));
    }

    private int week(LocalDate date, WeekPolicy policy) {
        return classifier.weekNumber(date, policy, PROJECT);
    }
}
