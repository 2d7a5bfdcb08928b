package com.dcruver.weekly.domain;

import com.dcruver.weekly.domain.week.WeekPolicy;
import com.dcruver.weekly.domain.week.WeekRange;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Classification metadata attached to a document by the latest classification run.
 */
@Value
@Builder
public class WeekAssignment {
    WeekPolicy policy;
    LocalDate date;
    String displayDate;
    int weekNumber;
    WeekRange range;

    public Optional<WeekRange> getRangeIfPresent() {
        return Optional.ofNullable(range);
    }
}
