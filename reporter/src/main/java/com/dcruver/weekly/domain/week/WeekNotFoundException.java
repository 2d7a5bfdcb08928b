package com.dcruver.weekly.domain.week;

import lombok.Getter;

/**
 * Raised when querying a week bucket that the last classification run did not populate.
 */
@Getter
public class WeekNotFoundException extends RuntimeException {

    private final int weekNumber;

    public WeekNotFoundException(int weekNumber) {
        super("No documents in week " + weekNumber);
        this.weekNumber = weekNumber;
    }
}
