package com.drivelesson.availability.domain.model;

import com.drivelesson.common.exception.InvalidTimeRangeException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Extra open hours for a single date, added on top of the weekly schedule.
 */
public record DateOverrideEntry(
        Long id,
        Long providerId,
        LocalDate date,
        LocalTime startTime,
        LocalTime endTime,
        boolean active
) {
    public DateOverrideEntry {
        Objects.requireNonNull(date, "date");
        if (startTime == null || endTime == null || !endTime.isAfter(startTime)) {
            throw new InvalidTimeRangeException(startTime, endTime);
        }
    }

    public Interval<LocalTime> toInterval() {
        return Interval.of(startTime, endTime);
    }
}
