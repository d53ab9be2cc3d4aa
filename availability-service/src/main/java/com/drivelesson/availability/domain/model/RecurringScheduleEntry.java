package com.drivelesson.availability.domain.model;

import com.drivelesson.common.exception.InvalidTimeRangeException;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.util.Objects;

/**
 * Weekly open hours of a provider. Several entries for the same weekday are
 * independent open intervals.
 */
public record RecurringScheduleEntry(
        Long id,
        Long providerId,
        DayOfWeek dayOfWeek,
        LocalTime startTime,
        LocalTime endTime,
        boolean active
) {
    public RecurringScheduleEntry {
        Objects.requireNonNull(dayOfWeek, "dayOfWeek");
        if (startTime == null || endTime == null || !endTime.isAfter(startTime)) {
            throw new InvalidTimeRangeException(startTime, endTime);
        }
    }

    public Interval<LocalTime> toInterval() {
        return Interval.of(startTime, endTime);
    }
}
