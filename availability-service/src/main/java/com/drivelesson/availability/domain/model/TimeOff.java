package com.drivelesson.availability.domain.model;

import com.drivelesson.common.exception.InvalidTimeRangeException;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.Optional;

/**
 * Provider unavailability over an inclusive date range. Without a time range the
 * whole of every covered day is blocked; with one, only that window on each day.
 */
public record TimeOff(
        Long id,
        Long providerId,
        LocalDate startDate,
        LocalDate endDate,
        LocalTime startTime,
        LocalTime endTime,
        String reason,
        String notes
) {
    public TimeOff {
        if (startDate == null || endDate == null || endDate.isBefore(startDate)) {
            throw new InvalidTimeRangeException(startDate, endDate);
        }
        if ((startTime == null) != (endTime == null)) {
            throw new InvalidTimeRangeException("Time off needs both a start and an end time, or neither");
        }
        if (startTime != null && !endTime.isAfter(startTime)) {
            throw new InvalidTimeRangeException(startTime, endTime);
        }
    }

    public static TimeOff fullDays(Long id, Long providerId, LocalDate startDate, LocalDate endDate, String reason) {
        return new TimeOff(id, providerId, startDate, endDate, null, null, reason, null);
    }

    public boolean isFullDay() {
        return startTime == null;
    }

    public boolean covers(LocalDate date) {
        return !date.isBefore(startDate) && !date.isAfter(endDate);
    }

    public Optional<Interval<LocalTime>> window() {
        return isFullDay() ? Optional.empty() : Optional.of(Interval.of(startTime, endTime));
    }
}
