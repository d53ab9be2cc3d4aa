package com.drivelesson.availability.domain.model;

import com.drivelesson.common.model.BookingStatus;

import java.time.Instant;

/**
 * Minimal view of an existing booking used for conflict checks.
 */
public record BookedLesson(Long bookingId, Long providerId, Instant start, Instant end, BookingStatus status) {

    public boolean isActive() {
        return status != null && status.isActive();
    }

    public boolean overlaps(Instant slotStart, Instant slotEnd) {
        return Interval.overlaps(start, end, slotStart, slotEnd);
    }
}
