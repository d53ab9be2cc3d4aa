package com.drivelesson.availability.domain.repository;

import com.drivelesson.availability.domain.model.BookedLesson;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of a provider's bookings that start in {@code [from, to)}.
 * Implementations should return PENDING and CONFIRMED bookings; callers still
 * filter on status.
 */
public interface BookingCalendarRepository {

    List<BookedLesson> getActiveBookings(Long providerId, Instant from, Instant to);
}
