package com.drivelesson.booking.domain.model;

import com.drivelesson.common.model.BookingStatus;

import java.util.Set;

/**
 * Filter for booking listings. Student and provider are optional but at least one is required;
 * an empty status set means every status.
 */
public record BookingQuery(Long studentId, Long providerId, Set<BookingStatus> statuses) {

    public BookingQuery {
        statuses = statuses == null ? Set.of() : Set.copyOf(statuses);
    }

    public static BookingQuery forStudent(Long studentId) {
        return new BookingQuery(studentId, null, Set.of());
    }

    public static BookingQuery forProvider(Long providerId) {
        return new BookingQuery(null, providerId, Set.of());
    }

    public boolean matches(LessonBooking booking) {
        return (studentId == null || studentId.equals(booking.getStudentId()))
                && (providerId == null || providerId.equals(booking.getProviderId()))
                && (statuses.isEmpty() || statuses.contains(booking.getStatus()));
    }
}
