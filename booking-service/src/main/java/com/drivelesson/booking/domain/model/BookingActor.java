package com.drivelesson.booking.domain.model;

/**
 * Who asked for a cancellation, reschedule or no-show.
 */
public enum BookingActor {
    STUDENT,
    INSTRUCTOR,
    ADMIN
}
