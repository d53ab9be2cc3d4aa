package com.drivelesson.booking.domain.lifecycle;

import com.drivelesson.booking.domain.model.LessonBooking;
import com.drivelesson.booking.events.BookingEvent;

import java.util.List;

/**
 * Result of a reschedule: the cancelled original and the unsaved replacement booking.
 */
public record RescheduleTransition(LessonBooking cancelled, LessonBooking replacement, List<BookingEvent> events) {

    public RescheduleTransition {
        events = List.copyOf(events);
    }
}
