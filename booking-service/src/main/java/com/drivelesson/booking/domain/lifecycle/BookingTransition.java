package com.drivelesson.booking.domain.lifecycle;

import com.drivelesson.booking.domain.model.LessonBooking;
import com.drivelesson.booking.events.BookingEvent;

import java.util.List;

/**
 * New booking state plus the events the change produced.
 */
public record BookingTransition(LessonBooking booking, List<BookingEvent> events) {

    public BookingTransition {
        events = List.copyOf(events);
    }
}
