package com.drivelesson.booking.domain.lifecycle;

import com.drivelesson.booking.domain.model.BookingActor;

import java.time.Instant;

/**
 * A request to move a booking through its lifecycle. Every command carries the
 * instant it is evaluated at so the state machine never reads a clock.
 */
public interface BookingCommand {

    Instant at();

    /** Verb used in error messages. */
    String verb();

    record ConfirmBooking(Instant at) implements BookingCommand {
        @Override
        public String verb() {
            return "confirm";
        }
    }

    record CancelBooking(BookingActor actor, String reason, Instant at) implements BookingCommand {
        @Override
        public String verb() {
            return "cancel";
        }
    }

    record StartLesson(Instant at) implements BookingCommand {
        @Override
        public String verb() {
            return "start";
        }
    }

    record CompleteBooking(Instant at) implements BookingCommand {
        @Override
        public String verb() {
            return "complete";
        }
    }

    record MarkNoShow(BookingActor actor, Instant at) implements BookingCommand {
        @Override
        public String verb() {
            return "mark as no-show";
        }
    }

    record RescheduleBooking(BookingActor actor, Instant newLessonStart, String reason, Instant at) implements BookingCommand {
        @Override
        public String verb() {
            return "reschedule";
        }
    }
}
