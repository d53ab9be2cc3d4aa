package com.drivelesson.availability.domain.model;

import java.time.LocalDate;
import java.time.ZonedDateTime;

public record LessonSlot(LocalDate date, ZonedDateTime start, ZonedDateTime end, int durationMinutes, boolean booked) {

    public LessonSlot markBooked() {
        return booked ? this : new LessonSlot(date, start, end, durationMinutes, true);
    }
}
