package com.drivelesson.availability.domain.model;

import java.time.LocalDate;
import java.util.List;

public record DailyAvailability(LocalDate date, List<LessonSlot> slots) {

    public DailyAvailability {
        slots = List.copyOf(slots);
    }
}
