package com.drivelesson.availability.domain.service;

import com.drivelesson.availability.config.SchedulingProperties;
import com.drivelesson.availability.domain.model.IntervalSet;
import com.drivelesson.common.exception.PolicyViolationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;

/**
 * Turns open intervals into fixed-length lesson slots separated by the configured buffer.
 */
@Component
@RequiredArgsConstructor
public class SlotGenerator {

    private final SchedulingProperties properties;

    public SlotSequence generate(LocalDate date, IntervalSet<LocalTime> intervals, int durationMinutes) {
        if (durationMinutes <= 0) {
            throw new PolicyViolationException("Lesson duration must be positive, got " + durationMinutes);
        }
        return new SlotSequence(date, intervals, durationMinutes, properties.getBufferMinutes(), properties.zone());
    }
}
