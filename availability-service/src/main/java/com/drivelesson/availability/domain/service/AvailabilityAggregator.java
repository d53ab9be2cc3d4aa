package com.drivelesson.availability.domain.service;

import com.drivelesson.availability.domain.model.DateOverrideEntry;
import com.drivelesson.availability.domain.model.Interval;
import com.drivelesson.availability.domain.model.IntervalSet;
import com.drivelesson.availability.domain.model.RecurringScheduleEntry;
import com.drivelesson.availability.domain.model.TimeOff;
import com.drivelesson.availability.domain.repository.AvailabilityRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Combines a provider's weekly schedule, date overrides and time off into the
 * open intervals for one calendar date.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AvailabilityAggregator {

    private final AvailabilityRepository availabilityRepository;

    /**
     * Open intervals for {@code date}, ordered by start. Empty when the provider has
     * nothing scheduled or a full-day time off covers the date.
     */
    public IntervalSet<LocalTime> openIntervals(Long providerId, LocalDate date) {
        List<Interval<LocalTime>> open = new ArrayList<>();
        for (RecurringScheduleEntry entry : availabilityRepository.getRecurringSchedule(providerId, date.getDayOfWeek())) {
            if (entry.active() && entry.dayOfWeek() == date.getDayOfWeek()) {
                open.add(entry.toInterval());
            }
        }
        List<Interval<LocalTime>> overrides = new ArrayList<>();
        for (DateOverrideEntry entry : availabilityRepository.getDateOverrides(providerId, date)) {
            if (entry.active() && entry.date().equals(date)) {
                overrides.add(entry.toInterval());
            }
        }
        IntervalSet<LocalTime> intervals = IntervalSet.of(open).union(IntervalSet.of(overrides));
        if (intervals.isEmpty()) {
            return intervals;
        }

        for (TimeOff timeOff : availabilityRepository.getUnavailability(providerId, date)) {
            if (!timeOff.covers(date)) {
                continue;
            }
            if (timeOff.isFullDay()) {
                log.debug("Provider {} blocked all day on {} (time off {})", providerId, date, timeOff.id());
                return IntervalSet.empty();
            }
            intervals = intervals.subtract(timeOff.window().orElseThrow());
        }
        log.debug("Provider {} open intervals on {}: {}", providerId, date, intervals);
        return intervals;
    }
}
