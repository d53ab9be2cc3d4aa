package com.drivelesson.availability.domain.repository;

import com.drivelesson.availability.domain.model.DateOverrideEntry;
import com.drivelesson.availability.domain.model.ProviderProfile;
import com.drivelesson.availability.domain.model.RecurringScheduleEntry;
import com.drivelesson.availability.domain.model.TimeOff;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

/**
 * Read access to provider schedule data. Implemented by the storage layer.
 */
public interface AvailabilityRepository {

    Optional<ProviderProfile> findProvider(Long providerId);

    List<RecurringScheduleEntry> getRecurringSchedule(Long providerId, DayOfWeek dayOfWeek);

    List<DateOverrideEntry> getDateOverrides(Long providerId, LocalDate date);

    /** Time-off rows whose date range includes {@code date}. */
    List<TimeOff> getUnavailability(Long providerId, LocalDate date);
}
