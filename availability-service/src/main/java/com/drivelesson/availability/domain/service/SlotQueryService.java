package com.drivelesson.availability.domain.service;

import com.drivelesson.availability.config.SchedulingProperties;
import com.drivelesson.availability.domain.model.BookedLesson;
import com.drivelesson.availability.domain.model.DailyAvailability;
import com.drivelesson.availability.domain.model.IntervalSet;
import com.drivelesson.availability.domain.model.LessonSlot;
import com.drivelesson.availability.domain.model.ProviderProfile;
import com.drivelesson.availability.domain.model.SlotMode;
import com.drivelesson.availability.domain.repository.AvailabilityRepository;
import com.drivelesson.availability.domain.repository.BookingCalendarRepository;
import com.drivelesson.common.exception.InvalidTimeRangeException;
import com.drivelesson.common.exception.PolicyViolationException;
import com.drivelesson.common.exception.ResourceNotFoundException;
import com.drivelesson.common.exception.SlotUnavailableException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for slot listings and for checking that a requested lesson time
 * can still be booked.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SlotQueryService {

    private final AvailabilityRepository availabilityRepository;
    private final BookingCalendarRepository bookingCalendarRepository;
    private final AvailabilityAggregator availabilityAggregator;
    private final SlotGenerator slotGenerator;
    private final ConflictResolver conflictResolver;
    private final SchedulingProperties properties;

    /**
     * Slots per date in {@code [startDate, endDate]}. Dates without any slot are left out.
     * A provider who is not accepting bookings gets an empty listing.
     */
    public List<DailyAvailability> listAvailableSlots(Long providerId, LocalDate startDate, LocalDate endDate,
                                                      int durationMinutes, boolean showBooked) {
        validateDuration(durationMinutes);
        if (endDate.isBefore(startDate)) {
            throw new InvalidTimeRangeException(startDate, endDate);
        }
        long days = ChronoUnit.DAYS.between(startDate, endDate);
        if (days > properties.getMaxLookaheadDays()) {
            throw new PolicyViolationException(String.format(
                    "Date range of %d days exceeds the maximum of %d", days, properties.getMaxLookaheadDays()));
        }

        ProviderProfile provider = requireProvider(providerId);
        if (!provider.acceptingBookings()) {
            log.info("Provider {} is not accepting bookings, returning no slots", providerId);
            return List.of();
        }

        List<BookedLesson> bookings = loadBookings(providerId, startDate, endDate);
        SlotMode mode = showBooked ? SlotMode.SHOW_BOOKED : SlotMode.AVAILABLE_ONLY;

        List<DailyAvailability> result = new ArrayList<>();
        for (LocalDate date = startDate; !date.isAfter(endDate); date = date.plusDays(1)) {
            IntervalSet<LocalTime> intervals = availabilityAggregator.openIntervals(providerId, date);
            if (intervals.isEmpty()) {
                continue;
            }
            SlotSequence candidates = slotGenerator.generate(date, intervals, durationMinutes);
            List<LessonSlot> slots = conflictResolver.resolve(candidates, bookings, mode);
            if (!slots.isEmpty()) {
                result.add(new DailyAvailability(date, slots));
            }
        }
        log.debug("Provider {} has slots on {} date(s) between {} and {}", providerId, result.size(), startDate, endDate);
        return result;
    }

    /**
     * Verifies a lesson starting at {@code start} fits inside an open interval and does not
     * clash with an active booking. {@code excludeBookingId} lets a reschedule ignore the
     * booking being moved.
     *
     * @throws SlotUnavailableException if the time cannot be booked
     */
    public void ensureBookable(Long providerId, Instant start, int durationMinutes, Long excludeBookingId) {
        validateDuration(durationMinutes);
        ProviderProfile provider = requireProvider(providerId);
        if (!provider.acceptingBookings()) {
            throw new SlotUnavailableException("Provider " + providerId + " is not accepting bookings");
        }

        ZonedDateTime localStart = start.atZone(properties.zone());
        ZonedDateTime localEnd = localStart.plusMinutes(durationMinutes);
        if (!localEnd.toLocalDate().equals(localStart.toLocalDate())) {
            throw new SlotUnavailableException("Lesson at " + localStart + " runs past midnight");
        }
        LocalDate date = localStart.toLocalDate();
        IntervalSet<LocalTime> intervals = availabilityAggregator.openIntervals(providerId, date);
        if (!intervals.covers(localStart.toLocalTime(), localEnd.toLocalTime())) {
            throw new SlotUnavailableException(String.format(
                    "Provider %s is not available at %s for %d minutes", providerId, localStart, durationMinutes));
        }

        Instant end = localEnd.toInstant();
        List<BookedLesson> bookings = loadBookings(providerId, date, date);
        if (conflictResolver.clashes(start, end, bookings, excludeBookingId)) {
            throw new SlotUnavailableException(String.format(
                    "Provider %s already has a booking overlapping %s", providerId, localStart));
        }
    }

    // Starts one maximum lesson length early so bookings spilling over midnight are seen.
    private List<BookedLesson> loadBookings(Long providerId, LocalDate startDate, LocalDate endDate) {
        ZoneId zone = properties.zone();
        Instant from = startDate.atStartOfDay(zone).minusMinutes(properties.getMaxDurationMinutes()).toInstant();
        Instant to = endDate.plusDays(1).atStartOfDay(zone).toInstant();
        return bookingCalendarRepository.getActiveBookings(providerId, from, to);
    }

    private ProviderProfile requireProvider(Long providerId) {
        return availabilityRepository.findProvider(providerId)
                .orElseThrow(() -> new ResourceNotFoundException("Provider", providerId));
    }

    private void validateDuration(int durationMinutes) {
        if (durationMinutes < properties.getMinDurationMinutes() || durationMinutes > properties.getMaxDurationMinutes()) {
            throw new PolicyViolationException(String.format("Lesson duration must be between %d and %d minutes, got %d",
                    properties.getMinDurationMinutes(), properties.getMaxDurationMinutes(), durationMinutes));
        }
    }
}
