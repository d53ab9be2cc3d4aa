package com.drivelesson.availability.domain.service;

import com.drivelesson.availability.domain.model.DateOverrideEntry;
import com.drivelesson.availability.domain.model.Interval;
import com.drivelesson.availability.domain.model.IntervalSet;
import com.drivelesson.availability.domain.model.RecurringScheduleEntry;
import com.drivelesson.availability.domain.model.TimeOff;
import com.drivelesson.availability.domain.repository.AvailabilityRepository;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AvailabilityAggregatorTest {

    private static final Long PROVIDER_ID = 7L;
    private static final LocalDate MONDAY = LocalDate.of(2026, 3, 2);

    @Mock
    private AvailabilityRepository availabilityRepository;

    @InjectMocks
    private AvailabilityAggregator aggregator;

    private static RecurringScheduleEntry weekly(String start, String end, boolean active) {
        return new RecurringScheduleEntry(1L, PROVIDER_ID, DayOfWeek.MONDAY,
                LocalTime.parse(start), LocalTime.parse(end), active);
    }

    private static Interval<LocalTime> span(String start, String end) {
        return Interval.of(LocalTime.parse(start), LocalTime.parse(end));
    }

    @Test
    @DisplayName("active weekly entries and date overrides are combined, inactive ones ignored")
    void combinesScheduleAndOverrides() {
        // given
        when(availabilityRepository.getRecurringSchedule(PROVIDER_ID, DayOfWeek.MONDAY))
                .thenReturn(List.of(weekly("13:00", "16:00", true), weekly("08:00", "12:00", true), weekly("18:00", "20:00", false)));
        when(availabilityRepository.getDateOverrides(PROVIDER_ID, MONDAY))
                .thenReturn(List.of(new DateOverrideEntry(2L, PROVIDER_ID, MONDAY, LocalTime.of(6, 0), LocalTime.of(7, 0), true)));
        when(availabilityRepository.getUnavailability(PROVIDER_ID, MONDAY)).thenReturn(List.of());

        // when
        IntervalSet<LocalTime> result = aggregator.openIntervals(PROVIDER_ID, MONDAY);

        // then
        assertThat(result.asList()).containsExactly(span("06:00", "07:00"), span("08:00", "12:00"), span("13:00", "16:00"));
    }

    @Test
    @DisplayName("full-day time off empties the date")
    void fullDayTimeOff_returnsEmpty() {
        // given
        when(availabilityRepository.getRecurringSchedule(PROVIDER_ID, DayOfWeek.MONDAY))
                .thenReturn(List.of(weekly("08:00", "12:00", true)));
        when(availabilityRepository.getDateOverrides(PROVIDER_ID, MONDAY)).thenReturn(List.of());
        when(availabilityRepository.getUnavailability(PROVIDER_ID, MONDAY))
                .thenReturn(List.of(TimeOff.fullDays(3L, PROVIDER_ID, MONDAY.minusDays(1), MONDAY.plusDays(1), "leave")));

        // when / then
        assertThat(aggregator.openIntervals(PROVIDER_ID, MONDAY).isEmpty()).isTrue();
    }

    @Test
    @DisplayName("timed time off is cut out of every open interval")
    void timedTimeOff_isSubtracted() {
        // given
        when(availabilityRepository.getRecurringSchedule(PROVIDER_ID, DayOfWeek.MONDAY))
                .thenReturn(List.of(weekly("08:00", "12:00", true)));
        when(availabilityRepository.getDateOverrides(PROVIDER_ID, MONDAY)).thenReturn(List.of());
        when(availabilityRepository.getUnavailability(PROVIDER_ID, MONDAY)).thenReturn(List.of(
                new TimeOff(3L, PROVIDER_ID, MONDAY, MONDAY, LocalTime.of(9, 0), LocalTime.of(10, 0), "dentist", null)));

        // when
        IntervalSet<LocalTime> result = aggregator.openIntervals(PROVIDER_ID, MONDAY);

        // then
        assertThat(result.asList()).containsExactly(span("08:00", "09:00"), span("10:00", "12:00"));
    }

    @Test
    @DisplayName("no schedule entries gives an empty result without consulting time off")
    void noEntries_returnsEmpty() {
        // given
        when(availabilityRepository.getRecurringSchedule(PROVIDER_ID, DayOfWeek.MONDAY)).thenReturn(List.of());
        when(availabilityRepository.getDateOverrides(PROVIDER_ID, MONDAY)).thenReturn(List.of());
        lenient().when(availabilityRepository.getUnavailability(PROVIDER_ID, MONDAY)).thenReturn(List.of());

        // when / then
        assertThat(aggregator.openIntervals(PROVIDER_ID, MONDAY).isEmpty()).isTrue();
    }
}
