package com.drivelesson.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

/**
 * One provider's lessons for the day, sent early in the morning.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DailySummaryDueEvent implements BookingEvent {
    private Long providerId;
    private LocalDate date;
    private List<Long> bookingIds;
    private List<Instant> lessonStarts;
    private Instant timestamp;

    @Override
    public String partitionKey() {
        return "provider-" + providerId;
    }
}
