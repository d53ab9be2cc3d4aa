package com.drivelesson.booking.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published when a paid booking is confirmed. Drives the confirmation message to student and provider.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingConfirmedEvent implements BookingEvent {
    private Long bookingId;
    private String reference;
    private Long studentId;
    private Long providerId;
    private Instant lessonStart;
    private int durationMinutes;
    private BigDecimal totalPaid;
    private Instant timestamp;

    @Override
    public String partitionKey() {
        return String.valueOf(bookingId);
    }
}
