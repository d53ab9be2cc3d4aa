package com.drivelesson.booking.domain.model;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * What a student paid for: a lesson with a provider at a given time.
 */
public record BookingIntent(
        @NotNull Long studentId,
        @NotNull Long providerId,
        @NotNull Instant lessonStart,
        @Positive int durationMinutes,
        @NotNull @PositiveOrZero BigDecimal amount,
        @PositiveOrZero BigDecimal bookingFee
) {
}
