package com.drivelesson.booking.domain.model;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Credit issued when a paid booking is cancelled or rescheduled.
 * {@code creditAmount} never exceeds {@code originalAmount}.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class CancellationCredit {
    private final Long id;
    private final Long studentId;
    private final Long originalBookingId;
    private final Long appliedBookingId;
    private final BigDecimal creditAmount;
    private final BigDecimal originalAmount;
    private final CreditStatus status;
    private final CreditReason reason;
    private final String notes;
    private final Instant createdAt;
    private final Instant appliedAt;
}
