package com.drivelesson.booking.domain.model;

import com.drivelesson.common.model.BookingStatus;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A student's lesson with one provider. Instances are immutable: every change
 * produces a copy through {@link #toBuilder()}. Bookings are never deleted, a
 * finished or abandoned booking keeps its terminal status.
 */
@Getter
@ToString
@Builder(toBuilder = true)
public class LessonBooking {
    private final Long id;
    private final String reference;
    private final Long studentId;
    private final Long providerId;
    private final Instant lessonStart;
    private final int durationMinutes;

    @Builder.Default
    private final BookingStatus status = BookingStatus.PENDING;
    @Builder.Default
    private final PaymentStatus paymentStatus = PaymentStatus.PENDING;
    private final String paymentReference;

    private final BigDecimal amount;
    @Builder.Default
    private final BigDecimal bookingFee = BigDecimal.ZERO;
    /** Credit consumed by this booking at checkout or reschedule. */
    @Builder.Default
    private final BigDecimal creditAppliedAmount = BigDecimal.ZERO;

    private final BookingActor cancelledBy;
    private final String cancellationReason;
    private final Instant cancelledAt;
    private final BigDecimal cancellationCreditAmount;
    private final BigDecimal cancellationFee;
    private final BigDecimal refundAmount;

    private final int rebookingCount;
    /** Lesson start before the first reschedule. Set once. */
    private final Instant originalLessonStart;
    private final Long rescheduledFromBookingId;

    private final boolean reminderSent;
    private final boolean providerReminderSent;
    private final boolean dailySummarySent;

    private final Instant createdAt;
    private final Instant completedAt;

    public Instant getLessonEnd() {
        return lessonStart.plusSeconds(durationMinutes * 60L);
    }

    /** Lesson amount plus booking fee. */
    public BigDecimal getTotalPaid() {
        BigDecimal fee = bookingFee == null ? BigDecimal.ZERO : bookingFee;
        return amount.add(fee);
    }

    /**
     * Value the student has actually put into this booking: the whole total once it is
     * PAID, otherwise only the credit already applied to it.
     */
    public BigDecimal getAmountPaid() {
        if (paymentStatus == PaymentStatus.PAID) {
            return getTotalPaid();
        }
        if (paymentStatus == PaymentStatus.REFUNDED || creditAppliedAmount == null) {
            return BigDecimal.ZERO;
        }
        return creditAppliedAmount;
    }

    public boolean isActive() {
        return status.isActive();
    }
}
