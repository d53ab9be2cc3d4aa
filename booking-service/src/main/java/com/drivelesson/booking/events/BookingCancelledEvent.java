package com.drivelesson.booking.events;

import com.drivelesson.booking.domain.model.BookingActor;
import com.drivelesson.booking.domain.model.PaymentStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Published when a booking is cancelled. Carries what the credit calculator needs:
 * who cancelled, when, the lesson start and what was paid.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BookingCancelledEvent implements BookingEvent {
    private Long bookingId;
    private String reference;
    private Long studentId;
    private Long providerId;
    private Instant lessonStart;
    private BookingActor actor;
    private String reason;
    private PaymentStatus paymentStatus;
    /** Cash plus applied credit held by the booking when it was cancelled. */
    private BigDecimal amountPaid;
    private Instant timestamp;

    @Override
    public String partitionKey() {
        return String.valueOf(bookingId);
    }
}
