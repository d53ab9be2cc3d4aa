package com.drivelesson.booking.domain.service;

import com.drivelesson.booking.domain.credit.CreditApplication;
import com.drivelesson.booking.domain.credit.CreditService;
import com.drivelesson.booking.domain.model.BookingIntent;
import com.drivelesson.booking.domain.model.LessonBooking;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;

/**
 * Callbacks from the payment gateway integration.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class PaymentSettlementService {

    private final BookingService bookingService;
    private final CreditService creditService;
    private final Clock clock;

    /**
     * Lesson fee collected: create the booking, use the student's available credit
     * against it, then release credits still waiting for this payment.
     */
    public LessonBooking onPaymentSucceeded(@Valid BookingIntent intent, String paymentReference) {
        log.info("Payment {} succeeded for student ID: {}", paymentReference, intent.studentId());
        LessonBooking booking = bookingService.createBooking(intent, paymentReference);

        CreditApplication application = creditService.applyAvailableCredits(
                booking.getStudentId(), booking.getId(), booking.getTotalPaid(), clock.instant());
        if (!application.isEmpty()) {
            booking = bookingService.recordCreditApplied(booking, application.amountCovered());
        }
        creditService.releasePendingCredits(booking.getStudentId());
        return booking;
    }

    /** Outstanding balance of a rescheduled booking collected. */
    public LessonBooking onBalancePaid(Long bookingId, String paymentReference) {
        log.info("Payment {} settles balance of booking ID: {}", paymentReference, bookingId);
        return bookingService.markBalancePaid(bookingId, paymentReference);
    }

    /** The gateway reports the student's pending credit as usable. */
    public int onCreditAvailable(Long studentId) {
        return creditService.releasePendingCredits(studentId);
    }
}
