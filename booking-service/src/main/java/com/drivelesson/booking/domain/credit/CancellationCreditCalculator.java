package com.drivelesson.booking.domain.credit;

import com.drivelesson.booking.domain.model.BookingActor;
import com.drivelesson.booking.domain.model.CancellationCredit;
import com.drivelesson.booking.domain.model.CreditReason;
import com.drivelesson.booking.domain.model.CreditStatus;
import com.drivelesson.booking.events.BookingCancelledEvent;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.util.Optional;

/**
 * Works out the credit owed for a cancelled or rescheduled booking.
 * <ul>
 *   <li>reschedule: 100%</li>
 *   <li>admin cancellation: 100%</li>
 *   <li>student or instructor, 24 hours or more before the lesson: 90%</li>
 *   <li>student or instructor, under 24 hours: 50%</li>
 * </ul>
 * The percentage applies to the value the booking actually held: cash paid plus any
 * credit already applied to it. A booking holding nothing earns nothing.
 */
@Component
public class CancellationCreditCalculator {

    static final BigDecimal FULL = new BigDecimal("1.00");
    static final BigDecimal EARLY = new BigDecimal("0.90");
    static final BigDecimal LATE = new BigDecimal("0.50");
    static final Duration EARLY_NOTICE = Duration.ofHours(24);

    public Optional<CancellationCredit> calculate(BookingCancelledEvent cancellation, CreditReason reason) {
        BigDecimal paid = cancellation.getAmountPaid();
        if (paid == null || paid.signum() <= 0) {
            return Optional.empty();
        }
        Duration notice = Duration.between(cancellation.getTimestamp(), cancellation.getLessonStart());
        BigDecimal percentage = reason == CreditReason.RESCHEDULE
                ? FULL
                : percentageFor(cancellation.getActor(), notice);
        BigDecimal original = paid.setScale(2, RoundingMode.HALF_UP);
        BigDecimal credit = original.multiply(percentage).setScale(2, RoundingMode.HALF_UP);

        return Optional.of(CancellationCredit.builder()
                .studentId(cancellation.getStudentId())
                .originalBookingId(cancellation.getBookingId())
                .creditAmount(credit)
                .originalAmount(original)
                .status(CreditStatus.PENDING)
                .reason(reason)
                .notes(String.format("%s%% credit, %s %s %dh before lesson",
                        percentage.movePointRight(2).stripTrailingZeros().toPlainString(),
                        cancellation.getActor().name().toLowerCase(),
                        reason == CreditReason.RESCHEDULE ? "rescheduled" : "cancelled",
                        notice.toHours()))
                .createdAt(cancellation.getTimestamp())
                .build());
    }

    public BigDecimal percentageFor(BookingActor actor, Duration notice) {
        if (actor == BookingActor.ADMIN) {
            return FULL;
        }
        return notice.compareTo(EARLY_NOTICE) >= 0 ? EARLY : LATE;
    }
}
