package com.drivelesson.booking.domain.lifecycle;

import com.drivelesson.booking.domain.lifecycle.BookingCommand.CancelBooking;
import com.drivelesson.booking.domain.lifecycle.BookingCommand.CompleteBooking;
import com.drivelesson.booking.domain.lifecycle.BookingCommand.ConfirmBooking;
import com.drivelesson.booking.domain.lifecycle.BookingCommand.MarkNoShow;
import com.drivelesson.booking.domain.lifecycle.BookingCommand.RescheduleBooking;
import com.drivelesson.booking.domain.lifecycle.BookingCommand.StartLesson;
import com.drivelesson.booking.domain.model.BookingActor;
import com.drivelesson.booking.domain.model.LessonBooking;
import com.drivelesson.booking.domain.model.PaymentStatus;
import com.drivelesson.booking.events.BookingCancelledEvent;
import com.drivelesson.booking.events.BookingConfirmedEvent;
import com.drivelesson.booking.events.LessonStatusChangedEvent;
import com.drivelesson.common.exception.InvalidStateTransitionException;
import com.drivelesson.common.exception.PolicyViolationException;
import com.drivelesson.common.model.BookingStatus;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;

/**
 * Booking state machine.
 * <pre>
 * PENDING -> CONFIRMED -> IN_PROGRESS -> COMPLETED
 * PENDING | CONFIRMED -> CANCELLED
 * PENDING | CONFIRMED -> NO_SHOW
 * </pre>
 * Pure: takes a booking and a command, returns the new booking and its events.
 * Storage and publishing are the caller's job.
 */
@Component
public class BookingLifecycle {

    static final String RESCHEDULE_REASON = "Rescheduled";

    public BookingTransition apply(LessonBooking booking, BookingCommand command) {
        if (command instanceof ConfirmBooking confirm) {
            return confirm(booking, confirm);
        }
        if (command instanceof CancelBooking cancel) {
            return cancel(booking, cancel);
        }
        if (command instanceof StartLesson start) {
            return start(booking, start);
        }
        if (command instanceof CompleteBooking complete) {
            return complete(booking, complete);
        }
        if (command instanceof MarkNoShow noShow) {
            return markNoShow(booking, noShow);
        }
        throw new IllegalArgumentException("Unsupported booking command " + command.getClass().getSimpleName());
    }

    /**
     * Cancels {@code booking} and drafts its replacement at the new time. The replacement
     * keeps amount, fee and duration, counts one more rebooking and remembers the very
     * first lesson start.
     */
    public RescheduleTransition reschedule(LessonBooking booking, RescheduleBooking command) {
        String reason = command.reason() == null || command.reason().isBlank()
                ? RESCHEDULE_REASON
                : RESCHEDULE_REASON + ": " + command.reason();
        BookingTransition cancelled = cancel(booking, new CancelBooking(command.actor(), reason, command.at()));

        LessonBooking replacement = LessonBooking.builder()
                .studentId(booking.getStudentId())
                .providerId(booking.getProviderId())
                .lessonStart(command.newLessonStart())
                .durationMinutes(booking.getDurationMinutes())
                .status(BookingStatus.PENDING)
                .paymentStatus(PaymentStatus.PENDING)
                .amount(booking.getAmount())
                .bookingFee(booking.getBookingFee())
                .creditAppliedAmount(BigDecimal.ZERO)
                .rebookingCount(booking.getRebookingCount() + 1)
                .originalLessonStart(booking.getOriginalLessonStart() != null
                        ? booking.getOriginalLessonStart()
                        : booking.getLessonStart())
                .rescheduledFromBookingId(booking.getId())
                .createdAt(command.at())
                .build();
        return new RescheduleTransition(cancelled.booking(), replacement, cancelled.events());
    }

    private BookingTransition confirm(LessonBooking booking, ConfirmBooking command) {
        requireStatus(booking, command, BookingStatus.PENDING);
        if (booking.getPaymentStatus() != PaymentStatus.PAID) {
            throw new InvalidStateTransitionException(String.format(
                    "Cannot confirm booking %s before payment, payment status is %s",
                    booking.getId(), booking.getPaymentStatus()));
        }
        LessonBooking confirmed = booking.toBuilder().status(BookingStatus.CONFIRMED).build();
        BookingConfirmedEvent event = BookingConfirmedEvent.builder()
                .bookingId(confirmed.getId())
                .reference(confirmed.getReference())
                .studentId(confirmed.getStudentId())
                .providerId(confirmed.getProviderId())
                .lessonStart(confirmed.getLessonStart())
                .durationMinutes(confirmed.getDurationMinutes())
                .totalPaid(confirmed.getTotalPaid())
                .timestamp(command.at())
                .build();
        return new BookingTransition(confirmed, List.of(event));
    }

    private BookingTransition cancel(LessonBooking booking, CancelBooking command) {
        requireStatus(booking, command, BookingStatus.PENDING, BookingStatus.CONFIRMED);
        LessonBooking cancelled = booking.toBuilder()
                .status(BookingStatus.CANCELLED)
                .cancelledBy(command.actor())
                .cancellationReason(command.reason())
                .cancelledAt(command.at())
                .build();
        BookingCancelledEvent event = BookingCancelledEvent.builder()
                .bookingId(cancelled.getId())
                .reference(cancelled.getReference())
                .studentId(cancelled.getStudentId())
                .providerId(cancelled.getProviderId())
                .lessonStart(cancelled.getLessonStart())
                .actor(command.actor())
                .reason(command.reason())
                .paymentStatus(cancelled.getPaymentStatus())
                .amountPaid(cancelled.getAmountPaid())
                .timestamp(command.at())
                .build();
        return new BookingTransition(cancelled, List.of(event));
    }

    private BookingTransition start(LessonBooking booking, StartLesson command) {
        requireStatus(booking, command, BookingStatus.CONFIRMED);
        requireStarted(booking, command);
        return statusChange(booking, booking.toBuilder().status(BookingStatus.IN_PROGRESS).build(), command);
    }

    private BookingTransition complete(LessonBooking booking, CompleteBooking command) {
        requireStatus(booking, command, BookingStatus.CONFIRMED, BookingStatus.IN_PROGRESS);
        requireStarted(booking, command);
        LessonBooking completed = booking.toBuilder()
                .status(BookingStatus.COMPLETED)
                .completedAt(command.at())
                .build();
        return statusChange(booking, completed, command);
    }

    private BookingTransition markNoShow(LessonBooking booking, MarkNoShow command) {
        if (command.actor() == BookingActor.STUDENT) {
            throw new PolicyViolationException("Only the instructor or an admin can mark booking "
                    + booking.getId() + " as a no-show");
        }
        requireStatus(booking, command, BookingStatus.PENDING, BookingStatus.CONFIRMED);
        requireStarted(booking, command);
        return statusChange(booking, booking.toBuilder().status(BookingStatus.NO_SHOW).build(), command);
    }

    private BookingTransition statusChange(LessonBooking before, LessonBooking after, BookingCommand command) {
        LessonStatusChangedEvent event = LessonStatusChangedEvent.builder()
                .bookingId(after.getId())
                .studentId(after.getStudentId())
                .providerId(after.getProviderId())
                .previousStatus(before.getStatus())
                .status(after.getStatus())
                .timestamp(command.at())
                .build();
        return new BookingTransition(after, List.of(event));
    }

    private void requireStatus(LessonBooking booking, BookingCommand command, BookingStatus... allowed) {
        for (BookingStatus status : allowed) {
            if (booking.getStatus() == status) {
                return;
            }
        }
        throw new InvalidStateTransitionException(booking.getId(), booking.getStatus(), command.verb());
    }

    private void requireStarted(LessonBooking booking, BookingCommand command) {
        if (command.at().isBefore(booking.getLessonStart())) {
            throw new InvalidStateTransitionException(String.format(
                    "Cannot %s booking %s before the lesson starts at %s",
                    command.verb(), booking.getId(), booking.getLessonStart()));
        }
    }
}
