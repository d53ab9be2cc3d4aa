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
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.math.BigDecimal;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookingLifecycleTest {

    private static final Instant LESSON_START = Instant.parse("2026-03-02T07:15:00Z");
    private static final Instant BEFORE_START = LESSON_START.minusSeconds(3600);
    private static final Instant AFTER_START = LESSON_START.plusSeconds(600);

    private final BookingLifecycle lifecycle = new BookingLifecycle();

    private static LessonBooking booking(BookingStatus status, PaymentStatus paymentStatus) {
        return LessonBooking.builder()
                .id(42L)
                .reference("BK1A2B3C4D")
                .studentId(100L)
                .providerId(7L)
                .lessonStart(LESSON_START)
                .durationMinutes(60)
                .status(status)
                .paymentStatus(paymentStatus)
                .amount(new BigDecimal("350.00"))
                .bookingFee(new BigDecimal("20.00"))
                .build();
    }

    @Test
    @DisplayName("confirm moves a paid pending booking to confirmed and emits an event")
    void confirm_paidPending() {
        // when
        BookingTransition transition = lifecycle.apply(booking(BookingStatus.PENDING, PaymentStatus.PAID),
                new ConfirmBooking(BEFORE_START));

        // then
        assertThat(transition.booking().getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        assertThat(transition.events()).singleElement().isInstanceOf(BookingConfirmedEvent.class);
        BookingConfirmedEvent event = (BookingConfirmedEvent) transition.events().get(0);
        assertThat(event.getTotalPaid()).isEqualByComparingTo("370.00");
    }

    @ParameterizedTest
    @EnumSource(value = PaymentStatus.class, names = {"PENDING", "FAILED", "REFUNDED"})
    @DisplayName("confirm without payment always fails")
    void confirm_unpaidFails(PaymentStatus paymentStatus) {
        assertThatThrownBy(() -> lifecycle.apply(booking(BookingStatus.PENDING, paymentStatus),
                new ConfirmBooking(BEFORE_START)))
                .isInstanceOf(InvalidStateTransitionException.class)
                .extracting("errorCode").isEqualTo("INVALID_STATE_TRANSITION");
    }

    @Test
    @DisplayName("confirm from confirmed is rejected")
    void confirm_twiceFails() {
        assertThatThrownBy(() -> lifecycle.apply(booking(BookingStatus.CONFIRMED, PaymentStatus.PAID),
                new ConfirmBooking(BEFORE_START)))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("Cannot confirm booking 42 in status CONFIRMED");
    }

    @Test
    @DisplayName("cancel records actor, reason and time and leaves the input untouched")
    void cancel_recordsMetadata() {
        // given
        LessonBooking original = booking(BookingStatus.CONFIRMED, PaymentStatus.PAID);

        // when
        BookingTransition transition = lifecycle.apply(original,
                new CancelBooking(BookingActor.STUDENT, "Car trouble", BEFORE_START));

        // then
        LessonBooking cancelled = transition.booking();
        assertThat(cancelled.getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(cancelled.getCancelledBy()).isEqualTo(BookingActor.STUDENT);
        assertThat(cancelled.getCancellationReason()).isEqualTo("Car trouble");
        assertThat(cancelled.getCancelledAt()).isEqualTo(BEFORE_START);
        assertThat(original.getStatus()).isEqualTo(BookingStatus.CONFIRMED);
        BookingCancelledEvent event = (BookingCancelledEvent) transition.events().get(0);
        assertThat(event.getActor()).isEqualTo(BookingActor.STUDENT);
        assertThat(event.getPaymentStatus()).isEqualTo(PaymentStatus.PAID);
        assertThat(event.getAmountPaid()).isEqualByComparingTo("370.00");
    }

    @Test
    @DisplayName("cancelling a booking part paid by credit reports the credit as paid")
    void cancel_partPaidByCredit() {
        // given
        LessonBooking partPaid = booking(BookingStatus.PENDING, PaymentStatus.PENDING).toBuilder()
                .creditAppliedAmount(new BigDecimal("50.00"))
                .build();

        // when
        BookingTransition transition = lifecycle.apply(partPaid,
                new CancelBooking(BookingActor.STUDENT, null, BEFORE_START));

        // then
        BookingCancelledEvent event = (BookingCancelledEvent) transition.events().get(0);
        assertThat(event.getPaymentStatus()).isEqualTo(PaymentStatus.PENDING);
        assertThat(event.getAmountPaid()).isEqualByComparingTo("50.00");
    }

    @ParameterizedTest
    @EnumSource(value = BookingStatus.class, names = {"IN_PROGRESS", "COMPLETED", "CANCELLED", "NO_SHOW"})
    @DisplayName("cancel is only allowed from pending or confirmed")
    void cancel_fromOtherStatesFails(BookingStatus status) {
        assertThatThrownBy(() -> lifecycle.apply(booking(status, PaymentStatus.PAID),
                new CancelBooking(BookingActor.ADMIN, "cleanup", BEFORE_START)))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("complete before the lesson starts always fails")
    void complete_beforeStartFails() {
        assertThatThrownBy(() -> lifecycle.apply(booking(BookingStatus.CONFIRMED, PaymentStatus.PAID),
                new CompleteBooking(BEFORE_START)))
                .isInstanceOf(InvalidStateTransitionException.class)
                .hasMessageContaining("before the lesson starts");
    }

    @Test
    @DisplayName("start then complete sets the completion timestamp")
    void startThenComplete() {
        // given
        LessonBooking confirmed = booking(BookingStatus.CONFIRMED, PaymentStatus.PAID);

        // when
        LessonBooking started = lifecycle.apply(confirmed, new StartLesson(LESSON_START)).booking();
        BookingTransition completed = lifecycle.apply(started, new CompleteBooking(AFTER_START));

        // then
        assertThat(started.getStatus()).isEqualTo(BookingStatus.IN_PROGRESS);
        assertThat(completed.booking().getStatus()).isEqualTo(BookingStatus.COMPLETED);
        assertThat(completed.booking().getCompletedAt()).isEqualTo(AFTER_START);
        LessonStatusChangedEvent event = (LessonStatusChangedEvent) completed.events().get(0);
        assertThat(event.getPreviousStatus()).isEqualTo(BookingStatus.IN_PROGRESS);
    }

    @Test
    @DisplayName("start requires a confirmed booking")
    void start_pendingFails() {
        assertThatThrownBy(() -> lifecycle.apply(booking(BookingStatus.PENDING, PaymentStatus.PAID),
                new StartLesson(AFTER_START)))
                .isInstanceOf(InvalidStateTransitionException.class);
    }

    @Test
    @DisplayName("no-show by instructor after start is terminal")
    void noShow_byInstructor() {
        BookingTransition transition = lifecycle.apply(booking(BookingStatus.CONFIRMED, PaymentStatus.PAID),
                new MarkNoShow(BookingActor.INSTRUCTOR, AFTER_START));

        assertThat(transition.booking().getStatus()).isEqualTo(BookingStatus.NO_SHOW);
        assertThat(transition.booking().getStatus().isTerminal()).isTrue();
    }

    @Test
    @DisplayName("students cannot mark a no-show")
    void noShow_byStudentFails() {
        assertThatThrownBy(() -> lifecycle.apply(booking(BookingStatus.CONFIRMED, PaymentStatus.PAID),
                new MarkNoShow(BookingActor.STUDENT, AFTER_START)))
                .isInstanceOf(PolicyViolationException.class);
    }

    @Test
    @DisplayName("reschedule cancels the original and drafts a linked replacement")
    void reschedule_draftsReplacement() {
        // given
        Instant newStart = LESSON_START.plusSeconds(2 * 24 * 3600);

        // when
        RescheduleTransition transition = lifecycle.reschedule(booking(BookingStatus.CONFIRMED, PaymentStatus.PAID),
                new RescheduleBooking(BookingActor.INSTRUCTOR, newStart, null, BEFORE_START));

        // then
        assertThat(transition.cancelled().getStatus()).isEqualTo(BookingStatus.CANCELLED);
        assertThat(transition.cancelled().getCancellationReason()).isEqualTo("Rescheduled");
        LessonBooking replacement = transition.replacement();
        assertThat(replacement.getId()).isNull();
        assertThat(replacement.getStatus()).isEqualTo(BookingStatus.PENDING);
        assertThat(replacement.getLessonStart()).isEqualTo(newStart);
        assertThat(replacement.getRebookingCount()).isEqualTo(1);
        assertThat(replacement.getOriginalLessonStart()).isEqualTo(LESSON_START);
        assertThat(replacement.getRescheduledFromBookingId()).isEqualTo(42L);
        assertThat(replacement.getAmount()).isEqualByComparingTo("350.00");
        assertThat(replacement.getBookingFee()).isEqualByComparingTo("20.00");
    }

    @Test
    @DisplayName("a second reschedule keeps the first original lesson start")
    void reschedule_keepsOriginalLessonStart() {
        // given
        Instant firstStart = LESSON_START.minusSeconds(7 * 24 * 3600);
        LessonBooking alreadyMoved = booking(BookingStatus.PENDING, PaymentStatus.PAID).toBuilder()
                .rebookingCount(1)
                .originalLessonStart(firstStart)
                .build();

        // when
        LessonBooking replacement = lifecycle.reschedule(alreadyMoved, new RescheduleBooking(
                BookingActor.STUDENT, LESSON_START.plusSeconds(86400), "exam", BEFORE_START)).replacement();

        // then
        assertThat(replacement.getRebookingCount()).isEqualTo(2);
        assertThat(replacement.getOriginalLessonStart()).isEqualTo(firstStart);
    }
}
