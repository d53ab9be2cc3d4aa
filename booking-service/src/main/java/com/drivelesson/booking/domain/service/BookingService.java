package com.drivelesson.booking.domain.service;

import com.drivelesson.availability.domain.service.SlotQueryService;
import com.drivelesson.booking.domain.credit.CreditService;
import com.drivelesson.booking.domain.lifecycle.BookingCommand;
import com.drivelesson.booking.domain.lifecycle.BookingCommand.CancelBooking;
import com.drivelesson.booking.domain.lifecycle.BookingCommand.CompleteBooking;
import com.drivelesson.booking.domain.lifecycle.BookingCommand.ConfirmBooking;
import com.drivelesson.booking.domain.lifecycle.BookingCommand.MarkNoShow;
import com.drivelesson.booking.domain.lifecycle.BookingCommand.RescheduleBooking;
import com.drivelesson.booking.domain.lifecycle.BookingCommand.StartLesson;
import com.drivelesson.booking.domain.lifecycle.BookingLifecycle;
import com.drivelesson.booking.domain.lifecycle.BookingTransition;
import com.drivelesson.booking.domain.lifecycle.RescheduleTransition;
import com.drivelesson.booking.domain.model.BookingActor;
import com.drivelesson.booking.domain.model.BookingIntent;
import com.drivelesson.booking.domain.model.BookingQuery;
import com.drivelesson.booking.domain.model.CancellationCredit;
import com.drivelesson.booking.domain.model.LessonBooking;
import com.drivelesson.booking.domain.model.PaymentStatus;
import com.drivelesson.booking.domain.repository.BookingRepository;
import com.drivelesson.booking.events.BookingCancelledEvent;
import com.drivelesson.booking.events.BookingEvent;
import com.drivelesson.booking.events.BookingEventPublisher;
import com.drivelesson.booking.events.BookingRescheduledEvent;
import com.drivelesson.common.exception.InvalidStateTransitionException;
import com.drivelesson.common.exception.PolicyViolationException;
import com.drivelesson.common.exception.ResourceNotFoundException;
import com.drivelesson.common.model.BookingStatus;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;

/**
 * Booking entry points. Every status change goes through {@link BookingLifecycle};
 * this service loads and stores bookings, hands cancellations to the credit service
 * and publishes the resulting events.
 */
@Slf4j
@Service
@Validated
@RequiredArgsConstructor
public class BookingService {

    private final BookingRepository bookingRepository;
    private final BookingLifecycle lifecycle;
    private final CreditService creditService;
    private final SlotQueryService slotQueryService;
    private final BookingEventPublisher eventPublisher;
    private final BookingReferenceGenerator referenceGenerator;
    private final Clock clock;

    /**
     * Creates a PENDING, paid booking once the lesson fee has been collected.
     * The requested time is re-checked against open hours, time off and active bookings.
     */
    public LessonBooking createBooking(@Valid BookingIntent intent, String paymentReference) {
        log.info("Creating booking for student ID: {}, provider ID: {}, start: {}",
                intent.studentId(), intent.providerId(), intent.lessonStart());
        Instant now = clock.instant();
        requireFuture(intent.lessonStart(), now);
        if (intent.amount() == null || intent.amount().signum() < 0) {
            throw new PolicyViolationException("Lesson amount must be zero or more");
        }
        slotQueryService.ensureBookable(intent.providerId(), intent.lessonStart(), intent.durationMinutes(), null);

        LessonBooking booking = LessonBooking.builder()
                .reference(referenceGenerator.next())
                .studentId(intent.studentId())
                .providerId(intent.providerId())
                .lessonStart(intent.lessonStart())
                .durationMinutes(intent.durationMinutes())
                .status(BookingStatus.PENDING)
                .paymentStatus(PaymentStatus.PAID)
                .paymentReference(paymentReference)
                .amount(intent.amount())
                .bookingFee(intent.bookingFee() == null ? BigDecimal.ZERO : intent.bookingFee())
                .createdAt(now)
                .build();
        booking = bookingRepository.createBooking(booking);
        log.info("Booking {} created with ID: {}", booking.getReference(), booking.getId());
        return booking;
    }

    public LessonBooking getBooking(Long id) {
        return bookingRepository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException("Booking", id));
    }

    /**
     * Bookings of a student and/or provider, ordered by lesson start.
     */
    public List<LessonBooking> listBookings(BookingQuery query) {
        List<LessonBooking> candidates;
        if (query.studentId() != null) {
            candidates = bookingRepository.findByStudentId(query.studentId());
        } else if (query.providerId() != null) {
            candidates = bookingRepository.findByProviderId(query.providerId());
        } else {
            throw new PolicyViolationException("Booking listing needs a student or a provider");
        }
        return candidates.stream()
                .filter(query::matches)
                .sorted(Comparator.comparing(LessonBooking::getLessonStart))
                .toList();
    }

    public LessonBooking confirmBooking(Long id) {
        return transition(id, new ConfirmBooking(clock.instant()));
    }

    public LessonBooking startLesson(Long id) {
        return transition(id, new StartLesson(clock.instant()));
    }

    public LessonBooking completeBooking(Long id) {
        return transition(id, new CompleteBooking(clock.instant()));
    }

    public LessonBooking markNoShow(Long id, BookingActor actor) {
        return transition(id, new MarkNoShow(actor, clock.instant()));
    }

    /**
     * Cancels a PENDING or CONFIRMED booking. Whatever the booking held, cash or applied
     * credit, earns a PENDING credit; the part not credited is kept as the cancellation
     * fee. Nothing is refunded.
     */
    public LessonBooking cancelBooking(Long id, BookingActor actor, String reason) {
        LessonBooking booking = getBooking(id);
        BookingTransition transition = lifecycle.apply(booking, new CancelBooking(actor, reason, clock.instant()));
        BookingCancelledEvent cancellation = cancellationOf(transition.events());

        Optional<CancellationCredit> credit = creditService.issueCancellationCredit(cancellation);
        LessonBooking cancelled = bookingRepository.updateBooking(settle(transition.booking(), credit));
        eventPublisher.publishAll(transition.events());
        log.info("Booking ID: {} cancelled by {}, credit {}", id, actor,
                credit.map(CancellationCredit::getCreditAmount).orElse(BigDecimal.ZERO));
        return cancelled;
    }

    /**
     * Moves a booking to a new time: the old booking is cancelled and a linked replacement
     * is created. Everything the old booking held is credited in full straight onto the
     * replacement, so a paid booking stays paid. A booking that still owed a balance passes
     * that balance on to the replacement.
     *
     * @return the replacement booking
     */
    public LessonBooking rescheduleBooking(Long id, BookingActor actor, Instant newLessonStart, String reason) {
        LessonBooking booking = getBooking(id);
        Instant now = clock.instant();
        requireFuture(newLessonStart, now);
        if (!booking.isActive()) {
            throw new InvalidStateTransitionException(id, booking.getStatus(), "reschedule");
        }
        slotQueryService.ensureBookable(booking.getProviderId(), newLessonStart, booking.getDurationMinutes(), id);

        RescheduleTransition transition = lifecycle.reschedule(booking,
                new RescheduleBooking(actor, newLessonStart, reason, now));
        LessonBooking replacement = bookingRepository.createBooking(transition.replacement().toBuilder()
                .reference(referenceGenerator.next())
                .build());

        BookingCancelledEvent cancellation = cancellationOf(transition.events());
        Optional<CancellationCredit> credit = creditService.issueRescheduleCredit(cancellation, replacement.getId());
        BigDecimal covered = credit.map(CancellationCredit::getCreditAmount).orElse(BigDecimal.ZERO)
                .min(replacement.getTotalPaid());
        BigDecimal balanceDue = replacement.getTotalPaid().subtract(covered);
        replacement = bookingRepository.updateBooking(replacement.toBuilder()
                .creditAppliedAmount(covered)
                .paymentStatus(balanceDue.signum() <= 0 ? PaymentStatus.PAID : PaymentStatus.PENDING)
                .build());
        bookingRepository.updateBooking(settle(transition.cancelled(), credit));

        List<BookingEvent> events = new ArrayList<>(transition.events());
        events.add(BookingRescheduledEvent.builder()
                .previousBookingId(id)
                .bookingId(replacement.getId())
                .reference(replacement.getReference())
                .studentId(replacement.getStudentId())
                .providerId(replacement.getProviderId())
                .previousLessonStart(booking.getLessonStart())
                .lessonStart(replacement.getLessonStart())
                .rebookingCount(replacement.getRebookingCount())
                .actor(actor)
                .creditApplied(covered)
                .balanceDue(balanceDue)
                .timestamp(now)
                .build());
        eventPublisher.publishAll(events);
        log.info("Booking ID: {} rescheduled by {} to booking ID: {} at {}, balance due {}",
                id, actor, replacement.getId(), newLessonStart, balanceDue);
        return replacement;
    }

    /**
     * Closes bookings whose lesson has ended but that nobody completed, so they leave the
     * active set. CONFIRMED and IN_PROGRESS bookings are completed; a paid PENDING booking
     * is confirmed first. A PENDING booking with a balance still owed is left for an admin.
     * A failure on one booking is logged and the sweep carries on.
     *
     * @param since only lessons starting at or after this instant are considered
     * @return number of bookings completed
     */
    public int completeFinishedLessons(Instant since) {
        Instant now = clock.instant();
        List<LessonBooking> candidates = bookingRepository.findByStatusStartingBetween(
                EnumSet.of(BookingStatus.PENDING, BookingStatus.CONFIRMED, BookingStatus.IN_PROGRESS), since, now);
        int completed = 0;
        for (LessonBooking booking : candidates) {
            if (booking.getLessonEnd().isAfter(now)) {
                continue;
            }
            if (booking.getStatus() == BookingStatus.PENDING && booking.getPaymentStatus() != PaymentStatus.PAID) {
                log.warn("Lesson of booking ID: {} has ended with payment {}, leaving it open",
                        booking.getId(), booking.getPaymentStatus());
                continue;
            }
            try {
                List<BookingEvent> events = new ArrayList<>();
                LessonBooking current = booking;
                if (current.getStatus() == BookingStatus.PENDING) {
                    BookingTransition confirmed = lifecycle.apply(current, new ConfirmBooking(now));
                    current = confirmed.booking();
                    events.addAll(confirmed.events());
                }
                BookingTransition finished = lifecycle.apply(current, new CompleteBooking(now));
                bookingRepository.updateBooking(finished.booking());
                events.addAll(finished.events());
                eventPublisher.publishAll(events);
                completed++;
            } catch (Exception e) {
                log.error("Failed to complete finished lesson of booking ID: {}", booking.getId(), e);
            }
        }
        if (completed > 0) {
            log.info("Completed {} finished lesson(s)", completed);
        }
        return completed;
    }

    /** Records the outstanding balance of a rescheduled booking as paid. */
    public LessonBooking markBalancePaid(Long id, String paymentReference) {
        LessonBooking booking = getBooking(id);
        if (!booking.isActive() || booking.getPaymentStatus() == PaymentStatus.PAID) {
            throw new InvalidStateTransitionException(String.format(
                    "Booking %s has no outstanding balance (status %s, payment %s)",
                    id, booking.getStatus(), booking.getPaymentStatus()));
        }
        LessonBooking paid = bookingRepository.updateBooking(booking.toBuilder()
                .paymentStatus(PaymentStatus.PAID)
                .paymentReference(paymentReference)
                .build());
        log.info("Balance paid for booking ID: {}", id);
        return paid;
    }

    /** Records how much of a booking's total was covered by credit. */
    public LessonBooking recordCreditApplied(LessonBooking booking, BigDecimal amount) {
        return bookingRepository.updateBooking(booking.toBuilder().creditAppliedAmount(amount).build());
    }

    private LessonBooking transition(Long id, BookingCommand command) {
        LessonBooking booking = getBooking(id);
        BookingTransition transition = lifecycle.apply(booking, command);
        LessonBooking saved = bookingRepository.updateBooking(transition.booking());
        eventPublisher.publishAll(transition.events());
        log.info("Booking ID: {} moved from {} to {}", id, booking.getStatus(), saved.getStatus());
        return saved;
    }

    private LessonBooking settle(LessonBooking cancelled, Optional<CancellationCredit> credit) {
        BigDecimal creditAmount = credit.map(CancellationCredit::getCreditAmount).orElse(BigDecimal.ZERO);
        BigDecimal fee = cancelled.getAmountPaid().subtract(creditAmount).max(BigDecimal.ZERO);
        return cancelled.toBuilder()
                .cancellationCreditAmount(creditAmount)
                .cancellationFee(fee)
                .refundAmount(BigDecimal.ZERO)
                .build();
    }

    private static BookingCancelledEvent cancellationOf(List<BookingEvent> events) {
        return events.stream()
                .filter(BookingCancelledEvent.class::isInstance)
                .map(BookingCancelledEvent.class::cast)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("Cancellation produced no cancelled event"));
    }

    private static void requireFuture(Instant lessonStart, Instant now) {
        if (lessonStart == null || !lessonStart.isAfter(now)) {
            throw new PolicyViolationException("Lesson start " + lessonStart + " must be in the future");
        }
    }
}
