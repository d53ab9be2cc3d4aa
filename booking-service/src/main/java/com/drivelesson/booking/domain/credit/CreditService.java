package com.drivelesson.booking.domain.credit;

import com.drivelesson.booking.domain.model.CancellationCredit;
import com.drivelesson.booking.domain.model.CreditReason;
import com.drivelesson.booking.domain.model.CreditStatus;
import com.drivelesson.booking.domain.repository.CreditRepository;
import com.drivelesson.booking.events.BookingCancelledEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Owns every write to cancellation credits: issuing them from cancellations and
 * reschedules, releasing them after the next payment and applying them at checkout.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CreditService {

    private static final Comparator<CancellationCredit> OLDEST_FIRST = Comparator
            .comparing(CancellationCredit::getCreatedAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(CancellationCredit::getId, Comparator.nullsLast(Comparator.naturalOrder()));

    private final CreditRepository creditRepository;
    private final CancellationCreditCalculator calculator;

    /**
     * Issues the PENDING credit for a cancellation. A booking earns at most one credit,
     * so a repeated event returns the credit already stored.
     */
    public Optional<CancellationCredit> issueCancellationCredit(BookingCancelledEvent cancellation) {
        Optional<CancellationCredit> existing = creditRepository.findByOriginalBookingId(cancellation.getBookingId());
        if (existing.isPresent()) {
            log.info("Credit already issued for booking ID: {}", cancellation.getBookingId());
            return existing;
        }
        Optional<CancellationCredit> credit = calculator.calculate(cancellation, CreditReason.CANCELLATION)
                .map(creditRepository::createCredit);
        credit.ifPresentOrElse(
                c -> log.info("Issued credit {} of {} for cancelled booking ID: {}",
                        c.getId(), c.getCreditAmount(), cancellation.getBookingId()),
                () -> log.info("No credit for booking ID: {} (nothing paid, payment status {})",
                        cancellation.getBookingId(), cancellation.getPaymentStatus()));
        return credit;
    }

    /**
     * Issues the credit for a rescheduled booking and applies it straight away to the replacement.
     */
    public Optional<CancellationCredit> issueRescheduleCredit(BookingCancelledEvent cancellation, Long replacementBookingId) {
        Optional<CancellationCredit> existing = creditRepository.findByOriginalBookingId(cancellation.getBookingId());
        if (existing.isPresent()) {
            log.info("Credit already issued for booking ID: {}", cancellation.getBookingId());
            return existing;
        }
        return calculator.calculate(cancellation, CreditReason.RESCHEDULE)
                .map(credit -> credit.toBuilder()
                        .status(CreditStatus.APPLIED)
                        .appliedBookingId(replacementBookingId)
                        .appliedAt(cancellation.getTimestamp())
                        .build())
                .map(creditRepository::createCredit)
                .map(credit -> {
                    log.info("Applied reschedule credit {} of {} from booking ID: {} to booking ID: {}",
                            credit.getId(), credit.getCreditAmount(), cancellation.getBookingId(), replacementBookingId);
                    return credit;
                });
    }

    /**
     * Releases a student's PENDING credits once their next payment has gone through.
     *
     * @return number of credits made AVAILABLE
     */
    public int releasePendingCredits(Long studentId) {
        List<CancellationCredit> pending = creditRepository.findByStudentIdAndStatus(studentId, CreditStatus.PENDING);
        for (CancellationCredit credit : pending) {
            creditRepository.updateCredit(credit.toBuilder().status(CreditStatus.AVAILABLE).build());
        }
        if (!pending.isEmpty()) {
            log.info("Released {} pending credit(s) for student ID: {}", pending.size(), studentId);
        }
        return pending.size();
    }

    /**
     * Which AVAILABLE credits would be used against {@code bookingTotal}, without using them.
     */
    public CreditApplication previewCheckout(Long studentId, BigDecimal bookingTotal) {
        return CreditApplication.of(selectCredits(studentId, bookingTotal), bookingTotal);
    }

    /**
     * Applies AVAILABLE credits, oldest first, until {@code bookingTotal} is covered.
     * Each credit is consumed whole by this one booking; any excess is forfeited.
     */
    public CreditApplication applyAvailableCredits(Long studentId, Long targetBookingId, BigDecimal bookingTotal, Instant at) {
        List<CancellationCredit> applied = new ArrayList<>();
        for (CancellationCredit credit : selectCredits(studentId, bookingTotal)) {
            applied.add(creditRepository.applyCredit(credit.getId(), targetBookingId, at));
        }
        CreditApplication application = CreditApplication.of(applied, bookingTotal);
        if (!application.isEmpty()) {
            log.info("Applied {} credit(s) worth {} to booking ID: {}",
                    applied.size(), application.creditTotal(), targetBookingId);
        }
        if (application.forfeitedAmount().signum() > 0) {
            log.warn("Credit of {} exceeds booking ID: {} total {}, excess {} forfeited",
                    application.creditTotal(), targetBookingId, bookingTotal, application.forfeitedAmount());
        }
        return application;
    }

    public CreditSummary getCreditSummary(Long studentId) {
        List<CancellationCredit> available = creditRepository.findByStudentIdAndStatus(studentId, CreditStatus.AVAILABLE);
        List<CancellationCredit> pending = creditRepository.findByStudentIdAndStatus(studentId, CreditStatus.PENDING);
        List<CancellationCredit> credits = new ArrayList<>(available);
        credits.addAll(pending);
        credits.sort(OLDEST_FIRST);
        return new CreditSummary(studentId, sum(available), sum(pending), credits);
    }

    /** All credits of a student, newest first. */
    public List<CancellationCredit> getCreditHistory(Long studentId) {
        List<CancellationCredit> history = new ArrayList<>(creditRepository.findByStudentId(studentId));
        history.sort(OLDEST_FIRST.reversed());
        return history;
    }

    /**
     * Admin reset: expires every PENDING and AVAILABLE credit of the student.
     *
     * @return number of credits expired
     */
    public int resetCredits(Long studentId) {
        int expired = 0;
        for (CreditStatus status : List.of(CreditStatus.PENDING, CreditStatus.AVAILABLE)) {
            for (CancellationCredit credit : creditRepository.findByStudentIdAndStatus(studentId, status)) {
                creditRepository.updateCredit(credit.toBuilder().status(CreditStatus.EXPIRED).build());
                expired++;
            }
        }
        log.info("Expired {} credit(s) for student ID: {}", expired, studentId);
        return expired;
    }

    private List<CancellationCredit> selectCredits(Long studentId, BigDecimal bookingTotal) {
        List<CancellationCredit> available = new ArrayList<>(
                creditRepository.findByStudentIdAndStatus(studentId, CreditStatus.AVAILABLE));
        available.sort(OLDEST_FIRST);
        List<CancellationCredit> selected = new ArrayList<>();
        BigDecimal remaining = bookingTotal;
        for (CancellationCredit credit : available) {
            if (remaining.signum() <= 0) {
                break;
            }
            selected.add(credit);
            remaining = remaining.subtract(credit.getCreditAmount());
        }
        return selected;
    }

    private static BigDecimal sum(List<CancellationCredit> credits) {
        return credits.stream().map(CancellationCredit::getCreditAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
    }
}
