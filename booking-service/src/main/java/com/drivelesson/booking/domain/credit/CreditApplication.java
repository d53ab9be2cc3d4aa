package com.drivelesson.booking.domain.credit;

import com.drivelesson.booking.domain.model.CancellationCredit;

import java.math.BigDecimal;
import java.util.List;

/**
 * Outcome of using credits against a booking total.
 *
 * @param credits         credits consumed, each one in full
 * @param creditTotal     sum of the consumed credits
 * @param amountCovered   part of the booking total paid by credit
 * @param amountDue       what the student still has to pay
 * @param forfeitedAmount credit beyond the booking total, which is not carried over
 */
public record CreditApplication(
        List<CancellationCredit> credits,
        BigDecimal creditTotal,
        BigDecimal amountCovered,
        BigDecimal amountDue,
        BigDecimal forfeitedAmount
) {
    public CreditApplication {
        credits = List.copyOf(credits);
    }

    public static CreditApplication of(List<CancellationCredit> credits, BigDecimal bookingTotal) {
        BigDecimal creditTotal = credits.stream()
                .map(CancellationCredit::getCreditAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal covered = creditTotal.min(bookingTotal);
        return new CreditApplication(credits, creditTotal, covered,
                bookingTotal.subtract(covered), creditTotal.subtract(covered));
    }

    public boolean isEmpty() {
        return credits.isEmpty();
    }

    public boolean coversTotal() {
        return amountDue.signum() <= 0;
    }
}
