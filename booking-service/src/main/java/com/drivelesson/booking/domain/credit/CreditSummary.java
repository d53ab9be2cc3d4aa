package com.drivelesson.booking.domain.credit;

import com.drivelesson.booking.domain.model.CancellationCredit;

import java.math.BigDecimal;
import java.util.List;

/**
 * A student's usable credit: AVAILABLE now plus PENDING until their next payment.
 */
public record CreditSummary(
        Long studentId,
        BigDecimal availableTotal,
        BigDecimal pendingTotal,
        List<CancellationCredit> credits
) {
    public CreditSummary {
        credits = List.copyOf(credits);
    }
}
