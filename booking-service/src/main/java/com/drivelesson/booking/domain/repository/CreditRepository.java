package com.drivelesson.booking.domain.repository;

import com.drivelesson.booking.domain.model.CancellationCredit;
import com.drivelesson.booking.domain.model.CreditStatus;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Credit storage, provided by the persistence layer. Only the credit service writes through it.
 */
public interface CreditRepository {

    CancellationCredit createCredit(CancellationCredit credit);

    /** Marks the credit APPLIED against {@code targetBookingId}. */
    CancellationCredit applyCredit(Long creditId, Long targetBookingId, Instant appliedAt);

    CancellationCredit updateCredit(CancellationCredit credit);

    Optional<CancellationCredit> findByOriginalBookingId(Long bookingId);

    List<CancellationCredit> findByStudentId(Long studentId);

    List<CancellationCredit> findByStudentIdAndStatus(Long studentId, CreditStatus status);
}
