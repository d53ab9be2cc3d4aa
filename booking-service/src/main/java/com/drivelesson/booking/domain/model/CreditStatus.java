package com.drivelesson.booking.domain.model;

/**
 * PENDING until the student's next payment is processed, then AVAILABLE until
 * applied at checkout. EXPIRED credits can no longer be used.
 */
public enum CreditStatus {
    PENDING,
    AVAILABLE,
    APPLIED,
    EXPIRED
}
