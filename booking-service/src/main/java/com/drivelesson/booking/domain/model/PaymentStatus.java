package com.drivelesson.booking.domain.model;

public enum PaymentStatus {
    PENDING,
    PAID,
    REFUNDED,
    FAILED
}
