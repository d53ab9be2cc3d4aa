package com.drivelesson.booking.domain.model;

public enum CreditReason {
    CANCELLATION,
    RESCHEDULE
}
