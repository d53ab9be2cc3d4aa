package com.drivelesson.common.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lesson booking status. Only {@link #PENDING} and {@link #CONFIRMED} bookings
 * hold a slot; everything else frees the time for other students.
 */
public enum BookingStatus {
    PENDING,
    CONFIRMED,
    IN_PROGRESS,
    COMPLETED,
    CANCELLED,
    NO_SHOW;

    private static final Set<BookingStatus> ACTIVE = EnumSet.of(PENDING, CONFIRMED);
    private static final Set<BookingStatus> TERMINAL = EnumSet.of(COMPLETED, CANCELLED, NO_SHOW);

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public static Set<BookingStatus> activeStatuses() {
        return EnumSet.copyOf(ACTIVE);
    }
}
