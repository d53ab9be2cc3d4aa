package com.drivelesson.common.exception;

/**
 * Thrown when a requested lesson time is outside the provider's open hours,
 * blocked by time off or already taken by an active booking.
 */
public class SlotUnavailableException extends BusinessException {
    public static final String CODE = "SLOT_UNAVAILABLE";

    public SlotUnavailableException(String message) {
        super(message, CODE);
    }
}
