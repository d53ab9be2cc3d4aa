package com.drivelesson.common.exception;

/**
 * Thrown when a booking command is not allowed from the booking's current status.
 */
public class InvalidStateTransitionException extends BusinessException {
    public static final String CODE = "INVALID_STATE_TRANSITION";

    public InvalidStateTransitionException(String message) {
        super(message, CODE);
    }

    public InvalidStateTransitionException(Object bookingId, Object currentStatus, String command) {
        super(String.format("Cannot %s booking %s in status %s", command, bookingId, currentStatus), CODE);
    }
}
