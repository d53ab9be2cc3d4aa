package com.drivelesson.common.exception;

/**
 * Thrown when a request is well formed but breaks a booking policy
 * (duration bounds, lookahead window, actor not permitted).
 */
public class PolicyViolationException extends BusinessException {
    public static final String CODE = "POLICY_VIOLATION";

    public PolicyViolationException(String message) {
        super(message, CODE);
    }
}
