package com.drivelesson.common.exception;

public class InvalidTimeRangeException extends BusinessException {
    public static final String CODE = "INVALID_TIME_RANGE";

    public InvalidTimeRangeException(String message) {
        super(message, CODE);
    }

    public InvalidTimeRangeException(Object start, Object end) {
        super(String.format("End %s must be after start %s", end, start), CODE);
    }
}
