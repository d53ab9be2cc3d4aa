package com.drivelesson.common.exception;

import lombok.Getter;

/**
 * Base of the scheduling and booking error taxonomy. Each subtype carries a stable
 * error code so the presentation layer can map it to its own status codes.
 * None of these are retried; each is scoped to the request that raised it.
 */
@Getter
public abstract class BusinessException extends RuntimeException {
    private final String errorCode;

    protected BusinessException(String message, String errorCode) {
        super(message);
        this.errorCode = errorCode;
    }
}
