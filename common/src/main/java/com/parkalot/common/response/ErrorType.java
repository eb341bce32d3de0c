package com.parkalot.common.response;

/**
 * Coarse error categories exposed to callers next to the machine-readable code.
 * Everything except {@link #FATAL} is an expected business outcome.
 */
public enum ErrorType {
    VALIDATION,
    NOT_FOUND,
    CONFLICT,
    ACCESS_DENIED,
    EXTERNAL_FAILURE,
    FATAL;

    public boolean isExpected() {
        return this != FATAL;
    }
}
