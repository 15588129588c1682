package com.thevig.backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Another request changed the draft between read and write. The caller may
 * re-read the draft and try again.
 */
public class ConcurrencyConflictException extends DraftException {

    public ConcurrencyConflictException(String message) {
        super("CONCURRENCY_CONFLICT", HttpStatus.CONFLICT, message, true);
    }

    public ConcurrencyConflictException(String message, Throwable cause) {
        this(message);
        initCause(cause);
    }
}
