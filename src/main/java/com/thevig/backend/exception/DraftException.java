package com.thevig.backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Base type of every rejected draft operation. Carries the error code and the
 * HTTP status the REST layer answers with.
 */
@Getter
public abstract class DraftException extends RuntimeException {

    private final String code;
    private final HttpStatus status;
    private final boolean retryable;

    protected DraftException(String code, HttpStatus status, String message) {
        this(code, status, message, false);
    }

    protected DraftException(String code, HttpStatus status, String message, boolean retryable) {
        super(message);
        this.code = code;
        this.status = status;
        this.retryable = retryable;
    }
}
