package com.thevig.backend.exception;

import org.springframework.http.HttpStatus;

public class InvalidDraftStateException extends DraftException {

    public InvalidDraftStateException(String message) {
        super("INVALID_STATE", HttpStatus.CONFLICT, message);
    }
}
