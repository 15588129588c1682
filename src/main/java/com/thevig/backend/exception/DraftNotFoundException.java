package com.thevig.backend.exception;

import org.springframework.http.HttpStatus;

public class DraftNotFoundException extends DraftException {

    public DraftNotFoundException(String message) {
        super("NOT_FOUND", HttpStatus.NOT_FOUND, message);
    }

    public static DraftNotFoundException draft(String draftId) {
        return new DraftNotFoundException("Draft not found: " + draftId);
    }

    public static DraftNotFoundException resource(String poolId, String resourceId) {
        return new DraftNotFoundException("Resource " + resourceId + " is not part of pool " + poolId);
    }
}
