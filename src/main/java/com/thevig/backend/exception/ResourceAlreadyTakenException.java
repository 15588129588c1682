package com.thevig.backend.exception;

import org.springframework.http.HttpStatus;

public class ResourceAlreadyTakenException extends DraftException {

    public ResourceAlreadyTakenException(String draftId, String resourceId) {
        super("RESOURCE_ALREADY_TAKEN", HttpStatus.CONFLICT,
                "Resource " + resourceId + " was already picked in draft " + draftId);
    }
}
