package com.thevig.backend.exception;

import org.springframework.http.HttpStatus;

public class NotYourTurnException extends DraftException {

    public NotYourTurnException(String draftId, String participantId) {
        super("NOT_YOUR_TURN", HttpStatus.FORBIDDEN,
                "It is not " + participantId + "'s turn in draft " + draftId);
    }
}
