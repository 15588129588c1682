package com.thevig.backend.util;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Reads the caller's participant id from the X-Participant-Id header. The
 * value is set by the authenticating gateway and trusted as-is.
 */
public class ParticipantAuthUtil {

    public static final String HEADER_NAME = "X-Participant-Id";

    private ParticipantAuthUtil() {
        throw new UnsupportedOperationException("Utility class");
    }

    /**
     * @throws ResponseStatusException with HTTP 401 when the header is missing
     *                                 or blank
     */
    public static String getParticipantIdFromRequest(HttpServletRequest request) {
        String participantId = getParticipantIdFromRequestOptional(request);
        if (participantId == null) {
            throw new ResponseStatusException(
                    HttpStatus.UNAUTHORIZED,
                    "Header " + HEADER_NAME + " is required to identify the participant");
        }
        return participantId;
    }

    public static String getParticipantIdFromRequestOptional(HttpServletRequest request) {
        String participantId = request.getHeader(HEADER_NAME);
        if (participantId == null || participantId.trim().isEmpty()) {
            return null;
        }
        return participantId.trim();
    }
}
