package com.thevig.backend.notification;

import java.util.Map;

/**
 * Outbound delivery of a draft notification to one participant (email, push...).
 * Implementations may throw; callers log and move on.
 */
public interface NotificationSink {

    void send(String participantId, DraftNotificationType type, Map<String, Object> payload);
}
