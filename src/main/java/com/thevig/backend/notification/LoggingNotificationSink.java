package com.thevig.backend.notification;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;

@Slf4j
public class LoggingNotificationSink implements NotificationSink {

    @Override
    public void send(String participantId, DraftNotificationType type, Map<String, Object> payload) {
        log.info("📨 [Notification] {} -> {} {}", type, participantId, payload);
    }
}
