package com.thevig.backend.notification;

public enum DraftNotificationType {
    YOUR_TURN,
    REMINDER,
    PICK_MADE,
    PICK_SKIPPED,
    DRAFT_STARTED,
    DRAFT_PAUSED,
    DRAFT_RESUMED,
    DRAFT_COMPLETED;

    /**
     * Lower-case name used for broadcast channels.
     */
    public String channelSuffix() {
        return name().toLowerCase();
    }
}
