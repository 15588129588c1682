package com.thevig.backend.domain.entity;

public enum DraftStatus {
    PENDING,
    IN_PROGRESS,
    PAUSED,
    COMPLETED
}
