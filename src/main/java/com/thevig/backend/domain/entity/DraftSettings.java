package com.thevig.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "draft_settings",
        uniqueConstraints = @UniqueConstraint(name = "uk_draft_settings_pool", columnNames = "pool_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DraftSettings {
    @Id
    @Column(length = 80)
    private String id;

    @Column(name = "pool_id", nullable = false, length = 64)
    private String poolId;

    @Column(name = "pick_time_seconds", nullable = false)
    private int pickTimeSeconds;

    @Column(name = "reminder_minutes", nullable = false)
    private int reminderMinutes;

    @Column(name = "enable_auto_skip", nullable = false)
    private boolean autoSkipEnabled;

    @Column(name = "auto_skip_after_seconds", nullable = false)
    private int autoSkipAfterSeconds;

    @Column(name = "break_between_rounds_seconds", nullable = false)
    private int breakBetweenRoundsSeconds;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }

    public static String idForPool(String poolId) {
        return "settings_" + poolId;
    }
}
