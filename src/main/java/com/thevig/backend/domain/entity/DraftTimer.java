package com.thevig.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Duration;
import java.time.Instant;

/**
 * Deadline bookkeeping for the current turn of a draft. The deadline is only
 * set while the draft is in progress; a paused draft keeps the remaining
 * seconds instead.
 */
@Entity
@Table(name = "draft_timers")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DraftTimer {
    @Id
    @Column(name = "draft_id", length = 64)
    private String draftId;

    @Column(name = "current_pick_deadline")
    private Instant deadline;

    @Column(name = "turn_started_at")
    private Instant turnStartedAt;

    @Column(name = "last_reminded_at")
    private Instant lastRemindedAt;

    // deadline the last reminder was sent for
    @Column(name = "reminded_deadline")
    private Instant remindedDeadline;

    @Column(name = "paused_at")
    private Instant pausedAt;

    @Column(name = "paused_remaining_seconds")
    private Long pausedRemainingSeconds;

    @Version
    private Long version;

    public static DraftTimer forDraft(String draftId) {
        return DraftTimer.builder().draftId(draftId).build();
    }

    public void startTurn(Instant newDeadline, Instant now) {
        this.deadline = newDeadline;
        this.turnStartedAt = now;
        this.remindedDeadline = null;
        this.pausedAt = null;
        this.pausedRemainingSeconds = null;
    }

    /**
     * Freezes the running deadline into a remaining-seconds snapshot.
     */
    public void pause(Instant now) {
        this.pausedRemainingSeconds = deadline == null
                ? null
                : Math.max(0, Duration.between(now, deadline).getSeconds());
        this.pausedAt = now;
        this.deadline = null;
    }

    /**
     * Restores the deadline from the pause snapshot, or grants a full pick
     * window when none was captured. The turn start moves forward by the
     * paused duration so elapsed time excludes the pause.
     */
    public Instant resume(Instant now, long fullPickSeconds) {
        long seconds = pausedRemainingSeconds != null ? pausedRemainingSeconds : fullPickSeconds;
        if (turnStartedAt != null && pausedAt != null) {
            turnStartedAt = turnStartedAt.plus(Duration.between(pausedAt, now));
        }
        this.deadline = now.plusSeconds(seconds);
        this.pausedAt = null;
        this.pausedRemainingSeconds = null;
        return deadline;
    }

    public void clear() {
        this.deadline = null;
        this.turnStartedAt = null;
        this.remindedDeadline = null;
        this.pausedAt = null;
        this.pausedRemainingSeconds = null;
    }

    public Long elapsedSeconds(Instant now) {
        if (turnStartedAt == null)
            return null;
        return Math.max(0, Duration.between(turnStartedAt, now).getSeconds());
    }

    public boolean reminderSentFor(Instant currentDeadline) {
        return remindedDeadline != null && remindedDeadline.equals(currentDeadline);
    }
}
