package com.thevig.backend.draft;

import com.thevig.backend.dto.DraftSettingsDTO;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Deadline arithmetic for a draft turn, driven by the pool's settings.
 */
@Component
@RequiredArgsConstructor
public class DeadlinePolicy {

    private final SnakeTurnResolver turnResolver;

    public Instant nextDeadline(Instant now, DraftSettingsDTO settings, int nextPickIndex, int participantCount) {
        long seconds = settings.getPickTimeSeconds();
        if (turnResolver.isRoundBoundary(nextPickIndex, participantCount)) {
            seconds += settings.getBreakBetweenRoundsSeconds();
        }
        return now.plusSeconds(seconds);
    }

    /**
     * Overdue time after which a timed-out turn is skipped. Auto-skip counts
     * from the turn start, so the grace is the part of the threshold beyond
     * the pick window.
     */
    public long autoSkipGraceSeconds(DraftSettingsDTO settings) {
        return Math.max(0L, (long) settings.getAutoSkipAfterSeconds() - settings.getPickTimeSeconds());
    }

    /**
     * True once the deadline has been reached and the overdue time covers the
     * auto-skip grace. Compared at full precision: a turn with any time left,
     * even under a second, is never skipped.
     */
    public boolean shouldAutoSkip(Duration remaining, DraftSettingsDTO settings) {
        if (hasTimeLeft(remaining) || !settings.isAutoSkipEnabled()) {
            return false;
        }
        return remaining.negated().compareTo(Duration.ofSeconds(autoSkipGraceSeconds(settings))) >= 0;
    }

    public boolean inReminderWindow(Duration remaining, DraftSettingsDTO settings) {
        return hasTimeLeft(remaining)
                && remaining.compareTo(Duration.ofMinutes(settings.getReminderMinutes())) < 0;
    }

    private static boolean hasTimeLeft(Duration remaining) {
        return !remaining.isNegative() && !remaining.isZero();
    }
}
