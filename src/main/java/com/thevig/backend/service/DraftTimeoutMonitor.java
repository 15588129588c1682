package com.thevig.backend.service;

import com.thevig.backend.domain.entity.Draft;
import com.thevig.backend.domain.entity.DraftStatus;
import com.thevig.backend.domain.entity.DraftTimer;
import com.thevig.backend.domain.repository.DraftRepository;
import com.thevig.backend.domain.repository.DraftTimerRepository;
import com.thevig.backend.draft.DeadlinePolicy;
import com.thevig.backend.draft.SnakeTurnResolver;
import com.thevig.backend.dto.DraftSettingsDTO;
import com.thevig.backend.dto.TimeoutCheckResult;
import com.thevig.backend.exception.ConcurrencyConflictException;
import com.thevig.backend.exception.DraftNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Checks a single draft's turn deadline: skips the turn once it is overdue
 * past the auto-skip grace, or reminds the current picker when the deadline
 * gets close. Holds no state of its own and can be called any number of
 * times; a skip that loses to a real pick is re-checked once and then finds
 * nothing to do.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftTimeoutMonitor {

    private final DraftRepository draftRepository;
    private final DraftTimerRepository timerRepository;
    private final DraftSettingsService settingsService;
    private final DraftPickService pickService;
    private final DraftNotificationService notificationService;
    private final SnakeTurnResolver turnResolver;
    private final DeadlinePolicy deadlinePolicy;
    private final Clock clock;

    @Retryable(retryFor = ConcurrencyConflictException.class, maxAttempts = 2, backoff = @Backoff(delay = 50))
    public TimeoutCheckResult checkAndHandleTimeout(String draftId) {
        Draft draft = draftRepository.findById(draftId)
                .orElseThrow(() -> DraftNotFoundException.draft(draftId));
        if (draft.getStatus() != DraftStatus.IN_PROGRESS) {
            return TimeoutCheckResult.noop(draftId, null);
        }

        Optional<DraftTimer> timer = timerRepository.findById(draftId);
        if (timer.isEmpty() || timer.get().getDeadline() == null) {
            return TimeoutCheckResult.noop(draftId, null);
        }
        Optional<String> currentPicker = turnResolver.whoseTurn(draft);
        if (currentPicker.isEmpty()) {
            return TimeoutCheckResult.noop(draftId, null);
        }

        Instant now = clock.instant();
        Instant deadline = timer.get().getDeadline();
        Duration remaining = Duration.between(now, deadline);
        long remainingSeconds = remaining.getSeconds();
        DraftSettingsDTO settings = settingsService.getForPool(draft.getPoolId());

        if (deadlinePolicy.shouldAutoSkip(remaining, settings)) {
            log.info("⏰ [DraftTimeout] Draft {} pick {} overdue by {}s, skipping {}",
                    draftId, draft.getCurrentPick() + 1, -remainingSeconds, currentPicker.get());
            PickResult result = pickService.skipOnTimeout(draftId, draft.getCurrentPick(), deadline);
            return TimeoutCheckResult.builder()
                    .draftId(draftId)
                    .skipped(true)
                    .skippedParticipantId(result.pick().getParticipantId())
                    .remainingSeconds(remainingSeconds)
                    .build();
        }

        if (deadlinePolicy.inReminderWindow(remaining, settings)
                && !timer.get().reminderSentFor(deadline)
                && timerRepository.markReminderSent(draftId, deadline, now) == 1) {
            log.info("🔔 [DraftTimeout] Reminding {} on draft {} ({}s left)",
                    currentPicker.get(), draftId, remainingSeconds);
            notificationService.reminder(draft, currentPicker.get(), deadline, remainingSeconds);
            return TimeoutCheckResult.builder()
                    .draftId(draftId)
                    .reminderSent(true)
                    .remainingSeconds(remainingSeconds)
                    .build();
        }

        log.debug("[DraftTimeout] Draft {} has {}s left, nothing to do", draftId, remainingSeconds);
        return TimeoutCheckResult.noop(draftId, remainingSeconds);
    }
}
