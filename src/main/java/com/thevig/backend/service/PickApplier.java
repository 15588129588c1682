package com.thevig.backend.service;

import com.thevig.backend.catalog.ResourceCatalog;
import com.thevig.backend.domain.entity.Draft;
import com.thevig.backend.domain.entity.DraftPick;
import com.thevig.backend.domain.entity.DraftStatus;
import com.thevig.backend.domain.entity.DraftTimer;
import com.thevig.backend.domain.repository.DraftPickRepository;
import com.thevig.backend.domain.repository.DraftRepository;
import com.thevig.backend.domain.repository.DraftTimerRepository;
import com.thevig.backend.draft.DeadlinePolicy;
import com.thevig.backend.draft.SnakeTurnResolver;
import com.thevig.backend.dto.DraftSettingsDTO;
import com.thevig.backend.exception.ConcurrencyConflictException;
import com.thevig.backend.exception.DraftNotFoundException;
import com.thevig.backend.exception.InvalidDraftStateException;
import com.thevig.backend.exception.NotYourTurnException;
import com.thevig.backend.exception.ResourceAlreadyTakenException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Validates and commits one pick or skip. Each public method is a single
 * transaction: the draft row is advanced with a conditional update on the
 * pick index read at the start, then the pick row is inserted and the timer
 * moved to the next turn. Any failure rolls all three back.
 *
 * <p>Callers go through {@link DraftPickService}, which adds the per-draft
 * lock and sends notifications after commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PickApplier {

    private final DraftRepository draftRepository;
    private final DraftPickRepository pickRepository;
    private final DraftTimerRepository timerRepository;
    private final ResourceCatalog resourceCatalog;
    private final DraftSettingsService settingsService;
    private final SnakeTurnResolver turnResolver;
    private final DeadlinePolicy deadlinePolicy;
    private final Clock clock;

    @Transactional
    public PickResult applyPick(String draftId, String participantId, String resourceId) {
        if (participantId == null || participantId.isBlank()) {
            throw new IllegalArgumentException("participantId is required");
        }
        if (resourceId == null || resourceId.isBlank()) {
            throw new IllegalArgumentException("resourceId is required");
        }

        Draft draft = loadDraft(draftId);
        requireInProgress(draft);

        String currentPicker = currentPicker(draft);
        if (!currentPicker.equals(participantId)) {
            log.warn("⚠️ [DraftPick] {} tried to pick out of turn in draft {} (current: {})",
                    participantId, draftId, currentPicker);
            throw new NotYourTurnException(draftId, participantId);
        }

        boolean skip = DraftPick.isSkipResource(resourceId);
        if (!skip) {
            if (!resourceCatalog.contains(draft.getPoolId(), resourceId)) {
                throw DraftNotFoundException.resource(draft.getPoolId(), resourceId);
            }
            if (pickRepository.existsByDraftIdAndResourceIdAndSkippedFalse(draftId, resourceId)) {
                throw new ResourceAlreadyTakenException(draftId, resourceId);
            }
        }

        return commit(draft, participantId, resourceId, skip);
    }

    /**
     * Skips the current picker's turn without checking who asked.
     */
    @Transactional
    public PickResult applyForcedSkip(String draftId) {
        Draft draft = loadDraft(draftId);
        requireInProgress(draft);
        return commit(draft, currentPicker(draft), DraftPick.SKIPPED_RESOURCE, true);
    }

    /**
     * Skips the turn at {@code expectedPick} whose deadline was
     * {@code expectedDeadline}; fails with a conflict when the draft has moved
     * past that pick or the deadline was reset by a pause and resume.
     */
    @Transactional
    public PickResult skipCurrentTurn(String draftId, int expectedPick, Instant expectedDeadline) {
        Draft draft = loadDraft(draftId);
        requireInProgress(draft);
        if (draft.getCurrentPick() != expectedPick) {
            throw new ConcurrencyConflictException(
                    "Draft " + draftId + " moved from pick " + expectedPick + " to " + draft.getCurrentPick());
        }
        Instant deadline = timerRepository.findById(draftId).map(DraftTimer::getDeadline).orElse(null);
        if (!Objects.equals(deadline, expectedDeadline)) {
            log.warn("⚠️ [DraftPick] Deadline of draft {} changed from {} to {}, not skipping",
                    draftId, expectedDeadline, deadline);
            throw new ConcurrencyConflictException(
                    "Deadline of draft " + draftId + " changed before the timeout skip");
        }
        return commit(draft, currentPicker(draft), DraftPick.SKIPPED_RESOURCE, true);
    }

    private PickResult commit(Draft draft, String participantId, String resourceId, boolean skipped) {
        Instant now = clock.instant();
        String draftId = draft.getId();
        int participantCount = draft.participantCount();
        int expectedPick = draft.getCurrentPick();
        int nextPick = expectedPick + 1;
        int nextRound = turnResolver.currentRoundAfter(nextPick, participantCount, draft.getTotalRounds());
        boolean completes = nextPick >= draft.getTotalPicks();

        int updated = completes
                ? draftRepository.advancePickAndComplete(draftId, expectedPick, nextPick, nextRound, now)
                : draftRepository.advancePick(draftId, expectedPick, nextPick, nextRound, now);
        if (updated == 0) {
            log.warn("⚠️ [DraftPick] Lost race on draft {} at pick {}", draftId, expectedPick);
            throw new ConcurrencyConflictException(
                    "Draft " + draftId + " changed while applying pick " + nextPick);
        }

        DraftTimer timer = timerRepository.findById(draftId).orElseGet(() -> DraftTimer.forDraft(draftId));

        DraftPick pick = DraftPick.builder()
                .id(newPickId())
                .draftId(draftId)
                .roundNumber(turnResolver.roundOf(expectedPick, participantCount))
                .pickNumber(nextPick)
                .participantId(participantId)
                .resourceId(resourceId)
                .claimedResourceId(skipped ? null : resourceId)
                .skipped(skipped)
                .pickedAt(now)
                .elapsedSeconds(timer.elapsedSeconds(now))
                .build();
        try {
            pickRepository.saveAndFlush(pick);
        } catch (DataIntegrityViolationException e) {
            log.warn("⚠️ [DraftPick] Duplicate pick rejected for draft {} pick {}", draftId, nextPick);
            throw new ConcurrencyConflictException("Pick " + nextPick + " of draft " + draftId + " already exists", e);
        }

        Instant nextDeadline = null;
        String nextPicker = null;
        if (completes) {
            timer.clear();
        } else {
            DraftSettingsDTO settings = settingsService.getForPool(draft.getPoolId());
            nextDeadline = deadlinePolicy.nextDeadline(now, settings, nextPick, participantCount);
            timer.startTurn(nextDeadline, now);
            nextPicker = turnResolver.participantAt(draft.getDraftOrder(), nextPick);
        }
        try {
            timerRepository.saveAndFlush(timer);
        } catch (OptimisticLockingFailureException e) {
            log.warn("⚠️ [DraftPick] Timer of draft {} changed concurrently at pick {}", draftId, nextPick);
            throw new ConcurrencyConflictException("Timer of draft " + draftId + " changed while applying pick", e);
        }

        Draft updatedDraft = loadDraft(draftId);

        if (skipped) {
            log.info("⏭️ [DraftPick] Draft {} pick {} skipped for {}", draftId, nextPick, participantId);
        } else {
            log.info("✅ [DraftPick] Draft {} pick {}: {} took {}", draftId, nextPick, participantId, resourceId);
        }
        if (completes) {
            log.info("🏁 [DraftPick] Draft {} completed after {} picks", draftId, nextPick);
        }

        return new PickResult(pick, updatedDraft, nextPicker, nextDeadline, completes);
    }

    private Draft loadDraft(String draftId) {
        return draftRepository.findById(draftId)
                .orElseThrow(() -> DraftNotFoundException.draft(draftId));
    }

    private void requireInProgress(Draft draft) {
        if (draft.getStatus() != DraftStatus.IN_PROGRESS) {
            throw new InvalidDraftStateException(
                    "Draft " + draft.getId() + " is " + draft.getStatus() + ", picks need IN_PROGRESS");
        }
    }

    private String currentPicker(Draft draft) {
        return turnResolver.whoseTurn(draft)
                .orElseThrow(() -> new InvalidDraftStateException("Draft " + draft.getId() + " has no open turn"));
    }

    private static String newPickId() {
        return "pick_" + UUID.randomUUID().toString().replace("-", "");
    }
}
