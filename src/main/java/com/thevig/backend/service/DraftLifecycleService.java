package com.thevig.backend.service;

import com.thevig.backend.config.AppProperties;
import com.thevig.backend.domain.entity.Draft;
import com.thevig.backend.domain.entity.DraftStatus;
import com.thevig.backend.domain.entity.DraftTimer;
import com.thevig.backend.domain.repository.DraftRepository;
import com.thevig.backend.domain.repository.DraftTimerRepository;
import com.thevig.backend.draft.ParticipantOrderGenerator;
import com.thevig.backend.draft.SnakeTurnResolver;
import com.thevig.backend.dto.DraftDTO;
import com.thevig.backend.dto.DraftSettingsDTO;
import com.thevig.backend.exception.ConcurrencyConflictException;
import com.thevig.backend.exception.DraftNotFoundException;
import com.thevig.backend.exception.InvalidDraftStateException;
import com.thevig.backend.mapper.DraftMapper;
import com.thevig.backend.util.TransactionCallbacks;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

/**
 * Draft state machine:
 * PENDING -> IN_PROGRESS <-> PAUSED, and IN_PROGRESS/PAUSED -> COMPLETED.
 * Every transition is a conditional update on the current status; a
 * transition that loses to a concurrent one fails with a conflict.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftLifecycleService {

    private static final int MIN_PARTICIPANTS_TO_START = 2;

    private final DraftRepository draftRepository;
    private final DraftTimerRepository timerRepository;
    private final DraftSettingsService settingsService;
    private final ParticipantOrderGenerator orderGenerator;
    private final SnakeTurnResolver turnResolver;
    private final DraftNotificationService notificationService;
    private final DraftMapper draftMapper;
    private final AppProperties appProperties;
    private final Clock clock;

    @Transactional
    public DraftDTO createDraft(String poolId, int totalRounds, List<String> participantIds, String creatorId) {
        if (poolId == null || poolId.isBlank()) {
            throw new IllegalArgumentException("poolId is required");
        }
        int maxRounds = appProperties.getDraft().getMaxRounds();
        if (totalRounds < 1 || totalRounds > maxRounds) {
            throw new IllegalArgumentException("totalRounds must be between 1 and " + maxRounds);
        }
        if (draftRepository.existsByPoolId(poolId)) {
            throw new InvalidDraftStateException("Pool " + poolId + " already has a draft");
        }

        List<String> order = orderGenerator.generate(participantIds);
        Instant now = clock.instant();

        Draft draft = Draft.builder()
                .id(newDraftId(now))
                .poolId(poolId)
                .status(DraftStatus.PENDING)
                .currentPick(0)
                .currentRound(1)
                .totalRounds(totalRounds)
                .totalPicks(totalRounds * order.size())
                .draftOrder(order)
                .createdBy(creatorId)
                .createdAt(now)
                .build();
        try {
            draft = draftRepository.saveAndFlush(draft);
        } catch (DataIntegrityViolationException e) {
            log.warn("⚠️ [DraftLifecycle] Concurrent draft creation for pool {}", poolId);
            throw new InvalidDraftStateException("Pool " + poolId + " already has a draft");
        }

        settingsService.ensureDefaults(poolId);
        timerRepository.save(DraftTimer.forDraft(draft.getId()));

        log.info("✅ [DraftLifecycle] Draft {} created for pool {}: {} participants x {} rounds",
                draft.getId(), poolId, order.size(), totalRounds);
        return draftMapper.toDto(draft);
    }

    @Transactional
    public DraftDTO startDraft(String draftId) {
        Draft draft = loadDraft(draftId);
        requireStatus(draft, DraftStatus.PENDING, "start");
        if (draft.participantCount() < MIN_PARTICIPANTS_TO_START) {
            throw new InvalidDraftStateException(
                    "Draft " + draftId + " needs at least " + MIN_PARTICIPANTS_TO_START + " participants to start");
        }

        Instant now = clock.instant();
        if (draftRepository.markStarted(draftId, now) == 0) {
            throw conflict(draftId, "start");
        }

        DraftSettingsDTO settings = settingsService.getForPool(draft.getPoolId());
        Instant deadline = now.plusSeconds(settings.getPickTimeSeconds());
        DraftTimer timer = loadTimer(draftId);
        timer.startTurn(deadline, now);
        saveTimer(timer, "start");

        Draft started = loadDraft(draftId);
        String firstPicker = turnResolver.whoseTurn(started).orElse(null);
        log.info("🚀 [DraftLifecycle] Draft {} started, {} picks first (deadline {})",
                draftId, firstPicker, deadline);

        TransactionCallbacks.afterCommit(() -> notificationService.draftStarted(started, firstPicker, deadline));
        return draftMapper.toDto(started);
    }

    @Transactional
    public DraftDTO pauseDraft(String draftId) {
        Draft draft = loadDraft(draftId);
        requireStatus(draft, DraftStatus.IN_PROGRESS, "pause");

        Instant now = clock.instant();
        if (draftRepository.transitionStatus(draftId, DraftStatus.IN_PROGRESS, DraftStatus.PAUSED, now) == 0) {
            throw conflict(draftId, "pause");
        }

        DraftTimer timer = loadTimer(draftId);
        timer.pause(now);
        saveTimer(timer, "pause");
        Long remaining = timer.getPausedRemainingSeconds();

        Draft paused = loadDraft(draftId);
        log.info("⏸️ [DraftLifecycle] Draft {} paused with {}s remaining", draftId, remaining);

        TransactionCallbacks.afterCommit(() -> notificationService.draftPaused(paused, remaining));
        return draftMapper.toDto(paused);
    }

    @Transactional
    public DraftDTO resumeDraft(String draftId) {
        Draft draft = loadDraft(draftId);
        requireStatus(draft, DraftStatus.PAUSED, "resume");

        Instant now = clock.instant();
        if (draftRepository.transitionStatus(draftId, DraftStatus.PAUSED, DraftStatus.IN_PROGRESS, now) == 0) {
            throw conflict(draftId, "resume");
        }

        DraftSettingsDTO settings = settingsService.getForPool(draft.getPoolId());
        DraftTimer timer = loadTimer(draftId);
        Instant deadline = timer.resume(now, settings.getPickTimeSeconds());
        saveTimer(timer, "resume");

        Draft resumed = loadDraft(draftId);
        String currentPicker = turnResolver.whoseTurn(resumed).orElse(null);
        log.info("▶️ [DraftLifecycle] Draft {} resumed, {} to pick by {}", draftId, currentPicker, deadline);

        TransactionCallbacks.afterCommit(() -> notificationService.draftResumed(resumed, currentPicker, deadline));
        return draftMapper.toDto(resumed);
    }

    /**
     * Ends the draft early. Picks made so far are kept; no further picks are
     * accepted.
     */
    @Transactional
    public DraftDTO completeDraft(String draftId) {
        Draft draft = loadDraft(draftId);
        if (draft.getStatus() != DraftStatus.IN_PROGRESS && draft.getStatus() != DraftStatus.PAUSED) {
            throw new InvalidDraftStateException(
                    "Cannot complete draft " + draftId + " while it is " + draft.getStatus());
        }

        Instant now = clock.instant();
        if (draftRepository.markCompleted(draftId, EnumSet.of(DraftStatus.IN_PROGRESS, DraftStatus.PAUSED), now) == 0) {
            throw conflict(draftId, "complete");
        }

        DraftTimer timer = loadTimer(draftId);
        timer.clear();
        saveTimer(timer, "complete");

        Draft completed = loadDraft(draftId);
        log.info("🏁 [DraftLifecycle] Draft {} completed by force at pick {}/{}",
                draftId, completed.getCurrentPick(), completed.getTotalPicks());

        TransactionCallbacks.afterCommit(() -> notificationService.draftCompleted(completed));
        return draftMapper.toDto(completed);
    }

    private Draft loadDraft(String draftId) {
        return draftRepository.findById(draftId)
                .orElseThrow(() -> DraftNotFoundException.draft(draftId));
    }

    private DraftTimer loadTimer(String draftId) {
        return timerRepository.findById(draftId).orElseGet(() -> DraftTimer.forDraft(draftId));
    }

    /**
     * Writes the timer, failing with a conflict when a pick committed a newer
     * turn since it was read.
     */
    private void saveTimer(DraftTimer timer, String action) {
        try {
            timerRepository.saveAndFlush(timer);
        } catch (OptimisticLockingFailureException e) {
            log.warn("⚠️ [DraftLifecycle] Timer of draft {} changed while trying to {}", timer.getDraftId(), action);
            throw new ConcurrencyConflictException(
                    "Draft " + timer.getDraftId() + " changed while trying to " + action, e);
        }
    }

    private static void requireStatus(Draft draft, DraftStatus expected, String action) {
        if (draft.getStatus() != expected) {
            throw new InvalidDraftStateException(
                    "Cannot " + action + " draft " + draft.getId() + " while it is " + draft.getStatus());
        }
    }

    private static ConcurrencyConflictException conflict(String draftId, String action) {
        log.warn("⚠️ [DraftLifecycle] Concurrent update while trying to {} draft {}", action, draftId);
        return new ConcurrencyConflictException("Draft " + draftId + " changed while trying to " + action);
    }

    private static String newDraftId(Instant now) {
        return "draft_" + now.toEpochMilli() + "_" + UUID.randomUUID().toString().substring(0, 8);
    }
}
