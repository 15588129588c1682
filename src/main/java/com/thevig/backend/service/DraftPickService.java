package com.thevig.backend.service;

import com.thevig.backend.dto.DraftPickDTO;
import com.thevig.backend.mapper.DraftMapper;
import com.thevig.backend.service.lock.DraftLockService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Entry point for picks and skips: takes the draft lock, commits through
 * {@link PickApplier} and notifies once the transaction is done.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftPickService {

    private final DraftLockService lockService;
    private final PickApplier pickApplier;
    private final DraftNotificationService notificationService;
    private final DraftMapper draftMapper;

    public DraftPickDTO makePick(String draftId, String participantId, String resourceId) {
        PickResult result = lockService.withDraftLock(draftId,
                () -> pickApplier.applyPick(draftId, participantId, resourceId));
        notificationService.pickCommitted(result);
        return draftMapper.toDto(result.pick());
    }

    public DraftPickDTO forceSkip(String draftId) {
        log.info("🔧 [DraftPick] Forcing skip on draft {}", draftId);
        PickResult result = lockService.withDraftLock(draftId, () -> pickApplier.applyForcedSkip(draftId));
        notificationService.pickCommitted(result);
        return draftMapper.toDto(result.pick());
    }

    public PickResult skipOnTimeout(String draftId, int expectedPick, Instant expectedDeadline) {
        PickResult result = lockService.withDraftLock(draftId,
                () -> pickApplier.skipCurrentTurn(draftId, expectedPick, expectedDeadline));
        notificationService.pickCommitted(result);
        return result;
    }
}
