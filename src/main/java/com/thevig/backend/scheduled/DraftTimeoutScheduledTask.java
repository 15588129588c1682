package com.thevig.backend.scheduled;

import com.thevig.backend.domain.entity.DraftStatus;
import com.thevig.backend.domain.repository.DraftRepository;
import com.thevig.backend.dto.TimeoutCheckResult;
import com.thevig.backend.service.DraftTimeoutMonitor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Periodic trigger for {@link DraftTimeoutMonitor}. Disable with
 * {@code app.draft.timeout-sweep.enabled=false} when an external cron calls the
 * timeout-check endpoint instead.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "app.draft.timeout-sweep", name = "enabled", havingValue = "true", matchIfMissing = true)
public class DraftTimeoutScheduledTask {

    private final DraftRepository draftRepository;
    private final DraftTimeoutMonitor timeoutMonitor;

    @Scheduled(fixedDelayString = "${app.draft.timeout-sweep.fixed-delay-ms:60000}",
            initialDelayString = "${app.draft.timeout-sweep.initial-delay-ms:15000}")
    public void sweep() {
        List<String> draftIds;
        try {
            draftIds = draftRepository.findIdsByStatus(DraftStatus.IN_PROGRESS);
        } catch (Exception e) {
            log.error("❌ [DraftTimeout] Could not list drafts in progress", e);
            return;
        }
        if (draftIds.isEmpty()) {
            return;
        }

        int skipped = 0;
        int reminded = 0;
        for (String draftId : draftIds) {
            try {
                TimeoutCheckResult result = timeoutMonitor.checkAndHandleTimeout(draftId);
                if (result.isSkipped()) {
                    skipped++;
                }
                if (result.isReminderSent()) {
                    reminded++;
                }
            } catch (Exception e) {
                log.error("❌ [DraftTimeout] Timeout check failed for draft {}", draftId, e);
            }
        }

        if (skipped > 0 || reminded > 0) {
            log.info("⏰ [DraftTimeout] Sweep over {} drafts: {} skipped, {} reminded",
                    draftIds.size(), skipped, reminded);
        } else {
            log.debug("[DraftTimeout] Sweep over {} drafts, nothing due", draftIds.size());
        }
    }
}
