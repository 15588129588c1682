package com.thevig.backend.service;

import com.thevig.backend.domain.entity.Draft;
import com.thevig.backend.domain.entity.DraftPick;
import com.thevig.backend.dto.events.DraftEvent;
import com.thevig.backend.notification.DraftNotificationType;
import com.thevig.backend.notification.NotificationSink;
import com.thevig.backend.util.DraftTimeFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;

/**
 * Decides who hears about a committed draft change and hands each message to
 * the {@link NotificationSink}; the same change goes out as a {@link DraftEvent}.
 * Only called after the change is committed. Delivery failures are logged.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftNotificationService {

    private final NotificationSink notificationSink;
    private final DraftBroadcastService broadcastService;
    private final Clock clock;

    public void draftStarted(Draft draft, String firstPicker, Instant deadline) {
        Map<String, Object> payload = basePayload(draft);
        payload.put("firstPicker", firstPicker);
        payload.put("deadline", deadline);
        notifyAll(draft, DraftNotificationType.DRAFT_STARTED, payload);
        if (firstPicker != null) {
            yourTurn(draft, firstPicker, deadline);
        }
        broadcastService.publish(eventFor(DraftNotificationType.DRAFT_STARTED, draft, firstPicker, deadline)
                .build());
    }

    public void pickCommitted(PickResult result) {
        Draft draft = result.draft();
        DraftPick pick = result.pick();

        Map<String, Object> payload = basePayload(draft);
        payload.put("pickNumber", pick.getPickNumber());
        payload.put("round", pick.getRoundNumber());
        payload.put("participantId", pick.getParticipantId());

        DraftNotificationType type;
        if (pick.isSkipped()) {
            type = DraftNotificationType.PICK_SKIPPED;
            deliver(pick.getParticipantId(), type, payload);
        } else {
            type = DraftNotificationType.PICK_MADE;
            payload.put("resourceId", pick.getResourceId());
            notifyAll(draft, type, payload);
        }

        broadcastService.publish(eventFor(type, draft, result.nextPicker(), result.nextDeadline())
                .participantId(pick.getParticipantId())
                .resourceId(pick.isSkipped() ? null : pick.getResourceId())
                .pickNumber(pick.getPickNumber())
                .build());

        if (result.completed()) {
            draftCompleted(draft);
        } else if (result.nextPicker() != null) {
            yourTurn(draft, result.nextPicker(), result.nextDeadline());
        }
    }

    public void draftPaused(Draft draft, Long remainingSeconds) {
        Map<String, Object> payload = basePayload(draft);
        payload.put("remainingSeconds", remainingSeconds);
        notifyAll(draft, DraftNotificationType.DRAFT_PAUSED, payload);
        broadcastService.publish(eventFor(DraftNotificationType.DRAFT_PAUSED, draft, null, null).build());
    }

    public void draftResumed(Draft draft, String currentPicker, Instant deadline) {
        Map<String, Object> payload = basePayload(draft);
        payload.put("currentPicker", currentPicker);
        payload.put("deadline", deadline);
        notifyAll(draft, DraftNotificationType.DRAFT_RESUMED, payload);
        broadcastService.publish(eventFor(DraftNotificationType.DRAFT_RESUMED, draft, currentPicker, deadline)
                .build());
    }

    public void draftCompleted(Draft draft) {
        notifyAll(draft, DraftNotificationType.DRAFT_COMPLETED, basePayload(draft));
        broadcastService.publish(eventFor(DraftNotificationType.DRAFT_COMPLETED, draft, null, null).build());
    }

    public void reminder(Draft draft, String participantId, Instant deadline, long remainingSeconds) {
        Map<String, Object> payload = basePayload(draft);
        payload.put("deadline", deadline);
        payload.put("remainingSeconds", remainingSeconds);
        payload.put("remainingHours", remainingSeconds / 3600);
        payload.put("remainingFormatted", DraftTimeFormatter.format(remainingSeconds));
        deliver(participantId, DraftNotificationType.REMINDER, payload);
    }

    private void yourTurn(Draft draft, String participantId, Instant deadline) {
        Map<String, Object> payload = basePayload(draft);
        payload.put("deadline", deadline);
        payload.put("pickNumber", draft.getCurrentPick() + 1);
        deliver(participantId, DraftNotificationType.YOUR_TURN, payload);
    }

    private void notifyAll(Draft draft, DraftNotificationType type, Map<String, Object> payload) {
        for (String participantId : draft.getDraftOrder()) {
            deliver(participantId, type, payload);
        }
    }

    private void deliver(String participantId, DraftNotificationType type, Map<String, Object> payload) {
        try {
            notificationSink.send(participantId, type, payload);
        } catch (Exception e) {
            log.error("❌ [Notification] Failed to deliver {} to {} for draft {}",
                    type, participantId, payload.get("draftId"), e);
        }
    }

    private Map<String, Object> basePayload(Draft draft) {
        Map<String, Object> payload = new HashMap<>();
        payload.put("draftId", draft.getId());
        payload.put("poolId", draft.getPoolId());
        payload.put("status", draft.getStatus().name());
        return payload;
    }

    private DraftEvent.DraftEventBuilder eventFor(DraftNotificationType type, Draft draft,
            String currentPicker, Instant deadline) {
        return DraftEvent.builder()
                .eventType(type.channelSuffix())
                .timestamp(clock.instant())
                .draftId(draft.getId())
                .poolId(draft.getPoolId())
                .status(draft.getStatus().name())
                .currentPick(draft.getCurrentPick())
                .totalPicks(draft.getTotalPicks())
                .currentRound(draft.getCurrentRound())
                .currentPicker(currentPicker)
                .deadline(deadline);
    }
}
