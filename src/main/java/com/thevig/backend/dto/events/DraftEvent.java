package com.thevig.backend.dto.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Draft state change published for the standings broadcast.
 *
 * Redis channels:
 * - draft:draft_started
 * - draft:pick_made / draft:pick_skipped
 * - draft:draft_paused / draft:draft_resumed
 * - draft:draft_completed
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * Event type, also the channel suffix
     */
    private String eventType;

    private Instant timestamp;

    private String draftId;

    private String poolId;

    private String status;

    /**
     * Number of committed picks after the change
     */
    private Integer currentPick;

    private Integer totalPicks;

    private Integer currentRound;

    /**
     * Participant whose turn it is now, null once completed
     */
    private String currentPicker;

    /**
     * Participant that acted (pick events only)
     */
    private String participantId;

    private String resourceId;

    private Integer pickNumber;

    private Instant deadline;
}
