package com.thevig.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Table(name = "draft_picks",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_draft_picks_number", columnNames = { "draft_id", "pick_number" }),
                @UniqueConstraint(name = "uk_draft_picks_round_number",
                        columnNames = { "draft_id", "round_number", "pick_number" }),
                @UniqueConstraint(name = "uk_draft_picks_claimed_resource",
                        columnNames = { "draft_id", "claimed_resource_id" })
        },
        indexes = {
                @Index(name = "idx_draft_picks_participant", columnList = "draft_id, participant_id"),
                @Index(name = "idx_draft_picks_resource", columnList = "resource_id")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class DraftPick {

    /**
     * Resource id recorded for a turn that was skipped instead of picked.
     */
    public static final String SKIPPED_RESOURCE = "skipped";

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "draft_id", nullable = false, length = 64)
    private String draftId;

    @Column(name = "round_number", nullable = false)
    private int roundNumber;

    // 1-based, contiguous per draft
    @Column(name = "pick_number", nullable = false)
    private int pickNumber;

    @Column(name = "participant_id", nullable = false, length = 64)
    private String participantId;

    @Column(name = "resource_id", nullable = false, length = 64)
    private String resourceId;

    // Same as resourceId for real picks, null for skips; backs the one-owner-per-resource constraint
    @Column(name = "claimed_resource_id", length = 64)
    private String claimedResourceId;

    @Column(nullable = false)
    private boolean skipped;

    @Column(name = "picked_at", nullable = false)
    private Instant pickedAt;

    @Column(name = "elapsed_seconds")
    private Long elapsedSeconds;

    public static boolean isSkipResource(String resourceId) {
        return SKIPPED_RESOURCE.equals(resourceId);
    }
}
