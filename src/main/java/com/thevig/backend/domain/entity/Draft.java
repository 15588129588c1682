package com.thevig.backend.domain.entity;

import com.thevig.backend.domain.converter.StringListJsonConverter;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.List;

@Entity
@Table(name = "drafts",
        uniqueConstraints = @UniqueConstraint(name = "uk_drafts_pool", columnNames = "pool_id"),
        indexes = @Index(name = "idx_drafts_status", columnList = "status"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Draft {
    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "pool_id", nullable = false, length = 64)
    private String poolId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private DraftStatus status;

    // Number of committed picks; the only source for whose turn it is
    @Column(name = "current_pick", nullable = false)
    private int currentPick;

    @Column(name = "current_round", nullable = false)
    private int currentRound;

    @Column(name = "total_rounds", nullable = false)
    private int totalRounds;

    @Column(name = "total_picks", nullable = false)
    private int totalPicks;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "draft_order", columnDefinition = "TEXT", nullable = false, updatable = false)
    private List<String> draftOrder;

    @Column(name = "created_by", length = 64)
    private String createdBy;

    @Column(name = "created_at")
    private Instant createdAt;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @Column(name = "started_at")
    private Instant startedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @PrePersist
    public void prePersist() {
        Instant now = Instant.now();
        if (createdAt == null)
            createdAt = now;
        updatedAt = now;
        if (status == null)
            status = DraftStatus.PENDING;
        if (currentRound == 0)
            currentRound = 1;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = Instant.now();
    }

    public int participantCount() {
        return draftOrder == null ? 0 : draftOrder.size();
    }

    public boolean isFinished() {
        return status == DraftStatus.COMPLETED || currentPick >= totalPicks;
    }
}
