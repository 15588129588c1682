package com.thevig.backend.dto;

import com.thevig.backend.domain.entity.DraftStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftDTO {
    private String id;
    private String poolId;
    private DraftStatus status;
    private int currentPick;
    private int currentRound;
    private int totalRounds;
    private int totalPicks;
    private int participantCount;
    private List<String> draftOrder;
    private String createdBy;
    private Instant createdAt;
    private Instant startedAt;
    private Instant completedAt;
}
