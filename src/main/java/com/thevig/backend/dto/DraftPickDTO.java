package com.thevig.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftPickDTO {
    private String id;
    private String draftId;
    private int roundNumber;
    private int pickNumber;
    private String participantId;
    private String resourceId;
    private String resourceName;
    private boolean skipped;
    private Instant pickedAt;
    private Long elapsedSeconds;
}
