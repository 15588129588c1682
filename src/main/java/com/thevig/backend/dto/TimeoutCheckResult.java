package com.thevig.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TimeoutCheckResult {
    private String draftId;
    private boolean skipped;
    private boolean reminderSent;
    private String skippedParticipantId;
    private Long remainingSeconds;

    public static TimeoutCheckResult noop(String draftId, Long remainingSeconds) {
        return TimeoutCheckResult.builder()
                .draftId(draftId)
                .remainingSeconds(remainingSeconds)
                .build();
    }
}
