package com.thevig.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a draft as shown to participants.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftStatusDTO {
    private DraftDTO draft;
    private String currentPicker;
    private Instant deadline;
    private Long remainingSeconds;
    private String remainingFormatted;
    private boolean timedOut;
    private List<DraftPickDTO> picks;
    private List<AvailableResourceDTO> availableResources;
    // participant id -> picked resource ids, skips excluded
    private Map<String, List<String>> rosters;
    private DraftSettingsDTO settings;
}
