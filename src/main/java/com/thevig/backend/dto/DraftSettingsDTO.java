package com.thevig.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DraftSettingsDTO implements Serializable {

    private static final long serialVersionUID = 1L;

    private String poolId;
    private int pickTimeSeconds;
    private int reminderMinutes;
    private boolean autoSkipEnabled;
    private int autoSkipAfterSeconds;
    private int breakBetweenRoundsSeconds;
}
