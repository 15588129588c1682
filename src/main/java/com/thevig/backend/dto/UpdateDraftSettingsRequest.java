package com.thevig.backend.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.PositiveOrZero;

/**
 * Partial settings update; null fields keep their current value.
 */
public record UpdateDraftSettingsRequest(
        @Min(value = 1, message = "pickTimeSeconds must be positive") Integer pickTimeSeconds,
        @PositiveOrZero(message = "reminderMinutes must not be negative") Integer reminderMinutes,
        Boolean autoSkipEnabled,
        @PositiveOrZero(message = "autoSkipAfterSeconds must not be negative") Integer autoSkipAfterSeconds,
        @PositiveOrZero(message = "breakBetweenRoundsSeconds must not be negative") Integer breakBetweenRoundsSeconds) {
}
