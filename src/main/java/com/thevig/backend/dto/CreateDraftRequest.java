package com.thevig.backend.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

public record CreateDraftRequest(
        @NotBlank(message = "poolId is required") String poolId,
        @Min(value = 1, message = "totalRounds must be at least 1")
        @Max(value = 50, message = "totalRounds must be at most 50") int totalRounds,
        @NotEmpty(message = "participantIds must not be empty") List<String> participantIds) {
}
