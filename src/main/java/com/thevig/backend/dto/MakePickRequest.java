package com.thevig.backend.dto;

import jakarta.validation.constraints.NotBlank;

public record MakePickRequest(@NotBlank(message = "resourceId is required") String resourceId) {
}
