package com.thevig.backend.controller;

import com.thevig.backend.dto.DraftSettingsDTO;
import com.thevig.backend.dto.UpdateDraftSettingsRequest;
import com.thevig.backend.service.DraftSettingsService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/draft-settings")
@RequiredArgsConstructor
public class DraftSettingsController {

    private final DraftSettingsService settingsService;

    @GetMapping("/{poolId}")
    public ResponseEntity<DraftSettingsDTO> getSettings(@PathVariable String poolId) {
        return ResponseEntity.ok(settingsService.getForPool(poolId));
    }

    @PutMapping("/{poolId}")
    public ResponseEntity<DraftSettingsDTO> updateSettings(
            @PathVariable String poolId,
            @Valid @RequestBody UpdateDraftSettingsRequest request) {
        return ResponseEntity.ok(settingsService.update(poolId, request));
    }
}
