package com.thevig.backend.controller;

import com.thevig.backend.dto.CreateDraftRequest;
import com.thevig.backend.dto.DraftDTO;
import com.thevig.backend.dto.DraftPickDTO;
import com.thevig.backend.dto.DraftStatusDTO;
import com.thevig.backend.dto.MakePickRequest;
import com.thevig.backend.dto.TimeoutCheckResult;
import com.thevig.backend.service.DraftLifecycleService;
import com.thevig.backend.service.DraftPickService;
import com.thevig.backend.service.DraftQueryService;
import com.thevig.backend.service.DraftTimeoutMonitor;
import com.thevig.backend.util.ParticipantAuthUtil;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/drafts")
@RequiredArgsConstructor
public class DraftController {

    private final DraftLifecycleService lifecycleService;
    private final DraftPickService pickService;
    private final DraftQueryService queryService;
    private final DraftTimeoutMonitor timeoutMonitor;

    @PostMapping
    public ResponseEntity<DraftDTO> createDraft(
            @Valid @RequestBody CreateDraftRequest request,
            HttpServletRequest httpRequest) {
        String creatorId = ParticipantAuthUtil.getParticipantIdFromRequestOptional(httpRequest);
        log.info("📋 [{}] Creating draft for pool {}", creatorId, request.poolId());
        DraftDTO draft = lifecycleService.createDraft(
                request.poolId(), request.totalRounds(), request.participantIds(), creatorId);
        return ResponseEntity.status(HttpStatus.CREATED).body(draft);
    }

    @PostMapping("/{draftId}/start")
    public ResponseEntity<DraftDTO> startDraft(@PathVariable String draftId) {
        return ResponseEntity.ok(lifecycleService.startDraft(draftId));
    }

    @PostMapping("/{draftId}/pause")
    public ResponseEntity<DraftDTO> pauseDraft(@PathVariable String draftId) {
        return ResponseEntity.ok(lifecycleService.pauseDraft(draftId));
    }

    @PostMapping("/{draftId}/resume")
    public ResponseEntity<DraftDTO> resumeDraft(@PathVariable String draftId) {
        return ResponseEntity.ok(lifecycleService.resumeDraft(draftId));
    }

    @PostMapping("/{draftId}/complete")
    public ResponseEntity<DraftDTO> completeDraft(@PathVariable String draftId) {
        return ResponseEntity.ok(lifecycleService.completeDraft(draftId));
    }

    @PostMapping("/{draftId}/pick")
    public ResponseEntity<DraftPickDTO> makePick(
            @PathVariable String draftId,
            @Valid @RequestBody MakePickRequest request,
            HttpServletRequest httpRequest) {
        String participantId = ParticipantAuthUtil.getParticipantIdFromRequest(httpRequest);
        DraftPickDTO pick = pickService.makePick(draftId, participantId, request.resourceId().trim());
        return ResponseEntity.status(HttpStatus.CREATED).body(pick);
    }

    @PostMapping("/{draftId}/force-skip")
    public ResponseEntity<DraftPickDTO> forceSkip(@PathVariable String draftId) {
        return ResponseEntity.status(HttpStatus.CREATED).body(pickService.forceSkip(draftId));
    }

    @GetMapping("/{draftId}")
    public ResponseEntity<DraftDTO> getDraft(@PathVariable String draftId) {
        return ResponseEntity.ok(queryService.getDraft(draftId));
    }

    @GetMapping("/{draftId}/status")
    public ResponseEntity<DraftStatusDTO> getStatus(@PathVariable String draftId) {
        return ResponseEntity.ok(queryService.getStatus(draftId));
    }

    @GetMapping("/by-pool/{poolId}")
    public ResponseEntity<DraftDTO> getDraftByPool(@PathVariable String poolId) {
        return ResponseEntity.ok(queryService.getDraftByPool(poolId));
    }

    @GetMapping("/{draftId}/picks")
    public ResponseEntity<List<DraftPickDTO>> getPicksByParticipant(
            @PathVariable String draftId,
            @RequestParam String participantId) {
        return ResponseEntity.ok(queryService.getPicksByParticipant(draftId, participantId));
    }

    /**
     * Hook for an external cron; safe to call as often as wanted.
     */
    @PostMapping("/{draftId}/timeout-check")
    public ResponseEntity<TimeoutCheckResult> checkTimeout(@PathVariable String draftId) {
        return ResponseEntity.ok(timeoutMonitor.checkAndHandleTimeout(draftId));
    }
}
