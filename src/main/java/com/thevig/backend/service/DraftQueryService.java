package com.thevig.backend.service;

import com.thevig.backend.catalog.CatalogResource;
import com.thevig.backend.catalog.ResourceCatalog;
import com.thevig.backend.domain.entity.Draft;
import com.thevig.backend.domain.entity.DraftPick;
import com.thevig.backend.domain.entity.DraftTimer;
import com.thevig.backend.domain.repository.DraftPickRepository;
import com.thevig.backend.domain.repository.DraftRepository;
import com.thevig.backend.domain.repository.DraftTimerRepository;
import com.thevig.backend.draft.SnakeTurnResolver;
import com.thevig.backend.dto.AvailableResourceDTO;
import com.thevig.backend.dto.DraftDTO;
import com.thevig.backend.dto.DraftPickDTO;
import com.thevig.backend.dto.DraftStatusDTO;
import com.thevig.backend.exception.DraftNotFoundException;
import com.thevig.backend.mapper.DraftMapper;
import com.thevig.backend.util.DraftTimeFormatter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DraftQueryService {

    private final DraftRepository draftRepository;
    private final DraftPickRepository pickRepository;
    private final DraftTimerRepository timerRepository;
    private final ResourceCatalog resourceCatalog;
    private final DraftSettingsService settingsService;
    private final SnakeTurnResolver turnResolver;
    private final DraftMapper draftMapper;
    private final Clock clock;

    public DraftDTO getDraft(String draftId) {
        return draftMapper.toDto(loadDraft(draftId));
    }

    public DraftDTO getDraftByPool(String poolId) {
        return draftRepository.findByPoolId(poolId)
                .map(draftMapper::toDto)
                .orElseThrow(() -> new DraftNotFoundException("No draft for pool " + poolId));
    }

    public List<DraftPickDTO> getPicksByParticipant(String draftId, String participantId) {
        Draft draft = loadDraft(draftId);
        Map<String, CatalogResource> catalog = catalogById(draft.getPoolId());
        return pickRepository.findByDraftIdAndParticipantIdOrderByPickNumberAsc(draftId, participantId).stream()
                .map(pick -> toPickDto(pick, catalog))
                .toList();
    }

    /**
     * Full picture of a draft: whose turn it is, time left, picks so far, what
     * is still available and what every participant holds.
     */
    public DraftStatusDTO getStatus(String draftId) {
        Draft draft = loadDraft(draftId);
        List<DraftPick> picks = pickRepository.findByDraftIdOrderByPickNumberAsc(draftId);
        List<CatalogResource> resources = resourceCatalog.listResources(draft.getPoolId());
        Map<String, CatalogResource> catalog = resources.stream()
                .collect(Collectors.toMap(CatalogResource::id, Function.identity(), (a, b) -> a));

        Set<String> taken = picks.stream()
                .filter(pick -> !pick.isSkipped())
                .map(DraftPick::getResourceId)
                .collect(Collectors.toSet());
        List<AvailableResourceDTO> available = resources.stream()
                .filter(resource -> !taken.contains(resource.id()))
                .map(resource -> AvailableResourceDTO.builder()
                        .id(resource.id())
                        .name(resource.name())
                        .abbreviation(resource.abbreviation())
                        .build())
                .toList();

        Map<String, List<String>> rosters = new LinkedHashMap<>();
        draft.getDraftOrder().forEach(participant -> rosters.put(participant, new ArrayList<>()));
        picks.stream()
                .filter(pick -> !pick.isSkipped())
                .forEach(pick -> rosters.computeIfAbsent(pick.getParticipantId(), k -> new ArrayList<>())
                        .add(pick.getResourceId()));

        Instant deadline = timerRepository.findById(draftId).map(DraftTimer::getDeadline).orElse(null);
        Long remaining = null;
        boolean timedOut = false;
        if (deadline != null) {
            long seconds = Duration.between(clock.instant(), deadline).getSeconds();
            timedOut = seconds < 0;
            remaining = Math.max(0L, seconds);
        }

        return DraftStatusDTO.builder()
                .draft(draftMapper.toDto(draft))
                .currentPicker(turnResolver.whoseTurn(draft).orElse(null))
                .deadline(deadline)
                .remainingSeconds(remaining)
                .remainingFormatted(DraftTimeFormatter.format(remaining))
                .timedOut(timedOut)
                .picks(picks.stream().map(pick -> toPickDto(pick, catalog)).toList())
                .availableResources(available)
                .rosters(rosters)
                .settings(settingsService.getForPool(draft.getPoolId()))
                .build();
    }

    private DraftPickDTO toPickDto(DraftPick pick, Map<String, CatalogResource> catalog) {
        DraftPickDTO dto = draftMapper.toDto(pick);
        CatalogResource resource = catalog.get(pick.getResourceId());
        if (resource != null) {
            dto.setResourceName(resource.name());
        }
        return dto;
    }

    private Map<String, CatalogResource> catalogById(String poolId) {
        return resourceCatalog.listResources(poolId).stream()
                .collect(Collectors.toMap(CatalogResource::id, Function.identity(), (a, b) -> a));
    }

    private Draft loadDraft(String draftId) {
        return draftRepository.findById(draftId)
                .orElseThrow(() -> DraftNotFoundException.draft(draftId));
    }
}
