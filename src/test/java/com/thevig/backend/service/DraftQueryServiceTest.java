package com.thevig.backend.service;

import com.thevig.backend.catalog.CatalogResource;
import com.thevig.backend.catalog.ResourceCatalog;
import com.thevig.backend.domain.entity.DraftPick;
import com.thevig.backend.domain.entity.DraftStatus;
import com.thevig.backend.domain.entity.DraftTimer;
import com.thevig.backend.domain.repository.DraftPickRepository;
import com.thevig.backend.domain.repository.DraftRepository;
import com.thevig.backend.domain.repository.DraftTimerRepository;
import com.thevig.backend.draft.SnakeTurnResolver;
import com.thevig.backend.dto.AvailableResourceDTO;
import com.thevig.backend.dto.DraftStatusDTO;
import com.thevig.backend.exception.DraftNotFoundException;
import com.thevig.backend.mapper.DraftMapper;
import com.thevig.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mapstruct.factory.Mappers;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.thevig.backend.service.DraftTestData.DRAFT_ID;
import static com.thevig.backend.service.DraftTestData.POOL_ID;
import static com.thevig.backend.service.DraftTestData.defaultSettings;
import static com.thevig.backend.service.DraftTestData.draft;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class DraftQueryServiceTest {

    private final Instant now = Instant.parse("2026-03-01T12:00:00Z");

    private DraftRepository draftRepository;
    private DraftPickRepository pickRepository;
    private DraftTimerRepository timerRepository;
    private DraftQueryService queryService;

    @BeforeEach
    void setup() {
        draftRepository = mock(DraftRepository.class);
        pickRepository = mock(DraftPickRepository.class);
        timerRepository = mock(DraftTimerRepository.class);
        ResourceCatalog catalog = mock(ResourceCatalog.class);
        DraftSettingsService settingsService = mock(DraftSettingsService.class);

        when(catalog.listResources(POOL_ID)).thenReturn(List.of(
                new CatalogResource("bos", "Boston Celtics", "BOS"),
                new CatalogResource("lal", "Los Angeles Lakers", "LAL"),
                new CatalogResource("mia", "Miami Heat", "MIA"),
                new CatalogResource("nyk", "New York Knicks", "NYK")));
        when(settingsService.getForPool(POOL_ID)).thenReturn(defaultSettings());

        queryService = new DraftQueryService(draftRepository, pickRepository, timerRepository, catalog,
                settingsService, new SnakeTurnResolver(), Mappers.getMapper(DraftMapper.class),
                new MutableClock(now));
    }

    private static DraftPick pick(int number, String participant, String resource) {
        boolean skipped = DraftPick.isSkipResource(resource);
        return DraftPick.builder()
                .id("pick_" + number).draftId(DRAFT_ID).pickNumber(number).roundNumber(1)
                .participantId(participant).resourceId(resource).skipped(skipped)
                .claimedResourceId(skipped ? null : resource).pickedAt(Instant.EPOCH)
                .build();
    }

    @Test
    void testStatusExcludesSkipsFromRostersAndTakenResources() {
        // given
        when(draftRepository.findById(DRAFT_ID))
                .thenReturn(Optional.of(draft(DraftStatus.IN_PROGRESS, 3, 2, "A", "B", "C")));
        when(pickRepository.findByDraftIdOrderByPickNumberAsc(DRAFT_ID)).thenReturn(List.of(
                pick(1, "A", "bos"), pick(2, "B", DraftPick.SKIPPED_RESOURCE), pick(3, "C", "mia")));
        DraftTimer timer = DraftTimer.forDraft(DRAFT_ID);
        timer.startTurn(now.plusSeconds(3725), now);
        when(timerRepository.findById(DRAFT_ID)).thenReturn(Optional.of(timer));

        // act
        DraftStatusDTO status = queryService.getStatus(DRAFT_ID);

        // assert
        assertThat(status.getCurrentPicker()).isEqualTo("C");
        assertThat(status.getRemainingSeconds()).isEqualTo(3725L);
        assertThat(status.getRemainingFormatted()).isEqualTo("1:02:05");
        assertThat(status.isTimedOut()).isFalse();
        assertThat(status.getAvailableResources()).extracting(AvailableResourceDTO::getId)
                .containsExactly("lal", "nyk");
        assertThat(status.getRosters()).containsEntry("A", List.of("bos"))
                .containsEntry("B", List.of())
                .containsEntry("C", List.of("mia"));
        assertThat(status.getPicks()).hasSize(3);
        assertThat(status.getPicks().get(0).getResourceName()).isEqualTo("Boston Celtics");
        assertThat(status.getSettings().getPickTimeSeconds()).isEqualTo(86400);
    }

    @Test
    void testStatusReportsTimedOutTurn() {
        when(draftRepository.findById(DRAFT_ID))
                .thenReturn(Optional.of(draft(DraftStatus.IN_PROGRESS, 0, 2, "A", "B")));
        when(pickRepository.findByDraftIdOrderByPickNumberAsc(DRAFT_ID)).thenReturn(List.of());
        DraftTimer timer = DraftTimer.forDraft(DRAFT_ID);
        timer.startTurn(now.minusSeconds(5), now.minusSeconds(100));
        when(timerRepository.findById(DRAFT_ID)).thenReturn(Optional.of(timer));

        DraftStatusDTO status = queryService.getStatus(DRAFT_ID);

        assertThat(status.isTimedOut()).isTrue();
        assertThat(status.getRemainingSeconds()).isZero();
        assertThat(status.getRemainingFormatted()).isEqualTo("0:00");
        assertThat(status.getAvailableResources()).hasSize(4);
    }

    @Test
    void testPicksByParticipant() {
        when(draftRepository.findById(DRAFT_ID))
                .thenReturn(Optional.of(draft(DraftStatus.IN_PROGRESS, 3, 2, "A", "B", "C")));
        when(pickRepository.findByDraftIdAndParticipantIdOrderByPickNumberAsc(DRAFT_ID, "A"))
                .thenReturn(List.of(pick(1, "A", "bos")));

        assertThat(queryService.getPicksByParticipant(DRAFT_ID, "A"))
                .singleElement()
                .satisfies(dto -> assertThat(dto.getResourceName()).isEqualTo("Boston Celtics"));
    }

    @Test
    void testUnknownPoolIsNotFound() {
        when(draftRepository.findByPoolId("nope")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> queryService.getDraftByPool("nope"))
                .isInstanceOf(DraftNotFoundException.class);
    }
}
