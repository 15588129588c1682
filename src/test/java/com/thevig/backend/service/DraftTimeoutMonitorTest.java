package com.thevig.backend.service;

import com.thevig.backend.domain.entity.Draft;
import com.thevig.backend.domain.entity.DraftPick;
import com.thevig.backend.domain.entity.DraftStatus;
import com.thevig.backend.domain.entity.DraftTimer;
import com.thevig.backend.domain.repository.DraftRepository;
import com.thevig.backend.domain.repository.DraftTimerRepository;
import com.thevig.backend.draft.DeadlinePolicy;
import com.thevig.backend.draft.SnakeTurnResolver;
import com.thevig.backend.dto.DraftSettingsDTO;
import com.thevig.backend.dto.TimeoutCheckResult;
import com.thevig.backend.exception.DraftNotFoundException;
import com.thevig.backend.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static com.thevig.backend.service.DraftTestData.DRAFT_ID;
import static com.thevig.backend.service.DraftTestData.POOL_ID;
import static com.thevig.backend.service.DraftTestData.defaultSettings;
import static com.thevig.backend.service.DraftTestData.draft;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class DraftTimeoutMonitorTest {

    private final Instant t0 = Instant.parse("2026-03-01T12:00:00Z");

    private DraftRepository draftRepository;
    private DraftTimerRepository timerRepository;
    private DraftSettingsService settingsService;
    private DraftPickService pickService;
    private DraftNotificationService notificationService;
    private MutableClock clock;
    private DraftTimer timer;
    private DraftTimeoutMonitor monitor;

    @BeforeEach
    void setup() {
        draftRepository = mock(DraftRepository.class);
        timerRepository = mock(DraftTimerRepository.class);
        settingsService = mock(DraftSettingsService.class);
        pickService = mock(DraftPickService.class);
        notificationService = mock(DraftNotificationService.class);
        clock = new MutableClock(t0);

        timer = DraftTimer.forDraft(DRAFT_ID);
        timer.startTurn(t0.plusSeconds(86400), t0);
        when(timerRepository.findById(DRAFT_ID)).thenReturn(Optional.of(timer));
        when(settingsService.getForPool(POOL_ID)).thenReturn(defaultSettings());

        SnakeTurnResolver resolver = new SnakeTurnResolver();
        monitor = new DraftTimeoutMonitor(draftRepository, timerRepository, settingsService, pickService,
                notificationService, resolver, new DeadlinePolicy(resolver), clock);
    }

    private void givenDraft(Draft draft) {
        when(draftRepository.findById(DRAFT_ID)).thenReturn(Optional.of(draft));
    }

    @Test
    void testOverdueTurnIsSkipped() {
        // given: deadline t0+86400, checked one second after it
        givenDraft(draft(DraftStatus.IN_PROGRESS, 0, 2, "A", "B", "C"));
        DraftPick skip = DraftPick.builder()
                .participantId("A")
                .resourceId(DraftPick.SKIPPED_RESOURCE)
                .skipped(true)
                .pickNumber(1)
                .build();
        when(pickService.skipOnTimeout(DRAFT_ID, 0, t0.plusSeconds(86400)))
                .thenReturn(new PickResult(skip, draft(DraftStatus.IN_PROGRESS, 1, 2, "A", "B", "C"),
                        "B", t0.plusSeconds(2 * 86400 + 1), false));
        clock.advanceSeconds(86401);

        // act
        TimeoutCheckResult result = monitor.checkAndHandleTimeout(DRAFT_ID);

        // assert
        assertThat(result.isSkipped()).isTrue();
        assertThat(result.getSkippedParticipantId()).isEqualTo("A");
        assertThat(result.getRemainingSeconds()).isEqualTo(-1L);
        verify(pickService).skipOnTimeout(DRAFT_ID, 0, t0.plusSeconds(86400));
    }

    @Test
    void testNoSkipBeforeDeadline() {
        givenDraft(draft(DraftStatus.IN_PROGRESS, 0, 2, "A", "B", "C"));
        clock.advanceSeconds(1000);

        TimeoutCheckResult result = monitor.checkAndHandleTimeout(DRAFT_ID);

        assertThat(result.isSkipped()).isFalse();
        assertThat(result.isReminderSent()).isFalse();
        assertThat(result.getRemainingSeconds()).isEqualTo(85400L);
        verifyNoInteractions(pickService);
    }

    @Test
    void testNoSkipWithHalfASecondLeft() {
        givenDraft(draft(DraftStatus.IN_PROGRESS, 0, 2, "A", "B", "C"));
        clock.advance(Duration.ofSeconds(86400).minusMillis(500));

        TimeoutCheckResult result = monitor.checkAndHandleTimeout(DRAFT_ID);

        assertThat(result.isSkipped()).isFalse();
        assertThat(result.getRemainingSeconds()).isZero();
        verifyNoInteractions(pickService);
    }

    @Test
    void testAutoSkipDisabledLeavesOverdueTurnAlone() {
        DraftSettingsDTO settings = defaultSettings();
        settings.setAutoSkipEnabled(false);
        when(settingsService.getForPool(POOL_ID)).thenReturn(settings);
        givenDraft(draft(DraftStatus.IN_PROGRESS, 0, 2, "A", "B", "C"));
        clock.advanceSeconds(200000);

        TimeoutCheckResult result = monitor.checkAndHandleTimeout(DRAFT_ID);

        assertThat(result.isSkipped()).isFalse();
        verifyNoInteractions(pickService);
    }

    @Test
    void testReminderSentOnceInsideWindow() {
        Draft draft = draft(DraftStatus.IN_PROGRESS, 1, 2, "A", "B", "C");
        givenDraft(draft);
        Instant deadline = timer.getDeadline();
        // 12h reminder lead time, now 11h before the deadline
        clock.advanceSeconds(86400 - 11 * 3600);
        when(timerRepository.markReminderSent(DRAFT_ID, deadline, clock.instant())).thenReturn(1, 0);

        TimeoutCheckResult first = monitor.checkAndHandleTimeout(DRAFT_ID);
        TimeoutCheckResult second = monitor.checkAndHandleTimeout(DRAFT_ID);

        assertThat(first.isReminderSent()).isTrue();
        assertThat(second.isReminderSent()).isFalse();
        verify(notificationService, times(1)).reminder(draft, "B", deadline, 11 * 3600L);
        verifyNoInteractions(pickService);
    }

    @Test
    void testResumedTurnIsRemindedForItsNewDeadline() {
        Draft draft = draft(DraftStatus.IN_PROGRESS, 1, 2, "A", "B", "C");
        givenDraft(draft);
        timer.setRemindedDeadline(timer.getDeadline());
        // paused and resumed with two hours left
        timer.pause(t0.plusSeconds(86400 - 7200));
        clock.advanceSeconds(100000);
        Instant resumedDeadline = timer.resume(clock.instant(), 86400);
        when(timerRepository.markReminderSent(DRAFT_ID, resumedDeadline, clock.instant())).thenReturn(1);

        TimeoutCheckResult result = monitor.checkAndHandleTimeout(DRAFT_ID);

        assertThat(result.isReminderSent()).isTrue();
        verify(notificationService).reminder(draft, "B", resumedDeadline, 7200L);
    }

    @Test
    void testNoReminderOutsideWindow() {
        givenDraft(draft(DraftStatus.IN_PROGRESS, 1, 2, "A", "B", "C"));
        clock.advanceSeconds(3600);

        TimeoutCheckResult result = monitor.checkAndHandleTimeout(DRAFT_ID);

        assertThat(result.isReminderSent()).isFalse();
        verify(timerRepository, never()).markReminderSent(anyString(), any(), any());
    }

    @Test
    void testPausedDraftIsNoop() {
        givenDraft(draft(DraftStatus.PAUSED, 0, 2, "A", "B"));
        clock.advanceSeconds(500000);

        TimeoutCheckResult result = monitor.checkAndHandleTimeout(DRAFT_ID);

        assertThat(result.isSkipped()).isFalse();
        assertThat(result.getRemainingSeconds()).isNull();
        verifyNoInteractions(pickService, notificationService);
    }

    @Test
    void testDraftWithoutDeadlineIsNoop() {
        givenDraft(draft(DraftStatus.IN_PROGRESS, 0, 2, "A", "B"));
        timer.clear();

        TimeoutCheckResult result = monitor.checkAndHandleTimeout(DRAFT_ID);

        assertThat(result.isSkipped()).isFalse();
        verify(notificationService, never()).reminder(any(), anyString(), any(), anyLong());
    }

    @Test
    void testUnknownDraftIsNotFound() {
        when(draftRepository.findById("missing")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> monitor.checkAndHandleTimeout("missing"))
                .isInstanceOf(DraftNotFoundException.class);
    }
}
