package com.thevig.backend.domain.repository;

import com.thevig.backend.domain.entity.Draft;
import com.thevig.backend.domain.entity.DraftPick;
import com.thevig.backend.domain.entity.DraftStatus;
import com.thevig.backend.domain.entity.DraftTimer;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
class DraftRepositoryTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Autowired
    private DraftRepository draftRepository;
    @Autowired
    private DraftPickRepository pickRepository;
    @Autowired
    private DraftTimerRepository timerRepository;

    private Draft saveDraft(String id, String poolId, DraftStatus status) {
        return draftRepository.saveAndFlush(Draft.builder()
                .id(id)
                .poolId(poolId)
                .status(status)
                .currentPick(0)
                .currentRound(1)
                .totalRounds(2)
                .totalPicks(4)
                .draftOrder(List.of("A", "B"))
                .createdBy("admin")
                .build());
    }

    private static DraftPick pick(String id, int number, String participant, String resource) {
        boolean skipped = DraftPick.isSkipResource(resource);
        return DraftPick.builder()
                .id(id)
                .draftId("d1")
                .roundNumber(1)
                .pickNumber(number)
                .participantId(participant)
                .resourceId(resource)
                .claimedResourceId(skipped ? null : resource)
                .skipped(skipped)
                .pickedAt(NOW)
                .build();
    }

    @Test
    void testDraftOrderRoundTripsThroughJsonColumn() {
        saveDraft("d1", "pool_1", DraftStatus.PENDING);

        Draft loaded = draftRepository.findByPoolId("pool_1").orElseThrow();

        assertThat(loaded.getDraftOrder()).containsExactly("A", "B");
        assertThat(draftRepository.existsByPoolId("pool_1")).isTrue();
    }

    @Test
    void testAdvancePickOnlyAppliesToExpectedPick() {
        saveDraft("d1", "pool_1", DraftStatus.IN_PROGRESS);

        assertThat(draftRepository.advancePick("d1", 0, 1, 1, NOW)).isEqualTo(1);
        // same expected value again: the row has moved on
        assertThat(draftRepository.advancePick("d1", 0, 1, 1, NOW)).isZero();

        Draft loaded = draftRepository.findById("d1").orElseThrow();
        assertThat(loaded.getCurrentPick()).isEqualTo(1);
        assertThat(loaded.getUpdatedAt()).isEqualTo(NOW);
    }

    @Test
    void testAdvancePickRequiresInProgress() {
        saveDraft("d1", "pool_1", DraftStatus.PAUSED);

        assertThat(draftRepository.advancePick("d1", 0, 1, 1, NOW)).isZero();
    }

    @Test
    void testFinalAdvanceCompletesDraft() {
        saveDraft("d1", "pool_1", DraftStatus.IN_PROGRESS);
        draftRepository.advancePick("d1", 0, 1, 1, NOW);
        draftRepository.advancePick("d1", 1, 2, 2, NOW);
        draftRepository.advancePick("d1", 2, 3, 2, NOW);

        assertThat(draftRepository.advancePickAndComplete("d1", 3, 4, 2, NOW)).isEqualTo(1);

        Draft loaded = draftRepository.findById("d1").orElseThrow();
        assertThat(loaded.getStatus()).isEqualTo(DraftStatus.COMPLETED);
        assertThat(loaded.getCurrentPick()).isEqualTo(4);
        assertThat(loaded.getCompletedAt()).isEqualTo(NOW);
    }

    @Test
    void testStatusTransitionsAreConditional() {
        saveDraft("d1", "pool_1", DraftStatus.PENDING);

        assertThat(draftRepository.markStarted("d1", NOW)).isEqualTo(1);
        assertThat(draftRepository.markStarted("d1", NOW)).isZero();
        assertThat(draftRepository.transitionStatus("d1", DraftStatus.PAUSED, DraftStatus.IN_PROGRESS, NOW)).isZero();
        assertThat(draftRepository.transitionStatus("d1", DraftStatus.IN_PROGRESS, DraftStatus.PAUSED, NOW))
                .isEqualTo(1);
        assertThat(draftRepository.markCompleted("d1",
                EnumSet.of(DraftStatus.IN_PROGRESS, DraftStatus.PAUSED), NOW)).isEqualTo(1);
        assertThat(draftRepository.markCompleted("d1",
                EnumSet.of(DraftStatus.IN_PROGRESS, DraftStatus.PAUSED), NOW)).isZero();
    }

    @Test
    void testFindIdsByStatus() {
        saveDraft("d1", "pool_1", DraftStatus.IN_PROGRESS);
        saveDraft("d2", "pool_2", DraftStatus.PAUSED);
        saveDraft("d3", "pool_3", DraftStatus.IN_PROGRESS);

        assertThat(draftRepository.findIdsByStatus(DraftStatus.IN_PROGRESS)).containsExactlyInAnyOrder("d1", "d3");
    }

    @Test
    void testSecondDraftForPoolViolatesConstraint() {
        saveDraft("d1", "pool_1", DraftStatus.PENDING);

        assertThatThrownBy(() -> saveDraft("d2", "pool_1", DraftStatus.PENDING))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void testDuplicatePickNumberViolatesConstraint() {
        pickRepository.saveAndFlush(pick("p1", 1, "A", "bos"));

        assertThatThrownBy(() -> pickRepository.saveAndFlush(pick("p2", 1, "B", "lal")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void testSameResourceCannotBeClaimedTwice() {
        pickRepository.saveAndFlush(pick("p1", 1, "A", "bos"));

        assertThatThrownBy(() -> pickRepository.saveAndFlush(pick("p2", 2, "B", "bos")))
                .isInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    void testSkipsDoNotClaimResources() {
        pickRepository.saveAndFlush(pick("p1", 1, "A", DraftPick.SKIPPED_RESOURCE));
        pickRepository.saveAndFlush(pick("p2", 2, "B", DraftPick.SKIPPED_RESOURCE));
        pickRepository.saveAndFlush(pick("p3", 3, "B", "bos"));

        assertThat(pickRepository.existsByDraftIdAndResourceIdAndSkippedFalse("d1", "bos")).isTrue();
        assertThat(pickRepository.existsByDraftIdAndResourceIdAndSkippedFalse("d1", DraftPick.SKIPPED_RESOURCE))
                .isFalse();
        assertThat(pickRepository.findByDraftIdAndParticipantIdOrderByPickNumberAsc("d1", "B"))
                .extracting(DraftPick::getPickNumber)
                .containsExactly(2, 3);
    }

    @Test
    void testReminderIsMarkedOncePerDeadline() {
        DraftTimer timer = DraftTimer.forDraft("d1");
        Instant deadline = NOW.plusSeconds(3600);
        timer.startTurn(deadline, NOW);
        timerRepository.saveAndFlush(timer);

        assertThat(timerRepository.markReminderSent("d1", deadline, NOW)).isEqualTo(1);
        assertThat(timerRepository.markReminderSent("d1", deadline, NOW.plusSeconds(60))).isZero();
        // a stale deadline means the turn already moved on
        assertThat(timerRepository.markReminderSent("d1", NOW.plusSeconds(7200), NOW)).isZero();
    }

    @Test
    void testResumedTurnCanBeRemindedAgain() {
        DraftTimer timer = DraftTimer.forDraft("d1");
        Instant deadline = NOW.plusSeconds(3600);
        timer.startTurn(deadline, NOW);
        timerRepository.saveAndFlush(timer);
        assertThat(timerRepository.markReminderSent("d1", deadline, NOW.plusSeconds(10))).isEqualTo(1);

        DraftTimer reloaded = timerRepository.findById("d1").orElseThrow();
        reloaded.pause(NOW.plusSeconds(100));
        Instant resumedDeadline = reloaded.resume(NOW.plusSeconds(400), 3600);
        timerRepository.saveAndFlush(reloaded);

        assertThat(resumedDeadline).isEqualTo(NOW.plusSeconds(3900));
        assertThat(timerRepository.markReminderSent("d1", resumedDeadline, NOW.plusSeconds(500))).isEqualTo(1);
    }

    @Test
    void testStaleTimerWriteIsRejected() {
        DraftTimer timer = DraftTimer.forDraft("d1");
        timer.startTurn(NOW.plusSeconds(3600), NOW);
        DraftTimer saved = timerRepository.saveAndFlush(timer);

        // snapshot taken before the next turn was written
        DraftTimer stale = DraftTimer.builder()
                .draftId("d1")
                .deadline(saved.getDeadline())
                .turnStartedAt(saved.getTurnStartedAt())
                .version(saved.getVersion())
                .build();

        saved.startTurn(NOW.plusSeconds(7200), NOW.plusSeconds(3000));
        timerRepository.saveAndFlush(saved);

        stale.pause(NOW.plusSeconds(3500));
        assertThatThrownBy(() -> timerRepository.saveAndFlush(stale))
                .isInstanceOf(OptimisticLockingFailureException.class);
    }
}
