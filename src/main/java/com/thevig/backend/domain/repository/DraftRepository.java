package com.thevig.backend.domain.repository;

import com.thevig.backend.domain.entity.Draft;
import com.thevig.backend.domain.entity.DraftStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Every state change of a draft row is a conditional update: it only applies
 * when the row still holds the values the caller read. A return value of 0
 * means another request changed the draft first.
 */
@Repository
public interface DraftRepository extends JpaRepository<Draft, String> {

    Optional<Draft> findByPoolId(String poolId);

    boolean existsByPoolId(String poolId);

    @Query("SELECT d.id FROM Draft d WHERE d.status = :status ORDER BY d.updatedAt ASC")
    List<String> findIdsByStatus(@Param("status") DraftStatus status);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Draft d SET d.currentPick = :nextPick, d.currentRound = :nextRound, d.updatedAt = :now " +
            "WHERE d.id = :id AND d.currentPick = :expectedPick " +
            "AND d.status = com.thevig.backend.domain.entity.DraftStatus.IN_PROGRESS")
    int advancePick(@Param("id") String id,
            @Param("expectedPick") int expectedPick,
            @Param("nextPick") int nextPick,
            @Param("nextRound") int nextRound,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Draft d SET d.currentPick = :nextPick, d.currentRound = :nextRound, " +
            "d.status = com.thevig.backend.domain.entity.DraftStatus.COMPLETED, " +
            "d.completedAt = :now, d.updatedAt = :now " +
            "WHERE d.id = :id AND d.currentPick = :expectedPick " +
            "AND d.status = com.thevig.backend.domain.entity.DraftStatus.IN_PROGRESS")
    int advancePickAndComplete(@Param("id") String id,
            @Param("expectedPick") int expectedPick,
            @Param("nextPick") int nextPick,
            @Param("nextRound") int nextRound,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Draft d SET d.status = :next, d.updatedAt = :now WHERE d.id = :id AND d.status = :expected")
    int transitionStatus(@Param("id") String id,
            @Param("expected") DraftStatus expected,
            @Param("next") DraftStatus next,
            @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Draft d SET d.status = com.thevig.backend.domain.entity.DraftStatus.IN_PROGRESS, " +
            "d.startedAt = :now, d.updatedAt = :now " +
            "WHERE d.id = :id AND d.status = com.thevig.backend.domain.entity.DraftStatus.PENDING")
    int markStarted(@Param("id") String id, @Param("now") Instant now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Draft d SET d.status = com.thevig.backend.domain.entity.DraftStatus.COMPLETED, " +
            "d.completedAt = :now, d.updatedAt = :now " +
            "WHERE d.id = :id AND d.status IN :allowed")
    int markCompleted(@Param("id") String id,
            @Param("allowed") Collection<DraftStatus> allowed,
            @Param("now") Instant now);
}
