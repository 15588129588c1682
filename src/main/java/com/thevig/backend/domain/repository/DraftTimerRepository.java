package com.thevig.backend.domain.repository;

import com.thevig.backend.domain.entity.DraftTimer;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;

public interface DraftTimerRepository extends JpaRepository<DraftTimer, String> {

    /**
     * Records a reminder for the running deadline, only if it is still the one
     * the caller saw and no reminder went out for it yet. A resumed turn gets a
     * new deadline and so can be reminded again. Returns 1 for the single
     * caller that should send the reminder.
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE DraftTimer t SET t.lastRemindedAt = :now, t.remindedDeadline = :deadline " +
            "WHERE t.draftId = :draftId AND t.deadline = :deadline " +
            "AND (t.remindedDeadline IS NULL OR t.remindedDeadline <> :deadline)")
    int markReminderSent(@Param("draftId") String draftId,
            @Param("deadline") Instant deadline,
            @Param("now") Instant now);
}
