package com.thevig.backend.domain.repository;

import com.thevig.backend.domain.entity.DraftPick;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DraftPickRepository extends JpaRepository<DraftPick, String> {

    List<DraftPick> findByDraftIdOrderByPickNumberAsc(String draftId);

    List<DraftPick> findByDraftIdAndParticipantIdOrderByPickNumberAsc(String draftId, String participantId);

    boolean existsByDraftIdAndResourceIdAndSkippedFalse(String draftId, String resourceId);
}
