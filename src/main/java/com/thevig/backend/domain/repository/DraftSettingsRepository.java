package com.thevig.backend.domain.repository;

import com.thevig.backend.domain.entity.DraftSettings;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface DraftSettingsRepository extends JpaRepository<DraftSettings, String> {
    Optional<DraftSettings> findByPoolId(String poolId);
}
