package com.thevig.backend.service;

import com.thevig.backend.config.AppProperties;
import com.thevig.backend.config.CacheConfig;
import com.thevig.backend.domain.entity.DraftSettings;
import com.thevig.backend.domain.repository.DraftSettingsRepository;
import com.thevig.backend.dto.DraftSettingsDTO;
import com.thevig.backend.dto.UpdateDraftSettingsRequest;
import com.thevig.backend.mapper.DraftMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-pool draft settings. A pool without a stored row behaves as if it had
 * the configured defaults. Changes only affect deadlines computed afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DraftSettingsService {

    private final DraftSettingsRepository settingsRepository;
    private final AppProperties appProperties;
    private final DraftMapper draftMapper;

    @Cacheable(cacheNames = CacheConfig.DRAFT_SETTINGS_CACHE, key = "#poolId")
    @Transactional(readOnly = true)
    public DraftSettingsDTO getForPool(String poolId) {
        return settingsRepository.findByPoolId(poolId)
                .map(draftMapper::toDto)
                .orElseGet(() -> draftMapper.toDto(defaultsFor(poolId)));
    }

    /**
     * Stores the default settings for the pool unless it already has some.
     */
    @CacheEvict(cacheNames = CacheConfig.DRAFT_SETTINGS_CACHE, key = "#poolId")
    @Transactional
    public DraftSettingsDTO ensureDefaults(String poolId) {
        DraftSettings settings = settingsRepository.findByPoolId(poolId)
                .orElseGet(() -> {
                    log.info("⚙️ [DraftSettings] Creating default settings for pool {}", poolId);
                    return settingsRepository.save(defaultsFor(poolId));
                });
        return draftMapper.toDto(settings);
    }

    @CacheEvict(cacheNames = CacheConfig.DRAFT_SETTINGS_CACHE, key = "#poolId")
    @Transactional
    public DraftSettingsDTO update(String poolId, UpdateDraftSettingsRequest request) {
        if (poolId == null || poolId.isBlank()) {
            throw new IllegalArgumentException("poolId is required");
        }
        DraftSettings settings = settingsRepository.findByPoolId(poolId)
                .orElseGet(() -> defaultsFor(poolId));

        if (request.pickTimeSeconds() != null) {
            requirePositive("pickTimeSeconds", request.pickTimeSeconds());
            settings.setPickTimeSeconds(request.pickTimeSeconds());
        }
        if (request.reminderMinutes() != null) {
            requireNotNegative("reminderMinutes", request.reminderMinutes());
            settings.setReminderMinutes(request.reminderMinutes());
        }
        if (request.autoSkipEnabled() != null) {
            settings.setAutoSkipEnabled(request.autoSkipEnabled());
        }
        if (request.autoSkipAfterSeconds() != null) {
            requireNotNegative("autoSkipAfterSeconds", request.autoSkipAfterSeconds());
            settings.setAutoSkipAfterSeconds(request.autoSkipAfterSeconds());
        }
        if (request.breakBetweenRoundsSeconds() != null) {
            requireNotNegative("breakBetweenRoundsSeconds", request.breakBetweenRoundsSeconds());
            settings.setBreakBetweenRoundsSeconds(request.breakBetweenRoundsSeconds());
        }

        DraftSettings saved = settingsRepository.save(settings);
        log.info("✅ [DraftSettings] Updated settings for pool {}: pickTime={}s, reminder={}min, autoSkip={}",
                poolId, saved.getPickTimeSeconds(), saved.getReminderMinutes(), saved.isAutoSkipEnabled());
        return draftMapper.toDto(saved);
    }

    private DraftSettings defaultsFor(String poolId) {
        AppProperties.Defaults defaults = appProperties.getDraft().getDefaults();
        return DraftSettings.builder()
                .id(DraftSettings.idForPool(poolId))
                .poolId(poolId)
                .pickTimeSeconds(defaults.getPickTimeSeconds())
                .reminderMinutes(defaults.getReminderMinutes())
                .autoSkipEnabled(defaults.isAutoSkipEnabled())
                .autoSkipAfterSeconds(defaults.getAutoSkipAfterSeconds())
                .breakBetweenRoundsSeconds(defaults.getBreakBetweenRoundsSeconds())
                .build();
    }

    private static void requirePositive(String field, int value) {
        if (value <= 0) {
            throw new IllegalArgumentException(field + " must be positive");
        }
    }

    private static void requireNotNegative(String field, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(field + " must not be negative");
        }
    }
}
