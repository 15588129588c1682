package com.thevig.backend.catalog;

import com.thevig.backend.config.CacheConfig;
import com.thevig.backend.domain.repository.PoolOptionRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
@RequiredArgsConstructor
public class JpaResourceCatalog implements ResourceCatalog {

    private final PoolOptionRepository poolOptionRepository;

    @Override
    @Cacheable(cacheNames = CacheConfig.POOL_CATALOG_CACHE, key = "#poolId")
    public List<CatalogResource> listResources(String poolId) {
        return poolOptionRepository.findByPoolIdOrderByNameAsc(poolId).stream()
                .map(option -> new CatalogResource(option.getId(), option.getName(), option.getAbbreviation()))
                .toList();
    }

    @Override
    public boolean contains(String poolId, String resourceId) {
        return poolOptionRepository.existsByPoolIdAndId(poolId, resourceId);
    }
}
