package com.thevig.backend.domain.repository;

import com.thevig.backend.domain.entity.PoolOption;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PoolOptionRepository extends JpaRepository<PoolOption, String> {

    List<PoolOption> findByPoolIdOrderByNameAsc(String poolId);

    boolean existsByPoolIdAndId(String poolId, String id);
}
