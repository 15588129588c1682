package com.thevig.backend.domain.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * A draftable option of a pool (a team, a player...). Owned by the pool
 * subsystem; the draft only reads it.
 */
@Entity
@Table(name = "pool_options", indexes = @Index(name = "idx_pool_options_pool", columnList = "pool_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PoolOption {
    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "pool_id", nullable = false, length = 64)
    private String poolId;

    @Column(nullable = false)
    private String name;

    @Column(length = 16)
    private String abbreviation;
}
