package com.aiinpocket.mystica.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 遭遇池：某地點在一段戰鬥等級區間內可出現的敵人集合。
 */
@Entity
@Table(name = "enemy_pool", indexes = {
        @Index(name = "idx_enemy_pool_location", columnList = "location_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnemyPool {

    @Id
    @Column(length = 64)
    private String id;

    @Column(name = "location_id", nullable = false, length = 64)
    private String locationId;

    @Column(name = "min_level", nullable = false)
    private Integer minLevel;

    @Column(name = "max_level", nullable = false)
    private Integer maxLevel;
}
