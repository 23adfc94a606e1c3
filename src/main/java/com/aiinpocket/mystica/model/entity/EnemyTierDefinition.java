package com.aiinpocket.mystica.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 敵人難度階級。
 */
@Entity
@Table(name = "enemy_tier")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnemyTierDefinition {

    @Id
    @Column(length = 32)
    private String id;

    /** 數值與 HP 倍率 */
    @Column(name = "difficulty_multiplier", nullable = false)
    private Double difficultyMultiplier;

    @Column(name = "gold_multiplier", nullable = false)
    private Double goldMultiplier;

    @Column(name = "xp_multiplier", nullable = false)
    private Double xpMultiplier;
}
