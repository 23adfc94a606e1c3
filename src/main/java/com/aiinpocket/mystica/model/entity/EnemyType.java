package com.aiinpocket.mystica.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 敵人類型定義。
 * 四項戰鬥數值以正規化比例儲存（加總約為 1），開戰時依等級與階級換算。
 */
@Entity
@Table(name = "enemy_type")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnemyType {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false, length = 100)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "tier_id", nullable = false)
    private EnemyTierDefinition tier;

    @Column(name = "base_hp", nullable = false)
    private Integer baseHp;

    @Column(name = "atk_power_normalized", nullable = false)
    private Double atkPowerNormalized;

    @Column(name = "atk_accuracy_normalized", nullable = false)
    private Double atkAccuracyNormalized;

    @Column(name = "def_power_normalized", nullable = false)
    private Double defPowerNormalized;

    @Column(name = "def_accuracy_normalized", nullable = false)
    private Double defAccuracyNormalized;

    /** 對話語氣（供台詞生成） */
    @Column(name = "dialogue_tone", length = 50)
    private String dialogueTone;

    /** 個性標籤，逗號分隔 */
    @Column(name = "personality_traits", length = 500)
    private String personalityTraits;
}
