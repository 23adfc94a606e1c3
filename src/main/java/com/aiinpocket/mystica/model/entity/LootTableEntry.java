package com.aiinpocket.mystica.model.entity;

import com.aiinpocket.mystica.model.enums.LootableType;
import jakarta.persistence.*;
import lombok.*;

/**
 * 敵人掉落表項目。lootable_id 依 lootable_type 指向材料或裝備類型。
 */
@Entity
@Table(name = "enemy_loot_entry", indexes = {
        @Index(name = "idx_loot_enemy_type", columnList = "enemy_type_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class LootTableEntry {

    @Id
    @Column(length = 64)
    private String id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "enemy_type_id", nullable = false)
    private EnemyType enemyType;

    @Enumerated(EnumType.STRING)
    @Column(name = "lootable_type", nullable = false, length = 15)
    private LootableType lootableType;

    @Column(name = "lootable_id", nullable = false, length = 64)
    private String lootableId;

    @Column(name = "drop_weight", nullable = false)
    private Double dropWeight;
}
