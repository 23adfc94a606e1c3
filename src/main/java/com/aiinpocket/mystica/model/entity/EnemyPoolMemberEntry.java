package com.aiinpocket.mystica.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "enemy_pool_member", indexes = {
        @Index(name = "idx_pool_member_pool", columnList = "pool_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnemyPoolMemberEntry {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "pool_id", nullable = false)
    private EnemyPool pool;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "enemy_type_id", nullable = false)
    private EnemyType enemyType;

    /** 生成權重，必須為正數 */
    @Column(name = "spawn_weight", nullable = false)
    private Double spawnWeight;
}
