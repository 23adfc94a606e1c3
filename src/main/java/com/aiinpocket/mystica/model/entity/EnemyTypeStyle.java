package com.aiinpocket.mystica.model.entity;

import jakarta.persistence.*;
import lombok.*;

@Entity
@Table(name = "enemy_type_style",
        uniqueConstraints = @UniqueConstraint(name = "uk_enemy_type_style",
                columnNames = {"enemy_type_id", "style_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class EnemyTypeStyle {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "enemy_type_id", nullable = false)
    private EnemyType enemyType;

    @Column(name = "style_id", nullable = false, length = 32)
    private String styleId;

    @Column(name = "weight_multiplier", nullable = false)
    @Builder.Default
    private Double weightMultiplier = 1.0;
}
