package com.aiinpocket.mystica.model.entity;

import jakarta.persistence.*;
import lombok.*;

/**
 * 玩家材料堆疊，以 (玩家, 材料, 風格) 為單位。
 */
@Entity
@Table(name = "material_stack",
        uniqueConstraints = @UniqueConstraint(name = "uk_material_stack",
                columnNames = {"player_id", "material_id", "style_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class MaterialStack {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Column(name = "material_id", nullable = false, length = 64)
    private String materialId;

    @Column(name = "style_id", nullable = false, length = 32)
    private String styleId;

    @Column(nullable = false)
    @Builder.Default
    private Integer quantity = 0;
}
