package com.aiinpocket.mystica.model.entity;

import com.aiinpocket.mystica.model.enums.WeaponPattern;
import jakarta.persistence.*;
import lombok.*;

/**
 * 玩家目前裝備武器的轉盤設定。
 * 各區段角度為套用命中率調整後的結果，五段加總為 360°。
 */
@Entity
@Table(name = "player_weapon",
        uniqueConstraints = @UniqueConstraint(name = "uk_player_weapon_player", columnNames = "player_id"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerWeapon {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private WeaponPattern pattern;

    @Column(name = "spin_deg_per_sec", nullable = false)
    private Double spinDegPerSecond;

    @Column(name = "deg_crit", nullable = false)
    private Double degCrit;

    @Column(name = "deg_normal", nullable = false)
    private Double degNormal;

    @Column(name = "deg_graze", nullable = false)
    private Double degGraze;

    @Column(name = "deg_miss", nullable = false)
    private Double degMiss;

    @Column(name = "deg_injure", nullable = false)
    private Double degInjure;
}
