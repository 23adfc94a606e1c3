package com.aiinpocket.mystica.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 玩家帳本與已計算完成的戰鬥數值（由裝備系統維護）。
 */
@Entity
@Table(name = "player_profile")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerProfile {

    @Id
    @Column(length = 64)
    private String id;

    @Column(nullable = false)
    @Builder.Default
    private Long gold = 0L;

    @Column(nullable = false)
    @Builder.Default
    private Long experience = 0L;

    @Column(name = "atk_power", nullable = false)
    private Double atkPower;

    @Column(name = "atk_accuracy", nullable = false)
    private Double atkAccuracy;

    @Column(name = "def_power", nullable = false)
    private Double defPower;

    @Column(name = "def_accuracy", nullable = false)
    private Double defAccuracy;

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PreUpdate
    void touch() {
        updatedAt = Instant.now();
    }
}
