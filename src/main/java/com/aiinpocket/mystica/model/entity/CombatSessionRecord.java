package com.aiinpocket.mystica.model.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 戰鬥 session 的持久化紀錄。
 * 快照與戰鬥紀錄以 JSON 文字存放；player_id 唯一，確保每位玩家同時只有一場戰鬥。
 */
@Entity
@Table(name = "combat_session",
        uniqueConstraints = @UniqueConstraint(name = "uk_combat_session_player", columnNames = "player_id"),
        indexes = @Index(name = "idx_combat_session_expires", columnList = "expires_at"))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CombatSessionRecord {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Column(name = "location_id", nullable = false, length = 64)
    private String locationId;

    @Column(name = "combat_level", nullable = false)
    private Integer combatLevel;

    @Column(name = "enemy_type_id", nullable = false, length = 64)
    private String enemyTypeId;

    /** 敵人數值快照（JSON） */
    @Column(name = "enemy_profile", nullable = false, columnDefinition = "TEXT")
    private String enemyProfile;

    /** 玩家數值快照（JSON） */
    @Column(name = "player_stats", nullable = false, columnDefinition = "TEXT")
    private String playerStats;

    /** 武器轉盤快照（JSON） */
    @Column(name = "weapon_config", nullable = false, columnDefinition = "TEXT")
    private String weaponConfig;

    @Column(name = "equipment_snapshot", columnDefinition = "TEXT")
    private String equipmentSnapshot;

    @Column(name = "enemy_pool_ids", columnDefinition = "TEXT")
    private String enemyPoolIds;

    @Column(name = "loot_entry_ids", columnDefinition = "TEXT")
    private String lootEntryIds;

    /** 回合紀錄陣列（JSON），HP 由最後一筆推導 */
    @Column(name = "combat_log", nullable = false, columnDefinition = "TEXT")
    private String combatLog;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;
}
