package com.aiinpocket.mystica.model.dto;

import com.aiinpocket.mystica.model.combat.CombatSession;
import com.aiinpocket.mystica.model.combat.EnemyCombatProfile;
import com.aiinpocket.mystica.model.combat.PlayerCombatStats;
import com.aiinpocket.mystica.model.combat.WeaponConfig;

import java.time.Instant;

/**
 * 進行中戰鬥的唯讀投影（開戰回應、斷線復原、對話生成等共用）。
 */
public record CombatSessionView(
        String sessionId,
        String playerId,
        String locationId,
        int combatLevel,
        int turnNumber,
        int playerHp,
        int enemyHp,
        int maxPlayerHp,
        int maxEnemyHp,
        EnemyCombatProfile enemy,
        PlayerCombatStats playerStats,
        WeaponConfig weapon,
        Instant createdAt,
        Instant expiresAt
) {
    public static CombatSessionView of(CombatSession session) {
        return new CombatSessionView(
                session.sessionId(),
                session.playerId(),
                session.locationId(),
                session.combatLevel(),
                session.turnNumber(),
                session.currentPlayerHp(),
                session.currentEnemyHp(),
                session.playerStats().hp(),
                session.enemy().hp(),
                session.enemy(),
                session.playerStats(),
                session.weapon(),
                session.createdAt(),
                session.expiresAt()
        );
    }
}
