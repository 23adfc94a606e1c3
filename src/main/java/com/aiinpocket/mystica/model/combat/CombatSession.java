package com.aiinpocket.mystica.model.combat;

import com.aiinpocket.mystica.model.enums.CombatResult;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 一場進行中的戰鬥。
 * 建立後除戰鬥紀錄外皆不可變；當前 HP 一律由戰鬥紀錄推導，紀錄為唯一事實來源。
 *
 * @param enemyPoolIds 開戰時符合條件的遭遇池（分析用）
 * @param lootEntryIds 開戰時敵人掉落表的項目（分析用）
 */
public record CombatSession(
        String sessionId,
        String playerId,
        String locationId,
        int combatLevel,
        EnemyCombatProfile enemy,
        PlayerCombatStats playerStats,
        WeaponConfig weapon,
        EquipmentSnapshot equipment,
        List<String> enemyPoolIds,
        List<String> lootEntryIds,
        Instant createdAt,
        Instant expiresAt,
        List<CombatLogEntry> combatLog
) {
    public CombatSession {
        enemyPoolIds = enemyPoolIds == null ? List.of() : List.copyOf(enemyPoolIds);
        lootEntryIds = lootEntryIds == null ? List.of() : List.copyOf(lootEntryIds);
        combatLog = combatLog == null ? List.of() : List.copyOf(combatLog);
    }

    public Optional<CombatLogEntry> lastEntry() {
        return combatLog.isEmpty() ? Optional.empty() : Optional.of(combatLog.get(combatLog.size() - 1));
    }

    /** 最後一筆紀錄的玩家 HP，尚無紀錄時為最大 HP */
    public int currentPlayerHp() {
        return lastEntry().map(CombatLogEntry::playerHp).orElse(playerStats.hp());
    }

    /** 最後一筆紀錄的敵人 HP，尚無紀錄時為最大 HP */
    public int currentEnemyHp() {
        return lastEntry().map(CombatLogEntry::enemyHp).orElse(enemy.hp());
    }

    /** 已完成的回合數 */
    public int turnNumber() {
        return combatLog.size();
    }

    public int nextTurnNumber() {
        return combatLog.size() + 1;
    }

    /**
     * 紀錄中已分出的勝負：敵人 HP 歸零為勝利，否則玩家 HP 歸零為戰敗。
     * 已分出勝負的 session 只等待結算，不再接受新回合。
     */
    public Optional<CombatResult> decidedResult() {
        if (currentEnemyHp() <= 0) {
            return Optional.of(CombatResult.VICTORY);
        }
        if (currentPlayerHp() <= 0) {
            return Optional.of(CombatResult.DEFEAT);
        }
        return Optional.empty();
    }

    public boolean isExpired(Instant now) {
        return isExpired(expiresAt, now);
    }

    /** 到期時刻（含）之後即視為過期；資料庫版與記憶體版儲存共用此規則 */
    public static boolean isExpired(Instant expiresAt, Instant now) {
        return !now.isBefore(expiresAt);
    }

    public CombatSession withEntry(CombatLogEntry entry) {
        List<CombatLogEntry> appended = new ArrayList<>(combatLog);
        appended.add(entry);
        return new CombatSession(sessionId, playerId, locationId, combatLevel, enemy, playerStats,
                weapon, equipment, enemyPoolIds, lootEntryIds, createdAt, expiresAt, appended);
    }
}
