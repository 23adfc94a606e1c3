package com.aiinpocket.mystica.model.dto;

import com.aiinpocket.mystica.model.enums.CombatStatus;
import com.aiinpocket.mystica.model.enums.HitZone;

/**
 * 攻擊回合結果。rewards 只在戰鬥於本回合結束時才有值。
 */
public record AttackResult(
        int turnNumber,
        HitZone hitZone,
        int damage,
        double zoneMultiplier,
        boolean critOccurred,
        Double critBonus,
        boolean selfInflicted,
        int playerHpRemaining,
        int enemyHpRemaining,
        CombatStatus status,
        CombatRewards rewards
) {}
