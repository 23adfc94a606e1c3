package com.aiinpocket.mystica.model.combat;

/**
 * 玩家戰鬥數值快照（已由裝備系統計算完成）。
 */
public record PlayerCombatStats(
        double atkPower,
        double atkAccuracy,
        double defPower,
        double defAccuracy,
        int hp
) {}
