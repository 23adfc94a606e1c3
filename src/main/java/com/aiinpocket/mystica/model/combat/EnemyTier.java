package com.aiinpocket.mystica.model.combat;

/**
 * 敵人難度階級倍率。
 */
public record EnemyTier(
        String tierId,
        double difficultyMultiplier,
        double goldMultiplier,
        double xpMultiplier
) {}
