package com.aiinpocket.mystica.model.combat;

/**
 * 敵人類型可用的外觀風格與其出現權重。
 */
public record EnemyStyleOption(
        String styleId,
        double weight
) {}
