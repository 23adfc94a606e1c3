package com.aiinpocket.mystica.model.combat;

import com.aiinpocket.mystica.model.enums.Rarity;

/**
 * 稀有度的基礎掉率。
 */
public record RarityWeight(
        Rarity rarity,
        double baseDropRate
) {}
