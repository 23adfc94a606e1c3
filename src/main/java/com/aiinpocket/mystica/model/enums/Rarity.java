package com.aiinpocket.mystica.model.enums;

/**
 * 裝備稀有度等級。
 * 實際掉落權重由稀有度定義表的基礎掉率與戰鬥等級共同決定。
 */
public enum Rarity {
    COMMON,
    UNCOMMON,
    RARE,
    EPIC,
    LEGENDARY
}
