package com.aiinpocket.mystica.model.enums;

/**
 * 單回合結束後的戰鬥狀態。
 * ONGOING: 戰鬥持續
 * VICTORY: 敵人 HP 歸零
 * DEFEAT: 玩家 HP 歸零
 */
public enum CombatStatus {
    ONGOING,
    VICTORY,
    DEFEAT
}
