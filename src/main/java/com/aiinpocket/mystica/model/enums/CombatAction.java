package com.aiinpocket.mystica.model.enums;

/**
 * 玩家回合動作。
 */
public enum CombatAction {
    ATTACK,
    DEFEND
}
