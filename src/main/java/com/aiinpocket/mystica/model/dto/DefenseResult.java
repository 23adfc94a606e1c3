package com.aiinpocket.mystica.model.dto;

import com.aiinpocket.mystica.model.enums.CombatStatus;
import com.aiinpocket.mystica.model.enums.HitZone;

/**
 * 防禦回合結果。防禦不會傷害敵人，因此 status 只會是 ONGOING 或 DEFEAT。
 */
public record DefenseResult(
        int turnNumber,
        HitZone hitZone,
        int enemyBaseDamage,
        int blocked,
        int taken,
        int playerHpRemaining,
        int enemyHpRemaining,
        CombatStatus status,
        CombatRewards rewards
) {}
