package com.aiinpocket.mystica.model.combat;

import java.util.List;

/**
 * 依戰鬥等級實例化後的敵人數值，開戰時寫入 session 快照。
 * styleId 為本場選中的外觀風格，掉落物預設繼承此風格。
 */
public record EnemyCombatProfile(
        String enemyTypeId,
        String name,
        int level,
        double atkPower,
        double atkAccuracy,
        double defPower,
        double defAccuracy,
        int hp,
        String styleId,
        String dialogueTone,
        List<String> personalityTraits
) {
    public EnemyCombatProfile {
        personalityTraits = personalityTraits == null ? List.of() : List.copyOf(personalityTraits);
    }

    public EnemyCombatProfile withStyle(String selectedStyleId) {
        return new EnemyCombatProfile(enemyTypeId, name, level, atkPower, atkAccuracy,
                defPower, defAccuracy, hp, selectedStyleId, dialogueTone, personalityTraits);
    }
}
