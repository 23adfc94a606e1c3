package com.aiinpocket.mystica.service.gateway;

import com.aiinpocket.mystica.model.combat.EnemyCombatProfile;
import com.aiinpocket.mystica.model.combat.EnemyStyleOption;
import com.aiinpocket.mystica.model.combat.EnemyTier;

import java.util.List;

/**
 * 敵人圖鑑。
 */
public interface EnemyCatalog {

    /**
     * 依戰鬥等級換算敵人實際數值。風格欄位留空，由呼叫端另行抽選。
     */
    EnemyCombatProfile realize(String enemyTypeId, int level);

    EnemyTier tier(String enemyTypeId);

    /** 敵人可出現的風格與權重；沒有設定時為空清單 */
    List<EnemyStyleOption> styles(String enemyTypeId);
}
