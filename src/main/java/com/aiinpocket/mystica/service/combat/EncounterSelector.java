package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.exception.CombatNotFoundException;
import com.aiinpocket.mystica.exception.GameDataException;
import com.aiinpocket.mystica.model.combat.EnemyCombatProfile;
import com.aiinpocket.mystica.model.combat.EnemyPoolMember;
import com.aiinpocket.mystica.model.combat.EnemyStyleOption;
import com.aiinpocket.mystica.service.gateway.EnemyCatalog;
import com.aiinpocket.mystica.service.gateway.EnemyPoolCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 開戰選怪：地點 + 等級 → 遭遇池 → 依生成權重抽出敵人 → 依風格權重抽出外觀。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class EncounterSelector {

    /** 敵人沒有設定任何風格時使用 */
    public static final String DEFAULT_STYLE_ID = "normal";

    private final EnemyPoolCatalog poolCatalog;
    private final EnemyCatalog enemyCatalog;
    private final WeightedRandomSelector selector;

    public Encounter select(String locationId, int combatLevel) {
        List<String> poolIds = poolCatalog.findEligiblePoolIds(locationId, combatLevel);
        if (poolIds.isEmpty()) {
            throw new CombatNotFoundException(
                    "No enemy pool for location " + locationId + " at level " + combatLevel);
        }

        List<EnemyPoolMember> members = poolCatalog.findMembers(poolIds);
        if (members.isEmpty()) {
            throw new GameDataException("Enemy pools " + poolIds + " have no members");
        }

        EnemyPoolMember picked = selector.selectOne(members, EnemyPoolMember::spawnWeight);
        EnemyCombatProfile enemy = enemyCatalog.realize(picked.enemyTypeId(), combatLevel)
                .withStyle(selectStyle(picked.enemyTypeId()));

        log.info("[戰鬥] 地點 {} 等級 {} 遭遇 {}（風格 {}，候選池 {} 個）",
                locationId, combatLevel, enemy.name(), enemy.styleId(), poolIds.size());
        return new Encounter(enemy, poolIds);
    }

    private String selectStyle(String enemyTypeId) {
        List<EnemyStyleOption> styles = enemyCatalog.styles(enemyTypeId);
        if (styles.isEmpty()) {
            return DEFAULT_STYLE_ID;
        }
        return selector.selectOne(styles, EnemyStyleOption::weight).styleId();
    }

    /** 抽選結果：敵人快照與當時符合條件的遭遇池 */
    public record Encounter(EnemyCombatProfile enemy, List<String> poolIds) {}
}
