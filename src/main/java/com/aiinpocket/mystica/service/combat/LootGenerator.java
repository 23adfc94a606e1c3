package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.config.CombatProperties;
import com.aiinpocket.mystica.exception.CombatNotFoundException;
import com.aiinpocket.mystica.exception.CombatValidationException;
import com.aiinpocket.mystica.exception.GameDataException;
import com.aiinpocket.mystica.model.combat.CombatSession;
import com.aiinpocket.mystica.model.combat.EnemyTier;
import com.aiinpocket.mystica.model.combat.ItemTypeDefinition;
import com.aiinpocket.mystica.model.combat.LootEntry;
import com.aiinpocket.mystica.model.combat.MaterialDefinition;
import com.aiinpocket.mystica.model.combat.RarityWeight;
import com.aiinpocket.mystica.model.dto.GeneratedLoot;
import com.aiinpocket.mystica.model.dto.ItemReward;
import com.aiinpocket.mystica.model.dto.MaterialReward;
import com.aiinpocket.mystica.model.enums.LootableType;
import com.aiinpocket.mystica.model.enums.Rarity;
import com.aiinpocket.mystica.service.gateway.EnemyCatalog;
import com.aiinpocket.mystica.service.gateway.LootCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * 勝利戰利品擲骰。只產生結果，不寫入任何玩家資料。
 *
 * <ul>
 *   <li>金幣 = floor(每級金幣 × 戰鬥等級 × 階級金幣倍率)</li>
 *   <li>經驗 = floor(每級經驗 × 戰鬥等級 × 階級經驗倍率)</li>
 *   <li>材料：從掉落表的材料項目加權抽 1~3 次（可重複）</li>
 *   <li>裝備：從掉落表的裝備項目加權抽 1 次，稀有度依等級加權另外抽</li>
 * </ul>
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class LootGenerator {

    private final EnemyCatalog enemyCatalog;
    private final LootCatalog lootCatalog;
    private final WeightedRandomSelector selector;
    private final RandomSource random;
    private final CombatProperties properties;

    public GeneratedLoot generate(CombatSession session) {
        int level = session.combatLevel();
        if (level < 1) {
            throw new CombatValidationException("Combat level must be at least 1, got " + level);
        }
        String enemyTypeId = session.enemy().enemyTypeId();
        String enemyStyleId = session.enemy().styleId();

        EnemyTier tier = enemyCatalog.tier(enemyTypeId);
        requirePositive(tier.goldMultiplier(), "gold multiplier", tier.tierId());
        requirePositive(tier.xpMultiplier(), "xp multiplier", tier.tierId());

        CombatProperties.RewardParams params = properties.rewards();
        long gold = (long) Math.floor(params.goldPerLevel() * level * tier.goldMultiplier());
        long experience = (long) Math.floor(params.xpPerLevel() * level * tier.xpMultiplier());

        List<LootEntry> table = lootCatalog.lootTable(enemyTypeId);
        List<MaterialReward> materials = rollMaterials(enemyTypeId, table, enemyStyleId);
        List<ItemReward> items = rollItems(table, level, enemyStyleId);

        log.debug("[掉落] 擲出戰利品 enemy={} level={}: gold={}, exp={}, 材料 {} 件, 裝備 {} 件",
                enemyTypeId, level, gold, experience, materials.size(), items.size());
        return new GeneratedLoot(gold, materials, items, experience);
    }

    private List<MaterialReward> rollMaterials(String enemyTypeId, List<LootEntry> table, String enemyStyleId) {
        List<LootEntry> materialEntries = table.stream()
                .filter(e -> e.type() == LootableType.MATERIAL)
                .toList();
        if (materialEntries.isEmpty()) {
            throw new GameDataException("Enemy type " + enemyTypeId + " has no material loot entries");
        }

        CombatProperties.RewardParams params = properties.rewards();
        int drops = random.nextIntInclusive(params.minMaterialDrops(), params.maxMaterialDrops());
        String enemyStyleName = styleName(enemyStyleId);

        return selector.select(materialEntries, LootEntry::dropWeight, drops).stream()
                .map(entry -> toMaterialReward(entry, enemyStyleId, enemyStyleName))
                .toList();
    }

    private MaterialReward toMaterialReward(LootEntry entry, String enemyStyleId, String enemyStyleName) {
        MaterialDefinition material = lootCatalog.material(entry.lootableId())
                .orElseThrow(() -> new CombatNotFoundException("Material", entry.lootableId()));

        // 材料自帶風格優先；風格定義遺失時退回敵人風格
        if (material.fixedStyleId() != null) {
            String fixedName = lootCatalog.styleName(material.fixedStyleId()).orElse(null);
            if (fixedName != null) {
                return new MaterialReward(material.id(), material.name(), material.fixedStyleId(), fixedName);
            }
            log.warn("[掉落] 材料 {} 的風格 {} 不存在，改用敵人風格", material.id(), material.fixedStyleId());
        }
        return new MaterialReward(material.id(), material.name(), enemyStyleId, enemyStyleName);
    }

    private List<ItemReward> rollItems(List<LootEntry> table, int level, String enemyStyleId) {
        List<LootEntry> itemEntries = table.stream()
                .filter(e -> e.type() == LootableType.ITEM_TYPE)
                .toList();
        if (itemEntries.isEmpty()) {
            return List.of();
        }

        LootEntry entry = selector.selectOne(itemEntries, LootEntry::dropWeight);
        ItemTypeDefinition itemType = lootCatalog.itemType(entry.lootableId())
                .orElseThrow(() -> new CombatNotFoundException("Item type", entry.lootableId()));
        Rarity rarity = rollRarity(level);

        return List.of(new ItemReward(null, itemType.id(), itemType.name(), itemType.category(),
                rarity, enemyStyleId, styleName(enemyStyleId)));
    }

    /**
     * 稀有度權重 = 基礎掉率 × (1 + 等級 × 每級加成)，等級越高越容易抽到高稀有度。
     */
    Rarity rollRarity(int level) {
        List<RarityWeight> weights = lootCatalog.rarityWeights();
        if (weights.isEmpty()) {
            throw new GameDataException("No rarity definitions configured");
        }
        double levelFactor = 1 + level * properties.rewards().rarityLevelBonus();
        return selector.selectOne(weights, w -> w.baseDropRate() * levelFactor).rarity();
    }

    private String styleName(String styleId) {
        return lootCatalog.styleName(styleId)
                .orElseThrow(() -> new CombatNotFoundException("Style", styleId));
    }

    private static void requirePositive(double value, String label, String tierId) {
        if (!(value > 0)) {
            throw new GameDataException("Tier " + tierId + " has non-positive " + label + ": " + value);
        }
    }
}
