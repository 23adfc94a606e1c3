package com.aiinpocket.mystica.service.gateway;

import com.aiinpocket.mystica.model.combat.ItemTypeDefinition;
import com.aiinpocket.mystica.model.combat.LootEntry;
import com.aiinpocket.mystica.model.combat.MaterialDefinition;
import com.aiinpocket.mystica.model.combat.RarityWeight;

import java.util.List;
import java.util.Optional;

/**
 * 掉落相關的靜態資料：掉落表、材料、裝備類型、稀有度、風格名稱。
 */
public interface LootCatalog {

    List<LootEntry> lootTable(String enemyTypeId);

    Optional<MaterialDefinition> material(String materialId);

    Optional<ItemTypeDefinition> itemType(String itemTypeId);

    List<RarityWeight> rarityWeights();

    Optional<String> styleName(String styleId);
}
