package com.aiinpocket.mystica.service.catalog;

import com.aiinpocket.mystica.config.CacheConfig;
import com.aiinpocket.mystica.model.combat.ItemTypeDefinition;
import com.aiinpocket.mystica.model.combat.LootEntry;
import com.aiinpocket.mystica.model.combat.MaterialDefinition;
import com.aiinpocket.mystica.model.combat.RarityWeight;
import com.aiinpocket.mystica.model.entity.StyleDefinition;
import com.aiinpocket.mystica.repository.ItemTypeRepository;
import com.aiinpocket.mystica.repository.LootTableEntryRepository;
import com.aiinpocket.mystica.repository.MaterialRepository;
import com.aiinpocket.mystica.repository.RarityDefinitionRepository;
import com.aiinpocket.mystica.repository.StyleDefinitionRepository;
import com.aiinpocket.mystica.service.gateway.LootCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * 掉落資料查詢。稀有度與風格名稱幾乎不變動，以 Caffeine 快取。
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class JpaLootCatalog implements LootCatalog {

    private final LootTableEntryRepository lootRepo;
    private final MaterialRepository materialRepo;
    private final ItemTypeRepository itemTypeRepo;
    private final RarityDefinitionRepository rarityRepo;
    private final StyleDefinitionRepository styleRepo;

    @Override
    public List<LootEntry> lootTable(String enemyTypeId) {
        return lootRepo.findByEnemyTypeIdOrderById(enemyTypeId).stream()
                .map(e -> new LootEntry(e.getId(), e.getLootableType(), e.getLootableId(), e.getDropWeight()))
                .toList();
    }

    @Override
    public Optional<MaterialDefinition> material(String materialId) {
        return materialRepo.findById(materialId)
                .map(m -> new MaterialDefinition(m.getId(), m.getName(), m.getStyleId()));
    }

    @Override
    public Optional<ItemTypeDefinition> itemType(String itemTypeId) {
        return itemTypeRepo.findById(itemTypeId)
                .map(t -> new ItemTypeDefinition(t.getId(), t.getName(), t.getCategory()));
    }

    @Override
    @Cacheable(CacheConfig.RARITY_DEFINITIONS)
    public List<RarityWeight> rarityWeights() {
        List<RarityWeight> weights = rarityRepo.findAll().stream()
                .map(r -> new RarityWeight(r.getRarity(), r.getBaseDropRate()))
                .sorted(Comparator.comparing(RarityWeight::rarity))
                .toList();
        log.info("[掉落] 載入稀有度定義 {} 筆", weights.size());
        return weights;
    }

    @Override
    @Cacheable(CacheConfig.STYLE_NAMES)
    public Optional<String> styleName(String styleId) {
        return styleRepo.findById(styleId).map(StyleDefinition::getDisplayName);
    }
}
