package com.aiinpocket.mystica.service.player;

import com.aiinpocket.mystica.model.entity.MaterialStack;
import com.aiinpocket.mystica.model.entity.PlayerItem;
import com.aiinpocket.mystica.model.enums.Rarity;
import com.aiinpocket.mystica.repository.MaterialStackRepository;
import com.aiinpocket.mystica.repository.PlayerItemRepository;
import com.aiinpocket.mystica.service.gateway.InventoryGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class JpaInventoryGateway implements InventoryGateway {

    private final MaterialStackRepository stackRepo;
    private final PlayerItemRepository itemRepo;

    @Override
    @Transactional
    public void addMaterial(String playerId, String materialId, String styleId, int quantity) {
        MaterialStack stack = stackRepo.findForUpdate(playerId, materialId, styleId)
                .orElseGet(() -> MaterialStack.builder()
                        .playerId(playerId)
                        .materialId(materialId)
                        .styleId(styleId)
                        .build());
        stack.setQuantity(stack.getQuantity() + quantity);
        stackRepo.save(stack);
        log.debug("[背包] 玩家 {} 材料 {}({}) +{} → {}", playerId, materialId, styleId, quantity, stack.getQuantity());
    }

    @Override
    @Transactional
    public String createItem(String playerId, String itemTypeId, int level, Rarity rarity, String styleId) {
        PlayerItem item = PlayerItem.builder()
                .id(UUID.randomUUID().toString())
                .playerId(playerId)
                .itemTypeId(itemTypeId)
                .level(level)
                .rarity(rarity)
                .styleId(styleId)
                .build();
        itemRepo.save(item);
        log.info("[背包] 玩家 {} 獲得裝備 {}（{} Lv.{}）", playerId, itemTypeId, rarity, level);
        return item.getId();
    }
}
