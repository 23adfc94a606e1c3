package com.aiinpocket.mystica.service.gateway;

import com.aiinpocket.mystica.model.enums.Rarity;

/**
 * 玩家背包。材料以 (材料, 風格) 為單位堆疊，裝備每件獨立。
 */
public interface InventoryGateway {

    void addMaterial(String playerId, String materialId, String styleId, int quantity);

    /** @return 新建立的裝備 ID */
    String createItem(String playerId, String itemTypeId, int level, Rarity rarity, String styleId);
}
