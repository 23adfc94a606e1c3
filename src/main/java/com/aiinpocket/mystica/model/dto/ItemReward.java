package com.aiinpocket.mystica.model.dto;

import com.aiinpocket.mystica.model.enums.Rarity;

/**
 * 掉落的裝備。itemId 在裝備紀錄建立後才有值。
 */
public record ItemReward(
        String itemId,
        String itemTypeId,
        String name,
        String category,
        Rarity rarity,
        String styleId,
        String styleName
) {
    public ItemReward withItemId(String createdItemId) {
        return new ItemReward(createdItemId, itemTypeId, name, category, rarity, styleId, styleName);
    }
}
