package com.aiinpocket.mystica.model.combat;

import com.aiinpocket.mystica.model.enums.Rarity;

import java.time.Instant;
import java.util.Map;

/**
 * 開戰當下的已裝備物品快照，僅供分析與斷線復原使用，不參與戰鬥計算。
 */
public record EquipmentSnapshot(
        Map<String, EquippedItem> equippedItems,
        Instant capturedAt
) {
    public EquipmentSnapshot {
        equippedItems = equippedItems == null ? Map.of() : Map.copyOf(equippedItems);
    }

    public static EquipmentSnapshot empty(Instant capturedAt) {
        return new EquipmentSnapshot(Map.of(), capturedAt);
    }

    public record EquippedItem(
            String itemId,
            String itemTypeId,
            int level,
            Rarity rarity
    ) {}
}
