package com.aiinpocket.mystica.model.combat;

import com.aiinpocket.mystica.model.enums.LootableType;

/**
 * 敵人掉落表項目；dropWeight 必須為正數。
 *
 * @param lootableId 材料 ID 或裝備類型 ID（依 type 而定）
 */
public record LootEntry(
        String id,
        LootableType type,
        String lootableId,
        double dropWeight
) {}
