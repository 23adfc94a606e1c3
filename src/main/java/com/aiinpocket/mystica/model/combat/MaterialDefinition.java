package com.aiinpocket.mystica.model.combat;

/**
 * 材料定義。fixedStyleId 為 null 時，掉落的材料繼承被擊敗敵人的風格。
 */
public record MaterialDefinition(
        String id,
        String name,
        String fixedStyleId
) {}
