package com.aiinpocket.mystica.model.dto;

import java.util.List;

/**
 * 勝利時擲出的戰利品（尚未寫入玩家資料）。
 */
public record GeneratedLoot(
        long gold,
        List<MaterialReward> materials,
        List<ItemReward> items,
        long experience
) {
    public GeneratedLoot {
        materials = List.copyOf(materials);
        items = List.copyOf(items);
    }

    /** 戰敗時不發放任何獎勵 */
    public static GeneratedLoot none() {
        return new GeneratedLoot(0, List.of(), List.of(), 0);
    }
}
