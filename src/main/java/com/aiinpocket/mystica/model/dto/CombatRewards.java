package com.aiinpocket.mystica.model.dto;

import com.aiinpocket.mystica.model.enums.CombatResult;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.List;

/**
 * 戰鬥結算結果。勝利帶有戰利品，戰敗只有戰績更新。
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "result")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CombatRewards.Victory.class, name = "victory"),
        @JsonSubTypes.Type(value = CombatRewards.Defeat.class, name = "defeat")
})
public sealed interface CombatRewards permits CombatRewards.Victory, CombatRewards.Defeat {

    /** 結果已由 JSON 型別欄位 "result" 表示，不重複輸出 */
    @JsonIgnore
    CombatResult result();

    CombatHistorySummary combatHistory();

    record Victory(
            long gold,
            List<MaterialReward> materials,
            List<ItemReward> items,
            long experience,
            CombatHistorySummary combatHistory
    ) implements CombatRewards {
        public Victory {
            materials = List.copyOf(materials);
            items = List.copyOf(items);
        }

        @Override
        @JsonIgnore
        public CombatResult result() {
            return CombatResult.VICTORY;
        }
    }

    record Defeat(CombatHistorySummary combatHistory) implements CombatRewards {
        @Override
        @JsonIgnore
        public CombatResult result() {
            return CombatResult.DEFEAT;
        }
    }
}
