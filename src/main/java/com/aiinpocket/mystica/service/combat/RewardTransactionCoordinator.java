package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.model.combat.CombatSession;
import com.aiinpocket.mystica.model.dto.CombatHistorySummary;
import com.aiinpocket.mystica.model.dto.CombatRewards;
import com.aiinpocket.mystica.model.dto.GeneratedLoot;
import com.aiinpocket.mystica.model.dto.ItemReward;
import com.aiinpocket.mystica.model.dto.MaterialReward;
import com.aiinpocket.mystica.model.enums.CombatResult;
import com.aiinpocket.mystica.service.gateway.InventoryGateway;
import com.aiinpocket.mystica.service.gateway.PlayerLedgerGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;

/**
 * 戰鬥結算協調器。
 *
 * <p>整個結算在同一個交易內完成：擲戰利品 → 更新戰績 → 入帳金幣 → 材料入包 →
 * 建立裝備 → 入帳經驗 → 刪除 session。任一步失敗整筆回滾，session 保留，
 * 呼叫端可以重新結算；成功後 session 已刪除，同一場戰鬥不會被結算第二次。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class RewardTransactionCoordinator {

    private final LootGenerator lootGenerator;
    private final CombatHistoryService historyService;
    private final PlayerLedgerGateway ledger;
    private final InventoryGateway inventory;
    private final CombatSessionStore sessionStore;

    @Transactional
    public CombatRewards complete(CombatSession session, CombatResult result) {
        try {
            GeneratedLoot loot = result == CombatResult.VICTORY
                    ? lootGenerator.generate(session)
                    : GeneratedLoot.none();
            CombatHistorySummary history = historyService.recordOutcome(
                    session.playerId(), session.locationId(), result);
            List<ItemReward> createdItems = applyAndClose(session, loot);

            log.info("[戰鬥獎勵] session {} 結算完成：{}，金幣 +{}，經驗 +{}，材料 {} 件，裝備 {} 件",
                    session.sessionId(), result.literal(), loot.gold(), loot.experience(),
                    loot.materials().size(), createdItems.size());

            if (result == CombatResult.DEFEAT) {
                return new CombatRewards.Defeat(history);
            }
            return new CombatRewards.Victory(loot.gold(), loot.materials(), createdItems,
                    loot.experience(), history);
        } catch (RuntimeException e) {
            log.error("[戰鬥獎勵] session {} 結算失敗，session 保留待重試", session.sessionId(), e);
            throw e;
        }
    }

    /**
     * 依固定順序寫入獎勵，最後刪除 session。
     *
     * @return 帶有新建裝備 ID 的裝備清單
     */
    private List<ItemReward> applyAndClose(CombatSession session, GeneratedLoot loot) {
        String playerId = session.playerId();

        if (loot.gold() > 0) {
            ledger.creditGold(playerId, loot.gold(), session.sessionId());
        }
        for (MaterialReward material : loot.materials()) {
            inventory.addMaterial(playerId, material.materialId(), material.styleId(), 1);
        }
        List<ItemReward> created = new ArrayList<>(loot.items().size());
        for (ItemReward item : loot.items()) {
            String itemId = inventory.createItem(playerId, item.itemTypeId(), session.combatLevel(),
                    item.rarity(), item.styleId());
            created.add(item.withItemId(itemId));
        }
        if (loot.experience() > 0) {
            ledger.creditExperience(playerId, loot.experience());
        }

        sessionStore.delete(session.sessionId());
        return created;
    }
}
