package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.model.combat.CombatSession;
import com.aiinpocket.mystica.model.dto.CombatHistorySummary;
import com.aiinpocket.mystica.model.dto.CombatRewards;
import com.aiinpocket.mystica.model.dto.GeneratedLoot;
import com.aiinpocket.mystica.model.dto.ItemReward;
import com.aiinpocket.mystica.model.dto.MaterialReward;
import com.aiinpocket.mystica.model.enums.CombatResult;
import com.aiinpocket.mystica.model.enums.Rarity;
import com.aiinpocket.mystica.service.gateway.InventoryGateway;
import com.aiinpocket.mystica.service.gateway.PlayerLedgerGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("戰鬥結算協調")
class RewardTransactionCoordinatorTest {

    private static final CombatHistorySummary WIN_HISTORY = new CombatHistorySummary("forest", 1, 1, 0, 1, 1);
    private static final CombatHistorySummary LOSS_HISTORY = new CombatHistorySummary("forest", 1, 0, 1, 0, 0);

    private static final GeneratedLoot LOOT = new GeneratedLoot(
            75,
            List.of(new MaterialReward("iron", "鐵礦", "watercolor", "水彩"),
                    new MaterialReward("crystal", "水晶", "pixel_art", "像素")),
            List.of(new ItemReward(null, "sword", "長劍", "weapon", Rarity.RARE, "watercolor", "水彩")),
            200);

    @Mock
    private LootGenerator lootGenerator;

    @Mock
    private CombatHistoryService historyService;

    @Mock
    private PlayerLedgerGateway ledger;

    @Mock
    private InventoryGateway inventory;

    @Mock
    private CombatSessionStore sessionStore;

    private RewardTransactionCoordinator coordinator;

    private final CombatSession session = CombatFixtures.session("s-1", "p-1", 5, CombatFixtures.goblin(5, 20, 10, 50));

    @BeforeEach
    void setUp() {
        coordinator = new RewardTransactionCoordinator(lootGenerator, historyService, ledger, inventory, sessionStore);
    }

    @Test
    @DisplayName("勝利：依 金幣 → 材料 → 裝備 → 經驗 → 刪除 session 的順序寫入")
    void victoryAppliesRewardsInOrder() {
        when(lootGenerator.generate(session)).thenReturn(LOOT);
        when(historyService.recordOutcome("p-1", "forest", CombatResult.VICTORY)).thenReturn(WIN_HISTORY);
        when(inventory.createItem("p-1", "sword", 5, Rarity.RARE, "watercolor")).thenReturn("item-123");

        CombatRewards rewards = coordinator.complete(session, CombatResult.VICTORY);

        InOrder order = inOrder(ledger, inventory, sessionStore);
        order.verify(ledger).creditGold("p-1", 75, "s-1");
        order.verify(inventory).addMaterial("p-1", "iron", "watercolor", 1);
        order.verify(inventory).addMaterial("p-1", "crystal", "pixel_art", 1);
        order.verify(inventory).createItem("p-1", "sword", 5, Rarity.RARE, "watercolor");
        order.verify(ledger).creditExperience("p-1", 200);
        order.verify(sessionStore).delete("s-1");

        assertThat(rewards).isInstanceOf(CombatRewards.Victory.class);
        CombatRewards.Victory victory = (CombatRewards.Victory) rewards;
        assertThat(victory.gold()).isEqualTo(75);
        assertThat(victory.experience()).isEqualTo(200);
        assertThat(victory.materials()).hasSize(2);
        assertThat(victory.items()).extracting(ItemReward::itemId).containsExactly("item-123");
        assertThat(victory.combatHistory()).isEqualTo(WIN_HISTORY);
    }

    @Test
    @DisplayName("寫入途中失敗時原樣拋出，session 保留供重試")
    void failureKeepsSessionAndRethrows() {
        when(lootGenerator.generate(session)).thenReturn(LOOT);
        when(historyService.recordOutcome("p-1", "forest", CombatResult.VICTORY)).thenReturn(WIN_HISTORY);
        IllegalStateException failure = new IllegalStateException("inventory unavailable");
        when(inventory.createItem(anyString(), anyString(), anyInt(), any(), anyString())).thenThrow(failure);

        assertThatThrownBy(() -> coordinator.complete(session, CombatResult.VICTORY)).isSameAs(failure);

        verify(ledger).creditGold("p-1", 75, "s-1");
        verify(ledger, never()).creditExperience(anyString(), anyLong());
        verify(sessionStore, never()).delete(anyString());
    }

    @Test
    @DisplayName("戰利品擲骰失敗時不更新戰績也不寫入任何獎勵")
    void lootFailureTouchesNothing() {
        when(lootGenerator.generate(session)).thenThrow(new IllegalStateException("bad loot table"));

        assertThatThrownBy(() -> coordinator.complete(session, CombatResult.VICTORY))
                .isInstanceOf(IllegalStateException.class);

        verifyNoInteractions(historyService, ledger, inventory, sessionStore);
    }

    @Test
    @DisplayName("戰敗：只更新戰績並刪除 session")
    void defeatOnlyUpdatesHistory() {
        when(historyService.recordOutcome("p-1", "forest", CombatResult.DEFEAT)).thenReturn(LOSS_HISTORY);

        CombatRewards rewards = coordinator.complete(session, CombatResult.DEFEAT);

        assertThat(rewards).isEqualTo(new CombatRewards.Defeat(LOSS_HISTORY));
        assertThat(rewards.result()).isEqualTo(CombatResult.DEFEAT);
        verifyNoInteractions(lootGenerator, ledger, inventory);
        verify(sessionStore).delete("s-1");
    }
}
