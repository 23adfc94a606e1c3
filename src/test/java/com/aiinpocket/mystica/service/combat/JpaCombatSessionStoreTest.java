package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.exception.CombatConflictException;
import com.aiinpocket.mystica.exception.CombatNotFoundException;
import com.aiinpocket.mystica.model.combat.CombatLogEntry;
import com.aiinpocket.mystica.model.combat.CombatSession;
import com.aiinpocket.mystica.model.combat.EquipmentSnapshot;
import com.aiinpocket.mystica.model.entity.CombatSessionRecord;
import com.aiinpocket.mystica.model.enums.HitZone;
import com.aiinpocket.mystica.model.enums.Rarity;
import com.aiinpocket.mystica.repository.CombatSessionRecordRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import tools.jackson.databind.json.JsonMapper;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("資料庫 session 儲存")
class JpaCombatSessionStoreTest {

    @Mock
    private CombatSessionRecordRepository sessionRepo;

    private MutableClock clock;
    private JpaCombatSessionStore store;

    private final CombatSession session = new CombatSession(
            "s-1", "p-1", "forest", 5,
            CombatFixtures.goblin(5, 20.5, 10.25, 50),
            CombatFixtures.player(30, 5),
            CombatFixtures.DEFAULT_WEAPON,
            new EquipmentSnapshot(
                    Map.of("weapon", new EquipmentSnapshot.EquippedItem("item-9", "sword", 3, Rarity.RARE)),
                    CombatFixtures.T0),
            List.of("pool-forest"), List.of("loot-iron"),
            CombatFixtures.T0, CombatFixtures.T0.plusSeconds(900), List.of());

    @BeforeEach
    void setUp() {
        clock = new MutableClock(CombatFixtures.T0);
        store = new JpaCombatSessionStore(sessionRepo, JsonMapper.builder().build(), clock);
    }

    private CombatSessionRecord persisted() {
        when(sessionRepo.findByPlayerId("p-1")).thenReturn(Optional.empty());
        store.create(session);
        ArgumentCaptor<CombatSessionRecord> captor = ArgumentCaptor.forClass(CombatSessionRecord.class);
        verify(sessionRepo).saveAndFlush(captor.capture());
        return captor.getValue();
    }

    @Test
    @DisplayName("寫入後讀回的 session 與原本相同")
    void storedSessionReadsBack() {
        CombatSessionRecord record = persisted();
        when(sessionRepo.findById("s-1")).thenReturn(Optional.of(record));

        assertThat(record.getPlayerId()).isEqualTo("p-1");
        assertThat(record.getEnemyTypeId()).isEqualTo("goblin");
        assertThat(record.getExpiresAt()).isEqualTo(CombatFixtures.T0.plusSeconds(900));
        assertThat(store.findActive("s-1")).contains(session);
    }

    @Test
    @DisplayName("附加回合紀錄後 HP 由最後一筆推導")
    void appendLogEntryUpdatesRecord() {
        CombatSessionRecord record = persisted();
        when(sessionRepo.findById("s-1")).thenReturn(Optional.of(record));
        CombatLogEntry entry = CombatLogEntry.attack(1, 15.5, HitZone.NORMAL, 20, 100, 30, CombatFixtures.T0);

        CombatSession updated = store.appendLogEntry("s-1", entry);

        assertThat(updated.currentEnemyHp()).isEqualTo(30);
        assertThat(store.findActive("s-1")).get()
                .satisfies(s -> assertThat(s.combatLog()).containsExactly(entry));
    }

    @Test
    @DisplayName("過期的紀錄讀取時視為不存在")
    void expiredRecordIsAbsent() {
        CombatSessionRecord record = persisted();
        when(sessionRepo.findById("s-1")).thenReturn(Optional.of(record));
        clock.advance(Duration.ofMinutes(15));

        assertThat(store.findActive("s-1")).isEmpty();
        assertThatThrownBy(() -> store.appendLogEntry("s-1",
                CombatLogEntry.attack(1, 15, HitZone.NORMAL, 20, 100, 30, clock.instant())))
                .isInstanceOf(CombatNotFoundException.class);
    }

    @Test
    @DisplayName("玩家已有有效 session 時拒絕建立")
    void activeSessionConflicts() {
        CombatSessionRecord existing = CombatSessionRecord.builder()
                .id("s-old").playerId("p-1").expiresAt(CombatFixtures.T0.plusSeconds(60)).build();
        when(sessionRepo.findByPlayerId("p-1")).thenReturn(Optional.of(existing));

        assertThatThrownBy(() -> store.create(session)).isInstanceOf(CombatConflictException.class);
        verify(sessionRepo, never()).saveAndFlush(any());
    }

    @Test
    @DisplayName("同玩家的過期 session 先清除再建立")
    void staleSessionIsPurgedFirst() {
        CombatSessionRecord stale = CombatSessionRecord.builder()
                .id("s-old").playerId("p-1").expiresAt(CombatFixtures.T0.minusSeconds(1)).build();
        when(sessionRepo.findByPlayerId("p-1")).thenReturn(Optional.of(stale));

        store.create(session);

        InOrder order = inOrder(sessionRepo);
        order.verify(sessionRepo).delete(stale);
        order.verify(sessionRepo).flush();
        order.verify(sessionRepo).saveAndFlush(any(CombatSessionRecord.class));
    }

    @Test
    @DisplayName("唯一鍵衝突（並行開戰）轉為 Conflict")
    void uniqueViolationBecomesConflict() {
        when(sessionRepo.findByPlayerId("p-1")).thenReturn(Optional.empty());
        when(sessionRepo.saveAndFlush(any(CombatSessionRecord.class)))
                .thenThrow(new DataIntegrityViolationException("uk_combat_session_player"));

        assertThatThrownBy(() -> store.create(session))
                .isInstanceOf(CombatConflictException.class)
                .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("刪除委派給 repository")
    void deleteDelegates() {
        store.delete("s-1");

        verify(sessionRepo).deleteById("s-1");
    }
}
