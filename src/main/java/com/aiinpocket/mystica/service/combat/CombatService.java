package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.config.CombatProperties;
import com.aiinpocket.mystica.exception.CombatConflictException;
import com.aiinpocket.mystica.exception.CombatNotFoundException;
import com.aiinpocket.mystica.exception.CombatValidationException;
import com.aiinpocket.mystica.model.combat.CombatLogEntry;
import com.aiinpocket.mystica.model.combat.CombatSession;
import com.aiinpocket.mystica.model.combat.EquipmentSnapshot;
import com.aiinpocket.mystica.model.combat.LootEntry;
import com.aiinpocket.mystica.model.combat.PlayerCombatStats;
import com.aiinpocket.mystica.model.combat.WeaponConfig;
import com.aiinpocket.mystica.model.dto.AttackResult;
import com.aiinpocket.mystica.model.dto.CombatRewards;
import com.aiinpocket.mystica.model.dto.CombatSessionView;
import com.aiinpocket.mystica.model.dto.DamageOutcome;
import com.aiinpocket.mystica.model.dto.DefenseOutcome;
import com.aiinpocket.mystica.model.dto.DefenseResult;
import com.aiinpocket.mystica.model.enums.CombatResult;
import com.aiinpocket.mystica.model.enums.CombatStatus;
import com.aiinpocket.mystica.model.enums.HitZone;
import com.aiinpocket.mystica.service.gateway.LootCatalog;
import com.aiinpocket.mystica.service.gateway.PlayerLoadoutGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * 戰鬥流程服務（session 狀態機）。
 *
 * <p>流程：開戰 → 若干回合的攻擊／防禦 → 結算（勝利或戰敗）或放棄。
 * HP 一律由 session 的回合紀錄推導；回合結束時任一方 HP 歸零即自動結算。
 * 自動結算失敗時 session 保留，此時勝負已定，只能以相同結果重新結算。
 * 攻擊回合敵人不反擊，敵人的傷害只在玩家選擇防禦時發生。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CombatService {

    private final CombatSessionStore sessionStore;
    private final PlayerLoadoutGateway loadoutGateway;
    private final LootCatalog lootCatalog;
    private final EncounterSelector encounterSelector;
    private final HitZoneResolver hitZoneResolver;
    private final DamageCalculator damageCalculator;
    private final DefenseResolver defenseResolver;
    private final RewardTransactionCoordinator rewardCoordinator;
    private final CombatProperties properties;
    private final Clock clock;

    // ===== 開戰 =====

    /**
     * 在指定地點以玩家選擇的等級開戰。
     *
     * @throws CombatValidationException 等級超出範圍
     * @throws CombatConflictException   玩家已有進行中的戰鬥
     * @throws CombatNotFoundException   該地點與等級沒有可用的遭遇池
     */
    public CombatSessionView startCombat(String playerId, String locationId, int combatLevel) {
        if (combatLevel < properties.minLevel() || combatLevel > properties.maxLevel()) {
            throw new CombatValidationException("Combat level must be between " + properties.minLevel()
                    + " and " + properties.maxLevel() + ", got " + combatLevel);
        }
        sessionStore.findActiveByPlayer(playerId).ifPresent(existing -> {
            log.warn("[戰鬥] 玩家 {} 已有進行中的 session {}，拒絕開新局", playerId, existing.sessionId());
            throw new CombatConflictException("Player " + playerId + " already has an active combat session");
        });

        PlayerCombatStats playerStats = loadoutGateway.combatStats(playerId);
        EncounterSelector.Encounter encounter = encounterSelector.select(locationId, combatLevel);
        WeaponConfig weapon = loadoutGateway.equippedWeapon(playerId)
                .orElseGet(() -> properties.defaultWeapon().toWeaponConfig());
        EquipmentSnapshot equipment = loadoutGateway.equipmentSnapshot(playerId);
        List<String> lootEntryIds = lootCatalog.lootTable(encounter.enemy().enemyTypeId()).stream()
                .map(LootEntry::id)
                .toList();

        Instant now = clock.instant();
        CombatSession session = new CombatSession(
                UUID.randomUUID().toString(),
                playerId,
                locationId,
                combatLevel,
                encounter.enemy(),
                playerStats,
                weapon,
                equipment,
                encounter.poolIds(),
                lootEntryIds,
                now,
                now.plus(properties.sessionTtl()),
                List.of());
        CombatSession created = sessionStore.create(session);

        log.info("[戰鬥] 開戰 session={} player={} location={} level={} enemy={} hp={}/{}",
                created.sessionId(), playerId, locationId, combatLevel,
                created.enemy().enemyTypeId(), created.currentPlayerHp(), created.currentEnemyHp());
        return CombatSessionView.of(created);
    }

    // ===== 回合 =====

    /**
     * 攻擊回合：依點擊角度判定命中區段並對敵人造成傷害（自傷區段則傷害自己）。
     */
    public AttackResult executeAttack(String sessionId, double tapDegrees) {
        HitZoneResolver.validateTapDegrees(tapDegrees);
        CombatSession session = loadUndecided(sessionId);
        HitZone zone = hitZoneResolver.resolve(tapDegrees, session.weapon().bands());
        DamageOutcome outcome = damageCalculator.calculate(
                session.playerStats().atkPower(), session.enemy().defPower(), zone);

        int playerHp = session.currentPlayerHp();
        int enemyHp = session.currentEnemyHp();
        if (outcome.selfInflicted()) {
            playerHp = Math.max(0, playerHp - outcome.damage());
        } else {
            enemyHp = Math.max(0, enemyHp - outcome.damage());
        }

        int turn = session.nextTurnNumber();
        CombatSession updated = sessionStore.appendLogEntry(sessionId, CombatLogEntry.attack(
                turn, tapDegrees, zone, outcome.damage(), playerHp, enemyHp, clock.instant()));

        log.debug("[戰鬥] session={} 第 {} 回合攻擊 zone={} damage={} playerHp={} enemyHp={}",
                sessionId, turn, zone, outcome.damage(), playerHp, enemyHp);

        Optional<CombatResult> decided = updated.decidedResult();
        CombatStatus status = decided.map(CombatResult::toStatus).orElse(CombatStatus.ONGOING);
        CombatRewards rewards = decided.map(result -> finish(updated, result)).orElse(null);
        return new AttackResult(turn, zone, outcome.damage(), outcome.totalMultiplier(),
                outcome.critOccurred(), outcome.critBonus(), outcome.selfInflicted(),
                playerHp, enemyHp, status, rewards);
    }

    /**
     * 防禦回合：依點擊角度判定減傷比例，承受敵人攻擊。防禦不會傷害敵人。
     */
    public DefenseResult executeDefense(String sessionId, double tapDegrees) {
        HitZoneResolver.validateTapDegrees(tapDegrees);
        CombatSession session = loadUndecided(sessionId);
        HitZone zone = hitZoneResolver.resolve(tapDegrees, session.weapon().bands());
        DefenseOutcome outcome = defenseResolver.resolve(
                session.enemy().atkPower(), session.playerStats().defPower(), zone);

        int playerHp = Math.max(0, session.currentPlayerHp() - outcome.taken());
        int enemyHp = session.currentEnemyHp();

        int turn = session.nextTurnNumber();
        CombatSession updated = sessionStore.appendLogEntry(sessionId, CombatLogEntry.defense(
                turn, tapDegrees, zone, outcome.blocked(), outcome.taken(), playerHp, enemyHp, clock.instant()));

        log.debug("[戰鬥] session={} 第 {} 回合防禦 zone={} base={} blocked={} taken={} playerHp={}",
                sessionId, turn, zone, outcome.baseEnemyDamage(), outcome.blocked(), outcome.taken(), playerHp);

        Optional<CombatResult> decided = updated.decidedResult();
        CombatStatus status = decided.map(CombatResult::toStatus).orElse(CombatStatus.ONGOING);
        CombatRewards rewards = decided.map(result -> finish(updated, result)).orElse(null);
        return new DefenseResult(turn, zone, outcome.baseEnemyDamage(), outcome.blocked(), outcome.taken(),
                playerHp, enemyHp, status, rewards);
    }

    // ===== 結算 / 放棄 =====

    /**
     * 由呼叫端宣告結果並結算（例如自動結算失敗後重試）。
     * 紀錄已分出勝負時，宣告的結果必須與紀錄一致。
     *
     * @param resultLiteral "victory" 或 "defeat"
     * @throws CombatValidationException 字面值不合法，或與紀錄中的勝負不符
     */
    public CombatRewards completeCombat(String sessionId, String resultLiteral) {
        CombatResult result = CombatResult.fromLiteral(resultLiteral);
        CombatSession session = loadActive(sessionId);
        session.decidedResult()
                .filter(decided -> decided != result)
                .ifPresent(decided -> {
                    log.warn("[戰鬥] session={} 紀錄結果為 {}，拒絕以 {} 結算",
                            sessionId, decided.literal(), result.literal());
                    throw new CombatValidationException("Combat session " + sessionId
                            + " already ended in " + decided.literal() + ", cannot complete as " + result.literal());
                });
        return rewardCoordinator.complete(session, result);
    }

    /**
     * 放棄戰鬥：直接刪除 session，不結算也不更新戰績。session 不存在時視為成功。
     */
    public void abandonCombat(String sessionId) {
        sessionStore.delete(sessionId);
        log.info("[戰鬥] session {} 已放棄", sessionId);
    }

    // ===== 查詢 =====

    public CombatSessionView getCombatSession(String sessionId) {
        return CombatSessionView.of(loadActive(sessionId));
    }

    /**
     * 斷線復原用查詢。session 屬於其他玩家時與不存在的回報方式相同。
     */
    public CombatSessionView getCombatSessionForRecovery(String sessionId, String playerId) {
        CombatSession session = loadActive(sessionId);
        if (!session.playerId().equals(playerId)) {
            log.warn("[戰鬥] 玩家 {} 嘗試讀取他人的 session {}", playerId, sessionId);
            throw new CombatNotFoundException("Combat session", sessionId);
        }
        return CombatSessionView.of(session);
    }

    public Optional<CombatSessionView> getActiveSession(String playerId) {
        return sessionStore.findActiveByPlayer(playerId).map(CombatSessionView::of);
    }

    // ===== 內部 =====

    private CombatSession loadActive(String sessionId) {
        return sessionStore.findActive(sessionId)
                .orElseThrow(() -> new CombatNotFoundException("Combat session", sessionId));
    }

    /** 回合操作只接受尚未分出勝負的 session */
    private CombatSession loadUndecided(String sessionId) {
        CombatSession session = loadActive(sessionId);
        session.decidedResult().ifPresent(decided -> {
            log.warn("[戰鬥] session={} 已分出勝負（{}），拒絕新回合", sessionId, decided.literal());
            throw new CombatValidationException("Combat session " + sessionId
                    + " already ended in " + decided.literal() + ", complete it instead");
        });
        return session;
    }

    private CombatRewards finish(CombatSession session, CombatResult result) {
        log.info("[戰鬥] session={} player={} 戰鬥結束：{}（{} 回合）",
                session.sessionId(), session.playerId(), result.literal(), session.turnNumber());
        return rewardCoordinator.complete(session, result);
    }
}
