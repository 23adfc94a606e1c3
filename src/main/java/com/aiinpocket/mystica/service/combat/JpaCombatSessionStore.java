package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.exception.CombatConflictException;
import com.aiinpocket.mystica.exception.CombatNotFoundException;
import com.aiinpocket.mystica.exception.GameDataException;
import com.aiinpocket.mystica.model.combat.CombatLogEntry;
import com.aiinpocket.mystica.model.combat.CombatSession;
import com.aiinpocket.mystica.model.combat.EnemyCombatProfile;
import com.aiinpocket.mystica.model.combat.EquipmentSnapshot;
import com.aiinpocket.mystica.model.combat.PlayerCombatStats;
import com.aiinpocket.mystica.model.combat.WeaponConfig;
import com.aiinpocket.mystica.model.entity.CombatSessionRecord;
import com.aiinpocket.mystica.repository.CombatSessionRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;
import tools.jackson.core.JacksonException;
import tools.jackson.core.type.TypeReference;
import tools.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * 以 combat_session 資料表保存戰鬥 session。
 * 快照與回合紀錄序列化為 JSON；讀取時過濾已過期的紀錄。
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaCombatSessionStore implements CombatSessionStore {

    private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
    private static final TypeReference<List<CombatLogEntry>> LOG_ENTRIES = new TypeReference<>() {};

    private final CombatSessionRecordRepository sessionRepo;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<CombatSession> findActive(String sessionId) {
        return sessionRepo.findById(sessionId)
                .filter(this::isActive)
                .map(this::toDomain);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<CombatSession> findActiveByPlayer(String playerId) {
        return sessionRepo.findByPlayerId(playerId)
                .filter(this::isActive)
                .map(this::toDomain);
    }

    @Override
    @Transactional
    public CombatSession create(CombatSession session) {
        Optional<CombatSessionRecord> existing = sessionRepo.findByPlayerId(session.playerId());
        if (existing.isPresent()) {
            if (isActive(existing.get())) {
                throw new CombatConflictException("Player " + session.playerId() + " already has an active combat session");
            }
            log.info("[戰鬥] 清除玩家 {} 的過期 session {}", session.playerId(), existing.get().getId());
            sessionRepo.delete(existing.get());
            sessionRepo.flush();
        }

        try {
            sessionRepo.saveAndFlush(toRecord(session));
        } catch (DataIntegrityViolationException e) {
            throw new CombatConflictException(
                    "Player " + session.playerId() + " already has an active combat session", e);
        }
        return session;
    }

    @Override
    @Transactional
    public CombatSession appendLogEntry(String sessionId, CombatLogEntry entry) {
        CombatSessionRecord record = sessionRepo.findById(sessionId)
                .filter(this::isActive)
                .orElseThrow(() -> new CombatNotFoundException("Combat session", sessionId));

        CombatSession updated = toDomain(record).withEntry(entry);
        record.setCombatLog(write(updated.combatLog()));
        record.setUpdatedAt(clock.instant());
        sessionRepo.save(record);
        return updated;
    }

    @Override
    @Transactional
    public void delete(String sessionId) {
        sessionRepo.deleteById(sessionId);
    }

    private boolean isActive(CombatSessionRecord record) {
        return !CombatSession.isExpired(record.getExpiresAt(), clock.instant());
    }

    // ===== 序列化 =====

    private CombatSessionRecord toRecord(CombatSession session) {
        Instant now = clock.instant();
        return CombatSessionRecord.builder()
                .id(session.sessionId())
                .playerId(session.playerId())
                .locationId(session.locationId())
                .combatLevel(session.combatLevel())
                .enemyTypeId(session.enemy().enemyTypeId())
                .enemyProfile(write(session.enemy()))
                .playerStats(write(session.playerStats()))
                .weaponConfig(write(session.weapon()))
                .equipmentSnapshot(write(session.equipment()))
                .enemyPoolIds(write(session.enemyPoolIds()))
                .lootEntryIds(write(session.lootEntryIds()))
                .combatLog(write(session.combatLog()))
                .createdAt(session.createdAt())
                .updatedAt(now)
                .expiresAt(session.expiresAt())
                .build();
    }

    private CombatSession toDomain(CombatSessionRecord record) {
        try {
            return new CombatSession(
                    record.getId(),
                    record.getPlayerId(),
                    record.getLocationId(),
                    record.getCombatLevel(),
                    objectMapper.readValue(record.getEnemyProfile(), EnemyCombatProfile.class),
                    objectMapper.readValue(record.getPlayerStats(), PlayerCombatStats.class),
                    objectMapper.readValue(record.getWeaponConfig(), WeaponConfig.class),
                    record.getEquipmentSnapshot() == null ? null
                            : objectMapper.readValue(record.getEquipmentSnapshot(), EquipmentSnapshot.class),
                    readStrings(record.getEnemyPoolIds()),
                    readStrings(record.getLootEntryIds()),
                    record.getCreatedAt(),
                    record.getExpiresAt(),
                    objectMapper.readValue(record.getCombatLog(), LOG_ENTRIES));
        } catch (JacksonException e) {
            throw new GameDataException("Stored combat session " + record.getId() + " is unreadable", e);
        }
    }

    private List<String> readStrings(String json) {
        return json == null ? List.of() : objectMapper.readValue(json, STRING_LIST);
    }

    private String write(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JacksonException e) {
            throw new IllegalStateException("Failed to serialize combat session data", e);
        }
    }
}
