package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.CombatSessionRecord;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface CombatSessionRecordRepository extends JpaRepository<CombatSessionRecord, String> {

    Optional<CombatSessionRecord> findByPlayerId(String playerId);
}
