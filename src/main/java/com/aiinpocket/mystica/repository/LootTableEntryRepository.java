package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.LootTableEntry;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface LootTableEntryRepository extends JpaRepository<LootTableEntry, String> {

    List<LootTableEntry> findByEnemyTypeIdOrderById(String enemyTypeId);
}
