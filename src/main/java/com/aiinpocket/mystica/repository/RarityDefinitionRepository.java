package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.RarityDefinition;
import com.aiinpocket.mystica.model.enums.Rarity;
import org.springframework.data.jpa.repository.JpaRepository;

public interface RarityDefinitionRepository extends JpaRepository<RarityDefinition, Rarity> {
}
