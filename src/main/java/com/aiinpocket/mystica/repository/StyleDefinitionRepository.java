package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.StyleDefinition;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StyleDefinitionRepository extends JpaRepository<StyleDefinition, String> {
}
