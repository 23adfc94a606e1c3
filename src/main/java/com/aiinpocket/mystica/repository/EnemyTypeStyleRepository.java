package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.EnemyTypeStyle;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface EnemyTypeStyleRepository extends JpaRepository<EnemyTypeStyle, Long> {

    List<EnemyTypeStyle> findByEnemyTypeIdOrderByStyleId(String enemyTypeId);
}
