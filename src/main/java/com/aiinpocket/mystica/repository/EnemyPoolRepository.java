package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.EnemyPool;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.List;

public interface EnemyPoolRepository extends JpaRepository<EnemyPool, String> {

    /** 等級落在 [min_level, max_level] 的遭遇池 */
    @Query("SELECT p.id FROM EnemyPool p WHERE p.locationId = :locationId " +
            "AND p.minLevel <= :level AND p.maxLevel >= :level ORDER BY p.id")
    List<String> findEligibleIds(@Param("locationId") String locationId, @Param("level") int level);
}
