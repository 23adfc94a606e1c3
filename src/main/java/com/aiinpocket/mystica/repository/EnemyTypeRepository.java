package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.EnemyType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface EnemyTypeRepository extends JpaRepository<EnemyType, String> {

    @Query("SELECT e FROM EnemyType e JOIN FETCH e.tier WHERE e.id = :id")
    Optional<EnemyType> findWithTier(@Param("id") String id);
}
