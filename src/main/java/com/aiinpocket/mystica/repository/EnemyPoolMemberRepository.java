package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.EnemyPoolMemberEntry;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;

public interface EnemyPoolMemberRepository extends JpaRepository<EnemyPoolMemberEntry, Long> {

    @Query("SELECT m FROM EnemyPoolMemberEntry m JOIN FETCH m.pool JOIN FETCH m.enemyType " +
            "WHERE m.pool.id IN :poolIds ORDER BY m.pool.id, m.id")
    List<EnemyPoolMemberEntry> findByPoolIds(@Param("poolIds") Collection<String> poolIds);
}
