package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.PlayerProfile;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface PlayerProfileRepository extends JpaRepository<PlayerProfile, String> {

    /** 以單一 UPDATE 累加，回傳受影響筆數（0 表示玩家不存在） */
    @Modifying
    @Query("UPDATE PlayerProfile p SET p.gold = p.gold + :amount WHERE p.id = :playerId")
    int addGold(@Param("playerId") String playerId, @Param("amount") long amount);

    @Modifying
    @Query("UPDATE PlayerProfile p SET p.experience = p.experience + :amount WHERE p.id = :playerId")
    int addExperience(@Param("playerId") String playerId, @Param("amount") long amount);
}
