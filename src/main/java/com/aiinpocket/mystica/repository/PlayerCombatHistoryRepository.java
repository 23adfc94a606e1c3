package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.PlayerCombatHistory;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface PlayerCombatHistoryRepository extends JpaRepository<PlayerCombatHistory, Long> {

    Optional<PlayerCombatHistory> findByPlayerIdAndLocationId(String playerId, String locationId);

    /** 結算時鎖定該筆戰績，避免同一玩家並行結算互相覆蓋計數 */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT h FROM PlayerCombatHistory h WHERE h.playerId = :playerId AND h.locationId = :locationId")
    Optional<PlayerCombatHistory> findForUpdate(@Param("playerId") String playerId,
                                                @Param("locationId") String locationId);
}
