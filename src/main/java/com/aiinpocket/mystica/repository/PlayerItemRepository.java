package com.aiinpocket.mystica.repository;

import com.aiinpocket.mystica.model.entity.PlayerItem;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface PlayerItemRepository extends JpaRepository<PlayerItem, String> {

    /** 已裝備中的物品 */
    List<PlayerItem> findByPlayerIdAndEquippedSlotIsNotNull(String playerId);
}
