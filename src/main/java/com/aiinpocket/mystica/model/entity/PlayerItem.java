package com.aiinpocket.mystica.model.entity;

import com.aiinpocket.mystica.model.enums.Rarity;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 玩家持有的單件裝備。
 */
@Entity
@Table(name = "player_item", indexes = {
        @Index(name = "idx_player_item_player", columnList = "player_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerItem {

    @Id
    @Column(length = 36)
    private String id;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Column(name = "item_type_id", nullable = false, length = 64)
    private String itemTypeId;

    @Column(nullable = false)
    private Integer level;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 15)
    private Rarity rarity;

    @Column(name = "style_id", nullable = false, length = 32)
    private String styleId;

    /** 已裝備的欄位；null 表示在背包中 */
    @Column(name = "equipped_slot", length = 30)
    private String equippedSlot;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
