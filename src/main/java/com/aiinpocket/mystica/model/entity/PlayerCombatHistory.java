package com.aiinpocket.mystica.model.entity;

import com.aiinpocket.mystica.model.dto.CombatHistorySummary;
import com.aiinpocket.mystica.model.enums.CombatResult;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

/**
 * 玩家在單一地點的累計戰績。
 */
@Entity
@Table(name = "player_combat_history",
        uniqueConstraints = @UniqueConstraint(name = "uk_history_player_location",
                columnNames = {"player_id", "location_id"}))
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerCombatHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "player_id", nullable = false, length = 64)
    private String playerId;

    @Column(name = "location_id", nullable = false, length = 64)
    private String locationId;

    @Column(name = "total_attempts", nullable = false)
    @Builder.Default
    private Integer totalAttempts = 0;

    @Column(nullable = false)
    @Builder.Default
    private Integer victories = 0;

    @Column(nullable = false)
    @Builder.Default
    private Integer defeats = 0;

    /** 目前連勝場數，戰敗歸零 */
    @Column(name = "current_streak", nullable = false)
    @Builder.Default
    private Integer currentStreak = 0;

    @Column(name = "longest_streak", nullable = false)
    @Builder.Default
    private Integer longestStreak = 0;

    @Column(name = "last_attempt")
    private Instant lastAttempt;

    public static PlayerCombatHistory start(String playerId, String locationId) {
        return PlayerCombatHistory.builder()
                .playerId(playerId)
                .locationId(locationId)
                .build();
    }

    /** 記錄一場結算：勝利累加連勝，戰敗連勝歸零 */
    public void record(CombatResult result, Instant at) {
        totalAttempts++;
        if (result == CombatResult.VICTORY) {
            victories++;
            currentStreak++;
            longestStreak = Math.max(longestStreak, currentStreak);
        } else {
            defeats++;
            currentStreak = 0;
        }
        lastAttempt = at;
    }

    public CombatHistorySummary toSummary() {
        return new CombatHistorySummary(locationId, totalAttempts, victories, defeats,
                currentStreak, longestStreak);
    }
}
