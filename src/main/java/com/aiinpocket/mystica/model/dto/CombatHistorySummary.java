package com.aiinpocket.mystica.model.dto;

/**
 * 玩家在單一地點的累計戰績。
 */
public record CombatHistorySummary(
        String locationId,
        int totalAttempts,
        int victories,
        int defeats,
        int currentStreak,
        int longestStreak
) {}
