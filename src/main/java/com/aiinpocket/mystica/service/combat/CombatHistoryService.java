package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.model.dto.CombatHistorySummary;
import com.aiinpocket.mystica.model.entity.PlayerCombatHistory;
import com.aiinpocket.mystica.model.enums.CombatResult;
import com.aiinpocket.mystica.repository.PlayerCombatHistoryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.Optional;

/**
 * 玩家各地點戰績（嘗試次數、勝敗、連勝）。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CombatHistoryService {

    private final PlayerCombatHistoryRepository historyRepo;
    private final Clock clock;

    /**
     * 記錄一場結算。首次在該地點結算時建立戰績。
     */
    @Transactional
    public CombatHistorySummary recordOutcome(String playerId, String locationId, CombatResult result) {
        PlayerCombatHistory history = historyRepo.findForUpdate(playerId, locationId)
                .orElseGet(() -> PlayerCombatHistory.start(playerId, locationId));
        history.record(result, clock.instant());
        historyRepo.save(history);

        log.info("[戰鬥紀錄] 玩家 {} 於 {} {}：{} 勝 {} 敗，連勝 {}（最高 {}）",
                playerId, locationId, result.literal(), history.getVictories(), history.getDefeats(),
                history.getCurrentStreak(), history.getLongestStreak());
        return history.toSummary();
    }

    @Transactional(readOnly = true)
    public Optional<CombatHistorySummary> find(String playerId, String locationId) {
        return historyRepo.findByPlayerIdAndLocationId(playerId, locationId)
                .map(PlayerCombatHistory::toSummary);
    }
}
