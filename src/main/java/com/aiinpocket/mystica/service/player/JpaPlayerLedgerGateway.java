package com.aiinpocket.mystica.service.player;

import com.aiinpocket.mystica.exception.CombatNotFoundException;
import com.aiinpocket.mystica.repository.PlayerProfileRepository;
import com.aiinpocket.mystica.service.gateway.PlayerLedgerGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * 玩家金幣與經驗入帳，以單一 UPDATE 累加避免讀改寫競爭。
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class JpaPlayerLedgerGateway implements PlayerLedgerGateway {

    private final PlayerProfileRepository profileRepo;

    @Override
    @Transactional
    public void creditGold(String playerId, long amount, String sourceSessionId) {
        if (profileRepo.addGold(playerId, amount) == 0) {
            throw new CombatNotFoundException("Player", playerId);
        }
        log.info("[帳本] 玩家 {} 獲得 {} 金幣（來源 session {}）", playerId, amount, sourceSessionId);
    }

    @Override
    @Transactional
    public void creditExperience(String playerId, long amount) {
        if (profileRepo.addExperience(playerId, amount) == 0) {
            throw new CombatNotFoundException("Player", playerId);
        }
        log.debug("[帳本] 玩家 {} 獲得 {} 經驗", playerId, amount);
    }
}
