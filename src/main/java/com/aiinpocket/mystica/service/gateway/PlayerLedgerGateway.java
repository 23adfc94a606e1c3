package com.aiinpocket.mystica.service.gateway;

/**
 * 玩家貨幣與經驗帳本。
 */
public interface PlayerLedgerGateway {

    /**
     * @param sourceSessionId 獎勵來源的戰鬥 session，供帳本追蹤
     */
    void creditGold(String playerId, long amount, String sourceSessionId);

    void creditExperience(String playerId, long amount);
}
