package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.model.combat.CombatLogEntry;
import com.aiinpocket.mystica.model.combat.CombatSession;

import java.util.Optional;

/**
 * 戰鬥 session 儲存。
 * 過期的 session 一律視為不存在；每位玩家同時最多一場有效 session。
 */
public interface CombatSessionStore {

    Optional<CombatSession> findActive(String sessionId);

    Optional<CombatSession> findActiveByPlayer(String playerId);

    /**
     * 建立 session。玩家已有有效 session 時拋出 CombatConflictException；
     * 已過期的舊 session 會先被清除。
     */
    CombatSession create(CombatSession session);

    /**
     * 附加一筆回合紀錄並回傳更新後的 session。
     * session 不存在或已過期時拋出 CombatNotFoundException。
     */
    CombatSession appendLogEntry(String sessionId, CombatLogEntry entry);

    /** 刪除 session；不存在時不做任何事 */
    void delete(String sessionId);
}
