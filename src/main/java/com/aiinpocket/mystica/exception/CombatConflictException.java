package com.aiinpocket.mystica.exception;

/**
 * 玩家已有進行中的戰鬥，無法再開新局。
 */
public class CombatConflictException extends RuntimeException {

    public CombatConflictException(String message) {
        super(message);
    }

    public CombatConflictException(String message, Throwable cause) {
        super(message, cause);
    }
}
