package com.aiinpocket.mystica.exception;

/**
 * 查無資源：戰鬥 session（已刪除、已過期或屬於其他玩家時一律如此回報）、
 * 敵人類型、玩家或遭遇池。
 */
public class CombatNotFoundException extends RuntimeException {

    public CombatNotFoundException(String resource, String id) {
        super(resource + " not found: " + id);
    }

    public CombatNotFoundException(String message) {
        super(message);
    }
}
