package com.aiinpocket.mystica.exception;

/**
 * 遊戲資料設定錯誤：遭遇池沒有成員、掉落表為空、權重或倍率不為正數等。
 * 需要營運端修正資料，呼叫端無法自行排除。
 */
public class GameDataException extends RuntimeException {

    public GameDataException(String message) {
        super(message);
    }

    public GameDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
