package com.aiinpocket.mystica.exception;

/**
 * 呼叫端輸入不合法（角度、等級、結果字面值等），永遠由呼叫端修正，不在內部重試。
 */
public class CombatValidationException extends IllegalArgumentException {

    public CombatValidationException(String message) {
        super(message);
    }
}
