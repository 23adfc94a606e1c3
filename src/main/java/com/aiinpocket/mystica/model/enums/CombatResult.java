package com.aiinpocket.mystica.model.enums;

import com.aiinpocket.mystica.exception.CombatValidationException;

import java.util.Locale;

/**
 * 戰鬥結算結果（僅勝利或戰敗兩種，放棄不結算）。
 */
public enum CombatResult {
    VICTORY,
    DEFEAT;

    /**
     * 解析呼叫端傳入的結果字面值（"victory" / "defeat"，不分大小寫）。
     *
     * @throws CombatValidationException 字面值不合法
     */
    public static CombatResult fromLiteral(String literal) {
        if (literal == null || literal.isBlank()) {
            throw new CombatValidationException("Result must be \"victory\" or \"defeat\"");
        }
        try {
            return valueOf(literal.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new CombatValidationException("Result must be \"victory\" or \"defeat\", got: " + literal);
        }
    }

    public CombatStatus toStatus() {
        return this == VICTORY ? CombatStatus.VICTORY : CombatStatus.DEFEAT;
    }

    public String literal() {
        return name().toLowerCase(Locale.ROOT);
    }
}
