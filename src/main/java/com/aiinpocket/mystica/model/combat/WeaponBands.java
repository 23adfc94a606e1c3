package com.aiinpocket.mystica.model.combat;

import com.aiinpocket.mystica.exception.GameDataException;
import com.aiinpocket.mystica.model.enums.HitZone;

/**
 * 武器轉盤五個區段的弧寬（度）。
 * 已由外部依玩家命中率調整過，核心邏輯視為不透明輸入；五段總和必須為 360°。
 */
public record WeaponBands(
        double crit,
        double normal,
        double graze,
        double miss,
        double injure
) {
    /** 容許累加誤差 */
    private static final double SUM_TOLERANCE = 1e-3;

    public WeaponBands {
        if (crit < 0 || normal < 0 || graze < 0 || miss < 0 || injure < 0) {
            throw new GameDataException("Weapon band widths must be non-negative");
        }
        double sum = crit + normal + graze + miss + injure;
        if (Math.abs(sum - 360.0) > SUM_TOLERANCE) {
            throw new GameDataException("Weapon bands must sum to 360 degrees, got " + sum);
        }
    }

    public double width(HitZone zone) {
        return switch (zone) {
            case CRIT -> crit;
            case NORMAL -> normal;
            case GRAZE -> graze;
            case MISS -> miss;
            case INJURE -> injure;
        };
    }
}
