package com.aiinpocket.mystica.model.dto;

import com.aiinpocket.mystica.model.enums.HitZone;

/**
 * 攻擊傷害計算結果。
 *
 * @param baseMultiplier 區段基礎倍率
 * @param critBonus      暴擊額外倍率 [0, 1.0)，非暴擊時為 null
 */
public record DamageOutcome(
        HitZone zone,
        int damage,
        double baseMultiplier,
        Double critBonus
) {
    public boolean critOccurred() {
        return critBonus != null;
    }

    public double totalMultiplier() {
        return critBonus == null ? baseMultiplier : baseMultiplier + critBonus;
    }

    /** 自傷區段的傷害由攻擊方自行承受 */
    public boolean selfInflicted() {
        return zone == HitZone.INJURE;
    }
}
