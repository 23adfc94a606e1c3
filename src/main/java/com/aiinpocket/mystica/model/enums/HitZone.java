package com.aiinpocket.mystica.model.enums;

/**
 * 時機轉盤的命中區段。
 * 宣告順序即轉盤上由 0° 起算的排列順序（暴擊 → 一般 → 擦傷 → 落空 → 自傷），
 * 客戶端轉盤美術依賴此順序，不可調整。
 *
 * <p>attackMultiplier 為攻擊倍率，mitigation 為防禦時的減傷比例（兩者刻意不同）。
 */
public enum HitZone {
    CRIT(1.6, 0.9),
    NORMAL(1.0, 0.7),
    GRAZE(0.6, 0.3),
    MISS(0.0, 0.0),
    /** 自傷：攻擊倍率為負，防禦時反而放大傷害 50% */
    INJURE(-0.5, -0.5);

    private final double attackMultiplier;
    private final double mitigation;

    HitZone(double attackMultiplier, double mitigation) {
        this.attackMultiplier = attackMultiplier;
        this.mitigation = mitigation;
    }

    public double attackMultiplier() {
        return attackMultiplier;
    }

    public double mitigation() {
        return mitigation;
    }
}
