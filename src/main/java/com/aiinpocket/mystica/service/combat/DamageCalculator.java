package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.model.dto.DamageOutcome;
import com.aiinpocket.mystica.model.enums.HitZone;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 攻擊傷害計算。
 *
 * <ul>
 *   <li>暴擊：基礎倍率 1.6 再加上 [0, 1.0) 的隨機加成</li>
 *   <li>自傷：傷害 = max(1, floor(攻擊力 × |總倍率|))，不扣防禦，由攻擊方自行承受</li>
 *   <li>其他：傷害 = max(1, floor(攻擊力 × 總倍率) − 防禦力)</li>
 * </ul>
 * 傷害永遠至少為 1。
 */
@Component
@RequiredArgsConstructor
public class DamageCalculator {

    public static final int MIN_DAMAGE = 1;
    /** 暴擊額外倍率上限（不含） */
    public static final double MAX_CRIT_BONUS = 1.0;

    private final RandomSource random;

    public DamageOutcome calculate(double attackerPower, double defenderPower, HitZone zone) {
        double baseMultiplier = zone.attackMultiplier();
        Double critBonus = zone == HitZone.CRIT ? random.nextDouble() * MAX_CRIT_BONUS : null;
        double totalMultiplier = critBonus == null ? baseMultiplier : baseMultiplier + critBonus;

        int damage;
        if (zone == HitZone.INJURE) {
            damage = Math.max(MIN_DAMAGE, (int) Math.floor(attackerPower * Math.abs(totalMultiplier)));
        } else {
            double raw = Math.floor(attackerPower * totalMultiplier) - defenderPower;
            damage = Math.max(MIN_DAMAGE, (int) Math.floor(raw));
        }
        return new DamageOutcome(zone, damage, baseMultiplier, critBonus);
    }
}
