package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.model.dto.DefenseOutcome;
import com.aiinpocket.mystica.model.enums.HitZone;
import org.springframework.stereotype.Component;

/**
 * 防禦減傷計算。
 * 敵人基礎傷害 = max(1, 敵人攻擊力 − 玩家防禦力)；
 * 擋下 = floor(基礎傷害 × 減傷比例)，承受 = max(1, 基礎傷害 − 擋下)。
 * 自傷區段的減傷比例為 -0.5，擋下為負數，承受傷害因此放大 50%。
 */
@Component
public class DefenseResolver {

    public int baseEnemyDamage(double enemyAttackPower, double playerDefensePower) {
        return Math.max(DamageCalculator.MIN_DAMAGE, (int) Math.floor(enemyAttackPower - playerDefensePower));
    }

    public DefenseOutcome resolve(int baseEnemyDamage, HitZone zone) {
        double mitigation = zone.mitigation();
        int blocked = (int) Math.floor(baseEnemyDamage * mitigation);
        int taken = Math.max(DamageCalculator.MIN_DAMAGE, baseEnemyDamage - blocked);
        return new DefenseOutcome(zone, baseEnemyDamage, mitigation, blocked, taken);
    }

    public DefenseOutcome resolve(double enemyAttackPower, double playerDefensePower, HitZone zone) {
        return resolve(baseEnemyDamage(enemyAttackPower, playerDefensePower), zone);
    }
}
