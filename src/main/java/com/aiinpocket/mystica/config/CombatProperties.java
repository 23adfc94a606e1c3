package com.aiinpocket.mystica.config;

import com.aiinpocket.mystica.model.combat.WeaponBands;
import com.aiinpocket.mystica.model.combat.WeaponConfig;
import com.aiinpocket.mystica.model.enums.WeaponPattern;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * 戰鬥引擎設定（application.yml 的 combat.*）。
 */
@ConfigurationProperties(prefix = "combat")
public record CombatProperties(
        Duration sessionTtl,
        int minLevel,
        int maxLevel,
        int playerBaseHp,
        DefaultWeapon defaultWeapon,
        RewardParams rewards
) {
    /**
     * 玩家未裝備武器時使用的轉盤設定。
     */
    public record DefaultWeapon(
            WeaponPattern pattern,
            double spinDegPerSecond,
            double crit,
            double normal,
            double graze,
            double miss,
            double injure
    ) {
        public WeaponConfig toWeaponConfig() {
            return new WeaponConfig(pattern, spinDegPerSecond,
                    new WeaponBands(crit, normal, graze, miss, injure));
        }
    }

    public record RewardParams(
            int goldPerLevel,
            int xpPerLevel,
            int minMaterialDrops,
            int maxMaterialDrops,
            double rarityLevelBonus
    ) {}

    /** 與 application.yml 相同的預設值 */
    public static CombatProperties defaults() {
        return new CombatProperties(
                Duration.ofMinutes(15), 1, 100, 100,
                new DefaultWeapon(WeaponPattern.SINGLE_ARC, 180, 10, 20, 110, 110, 110),
                new RewardParams(10, 20, 1, 3, 0.05));
    }
}
