package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.config.CombatProperties;
import com.aiinpocket.mystica.model.combat.CombatSession;
import com.aiinpocket.mystica.model.combat.EnemyCombatProfile;
import com.aiinpocket.mystica.model.combat.EquipmentSnapshot;
import com.aiinpocket.mystica.model.combat.PlayerCombatStats;
import com.aiinpocket.mystica.model.combat.WeaponConfig;

import java.time.Instant;
import java.util.List;

/** 測試共用的戰鬥資料 */
final class CombatFixtures {

    static final Instant T0 = Instant.parse("2026-03-01T12:00:00Z");
    static final WeaponConfig DEFAULT_WEAPON = CombatProperties.defaults().defaultWeapon().toWeaponConfig();

    private CombatFixtures() {
    }

    static EnemyCombatProfile goblin(int level, double atk, double def, int hp) {
        return new EnemyCombatProfile("goblin", "哥布林", level, atk, 10, def, 10, hp,
                "watercolor", "mocking", List.of("sneaky", "greedy"));
    }

    static PlayerCombatStats player(double atk, double def) {
        return new PlayerCombatStats(atk, 40, def, 40, 100);
    }

    static CombatSession session(String sessionId, String playerId, int level, EnemyCombatProfile enemy) {
        return new CombatSession(sessionId, playerId, "forest", level, enemy, player(30, 5),
                DEFAULT_WEAPON, EquipmentSnapshot.empty(T0), List.of("pool-forest"), List.of("loot-iron"),
                T0, T0.plusSeconds(900), List.of());
    }
}
