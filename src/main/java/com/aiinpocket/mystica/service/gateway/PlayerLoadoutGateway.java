package com.aiinpocket.mystica.service.gateway;

import com.aiinpocket.mystica.model.combat.EquipmentSnapshot;
import com.aiinpocket.mystica.model.combat.PlayerCombatStats;
import com.aiinpocket.mystica.model.combat.WeaponConfig;

import java.util.Optional;

/**
 * 玩家裝備與數值來源。開戰時讀取一次，之後整場戰鬥使用快照。
 */
public interface PlayerLoadoutGateway {

    /** 玩家目前的戰鬥數值；玩家不存在時拋出 CombatNotFoundException */
    PlayerCombatStats combatStats(String playerId);

    /** 已依命中率調整過的武器轉盤；未裝備武器時為 empty */
    Optional<WeaponConfig> equippedWeapon(String playerId);

    EquipmentSnapshot equipmentSnapshot(String playerId);
}
