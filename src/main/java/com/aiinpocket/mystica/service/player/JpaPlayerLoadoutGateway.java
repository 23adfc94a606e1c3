package com.aiinpocket.mystica.service.player;

import com.aiinpocket.mystica.config.CombatProperties;
import com.aiinpocket.mystica.exception.CombatNotFoundException;
import com.aiinpocket.mystica.model.combat.EquipmentSnapshot;
import com.aiinpocket.mystica.model.combat.PlayerCombatStats;
import com.aiinpocket.mystica.model.combat.WeaponBands;
import com.aiinpocket.mystica.model.combat.WeaponConfig;
import com.aiinpocket.mystica.model.entity.PlayerItem;
import com.aiinpocket.mystica.model.entity.PlayerProfile;
import com.aiinpocket.mystica.repository.PlayerItemRepository;
import com.aiinpocket.mystica.repository.PlayerProfileRepository;
import com.aiinpocket.mystica.repository.PlayerWeaponRepository;
import com.aiinpocket.mystica.service.gateway.PlayerLoadoutGateway;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * 從玩家資料表讀取開戰所需的數值、武器與裝備快照。
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaPlayerLoadoutGateway implements PlayerLoadoutGateway {

    private final PlayerProfileRepository profileRepo;
    private final PlayerWeaponRepository weaponRepo;
    private final PlayerItemRepository itemRepo;
    private final CombatProperties properties;
    private final Clock clock;

    @Override
    public PlayerCombatStats combatStats(String playerId) {
        PlayerProfile profile = profileRepo.findById(playerId)
                .orElseThrow(() -> new CombatNotFoundException("Player", playerId));
        return new PlayerCombatStats(profile.getAtkPower(), profile.getAtkAccuracy(),
                profile.getDefPower(), profile.getDefAccuracy(), properties.playerBaseHp());
    }

    @Override
    public Optional<WeaponConfig> equippedWeapon(String playerId) {
        return weaponRepo.findByPlayerId(playerId)
                .map(w -> new WeaponConfig(w.getPattern(), w.getSpinDegPerSecond(),
                        new WeaponBands(w.getDegCrit(), w.getDegNormal(), w.getDegGraze(),
                                w.getDegMiss(), w.getDegInjure())));
    }

    @Override
    public EquipmentSnapshot equipmentSnapshot(String playerId) {
        Map<String, EquipmentSnapshot.EquippedItem> slots = new LinkedHashMap<>();
        for (PlayerItem item : itemRepo.findByPlayerIdAndEquippedSlotIsNotNull(playerId)) {
            slots.put(item.getEquippedSlot(), new EquipmentSnapshot.EquippedItem(
                    item.getId(), item.getItemTypeId(), item.getLevel(), item.getRarity()));
        }
        return new EquipmentSnapshot(slots, clock.instant());
    }
}
