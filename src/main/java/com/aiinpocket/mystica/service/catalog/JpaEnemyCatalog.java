package com.aiinpocket.mystica.service.catalog;

import com.aiinpocket.mystica.exception.CombatNotFoundException;
import com.aiinpocket.mystica.model.combat.EnemyCombatProfile;
import com.aiinpocket.mystica.model.combat.EnemyStyleOption;
import com.aiinpocket.mystica.model.combat.EnemyTier;
import com.aiinpocket.mystica.model.entity.EnemyTierDefinition;
import com.aiinpocket.mystica.model.entity.EnemyType;
import com.aiinpocket.mystica.repository.EnemyTypeRepository;
import com.aiinpocket.mystica.repository.EnemyTypeStyleRepository;
import com.aiinpocket.mystica.service.gateway.EnemyCatalog;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Arrays;
import java.util.List;

/**
 * 以資料庫為來源的敵人圖鑑。
 *
 * <p>數值換算：實際數值 = 正規化數值 × 8 × (1 + 0.05 × (等級 − 1)²) × 階級難度倍率；
 * HP = floor(基礎 HP × 階級難度倍率)。
 */
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class JpaEnemyCatalog implements EnemyCatalog {

    static final double STAT_BASE = 8.0;
    static final double LEVEL_CURVE = 0.05;

    private final EnemyTypeRepository enemyTypeRepo;
    private final EnemyTypeStyleRepository styleRepo;

    @Override
    public EnemyCombatProfile realize(String enemyTypeId, int level) {
        EnemyType type = load(enemyTypeId);
        double difficulty = type.getTier().getDifficultyMultiplier();
        double scale = STAT_BASE * levelScaling(level) * difficulty;

        return new EnemyCombatProfile(
                type.getId(),
                type.getName(),
                level,
                type.getAtkPowerNormalized() * scale,
                type.getAtkAccuracyNormalized() * scale,
                type.getDefPowerNormalized() * scale,
                type.getDefAccuracyNormalized() * scale,
                (int) Math.floor(type.getBaseHp() * difficulty),
                null,
                type.getDialogueTone(),
                parseTraits(type.getPersonalityTraits()));
    }

    @Override
    public EnemyTier tier(String enemyTypeId) {
        EnemyTierDefinition tier = load(enemyTypeId).getTier();
        return new EnemyTier(tier.getId(), tier.getDifficultyMultiplier(),
                tier.getGoldMultiplier(), tier.getXpMultiplier());
    }

    @Override
    public List<EnemyStyleOption> styles(String enemyTypeId) {
        return styleRepo.findByEnemyTypeIdOrderByStyleId(enemyTypeId).stream()
                .map(s -> new EnemyStyleOption(s.getStyleId(), s.getWeightMultiplier()))
                .toList();
    }

    static double levelScaling(int level) {
        int offset = level - 1;
        return 1 + LEVEL_CURVE * offset * offset;
    }

    private EnemyType load(String enemyTypeId) {
        return enemyTypeRepo.findWithTier(enemyTypeId)
                .orElseThrow(() -> new CombatNotFoundException("Enemy type", enemyTypeId));
    }

    private static List<String> parseTraits(String raw) {
        if (raw == null || raw.isBlank()) return List.of();
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .toList();
    }
}
