package com.aiinpocket.mystica.model.dto;

import com.aiinpocket.mystica.model.enums.HitZone;

/**
 * 防禦減傷結果。blocked 可能為負數（自傷區段放大傷害），taken 至少為 1。
 */
public record DefenseOutcome(
        HitZone zone,
        int baseEnemyDamage,
        double mitigation,
        int blocked,
        int taken
) {}
