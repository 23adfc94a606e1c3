package com.aiinpocket.mystica.model.combat;

import com.aiinpocket.mystica.model.enums.WeaponPattern;

/**
 * 開戰時快照的武器設定。
 */
public record WeaponConfig(
        WeaponPattern pattern,
        double spinDegPerSecond,
        WeaponBands bands
) {}
