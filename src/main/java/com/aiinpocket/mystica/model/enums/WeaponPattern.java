package com.aiinpocket.mystica.model.enums;

/**
 * 武器轉盤的動畫樣式（僅供客戶端呈現，不影響命中判定）。
 */
public enum WeaponPattern {
    SINGLE_ARC,
    DUAL_ARCS,
    PULSING_ARC,
    ROULETTE,
    SAWTOOTH
}
