package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.exception.CombatValidationException;
import com.aiinpocket.mystica.model.combat.WeaponBands;
import com.aiinpocket.mystica.model.enums.HitZone;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 時機轉盤命中判定。
 * 區段依 暴擊 → 一般 → 擦傷 → 落空 → 自傷 的固定順序從 0° 起連續排列，
 * 取第一個累計上界大於點擊角度的區段；自傷區段吸收剩餘所有角度（含浮點累加誤差）。
 */
@Component
@Slf4j
public class HitZoneResolver {

    /** 自傷以外的區段，依轉盤順序 */
    private static final HitZone[] BOUNDED_ZONES = {
            HitZone.CRIT, HitZone.NORMAL, HitZone.GRAZE, HitZone.MISS
    };

    public HitZone resolve(double tapDegrees, WeaponBands bands) {
        validateTapDegrees(tapDegrees);

        double upperBound = 0;
        for (HitZone zone : BOUNDED_ZONES) {
            upperBound += bands.width(zone);
            if (tapDegrees < upperBound) {
                log.debug("[戰鬥] 命中判定 {}° → {}", tapDegrees, zone);
                return zone;
            }
        }
        log.debug("[戰鬥] 命中判定 {}° → {}", tapDegrees, HitZone.INJURE);
        return HitZone.INJURE;
    }

    /**
     * 點擊角度必須落在 [0, 360]，超出範圍視為呼叫端錯誤，不做截斷。
     */
    public static void validateTapDegrees(double tapDegrees) {
        if (Double.isNaN(tapDegrees) || tapDegrees < 0 || tapDegrees > 360) {
            throw new CombatValidationException("Tap position must be between 0 and 360 degrees, got " + tapDegrees);
        }
    }
}
