package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.model.dto.DamageOutcome;
import com.aiinpocket.mystica.model.enums.HitZone;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("攻擊傷害計算")
class DamageCalculatorTest {

    @Test
    @DisplayName("一般命中：攻擊力 × 1.0 扣除防禦力")
    void normalHitSubtractsDefense() {
        DamageCalculator calculator = new DamageCalculator(new ScriptedRandomSource());

        DamageOutcome outcome = calculator.calculate(50, 10, HitZone.NORMAL);

        assertThat(outcome.damage()).isEqualTo(40);
        assertThat(outcome.baseMultiplier()).isEqualTo(1.0);
        assertThat(outcome.critOccurred()).isFalse();
        assertThat(outcome.critBonus()).isNull();
        assertThat(outcome.selfInflicted()).isFalse();
    }

    @Test
    @DisplayName("防禦力壓過攻擊時傷害仍至少為 1")
    void damageIsAtLeastOne() {
        DamageCalculator calculator = new DamageCalculator(new ScriptedRandomSource());

        assertThat(calculator.calculate(50, 999, HitZone.GRAZE).damage()).isEqualTo(1);
        assertThat(calculator.calculate(50, 10, HitZone.MISS).damage()).isEqualTo(1);
    }

    @Test
    @DisplayName("擦傷：攻擊力 × 0.6")
    void grazeUsesReducedMultiplier() {
        DamageCalculator calculator = new DamageCalculator(new ScriptedRandomSource());

        assertThat(calculator.calculate(50, 10, HitZone.GRAZE).damage()).isEqualTo(20);
    }

    @Test
    @DisplayName("暴擊：基礎 1.6 加上隨機加成")
    void critAddsRandomBonus() {
        DamageCalculator calculator = new DamageCalculator(new ScriptedRandomSource().doubles(0.4));

        DamageOutcome outcome = calculator.calculate(50, 10, HitZone.CRIT);

        assertThat(outcome.critOccurred()).isTrue();
        assertThat(outcome.critBonus()).isEqualTo(0.4);
        assertThat(outcome.totalMultiplier()).isCloseTo(2.0, within(1e-9));
        assertThat(outcome.damage()).isEqualTo(90);
    }

    @Test
    @DisplayName("暴擊傷害落在 1.6 ~ 2.6 倍區間")
    void critDamageStaysInRange() {
        DamageCalculator calculator = new DamageCalculator(RandomSource.seeded(20240101L));

        for (int i = 0; i < 1_000; i++) {
            DamageOutcome outcome = calculator.calculate(50, 10, HitZone.CRIT);
            assertThat(outcome.critBonus()).isGreaterThanOrEqualTo(0.0).isLessThan(1.0);
            assertThat(outcome.damage()).isBetween(70, 120);
        }
    }

    @Test
    @DisplayName("自傷：攻擊力 × 0.5，不扣防禦，由攻擊方承受")
    void injureHitsAttacker() {
        DamageCalculator calculator = new DamageCalculator(new ScriptedRandomSource());

        DamageOutcome outcome = calculator.calculate(50, 999, HitZone.INJURE);

        assertThat(outcome.damage()).isEqualTo(25);
        assertThat(outcome.selfInflicted()).isTrue();
        assertThat(outcome.baseMultiplier()).isEqualTo(-0.5);
    }

    @Test
    @DisplayName("自傷傷害同樣至少為 1")
    void injureIsAtLeastOne() {
        DamageCalculator calculator = new DamageCalculator(new ScriptedRandomSource());

        assertThat(calculator.calculate(1, 0, HitZone.INJURE).damage()).isEqualTo(1);
    }
}
