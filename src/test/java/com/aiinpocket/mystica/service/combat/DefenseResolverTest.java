package com.aiinpocket.mystica.service.combat;

import com.aiinpocket.mystica.model.dto.DefenseOutcome;
import com.aiinpocket.mystica.model.enums.HitZone;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("防禦減傷計算")
class DefenseResolverTest {

    private final DefenseResolver resolver = new DefenseResolver();

    @ParameterizedTest(name = "{0}: 擋下 {1}，承受 {2}")
    @CsvSource({
            "CRIT, 90, 10",
            "NORMAL, 70, 30",
            "GRAZE, 30, 70",
            "MISS, 0, 100",
            "INJURE, -50, 150"
    })
    @DisplayName("基礎傷害 100 時各區段的擋下與承受")
    void mitigationByZone(HitZone zone, int blocked, int taken) {
        DefenseOutcome outcome = resolver.resolve(100, zone);

        assertThat(outcome.baseEnemyDamage()).isEqualTo(100);
        assertThat(outcome.blocked()).isEqualTo(blocked);
        assertThat(outcome.taken()).isEqualTo(taken);
    }

    @Test
    @DisplayName("敵人基礎傷害 = 敵人攻擊力 − 玩家防禦力，至少為 1")
    void baseDamageIsAtLeastOne() {
        assertThat(resolver.baseEnemyDamage(110, 10)).isEqualTo(100);
        assertThat(resolver.baseEnemyDamage(5, 20)).isEqualTo(1);
        assertThat(resolver.baseEnemyDamage(10.9, 0)).isEqualTo(10);
    }

    @Test
    @DisplayName("完美防禦仍至少承受 1 點傷害")
    void takenIsAtLeastOne() {
        DefenseOutcome outcome = resolver.resolve(5, 20, HitZone.CRIT);

        assertThat(outcome.baseEnemyDamage()).isEqualTo(1);
        assertThat(outcome.blocked()).isZero();
        assertThat(outcome.taken()).isEqualTo(1);
    }

    @Test
    @DisplayName("基礎傷害 1 時自傷區段放大為 2")
    void injureAmplifiesMinimumDamage() {
        DefenseOutcome outcome = resolver.resolve(1, HitZone.INJURE);

        assertThat(outcome.blocked()).isEqualTo(-1);
        assertThat(outcome.taken()).isEqualTo(2);
    }
}
