package com.example.realm.logic.combat;

import com.example.realm.support.ScriptedRandom;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CombatResolverTest {
    private final CombatResolver resolver = new CombatResolver(CombatRules.defaults());

    private static CombatStats stats(int accuracy, int evasion, int minDamage, int maxDamage, int defense, double crit) {
        return new CombatStats(accuracy, evasion, minDamage, maxDamage, defense, crit);
    }

    @Test
    void hitChanceIsClampedAtBothEnds() {
        assertThat(resolver.hitChance(stats(200, 0, 1, 1, 0, 0), stats(0, 0, 1, 1, 0, 0))).isEqualTo(0.95, within(1e-9));
        assertThat(resolver.hitChance(stats(0, 0, 1, 1, 0, 0), stats(0, 200, 1, 1, 0, 0))).isEqualTo(0.05, within(1e-9));
        assertThat(resolver.hitChance(stats(20, 0, 1, 1, 0, 0), stats(0, 10, 1, 1, 0, 0))).isEqualTo(0.85, within(1e-9));
    }

    @Test
    void criticalChanceIsCapped() {
        assertThat(resolver.criticalChance(stats(0, 0, 1, 1, 0, 0.0))).isEqualTo(0.10, within(1e-9));
        assertThat(resolver.criticalChance(stats(0, 0, 1, 1, 0, 0.05))).isEqualTo(0.15, within(1e-9));
        assertThat(resolver.criticalChance(stats(0, 0, 1, 1, 0, 3.0))).isEqualTo(0.5, within(1e-9));
    }

    @Test
    void criticalDoublesDamageAfterDefense() {
        ScriptedRandom rng = new ScriptedRandom().queueDoubles(0.5, 0.05).queueInts(6);

        AttackOutcome o = resolver.resolveAttack(stats(10, 0, 2, 8, 0, 0), stats(0, 10, 1, 1, 2, 0), rng);

        assertThat(o).isEqualTo(new AttackOutcome(true, true, 8));
    }

    @Test
    void rollAtOrAboveHitChanceMisses() {
        ScriptedRandom rng = new ScriptedRandom().queueDoubles(0.95);

        AttackOutcome o = resolver.resolveAttack(stats(500, 0, 5, 5, 0, 0), stats(0, 0, 1, 1, 0, 0), rng);

        assertThat(o).isEqualTo(AttackOutcome.MISS);
    }

    @Test
    void evenHopelessAttacksLandFivePercentOfTheTime() {
        ScriptedRandom rng = new ScriptedRandom().queueDoubles(0.049, 0.9);

        AttackOutcome o = resolver.resolveAttack(stats(0, 0, 1, 1, 0, 0), stats(0, 500, 1, 1, 0, 0), rng);

        assertThat(o.hit()).isTrue();
        assertThat(o.critical()).isFalse();
    }

    @Test
    void heavyArmorStillTakesOnePoint() {
        ScriptedRandom rng = new ScriptedRandom().queueDoubles(0.1, 0.9);

        AttackOutcome o = resolver.resolveAttack(stats(0, 0, 3, 3, 0, 0), stats(0, 0, 1, 1, 50, 0), rng);

        assertThat(o.damage()).isEqualTo(1);
    }
}
