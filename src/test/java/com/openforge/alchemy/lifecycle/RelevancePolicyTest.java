package com.openforge.alchemy.lifecycle;

import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class RelevancePolicyTest {

    private static final LocalDateTime NOW = LocalDateTime.of(2024, 6, 1, 0, 0);

    private final RelevancePolicy policy = RelevancePolicy.defaults();

    @Test
    void freshUnusedRecordScoresRecencyWeightOnly() {
        assertThat(policy.score(NOW, 0, NOW)).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void recencyHalvesEveryHalfLife() {
        double oneHalfLife = policy.score(NOW.minusDays(30), 0, NOW);
        double twoHalfLives = policy.score(NOW.minusDays(60), 0, NOW);
        assertThat(oneHalfLife).isCloseTo(0.35, within(1e-9));
        assertThat(twoHalfLives).isCloseTo(0.175, within(1e-9));
    }

    @Test
    void neverIncreasesWithAgeAndNeverDecreasesWithUse() {
        double previous = Double.MAX_VALUE;
        for (int days = 0; days <= 365; days += 7) {
            double s = policy.score(NOW.minusDays(days), 3, NOW);
            assertThat(s).isLessThanOrEqualTo(previous);
            previous = s;
        }
        previous = -1;
        for (int uses = 0; uses <= 100; uses++) {
            double s = policy.score(NOW.minusDays(10), uses, NOW);
            assertThat(s).isGreaterThanOrEqualTo(previous);
            previous = s;
        }
    }

    @Test
    void alwaysWithinUnitInterval() {
        assertThat(policy.score(NOW.minusYears(50), 0, NOW)).isBetween(0.0, 1.0);
        assertThat(policy.score(NOW, Integer.MAX_VALUE, NOW)).isBetween(0.0, 1.0);
        assertThat(policy.score(NOW.plusDays(3), 0, NOW)).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void nonsensicalParametersFallBackToDefaults() {
        RelevancePolicy odd = new RelevancePolicy(0, 7, -1);
        assertThat(odd).isEqualTo(RelevancePolicy.defaults());
    }
}
