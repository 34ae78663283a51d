package com.openforge.meetingmemory.temporal;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TemporalConfidenceTest {

    private static final Instant T0 = Instant.parse("2024-03-04T09:00:00Z");

    @Nested
    @DisplayName("currentConfidence")
    class Decay {

        @Test
        void equalsInitialConfidenceAtAssertionTime() {
            TemporalConfidence belief = TemporalConfidence.assertedAt(0.9, T0, DecayProfile.GENERAL);

            assertThat(belief.currentConfidence(T0)).isEqualTo(0.9);
        }

        @Test
        void generalBeliefsLoseAboutSixtyPercentInNineDays() {
            TemporalConfidence belief = TemporalConfidence.assertedAt(0.9, T0, DecayProfile.GENERAL);

            double after = belief.currentConfidence(T0.plus(Duration.ofDays(9)));

            assertThat(after).isCloseTo(0.9 * Math.exp(-0.9), within(1e-9));
            assertThat(after).isLessThan(0.9);
        }

        @Test
        void datedBeliefsDecayTenTimesSlower() {
            TemporalConfidence general = TemporalConfidence.assertedAt(0.8, T0, DecayProfile.GENERAL);
            TemporalConfidence dated   = TemporalConfidence.assertedAt(0.8, T0, DecayProfile.DATED);
            Instant later = T0.plus(Duration.ofDays(10));

            assertThat(dated.currentConfidence(later)).isCloseTo(0.8 * Math.exp(-0.1), within(1e-9));
            assertThat(general.currentConfidence(later)).isCloseTo(0.8 * Math.exp(-1.0), within(1e-9));
        }

        @Test
        void neverIncreasesWithElapsedTime() {
            TemporalConfidence belief = TemporalConfidence.assertedAt(1.0, T0, DecayProfile.GENERAL);

            double previous = belief.currentConfidence(T0);
            for (int hours = 1; hours <= 24 * 60; hours += 7) {
                double current = belief.currentConfidence(T0.plus(Duration.ofHours(hours)));
                assertThat(current).isLessThanOrEqualTo(previous);
                previous = current;
            }
        }

        @Test
        void readingBeforeTheAssertionDoesNotGrowTheBelief() {
            TemporalConfidence belief = TemporalConfidence.assertedAt(0.6, T0, DecayProfile.GENERAL);

            assertThat(belief.currentConfidence(T0.minus(Duration.ofDays(30)))).isEqualTo(0.6);
        }

        @Test
        void outOfRangeInitialValuesAreClamped() {
            assertThat(TemporalConfidence.assertedAt(1.7, T0, DecayProfile.GENERAL).initialConfidence()).isEqualTo(1.0);
            assertThat(TemporalConfidence.assertedAt(-0.3, T0, DecayProfile.GENERAL).initialConfidence()).isEqualTo(0.0);
            assertThat(TemporalConfidence.assertedAt(Double.NaN, T0, DecayProfile.GENERAL).initialConfidence()).isEqualTo(0.0);
        }
    }

    @Nested
    @DisplayName("reinforce")
    class Reinforce {

        @Test
        void addsEvidenceAndRestartsTheClock() {
            TemporalConfidence belief = TemporalConfidence.assertedAt(0.5, T0, DecayProfile.GENERAL);
            Instant later = T0.plus(Duration.ofDays(3));

            belief.reinforce(0.2, later);

            assertThat(belief.initialConfidence()).isCloseTo(0.7, within(1e-9));
            assertThat(belief.lastReinforced()).isEqualTo(later);
            assertThat(belief.reinforcementCount()).isEqualTo(1);
            assertThat(belief.currentConfidence(later)).isCloseTo(0.7, within(1e-9));
        }

        @Test
        void neverExceedsOneWhateverTheEvidence() {
            double[] strengths = {0.0, 0.3, 1.0, 5.0, 1e9, Double.POSITIVE_INFINITY, Double.NaN};
            for (double start : new double[]{0.0, 0.4, 0.99, 1.0}) {
                for (double strength : strengths) {
                    TemporalConfidence belief = TemporalConfidence.assertedAt(start, T0, DecayProfile.GENERAL);
                    belief.reinforce(strength, T0);
                    assertThat(belief.currentConfidence(T0)).isBetween(0.0, 1.0);
                }
            }
        }

        @Test
        void negativeEvidenceCannotPushBelowZero() {
            TemporalConfidence belief = TemporalConfidence.assertedAt(0.2, T0, DecayProfile.DATED);

            belief.reinforce(-3.0, T0);

            assertThat(belief.initialConfidence()).isEqualTo(0.0);
        }

        @Test
        void countsEveryReinforcement() {
            TemporalConfidence belief = TemporalConfidence.assertedAt(0.1, T0, DecayProfile.GENERAL);

            belief.reinforce(0.1, T0.plusSeconds(60));
            belief.reinforce(0.1, T0.plusSeconds(120));
            belief.reinforce(0.1);

            assertThat(belief.reinforcementCount()).isEqualTo(3);
            assertThat(belief.profile()).isEqualTo(DecayProfile.GENERAL);
        }
    }
}
