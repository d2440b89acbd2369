package com.debateplatform.common.scoring;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link DisagreementScorer}.
 */
class DisagreementScorerTest {

    private static final double EPS = 1e-9;

    // ── disagreement ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("disagreement")
    class DisagreementTests {

        @Test
        @DisplayName("absolute difference of the two scores")
        void absoluteDifference() {
            DisagreementScore s = DisagreementScorer.score(78, 0.9, 62, 0.8, ScoringPolicy.DEFAULT);
            assertEquals(16.0, s.disagreement(), EPS);
        }

        @Test
        @DisplayName("symmetric in its arguments")
        void symmetric() {
            for (ScoringPolicy policy : new ScoringPolicy[] {
                    ScoringPolicy.DEFAULT,
                    new ScoringPolicy(ConfidenceAggregation.MEAN, 0.5, 0.3)}) {
                assertEquals(
                    DisagreementScorer.score(85, 0.35, 40, 0.95, policy),
                    DisagreementScorer.score(40, 0.95, 85, 0.35, policy));
            }
        }

        @Test
        @DisplayName("out-of-range scores clamp to [0, 100]")
        void clampsScores() {
            DisagreementScore s = DisagreementScorer.score(140, 0.9, -20, 0.9, ScoringPolicy.DEFAULT);
            assertEquals(100.0, s.disagreement(), EPS);
        }

        @Test
        @DisplayName("NaN score clamps to zero")
        void nanScore() {
            DisagreementScore s = DisagreementScorer.score(Double.NaN, 0.9, 30, 0.9, ScoringPolicy.DEFAULT);
            assertEquals(30.0, s.disagreement(), EPS);
        }
    }

    // ── confidence ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("confidence")
    class ConfidenceTests {

        @Test
        @DisplayName("MINIMUM takes the weaker debater")
        void minimumAggregation() {
            DisagreementScore s = DisagreementScorer.score(70, 0.9, 65, 0.7, ScoringPolicy.DEFAULT);
            assertEquals(0.7, s.confidence(), EPS);
            assertFalse(s.penalized());
        }

        @Test
        @DisplayName("MEAN averages both")
        void meanAggregation() {
            ScoringPolicy mean = new ScoringPolicy(ConfidenceAggregation.MEAN, 0.4, 0.5);
            DisagreementScore s = DisagreementScorer.score(70, 0.9, 65, 0.7, mean);
            assertEquals(0.8, s.confidence(), EPS);
        }

        @Test
        @DisplayName("one debater below the floor → aggregate multiplied by the penalty")
        void lowConfidencePenalty() {
            ScoringPolicy mean = new ScoringPolicy(ConfidenceAggregation.MEAN, 0.4, 0.5);
            DisagreementScore s = DisagreementScorer.score(70, 0.9, 65, 0.3, mean);
            assertTrue(s.penalized());
            assertEquals(0.3, s.confidence(), EPS);
        }

        @Test
        @DisplayName("confidences outside [0, 1] are clamped before aggregating")
        void clampsConfidence() {
            DisagreementScore s = DisagreementScorer.score(50, 1.7, 50, 1.2, ScoringPolicy.DEFAULT);
            assertEquals(1.0, s.confidence(), EPS);
        }
    }

    @Test
    @DisplayName("policy rejects a zero penalty")
    void policyValidation() {
        assertThrows(IllegalArgumentException.class,
            () -> new ScoringPolicy(ConfidenceAggregation.MINIMUM, 0.4, 0.0));
        assertThrows(IllegalArgumentException.class,
            () -> new ScoringPolicy(ConfidenceAggregation.MINIMUM, 1.4, 0.5));
    }
}
