package com.debateplatform.common.policy;

import com.debateplatform.common.exception.DebateConfigurationException;
import com.debateplatform.common.model.AgentOutput;
import com.debateplatform.common.model.AgentRole;
import com.debateplatform.common.model.EscalationReason;
import com.debateplatform.common.model.RoundRecord;
import com.debateplatform.common.model.SynthesisOutput;
import com.debateplatform.common.scoring.ScoringPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DebateDecisionPolicyTest {

    private static final KindPolicy POLICY = KindPolicy.DEFAULT;

    private static RoundRecord round(int n, double disagreement, double confidence,
                                     boolean bullExcludes, boolean bearExcludes) {
        AgentOutput bull = new AgentOutput(AgentRole.BULL, n, 70, 0.8, "bull case", List.of(), List.of(),
            bullExcludes, bullExcludes ? "sanctioned jurisdiction" : null, 100, 50);
        AgentOutput bear = new AgentOutput(AgentRole.BEAR, n, 60, 0.8, "bear case", List.of(), List.of(),
            bearExcludes, bearExcludes ? "fund size below mandate" : null, 100, 50);
        SynthesisOutput synthesis = new SynthesisOutput(n, 65, 0.8, "synthesis", List.of(), List.of(), 100, 50);
        return new RoundRecord(n, bull, bear, synthesis, disagreement, confidence);
    }

    @Nested
    @DisplayName("decide()")
    class DecideTests {

        @Test
        @DisplayName("within threshold and confident → COMPLETE")
        void consensus() {
            assertEquals(RoundDecision.COMPLETE, DebateDecisionPolicy.decide(round(1, 16, 0.8, false, false), 1, POLICY));
        }

        @Test
        @DisplayName("disagreement exactly at the threshold still completes")
        void thresholdIsInclusive() {
            assertEquals(RoundDecision.COMPLETE, DebateDecisionPolicy.decide(round(1, 20, 0.6, false, false), 1, POLICY));
        }

        @Test
        @DisplayName("above threshold with rounds left → REGENERATE")
        void regenerate() {
            assertEquals(RoundDecision.REGENERATE, DebateDecisionPolicy.decide(round(1, 45, 0.9, false, false), 1, POLICY));
        }

        @Test
        @DisplayName("above threshold on the last round → ESCALATE_MAX_ROUNDS")
        void maxRounds() {
            RoundDecision d = DebateDecisionPolicy.decide(round(3, 35, 0.9, false, false), 3, POLICY);
            assertEquals(RoundDecision.ESCALATE_MAX_ROUNDS, d);
            assertEquals(EscalationReason.MAJOR_DISAGREEMENT, d.escalationReason());
        }

        @Test
        @DisplayName("agreement without confidence regenerates, then escalates as LOW_CONFIDENCE")
        void falseConsensus() {
            RoundRecord agreeButUnsure = round(1, 0, 0.3, false, false);
            assertEquals(RoundDecision.REGENERATE, DebateDecisionPolicy.decide(agreeButUnsure, 1, POLICY));
            assertEquals(RoundDecision.ESCALATE_LOW_CONFIDENCE,
                DebateDecisionPolicy.decide(agreeButUnsure, 1, POLICY.withMaxRounds(1)));
        }

        @Test
        @DisplayName("hard exclusion overrides a clean consensus")
        void hardExclusionWins() {
            RoundDecision d = DebateDecisionPolicy.decide(round(1, 2, 0.95, false, true), 1, POLICY);
            assertEquals(RoundDecision.ESCALATE_HARD_EXCLUSION, d);
            assertTrue(d.isEscalation());
        }
    }

    @Nested
    @DisplayName("describe()")
    class DescribeTests {

        @Test
        void maxRoundsMessageCitesRoundAndNumbers() {
            String text = DebateDecisionPolicy.describe(RoundDecision.ESCALATE_MAX_ROUNDS,
                round(3, 35, 0.9, false, false), POLICY);
            assertEquals("max rounds exceeded at round 3, disagreement = 35.0 (threshold 20.0)", text);
        }

        @Test
        void hardExclusionMessageNamesTheRole() {
            String text = DebateDecisionPolicy.describe(RoundDecision.ESCALATE_HARD_EXCLUSION,
                round(1, 2, 0.95, false, true), POLICY);
            assertEquals("hard exclusion raised in round 1: BEAR - fund size below mandate", text);
        }

        @Test
        void nonEscalationRejected() {
            assertThrows(IllegalArgumentException.class, () -> DebateDecisionPolicy.describe(
                RoundDecision.COMPLETE, round(1, 0, 0.9, false, false), POLICY));
        }
    }

    @Test
    @DisplayName("KindPolicy rejects max_rounds below 1")
    void invalidMaxRounds() {
        assertThrows(DebateConfigurationException.class,
            () -> new KindPolicy(20, 0.6, 0, ScoringPolicy.DEFAULT));
    }
}
