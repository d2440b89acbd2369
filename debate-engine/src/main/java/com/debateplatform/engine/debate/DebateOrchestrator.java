package com.debateplatform.engine.debate;

import com.debateplatform.common.exception.CacheInconsistencyException;
import com.debateplatform.common.exception.DebateFailedException;
import com.debateplatform.common.model.AgentOutput;
import com.debateplatform.common.model.AgentRole;
import com.debateplatform.common.model.CacheKey;
import com.debateplatform.common.model.DebateContext;
import com.debateplatform.common.model.DebateOutcome;
import com.debateplatform.common.model.DebateResult;
import com.debateplatform.common.model.DebateState;
import com.debateplatform.common.model.EntityPair;
import com.debateplatform.common.model.RoundRecord;
import com.debateplatform.common.policy.DebateDecisionPolicy;
import com.debateplatform.common.policy.KindPolicy;
import com.debateplatform.common.policy.RoundDecision;
import com.debateplatform.common.scoring.DisagreementScore;
import com.debateplatform.common.scoring.DisagreementScorer;
import com.debateplatform.common.trace.TraceContextUtil;
import com.debateplatform.common.variant.PromptVariant;
import com.debateplatform.common.variant.VariantSelector;
import com.debateplatform.engine.agent.AgentInvoker;
import com.debateplatform.engine.cache.DebateResultCache;
import com.debateplatform.engine.config.DebateProperties;
import com.debateplatform.engine.config.ExternalCallPolicy;
import com.debateplatform.engine.config.KindPolicyRegistry;
import com.debateplatform.engine.escalation.EscalationService;
import com.debateplatform.engine.logger.DebateFlowLogger;
import com.debateplatform.engine.store.DebateRunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Runs one debate through its state machine:
 * <pre>
 *   PENDING → DEBATING → SYNTHESIZING → COMPLETED
 *                 ↑            │        → ESCALATED
 *                 └─ regenerate┘        (FAILED from any non-terminal state)
 * </pre>
 *
 * <p>Per round the bull and bear run in parallel, each seeing the opponent's previous-round
 * output; the synthesizer then combines both. {@link DisagreementScorer} scores the pair and
 * {@link DebateDecisionPolicy} picks the transition. Rounds are strictly sequential and the
 * cancellation token is checked before each one.
 *
 * <p>Every transition is persisted through {@link DebateRunStore} before the next provider
 * call. Store writes and escalation hand-off go through {@link ExternalCallPolicy}, so a hung
 * write times out and fails the debate instead of holding its pair. Failures surface as {@link DebateFailedException} carrying the FAILED state with the
 * rounds recorded so far; nothing is cached for a failed debate.
 */
@Service
public class DebateOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(DebateOrchestrator.class);

    private final AgentInvoker agentInvoker;
    private final DebateRunStore runStore;
    private final EscalationService escalationService;
    private final DebateResultCache resultCache;
    private final KindPolicyRegistry policies;
    private final VariantSelector variantSelector;
    private final DebateFlowLogger flowLogger;
    private final DebateProperties properties;
    private final Clock clock;
    private final ExternalCallPolicy callPolicy;

    public DebateOrchestrator(AgentInvoker agentInvoker,
                              DebateRunStore runStore,
                              EscalationService escalationService,
                              DebateResultCache resultCache,
                              KindPolicyRegistry policies,
                              VariantSelector variantSelector,
                              DebateFlowLogger flowLogger,
                              DebateProperties properties,
                              Clock clock) {
        this.agentInvoker      = agentInvoker;
        this.runStore          = runStore;
        this.escalationService = escalationService;
        this.resultCache       = resultCache;
        this.policies          = policies;
        this.variantSelector   = variantSelector;
        this.flowLogger        = flowLogger;
        this.properties        = properties;
        this.clock             = clock;
        this.callPolicy        = new ExternalCallPolicy(properties);
    }

    public Mono<DebateOutcome> run(DebateContext context) {
        return run(context, UUID.randomUUID().toString(), new CancellationToken());
    }

    public Mono<DebateOutcome> run(DebateContext context, String debateId, CancellationToken token) {
        Mono<DebateOutcome> pipeline = Mono.defer(() -> {
            EntityPair pair = context.pair();
            KindPolicy policy = policies.policyFor(pair.kind());
            PromptVariant variant = variantSelector.select(pair.kind(), pair.pairId());
            DebateState state = DebateState.start(debateId, pair, variant.id(), policy.maxRounds(),
                                                  context.fingerprint(), clock.instant());
            Run run = new Run(state, context, variant, policy, token);
            flowLogger.logState(DebateFlowLogger.DEBATE_STARTED, state);

            return persist(state)
                .then(nextRound(run))
                .onErrorResume(e -> fail(run, e));
        });
        return TraceContextUtil.withDebateId(pipeline, debateId);
    }

    // ── rounds ───────────────────────────────────────────────────────────────

    private Mono<DebateOutcome> nextRound(Run run) {
        return Mono.defer(() -> {
            DebateState state = run.state();
            if (run.token().isCancelled()) {
                flowLogger.logState(DebateFlowLogger.DEBATE_CANCELLED, state);
                return Mono.just(new DebateOutcome.Cancelled(state));
            }

            AgentOutput bullFeedback = state.crossFeedbackFor(AgentRole.BULL).orElse(null);
            AgentOutput bearFeedback = state.crossFeedbackFor(AgentRole.BEAR).orElse(null);
            int round = state.beginRound(clock.instant());
            flowLogger.logState(DebateFlowLogger.ROUND_STARTED, state);

            return persist(state)
                .then(Mono.zip(
                    agentInvoker.invoke(AgentRole.BULL, round, run.variant(), run.context(), bullFeedback),
                    agentInvoker.invoke(AgentRole.BEAR, round, run.variant(), run.context(), bearFeedback)))
                .doOnEach(flowLogger.stage(DebateFlowLogger.DEBATERS_COMPLETED))
                .flatMap(outputs -> synthesize(run, round, outputs.getT1(), outputs.getT2()))
                .flatMap(record -> decide(run, record));
        });
    }

    private Mono<RoundRecord> synthesize(Run run, int round, AgentOutput bull, AgentOutput bear) {
        run.state().beginSynthesis(clock.instant());
        return persist(run.state())
            .then(agentInvoker.synthesize(round, run.variant(), run.context(), bull, bear))
            .doOnEach(flowLogger.stage(DebateFlowLogger.ROUND_SYNTHESIZED))
            .map(synthesis -> {
                DisagreementScore score = DisagreementScorer.score(bull, bear, run.policy().scoring());
                return new RoundRecord(round, bull, bear, synthesis, score.disagreement(), score.confidence());
            });
    }

    private Mono<DebateOutcome> decide(Run run, RoundRecord record) {
        DebateState state = run.state();
        state.recordRound(record, clock.instant());
        RoundDecision decision = DebateDecisionPolicy.decide(record, state.roundIndex(), run.policy());
        flowLogger.logRound(state, record, decision);

        return switch (decision) {
            case COMPLETE -> complete(run);
            case REGENERATE -> persist(state).then(nextRound(run));
            case ESCALATE_HARD_EXCLUSION, ESCALATE_MAX_ROUNDS, ESCALATE_LOW_CONFIDENCE -> escalate(run, record, decision);
        };
    }

    // ── terminal transitions ─────────────────────────────────────────────────

    private Mono<DebateOutcome> complete(Run run) {
        DebateState state = run.state();
        Instant now = clock.instant();
        DebateResult result = DebateResult.fromFinalRound(state, now);
        state.complete(result, now);

        return persist(state)
            .then(Mono.fromCallable(() -> {
                publish(run, result);
                flowLogger.logState(DebateFlowLogger.DEBATE_COMPLETED, state);
                return (DebateOutcome) new DebateOutcome.Completed(state, result);
            }));
    }

    private void publish(Run run, DebateResult result) {
        DebateState state = run.state();
        try {
            resultCache.put(new CacheKey(state.pair(), state.contextFingerprint()), result,
                            properties.getCacheTtl(), run.context().loadedAt());
        } catch (CacheInconsistencyException e) {
            log.warn("Completed result not cached; persisted state stays authoritative. debateId={} reason={}",
                     state.debateId(), e.getMessage());
        }
    }

    private Mono<DebateOutcome> escalate(Run run, RoundRecord record, RoundDecision decision) {
        DebateState state = run.state();
        String description = DebateDecisionPolicy.describe(decision, record, run.policy());
        state.escalate(decision.escalationReason(), description, clock.instant());

        return persist(state)
            .then(callPolicy.persist("escalation-open", escalationService.open(state)))
            .map(escalation -> {
                flowLogger.logState(DebateFlowLogger.DEBATE_ESCALATED, state);
                return new DebateOutcome.Escalated(state, escalation);
            });
    }

    private Mono<DebateOutcome> fail(Run run, Throwable cause) {
        if (cause instanceof DebateFailedException) {
            return Mono.error(cause);
        }
        DebateState state = run.state();
        flowLogger.logFailure(state, cause);
        if (state.status().isTerminal()) {
            return Mono.error(new DebateFailedException(state, cause));
        }
        state.fail(cause.getMessage(), clock.instant());
        return persist(state)
            .onErrorResume(saveError -> {
                log.error("FAILED state could not be persisted. debateId={}", state.debateId(), saveError);
                return Mono.empty();
            })
            .then(Mono.error(new DebateFailedException(state, cause)));
    }

    private Mono<Void> persist(DebateState state) {
        return callPolicy.persist("debate-run", runStore.save(state));
    }

    private record Run(DebateState state, DebateContext context, PromptVariant variant,
                       KindPolicy policy, CancellationToken token) {}
}
