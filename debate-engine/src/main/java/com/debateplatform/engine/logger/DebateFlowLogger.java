package com.debateplatform.engine.logger;

import com.debateplatform.common.model.DebateState;
import com.debateplatform.common.model.RoundRecord;
import com.debateplatform.common.policy.RoundDecision;
import com.debateplatform.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Logs each lifecycle stage of a debate run without touching pipeline behavior.
 *
 * <p>Stages, in order: {@link #DEBATE_STARTED}, then per round {@link #ROUND_STARTED},
 * {@link #DEBATERS_COMPLETED}, {@link #ROUND_SYNTHESIZED}, {@link #ROUND_DECIDED}; finally one of
 * {@link #DEBATE_COMPLETED}, {@link #DEBATE_ESCALATED}, {@link #DEBATE_CANCELLED},
 * {@link #DEBATE_FAILED}.
 *
 * <p>With {@code doOnEach} the debate id is read from the Reactor Context:
 * <pre>
 *     .doOnEach(debateFlowLogger.stage(DebateFlowLogger.DEBATERS_COMPLETED))
 * </pre>
 */
@Component
public class DebateFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DebateFlowLogger.class);

    public static final String DEBATE_STARTED     = "DEBATE_STARTED";
    public static final String ROUND_STARTED      = "ROUND_STARTED";
    public static final String DEBATERS_COMPLETED = "DEBATERS_COMPLETED";
    public static final String ROUND_SYNTHESIZED  = "ROUND_SYNTHESIZED";
    public static final String ROUND_DECIDED      = "ROUND_DECIDED";
    public static final String DEBATE_COMPLETED   = "DEBATE_COMPLETED";
    public static final String DEBATE_ESCALATED   = "DEBATE_ESCALATED";
    public static final String DEBATE_CANCELLED   = "DEBATE_CANCELLED";
    public static final String DEBATE_FAILED      = "DEBATE_FAILED";

    /** {@code doOnEach} consumer; fires on {@code onNext} only. */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String debateId = TraceContextUtil.getDebateId(signal.getContextView());
            TraceContextUtil.withMdc(debateId, () ->
                log.info("[DebateFlow] stage={} debateId={}", stageName, debateId)
            );
        };
    }

    public void logState(String stageName, DebateState state) {
        TraceContextUtil.withMdc(state.debateId(), () ->
            log.info("[DebateFlow] stage={} debateId={} pair={} variant={} status={} round={}/{}",
                     stageName, state.debateId(), state.pair().key(), state.variantId(),
                     state.status(), state.roundIndex(), state.maxRounds())
        );
    }

    public void logRound(DebateState state, RoundRecord round, RoundDecision decision) {
        TraceContextUtil.withMdc(state.debateId(), () ->
            log.info("[DebateFlow] stage={} debateId={} round={} bullScore={} bearScore={} "
                     + "disagreement={} confidence={} hardExclusion={} decision={}",
                     ROUND_DECIDED, state.debateId(), round.round(),
                     round.bull().score(), round.bear().score(),
                     round.disagreement(), round.confidence(), round.hardExclusion(), decision)
        );
    }

    public void logFailure(DebateState state, Throwable cause) {
        TraceContextUtil.withMdc(state.debateId(), () ->
            log.error("[DebateFlow] stage={} debateId={} pair={} round={} reason={}",
                      DEBATE_FAILED, state.debateId(), state.pair().key(), state.roundIndex(),
                      cause.getMessage())
        );
    }
}
