package com.debateplatform.common.trace;

import org.slf4j.MDC;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

/**
 * Carries the debate id through reactive pipelines for log correlation.
 *
 * <p>Reactor Context is the single source of truth for the debate id inside a pipeline.
 * MDC is only written as a temporary bridge around a single log statement, never as a
 * persistent ThreadLocal store.
 *
 * <pre>
 *     return TraceContextUtil.withDebateId(runDebate(state), state.debateId());
 * </pre>
 */
public final class TraceContextUtil {

    public static final String DEBATE_ID_KEY = "debateId";

    private TraceContextUtil() {}

    /**
     * Stores {@code debateId} in the Reactor Context. {@code contextWrite} propagates upstream
     * during subscription, so call this at the end of pipeline assembly.
     */
    public static <T> Mono<T> withDebateId(Mono<T> mono, String debateId) {
        return mono.contextWrite(ctx -> ctx.put(DEBATE_ID_KEY, debateId));
    }

    /** Returns the debate id from the context, or {@code "unknown"}; never {@code null}. */
    public static String getDebateId(ContextView ctx) {
        return ctx.getOrDefault(DEBATE_ID_KEY, "unknown");
    }

    /**
     * Bridges {@code debateId} into MDC for the duration of {@code logAction}, then removes it.
     * Only use inside logging side-effects.
     */
    public static void withMdc(String debateId, Runnable logAction) {
        MDC.put(DEBATE_ID_KEY, debateId);
        try {
            logAction.run();
        } finally {
            MDC.remove(DEBATE_ID_KEY);
        }
    }
}
