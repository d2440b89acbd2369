package com.debateplatform.engine.completion;

import reactor.core.publisher.Mono;

/**
 * The LLM completion capability.
 *
 * <p>Implementations signal failures only as
 * {@link com.debateplatform.common.exception.ProviderException}: timeouts, connection errors,
 * HTTP 429 and 5xx are {@code TRANSIENT}; every other failure is {@code PERMANENT}.
 * Retrying is the caller's concern.
 */
public interface CompletionClient {

    Mono<CompletionResponse> complete(CompletionRequest request);
}
