package com.debateplatform.engine.completion;

import com.debateplatform.common.exception.ProviderException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * {@link CompletionClient} backed by the Anthropic Messages API.
 *
 * <p>Fully non-blocking; the per-call timeout is applied on the reactive chain and every
 * failure leaves this class as a classified {@link ProviderException}.
 */
@Component
public class AnthropicCompletionClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicCompletionClient.class);

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;

    public AnthropicCompletionClient(@Qualifier("anthropicClient") WebClient anthropicClient,
                                     ObjectMapper objectMapper,
                                     @Value("${anthropic.api-key:}") String apiKey) {
        this.anthropicClient = anthropicClient;
        this.objectMapper    = objectMapper;
        this.apiKey          = apiKey;
    }

    @Override
    public Mono<CompletionResponse> complete(CompletionRequest request) {
        if (apiKey == null || apiKey.isBlank()) {
            return Mono.error(ProviderException.permanentFailure(request.role(),
                "no Anthropic API key configured", null));
        }

        Map<String, Object> body = Map.of(
            "model", request.model(),
            "max_tokens", request.maxTokens(),
            "messages", List.of(Map.of("role", "user", "content", request.prompt()))
        );

        return anthropicClient.post()
            .uri("/v1/messages")
            .header("x-api-key", apiKey)
            .bodyValue(body)
            .retrieve()
            .bodyToMono(String.class)
            .timeout(request.timeout())
            .map(response -> parse(request, response))
            .onErrorMap(e -> !(e instanceof ProviderException), e -> classify(request, e));
    }

    private CompletionResponse parse(CompletionRequest request, String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode content = root.path("content");
            if (!content.isArray() || content.isEmpty()) {
                throw ProviderException.permanentFailure(request.role(), "response carried no content block", null);
            }
            JsonNode usage = root.path("usage");
            return new CompletionResponse(
                content.get(0).path("text").asText(),
                usage.path("input_tokens").asInt(0),
                usage.path("output_tokens").asInt(0));
        } catch (ProviderException e) {
            throw e;
        } catch (Exception e) {
            throw ProviderException.permanentFailure(request.role(), "unreadable provider response", e);
        }
    }

    static ProviderException classify(CompletionRequest request, Throwable e) {
        if (e instanceof TimeoutException) {
            log.warn("[Completion] call timed out. role={} model={} timeout={}",
                     request.role(), request.model(), request.timeout());
            return ProviderException.transientFailure(request.role(),
                "provider timed out after " + request.timeout().toMillis() + "ms", e);
        }
        if (e instanceof WebClientResponseException wcre) {
            int status = wcre.getStatusCode().value();
            boolean retryable = status == 429 || wcre.getStatusCode().is5xxServerError();
            log.warn("[Completion] provider returned HTTP {}. role={} model={} transient={}",
                     status, request.role(), request.model(), retryable);
            String message = "provider returned HTTP " + status;
            return retryable
                ? ProviderException.transientFailure(request.role(), message, e)
                : ProviderException.permanentFailure(request.role(), message, e);
        }
        if (e instanceof WebClientRequestException) {
            log.warn("[Completion] connection failed. role={} reason={}", request.role(), e.getMessage());
            return ProviderException.transientFailure(request.role(), "connection failed: " + e.getMessage(), e);
        }
        return ProviderException.permanentFailure(request.role(), "provider call failed: " + e.getMessage(), e);
    }
}
