package com.debateplatform.engine.agent;

import com.debateplatform.common.exception.ProviderException;
import com.debateplatform.common.exception.SchemaValidationException;
import com.debateplatform.common.model.AgentOutput;
import com.debateplatform.common.model.AgentRole;
import com.debateplatform.common.variant.PromptVariant;
import com.debateplatform.engine.completion.CompletionRequest;
import com.debateplatform.engine.completion.CompletionResponse;
import com.debateplatform.engine.config.DebateProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

import static com.debateplatform.engine.DebateFixtures.bear;
import static com.debateplatform.engine.DebateFixtures.bull;
import static com.debateplatform.engine.DebateFixtures.context;
import static org.assertj.core.api.Assertions.assertThat;

class AgentInvokerTest {

    private static final PromptVariant VARIANT = new PromptVariant("default-v1", "default", "claude-sonnet-4-6", 1);

    private static final String VALID_DEBATER = """
        {"score": 78, "confidence": 0.85, "rationale": "strong sector overlap",
         "evidence": ["both target growth"], "concerns": ["ticket size"], "hard_exclusion": false}
        """;

    private static final String VALID_SYNTHESIS = """
        {"score": 74, "confidence": 0.8, "rationale": "good fit overall",
         "talking_points": ["growth mandate"], "concerns": []}
        """;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private DebateProperties properties;
    private List<CompletionRequest> requests;

    @BeforeEach
    void setUp() {
        properties = new DebateProperties();
        properties.setRetryBackoff(Duration.ofMillis(1));
        requests = new ArrayList<>();
    }

    private AgentInvoker invoker(Function<CompletionRequest, Mono<CompletionResponse>> provider) {
        return new AgentInvoker(
            request -> {
                requests.add(request);
                return provider.apply(request);
            },
            new PromptTemplateRegistry(),
            new AgentSchemaRegistry(objectMapper),
            objectMapper,
            properties);
    }

    private static Mono<CompletionResponse> reply(String text) {
        return Mono.just(new CompletionResponse(text, 900, 120));
    }

    @Nested
    @DisplayName("parsing and validation")
    class Parsing {

        @Test
        @DisplayName("fenced JSON is unwrapped and mapped onto the output")
        void parsesFencedJson() {
            AgentInvoker invoker = invoker(r -> reply("```json\n" + VALID_DEBATER + "```"));

            StepVerifier.create(invoker.invoke(AgentRole.BULL, 1, VARIANT, context(), null))
                .assertNext(out -> {
                    assertThat(out.role()).isEqualTo(AgentRole.BULL);
                    assertThat(out.round()).isEqualTo(1);
                    assertThat(out.score()).isEqualTo(78.0);
                    assertThat(out.confidence()).isEqualTo(0.85);
                    assertThat(out.evidence()).containsExactly("both target growth");
                    assertThat(out.hardExclusion()).isFalse();
                    assertThat(out.inputTokens()).isEqualTo(900);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("a payload missing required fields is rejected without retry")
        void schemaViolationIsNotRetried() {
            AgentInvoker invoker = invoker(r -> reply("{\"score\": 78, \"confidence\": 0.9}"));

            StepVerifier.create(invoker.invoke(AgentRole.BEAR, 1, VARIANT, context(), null))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(SchemaValidationException.class);
                    assertThat(((SchemaValidationException) e).getViolations()).isNotEmpty();
                })
                .verify();
            assertThat(requests).hasSize(1);
        }

        @Test
        @DisplayName("out-of-range scores are rejected, not clamped")
        void outOfRangeScoreRejected() {
            AgentInvoker invoker = invoker(r -> reply(VALID_DEBATER.replace("78", "140")));

            StepVerifier.create(invoker.invoke(AgentRole.BULL, 1, VARIANT, context(), null))
                .expectError(SchemaValidationException.class)
                .verify();
        }

        @Test
        @DisplayName("prose instead of JSON is a schema failure")
        void proseRejected() {
            AgentInvoker invoker = invoker(r -> reply("I think this is a great match."));

            StepVerifier.create(invoker.invoke(AgentRole.BULL, 1, VARIANT, context(), null))
                .expectError(SchemaValidationException.class)
                .verify();
        }

        @Test
        void stripsFencesOnlyWhenPresent() {
            assertThat(AgentInvoker.stripFences("```json\n{\"a\":1}\n```")).isEqualTo("{\"a\":1}");
            assertThat(AgentInvoker.stripFences("  {\"a\":1}  ")).isEqualTo("{\"a\":1}");
        }
    }

    @Nested
    @DisplayName("retry")
    class RetryBehaviour {

        @Test
        @DisplayName("transient failures are retried until the call succeeds")
        void transientRetriedThenSucceeds() {
            AtomicInteger calls = new AtomicInteger();
            AgentInvoker invoker = invoker(r -> calls.incrementAndGet() <= 2
                ? Mono.error(ProviderException.transientFailure(AgentRole.BULL, "HTTP 529", null))
                : reply(VALID_DEBATER));

            StepVerifier.create(invoker.invoke(AgentRole.BULL, 1, VARIANT, context(), null))
                .expectNextCount(1)
                .verifyComplete();
            assertThat(calls).hasValue(3);
        }

        @Test
        @DisplayName("the last transient failure surfaces after retry-count attempts in total")
        void retriesExhausted() {
            AgentInvoker invoker = invoker(r ->
                Mono.error(ProviderException.transientFailure(AgentRole.BULL, "HTTP 503", null)));

            StepVerifier.create(invoker.invoke(AgentRole.BULL, 1, VARIANT, context(), null))
                .expectErrorSatisfies(e -> {
                    assertThat(e).isInstanceOf(ProviderException.class);
                    assertThat(((ProviderException) e).isTransient()).isTrue();
                })
                .verify();
            assertThat(requests).hasSize(properties.getRetryCount());
        }

        @Test
        @DisplayName("retry-count bounds attempts even when a later attempt would answer")
        void noAttemptBeyondRetryCount() {
            properties.setRetryCount(3);
            AtomicInteger calls = new AtomicInteger();
            AgentInvoker invoker = invoker(r -> calls.incrementAndGet() <= 3
                ? Mono.error(ProviderException.transientFailure(AgentRole.BULL, "provider timed out", null))
                : reply(VALID_DEBATER));

            StepVerifier.create(invoker.invoke(AgentRole.BULL, 1, VARIANT, context(), null))
                .expectError(ProviderException.class)
                .verify();
            assertThat(calls).hasValue(3);
        }

        @Test
        @DisplayName("permanent failures are not retried")
        void permanentNotRetried() {
            AgentInvoker invoker = invoker(r ->
                Mono.error(ProviderException.permanentFailure(AgentRole.BULL, "HTTP 400", null)));

            StepVerifier.create(invoker.invoke(AgentRole.BULL, 1, VARIANT, context(), null))
                .expectError(ProviderException.class)
                .verify();
            assertThat(requests).hasSize(1);
        }
    }

    @Nested
    @DisplayName("prompts")
    class Prompts {

        @Test
        @DisplayName("round 2 prompts carry the opponent's previous output")
        void crossFeedbackRendered() {
            AgentOutput opponent = bear(1, 40, 0.7);
            AgentInvoker invoker = invoker(r -> reply(VALID_DEBATER));

            invoker.invoke(AgentRole.BULL, 2, VARIANT, context(), opponent).block();

            CompletionRequest request = requests.get(0);
            assertThat(request.prompt()).contains("Your opponent (BEAR) argued in round 1");
            assertThat(request.prompt()).contains("bear rationale round 1");
            assertThat(request.model()).isEqualTo("claude-sonnet-4-6");
            assertThat(request.maxTokens()).isEqualTo(AgentInvoker.DEBATER_MAX_TOKENS);
            assertThat(request.timeout()).isEqualTo(properties.getCallTimeout());
        }

        @Test
        @DisplayName("the synthesizer sees both debaters and returns talking points")
        void synthesisCombinesDebaters() {
            AgentInvoker invoker = invoker(r -> reply(VALID_SYNTHESIS));

            StepVerifier.create(invoker.synthesize(1, VARIANT, context(), bull(1, 80, 0.8), bear(1, 60, 0.7)))
                .assertNext(s -> {
                    assertThat(s.score()).isEqualTo(74.0);
                    assertThat(s.talkingPoints()).containsExactly("growth mandate");
                })
                .verifyComplete();

            assertThat(requests.get(0).role()).isEqualTo(AgentRole.SYNTHESIZER);
            assertThat(requests.get(0).prompt()).contains("bull rationale round 1", "bear rationale round 1");
        }

        @Test
        void synthesizerRoleRejectedByInvoke() {
            AgentInvoker invoker = invoker(r -> reply(VALID_DEBATER));

            StepVerifier.create(invoker.invoke(AgentRole.SYNTHESIZER, 1, VARIANT, context(), null))
                .expectError(IllegalArgumentException.class)
                .verify();
        }
    }
}
