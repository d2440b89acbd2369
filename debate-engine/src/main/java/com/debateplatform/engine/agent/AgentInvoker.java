package com.debateplatform.engine.agent;

import com.debateplatform.common.exception.ProviderException;
import com.debateplatform.common.exception.SchemaValidationException;
import com.debateplatform.common.model.AgentOutput;
import com.debateplatform.common.model.AgentRole;
import com.debateplatform.common.model.DebateContext;
import com.debateplatform.common.model.SynthesisOutput;
import com.debateplatform.common.variant.PromptVariant;
import com.debateplatform.engine.completion.CompletionClient;
import com.debateplatform.engine.completion.CompletionRequest;
import com.debateplatform.engine.completion.CompletionResponse;
import com.debateplatform.engine.config.DebateProperties;
import com.debateplatform.engine.config.ExternalCallPolicy;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Calls the completion provider for one agent role and turns the reply into a validated
 * {@link AgentOutput} or {@link SynthesisOutput}.
 *
 * <p>Per call:
 * <ol>
 *   <li>Render the role template of the variant's template set.</li>
 *   <li>Call the provider with the configured timeout. Transient failures are retried with
 *       exponential backoff, {@code debate.retry-count} attempts in total
 *       (see {@link ExternalCallPolicy}). The last failure is re-thrown when attempts run out.</li>
 *   <li>Strip markdown code fences, parse JSON, validate against the role schema.
 *       Parse and schema failures raise {@link SchemaValidationException}; never retried,
 *       never coerced.</li>
 * </ol>
 */
@Component
public class AgentInvoker {

    private static final Logger log = LoggerFactory.getLogger(AgentInvoker.class);

    static final int DEBATER_MAX_TOKENS   = 1024;
    static final int SYNTHESIS_MAX_TOKENS = 1536;

    private final CompletionClient completionClient;
    private final PromptTemplateRegistry templates;
    private final AgentSchemaRegistry schemas;
    private final ObjectMapper objectMapper;
    private final DebateProperties properties;
    private final ExternalCallPolicy callPolicy;

    public AgentInvoker(CompletionClient completionClient,
                        PromptTemplateRegistry templates,
                        AgentSchemaRegistry schemas,
                        ObjectMapper objectMapper,
                        DebateProperties properties) {
        this.completionClient = completionClient;
        this.templates        = templates;
        this.schemas          = schemas;
        this.objectMapper     = objectMapper;
        this.properties       = properties;
        this.callPolicy       = new ExternalCallPolicy(properties);
    }

    /**
     * Runs one debater.
     *
     * @param crossFeedback the opponent's previous-round output, {@code null} in round 1
     */
    public Mono<AgentOutput> invoke(AgentRole role, int round, PromptVariant variant,
                                    DebateContext context, AgentOutput crossFeedback) {
        if (role == AgentRole.SYNTHESIZER) {
            return Mono.error(new IllegalArgumentException("use synthesize() for the SYNTHESIZER role"));
        }
        return Mono.fromCallable(() -> {
                Map<String, String> values = baseValues(role, round, context);
                values.put("cross_feedback", crossFeedbackSection(crossFeedback));
                return templates.render(variant.templateSet(), role, values);
            })
            .flatMap(prompt -> call(role, variant, prompt, DEBATER_MAX_TOKENS))
            .map(response -> toAgentOutput(role, round, response));
    }

    public Mono<SynthesisOutput> synthesize(int round, PromptVariant variant, DebateContext context,
                                            AgentOutput bull, AgentOutput bear) {
        return Mono.fromCallable(() -> {
                Map<String, String> values = baseValues(AgentRole.SYNTHESIZER, round, context);
                values.put("bull_output", outputSection(bull));
                values.put("bear_output", outputSection(bear));
                return templates.render(variant.templateSet(), AgentRole.SYNTHESIZER, values);
            })
            .flatMap(prompt -> call(AgentRole.SYNTHESIZER, variant, prompt, SYNTHESIS_MAX_TOKENS))
            .map(response -> toSynthesisOutput(round, response));
    }

    // ── provider call with retry ─────────────────────────────────────────────

    private Mono<CompletionResponse> call(AgentRole role, PromptVariant variant, String prompt, int maxTokens) {
        CompletionRequest request = new CompletionRequest(
            role, variant.model(), prompt, maxTokens, properties.getCallTimeout());

        return Mono.defer(() -> completionClient.complete(request))
            .retryWhen(callPolicy.retrySpec("completion:" + role.code(), ProviderException::isTransient))
            .doOnNext(r -> log.debug("[AgentInvoker] completion received. role={} variant={} inputTokens={} outputTokens={}",
                                     role, variant.id(), r.inputTokens(), r.outputTokens()));
    }

    // ── prompt sections ──────────────────────────────────────────────────────

    private Map<String, String> baseValues(AgentRole role, int round, DebateContext context) {
        Map<String, String> values = new HashMap<>();
        values.put("kind", context.pair().kind().code());
        values.put("primary_id", context.pair().primaryId());
        values.put("secondary_id", context.pair().secondaryId());
        values.put("primary_profile", toJson(context.primary()));
        values.put("secondary_profile", toJson(context.secondary()));
        values.put("round", String.valueOf(round));
        values.put("output_schema", schemas.schemaText(role));
        return values;
    }

    private String crossFeedbackSection(AgentOutput opponent) {
        if (opponent == null) {
            return "";
        }
        return "Your opponent (" + opponent.role() + ") argued in round " + opponent.round() + ":\n"
            + outputSection(opponent)
            + "\nAddress these points directly. Revise your score only where the argument warrants it.\n";
    }

    private String outputSection(AgentOutput output) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("score: %.1f, confidence: %.2f%n", output.score(), output.confidence()));
        sb.append("rationale: ").append(output.rationale()).append('\n');
        if (!output.evidence().isEmpty()) {
            sb.append("evidence:\n");
            output.evidence().forEach(e -> sb.append("  - ").append(e).append('\n'));
        }
        if (!output.concerns().isEmpty()) {
            sb.append("concerns:\n");
            output.concerns().forEach(c -> sb.append("  - ").append(c).append('\n'));
        }
        if (output.hardExclusion()) {
            sb.append("hard exclusion: ").append(output.exclusionReason()).append('\n');
        }
        return sb.toString();
    }

    private String toJson(Map<String, Object> profile) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(profile);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("profile not serializable", e);
        }
    }

    // ── response parsing ──────────────────────────────────────────────────────

    private AgentOutput toAgentOutput(AgentRole role, int round, CompletionResponse response) {
        JsonNode json = parseAndValidate(role, response.text());
        return new AgentOutput(
            role,
            round,
            json.path("score").asDouble(),
            json.path("confidence").asDouble(),
            json.path("rationale").asText(),
            strings(json.path("evidence")),
            strings(json.path("concerns")),
            json.path("hard_exclusion").asBoolean(false),
            json.hasNonNull("exclusion_reason") ? json.path("exclusion_reason").asText() : null,
            response.inputTokens(),
            response.outputTokens());
    }

    private SynthesisOutput toSynthesisOutput(int round, CompletionResponse response) {
        JsonNode json = parseAndValidate(AgentRole.SYNTHESIZER, response.text());
        return new SynthesisOutput(
            round,
            json.path("score").asDouble(),
            json.path("confidence").asDouble(),
            json.path("rationale").asText(),
            strings(json.path("talking_points")),
            strings(json.path("concerns")),
            response.inputTokens(),
            response.outputTokens());
    }

    JsonNode parseAndValidate(AgentRole role, String text) {
        if (text == null || text.isBlank()) {
            throw new SchemaValidationException(role, "empty payload", List.of());
        }
        JsonNode json;
        try {
            json = objectMapper.readTree(stripFences(text));
        } catch (JsonProcessingException e) {
            throw new SchemaValidationException(role, "payload is not valid JSON", e);
        }
        List<String> violations = schemas.validate(role, json);
        if (!violations.isEmpty()) {
            log.warn("[AgentInvoker] schema violation. role={} violations={}", role, violations);
            throw new SchemaValidationException(role, "payload violates output schema", violations);
        }
        return json;
    }

    static String stripFences(String text) {
        String trimmed = text.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).trim();
            }
        }
        return trimmed;
    }

    private static List<String> strings(JsonNode array) {
        List<String> out = new ArrayList<>();
        if (array.isArray()) {
            array.forEach(n -> out.add(n.asText()));
        }
        return out;
    }
}
