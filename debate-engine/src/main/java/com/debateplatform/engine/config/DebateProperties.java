package com.debateplatform.engine.config;

import com.debateplatform.common.scoring.ConfidenceAggregation;
import com.debateplatform.common.variant.PromptVariant;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Debate engine settings, loaded from the {@code debate} namespace in application.yml.
 *
 * <pre>
 * debate:
 *   disagreement-threshold: 20
 *   min-confidence: 0.6
 *   max-rounds: 3
 *   kinds:
 *     pitch_generation:
 *       max-rounds: 2
 *   variants:
 *     lp_match:
 *       - id: lp-match-v1
 *         template-set: default
 *         model: claude-sonnet-4-6
 *         weight: 3
 * </pre>
 *
 * <p>Global values are the defaults; entries under {@code kinds.<kind>} override them field by
 * field. Values are checked once at startup by {@link KindPolicyRegistry}.
 */
@ConfigurationProperties(prefix = "debate")
@Data
public class DebateProperties {

    /** Consensus requires disagreement at or below this, on the 0–100 scale. */
    private double disagreementThreshold = 20.0;

    /** Consensus requires aggregate confidence at or above this. */
    private double minConfidence = 0.6;

    /** Round budget per debate. Must be at least 1. */
    private int maxRounds = 3;

    private ConfidenceAggregation confidenceAggregation = ConfidenceAggregation.MINIMUM;

    private double lowConfidenceFloor = 0.4;

    private double lowConfidencePenalty = 0.5;

    /** Debates run concurrently by one batch cycle. */
    private int parallelism = 4;

    private Duration cacheTtl = Duration.ofHours(24);

    /**
     * Attempts per external call, the first one included. A call failing transiently this many
     * times fails for good. Values below 1 mean a single attempt.
     */
    private int retryCount = 3;

    /** First backoff delay; doubles with every retry. */
    private Duration retryBackoff = Duration.ofMillis(500);

    /** Timeout of a single provider call or store write; expiry counts as a transient failure. */
    private Duration callTimeout = Duration.ofSeconds(60);

    private Map<String, KindOverride> kinds = new LinkedHashMap<>();

    private Map<String, List<Variant>> variants = new LinkedHashMap<>();

    /** Used for every kind without configured variants. */
    private Variant defaultVariant = new Variant();

    private Batch batch = new Batch();

    @Data
    public static class KindOverride {
        private Double disagreementThreshold;
        private Double minConfidence;
        private Integer maxRounds;
        private ConfidenceAggregation confidenceAggregation;
        private Double lowConfidenceFloor;
        private Double lowConfidencePenalty;
    }

    @Data
    public static class Variant {
        private String id = "default-v1";
        private String templateSet = "default";
        private String model = "claude-sonnet-4-6";
        private int weight = 1;

        public PromptVariant toPromptVariant() {
            return new PromptVariant(id, templateSet, model, weight);
        }
    }

    @Data
    public static class Batch {
        private boolean enabled = false;
        private Duration incrementalInterval = Duration.ofMinutes(15);
        private Duration fullInterval = Duration.ofHours(24);
        /** Kind codes enumerated by every cycle. */
        private List<String> kinds = new ArrayList<>(List.of("lp_match"));
    }
}
