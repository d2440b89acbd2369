package com.debateplatform.engine.config;

import com.debateplatform.common.exception.DebateConfigurationException;
import com.debateplatform.common.model.DebateKind;
import com.debateplatform.common.policy.KindPolicy;
import com.debateplatform.common.scoring.ScoringPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Resolved {@link KindPolicy} per {@link DebateKind}: global defaults merged with the
 * per-kind overrides. Built once; an invalid value fails application startup with
 * {@link DebateConfigurationException}.
 */
public class KindPolicyRegistry {

    private static final Logger log = LoggerFactory.getLogger(KindPolicyRegistry.class);

    private final Map<DebateKind, KindPolicy> policies = new EnumMap<>(DebateKind.class);

    public KindPolicyRegistry(DebateProperties properties) {
        for (String code : properties.getKinds().keySet()) {
            try {
                DebateKind.fromCode(code);
            } catch (IllegalArgumentException e) {
                throw new DebateConfigurationException("debate.kinds contains an unknown kind: " + code, e);
            }
        }
        for (DebateKind kind : DebateKind.values()) {
            KindPolicy policy = resolve(kind, properties);
            policies.put(kind, policy);
            log.info("KIND_POLICY_RESOLVED kind={} threshold={} minConfidence={} maxRounds={} aggregation={}",
                     kind.code(), policy.disagreementThreshold(), policy.minConfidence(),
                     policy.maxRounds(), policy.scoring().aggregation());
        }
    }

    public KindPolicy policyFor(DebateKind kind) {
        return policies.get(kind);
    }

    public Map<DebateKind, KindPolicy> all() {
        return Collections.unmodifiableMap(policies);
    }

    private static KindPolicy resolve(DebateKind kind, DebateProperties p) {
        DebateProperties.KindOverride o = p.getKinds().get(kind.code());
        if (o == null) {
            o = p.getKinds().get(kind.name());
        }
        if (o == null) {
            o = new DebateProperties.KindOverride();
        }
        try {
            ScoringPolicy scoring = new ScoringPolicy(
                o.getConfidenceAggregation() != null ? o.getConfidenceAggregation() : p.getConfidenceAggregation(),
                o.getLowConfidenceFloor() != null ? o.getLowConfidenceFloor() : p.getLowConfidenceFloor(),
                o.getLowConfidencePenalty() != null ? o.getLowConfidencePenalty() : p.getLowConfidencePenalty());
            return new KindPolicy(
                o.getDisagreementThreshold() != null ? o.getDisagreementThreshold() : p.getDisagreementThreshold(),
                o.getMinConfidence() != null ? o.getMinConfidence() : p.getMinConfidence(),
                o.getMaxRounds() != null ? o.getMaxRounds() : p.getMaxRounds(),
                scoring);
        } catch (DebateConfigurationException e) {
            throw new DebateConfigurationException("invalid debate policy for kind " + kind.code()
                + ": " + e.getMessage(), e);
        } catch (IllegalArgumentException e) {
            throw new DebateConfigurationException("invalid scoring policy for kind " + kind.code()
                + ": " + e.getMessage(), e);
        }
    }
}
