package com.debateplatform.common.variant;

import com.debateplatform.common.model.DebateKind;

import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.zip.CRC32;

/**
 * Chooses the prompt variant for a debate: {@code select(kind, pairId) → variant}.
 *
 * <p>Deterministic and side-effect-free: the pair id is hashed (CRC32, stable across JVMs)
 * into a bucket over the kind's cumulative variant weights, so the same pair always lands on
 * the same variant for a given configuration. Kinds without configured variants use the
 * fallback variant.
 *
 * <p>Built once from configuration and injected; it holds no mutable state.
 */
public final class VariantSelector {

    private final Map<DebateKind, List<PromptVariant>> variantsByKind;
    private final PromptVariant fallback;

    public VariantSelector(Map<DebateKind, List<PromptVariant>> variantsByKind, PromptVariant fallback) {
        this.fallback = Objects.requireNonNull(fallback, "fallback");
        this.variantsByKind = new EnumMap<>(DebateKind.class);
        variantsByKind.forEach((kind, variants) -> {
            if (variants != null && !variants.isEmpty()) {
                this.variantsByKind.put(kind, List.copyOf(variants));
            }
        });
    }

    public PromptVariant select(DebateKind kind, String pairId) {
        List<PromptVariant> candidates = variantsByKind.get(kind);
        if (candidates == null) {
            return fallback;
        }
        if (candidates.size() == 1) {
            return candidates.get(0);
        }
        int totalWeight = candidates.stream().mapToInt(PromptVariant::weight).sum();
        long bucket = bucket(kind, pairId) % totalWeight;

        long cumulative = 0;
        for (PromptVariant variant : candidates) {
            cumulative += variant.weight();
            if (bucket < cumulative) {
                return variant;
            }
        }
        return candidates.get(candidates.size() - 1);
    }

    /** Looks a variant up by id, e.g. when rendering a persisted run. */
    public PromptVariant byId(String variantId) {
        if (fallback.id().equals(variantId)) {
            return fallback;
        }
        return variantsByKind.values().stream()
            .flatMap(List::stream)
            .filter(v -> v.id().equals(variantId))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown prompt variant: " + variantId));
    }

    private static long bucket(DebateKind kind, String pairId) {
        CRC32 crc = new CRC32();
        crc.update((kind.code() + "|" + pairId).getBytes(StandardCharsets.UTF_8));
        return crc.getValue();
    }
}
