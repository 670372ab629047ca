package io.github.manjago.mutagen.tracking;

import io.github.manjago.mutagen.core.Tier;

import java.util.Map;

/**
 * Aggregates for one tier. {@code attempts == successes + failures}.
 * The improvement figures cover successful mutations only and are 0 when
 * the tier has none.
 */
public record TierStats(
    Tier tier,
    long attempts,
    long successes,
    long failures,
    double successRate,
    double totalImprovement,
    double averageImprovement,
    double maxImprovement,
    Map<String, Long> mutationTypes
) {

    public TierStats {
        mutationTypes = Map.copyOf(mutationTypes);
    }

    static TierStats empty(Tier tier) {
        return new TierStats(tier, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, Map.of());
    }
}
