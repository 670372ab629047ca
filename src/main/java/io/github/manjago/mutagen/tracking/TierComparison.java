package io.github.manjago.mutagen.tracking;

import io.github.manjago.mutagen.core.Tier;

import java.util.Map;

/**
 * Side-by-side view of the tiers. With no records every rate is 0 and
 * the "best" and "most used" tiers default to Tier 2.
 */
public record TierComparison(
    long total,
    Map<Tier, Long> distribution,
    Map<Tier, Double> distributionPercent,
    Map<Tier, Double> successRates,
    Map<Tier, Double> averageImprovement,
    Tier bestBySuccessRate,
    Tier bestByImprovement,
    Tier mostUsed
) {
}
