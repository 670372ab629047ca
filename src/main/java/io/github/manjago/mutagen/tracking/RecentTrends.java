package io.github.manjago.mutagen.tracking;

import io.github.manjago.mutagen.core.Tier;

import java.util.Map;

/**
 * Statistics over the last {@code window} records.
 *
 * @param size number of records actually in the window
 */
public record RecentTrends(
    int window,
    int size,
    Map<Tier, Long> distribution,
    Map<Tier, Double> successRates,
    double overallSuccessRate
) {
}
