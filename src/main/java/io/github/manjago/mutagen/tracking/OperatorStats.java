package io.github.manjago.mutagen.tracking;

/**
 * Aggregates for one mutation type across tiers; the average improvement
 * is taken over successful mutations.
 */
public record OperatorStats(
    String mutationType,
    long attempts,
    long successes,
    long failures,
    double successRate,
    double averageImprovement
) {
}
