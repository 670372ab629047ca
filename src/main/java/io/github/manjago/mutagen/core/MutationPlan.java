package io.github.manjago.mutagen.core;

import org.jetbrains.annotations.Nullable;

/**
 * What the selection manager decided for one mutation attempt.
 *
 * @param tier         tier to run
 * @param mutationType operator or transform name within the tier
 *                     (e.g. "add_factor", "ast_comparator_swap")
 * @param riskScore    complexity-based risk of the candidate in [0, 1]
 * @param rationale    human-readable reason for the choice
 * @param target       optional target inside the snippet (config key,
 *                     factor name); null lets the mutator choose
 */
public record MutationPlan(
    Tier tier,
    String mutationType,
    double riskScore,
    String rationale,
    @Nullable String target
) {

    public MutationPlan(Tier tier, String mutationType, double riskScore, String rationale) {
        this(tier, mutationType, riskScore, rationale, null);
    }

    @Override
    public String toString() {
        return String.format("Tier %d/%s (risk=%.3f): %s", tier.level(), mutationType, riskScore, rationale);
    }
}
