package io.github.manjago.mutagen.core;

import org.jetbrains.annotations.Nullable;

/**
 * Per-request state of the evolutionary run plus optional overrides.
 *
 * @param generation      current generation (0-based)
 * @param diversity       population diversity in [0, 1]
 * @param stagnation      generations since the last fitness improvement
 * @param overrideTier    forces a tier and skips selection
 * @param forceExit       forces an exit-parameter mutation
 * @param exitParameter   exit parameter to mutate (null = random)
 * @param mutationType    forces the operator/transform within the tier
 * @param target          forces the config key or factor to mutate
 * @param strategyId      caller's identifier for the candidate, for tracking
 */
public record MutationContext(
    int generation,
    double diversity,
    int stagnation,
    @Nullable Tier overrideTier,
    boolean forceExit,
    @Nullable String exitParameter,
    @Nullable String mutationType,
    @Nullable String target,
    @Nullable String strategyId
) {

    public MutationContext {
        if (generation < 0) {
            throw new IllegalArgumentException("generation must be >= 0: " + generation);
        }
        if (stagnation < 0) {
            throw new IllegalArgumentException("stagnation must be >= 0: " + stagnation);
        }
        if (diversity < 0 || diversity > 1 || Double.isNaN(diversity)) {
            throw new IllegalArgumentException("diversity must be in [0, 1]: " + diversity);
        }
        if (forceExit && overrideTier != null) {
            throw new IllegalArgumentException("forceExit and overrideTier are mutually exclusive");
        }
    }

    /**
     * Context with neutral diversity and no overrides.
     */
    public static MutationContext atGeneration(int generation) {
        return builder().generation(generation).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int generation = 0;
        private double diversity = 1.0;
        private int stagnation = 0;
        private Tier overrideTier;
        private boolean forceExit;
        private String exitParameter;
        private String mutationType;
        private String target;
        private String strategyId;

        public Builder generation(int generation) { this.generation = generation; return this; }
        public Builder diversity(double diversity) { this.diversity = diversity; return this; }
        public Builder stagnation(int stagnation) { this.stagnation = stagnation; return this; }
        public Builder overrideTier(Tier tier) { this.overrideTier = tier; return this; }
        public Builder forceExit(boolean force) { this.forceExit = force; return this; }
        public Builder exitParameter(String name) { this.exitParameter = name; return this; }
        public Builder mutationType(String type) { this.mutationType = type; return this; }
        public Builder target(String target) { this.target = target; return this; }
        public Builder strategyId(String id) { this.strategyId = id; return this; }

        public MutationContext build() {
            return new MutationContext(generation, diversity, stagnation, overrideTier, forceExit,
                exitParameter, mutationType, target, strategyId);
        }
    }
}
