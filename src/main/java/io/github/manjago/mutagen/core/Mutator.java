package io.github.manjago.mutagen.core;

import java.util.Set;

/**
 * A tier's mutation strategy.
 */
public interface Mutator {

    /**
     * Tier this mutator implements.
     */
    Tier tier();

    /**
     * Mutation types this mutator understands, as used in {@link MutationPlan#mutationType()}.
     */
    Set<String> mutationTypes();

    /**
     * Mutate a snippet according to the plan. The input is never modified;
     * failures are reported as {@link MutationOutcome.Rejected}.
     */
    MutationOutcome mutate(String code, MutationPlan plan);
}
