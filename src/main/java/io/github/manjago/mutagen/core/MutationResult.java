package io.github.manjago.mutagen.core;

import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Outcome of one {@code UnifiedMutationOperator.mutate} call.
 *
 * On failure {@code mutatedCode} is always the unmodified input.
 *
 * @param mutatedCode   new snippet, or the original on failure
 * @param success       whether a mutation was applied and validated
 * @param tierUsed      tier that produced the result; null for exit mutations
 *                      and for exhausted cascades
 * @param mutationType  what was applied (or planned, on failure)
 * @param fallbackChain every tier attempted, in order; empty for exit mutations
 * @param metadata      details (exit mutations: parameter, old_value, new_value, clamped)
 * @param error         failure reason, null on success
 * @param recordId      tracker record id for later performance feedback, -1 if not tracked
 */
public record MutationResult(
    String mutatedCode,
    boolean success,
    @Nullable Tier tierUsed,
    String mutationType,
    List<Tier> fallbackChain,
    Map<String, Object> metadata,
    @Nullable String error,
    long recordId
) {

    public static final String EXIT_MUTATION = "exit_parameter_mutation";

    public MutationResult {
        fallbackChain = List.copyOf(fallbackChain);
        metadata = Map.copyOf(metadata);
    }

    public boolean isExitMutation() {
        return EXIT_MUTATION.equals(mutationType);
    }

    /**
     * Whether any tier after the first was attempted.
     */
    public boolean usedFallback() {
        return fallbackChain.size() > 1;
    }

    /**
     * Fallback chain as tier numbers, e.g. [3, 2, 1].
     */
    public List<Integer> fallbackLevels() {
        return fallbackChain.stream().map(Tier::level).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        if (success) {
            return String.format("MutationResult[ok %s via %s, chain=%s]",
                mutationType, tierUsed == null ? "exit" : "tier " + tierUsed.level(), fallbackLevels());
        }
        return String.format("MutationResult[failed %s, chain=%s: %s]", mutationType, fallbackLevels(), error);
    }
}
