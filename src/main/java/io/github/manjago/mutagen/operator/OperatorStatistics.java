package io.github.manjago.mutagen.operator;

import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.exit.ExitMutationStats;

import java.util.Map;

/**
 * Snapshot of {@link UnifiedMutationOperator} counters.
 *
 * @param requests           mutate() calls
 * @param exitRequests       requests routed to the exit mutator
 * @param exitSuccesses      successful exit mutations (validation included)
 * @param tierRequests       requests routed to the tier cascade
 * @param tierSuccesses      tier requests that produced a candidate
 * @param fallbackRecoveries tier successes that needed at least one fallback
 * @param exhausted          tier requests where every attempted tier failed
 * @param validationFailures candidates rejected by the security validator
 * @param tierAttempts       attempts per tier, fallbacks included
 * @param tierAttemptSuccesses successful attempts per tier
 * @param exit               exit mutator counters
 */
public record OperatorStatistics(
    long requests,
    long exitRequests,
    long exitSuccesses,
    long tierRequests,
    long tierSuccesses,
    long fallbackRecoveries,
    long exhausted,
    long validationFailures,
    Map<Tier, Long> tierAttempts,
    Map<Tier, Long> tierAttemptSuccesses,
    ExitMutationStats exit
) {

    public OperatorStatistics {
        tierAttempts = Map.copyOf(tierAttempts);
        tierAttemptSuccesses = Map.copyOf(tierAttemptSuccesses);
    }

    public double successRate() {
        return requests == 0 ? 0.0 : (double) (exitSuccesses + tierSuccesses) / requests;
    }

    public double exitSuccessRate() {
        return exitRequests == 0 ? 0.0 : (double) exitSuccesses / exitRequests;
    }

    public double exitShare() {
        return requests == 0 ? 0.0 : (double) exitRequests / requests;
    }
}
