package io.github.manjago.mutagen.tracking;

import io.github.manjago.mutagen.core.Tier;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * One recorded mutation outcome.
 *
 * @param id               tracker-assigned id, increasing from 1
 * @param tier             tier credited with the outcome
 * @param mutationType     operator or transform name
 * @param success          whether a candidate was produced
 * @param performanceDelta fitness change reported by the caller, 0 until known
 * @param strategyId       caller's candidate id, may be null
 * @param metadata         mutator details (string keys, JSON-friendly values)
 * @param timestamp        epoch millis when recorded
 */
public record MutationRecord(
    long id,
    Tier tier,
    String mutationType,
    boolean success,
    double performanceDelta,
    @Nullable String strategyId,
    Map<String, Object> metadata,
    long timestamp
) {

    public MutationRecord {
        metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
    }

    public MutationRecord withPerformanceDelta(double delta) {
        return new MutationRecord(id, tier, mutationType, success, delta, strategyId, metadata, timestamp);
    }
}
