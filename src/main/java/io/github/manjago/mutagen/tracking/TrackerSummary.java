package io.github.manjago.mutagen.tracking;

import io.github.manjago.mutagen.core.Tier;

import java.util.Map;

/**
 * Overall tracker snapshot.
 */
public record TrackerSummary(long totalRecords, long successes, double successRate, Map<Tier, TierStats> tiers) {
}
