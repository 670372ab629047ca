package io.github.manjago.mutagen.tracking;

/**
 * Direction of a tier's success rate between the older and newer half of
 * its records.
 */
public enum TierTrend {
    IMPROVING,
    STABLE,
    DECLINING,
    INSUFFICIENT_DATA
}
