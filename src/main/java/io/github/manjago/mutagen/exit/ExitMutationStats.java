package io.github.manjago.mutagen.exit;

/**
 * Snapshot of exit mutator counters.
 */
public record ExitMutationStats(
    long total,
    long successes,
    long notFound,
    long unknownParameter,
    long syntaxFailures,
    long clamped
) {

    public long failures() {
        return total - successes;
    }

    /**
     * Fraction of successful attempts, 0 when nothing was attempted.
     */
    public double successRate() {
        return total == 0 ? 0.0 : (double) successes / total;
    }

    public double clampRate() {
        return successes == 0 ? 0.0 : (double) clamped / successes;
    }

    @Override
    public String toString() {
        return String.format("total=%d, success=%d (%.1f%%), not_found=%d, unknown=%d, syntax=%d, clamped=%d",
            total, successes, successRate() * 100, notFound, unknownParameter, syntaxFailures, clamped);
    }
}
