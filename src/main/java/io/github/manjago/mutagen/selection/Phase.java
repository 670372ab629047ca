package io.github.manjago.mutagen.selection;

import java.util.Locale;

/**
 * Segment of an evolutionary run by generation progress.
 */
public enum Phase {
    EARLY,
    MID,
    LATE;

    /**
     * Phase for a progress fraction in [0, 1].
     *
     * @param progress      generation / maxGenerations
     * @param earlyPhaseEnd progress below which the run is EARLY
     * @param midPhaseEnd   progress below which the run is MID
     */
    public static Phase of(double progress, double earlyPhaseEnd, double midPhaseEnd) {
        if (progress < earlyPhaseEnd) {
            return EARLY;
        }
        if (progress < midPhaseEnd) {
            return MID;
        }
        return LATE;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
