package io.github.manjago.mutagen.selection;

import io.github.manjago.mutagen.config.ConfigurationException;
import io.github.manjago.mutagen.core.Tier;

import java.util.Map;

/**
 * Risk thresholds mapping a candidate's risk score to its preferred tier.
 * Risk below {@code tier1} prefers Tier 1, below {@code tier2} Tier 2,
 * otherwise Tier 3.
 */
public record SelectionThresholds(double tier1, double tier2) {

    public static final SelectionThresholds DEFAULT = new SelectionThresholds(0.3, 0.7);

    private static final double TIER1_MIN = 0.1;
    private static final double TIER1_MAX = 0.5;
    private static final double TIER2_MAX = 0.9;
    private static final double MIN_GAP = 0.1;

    public SelectionThresholds {
        if (!(0.0 <= tier1 && tier1 <= tier2 && tier2 <= 1.0)) {
            throw new ConfigurationException(String.format(
                "Invalid thresholds: tier1=%s, tier2=%s (need 0 <= tier1 <= tier2 <= 1)", tier1, tier2));
        }
    }

    public Tier tierFor(double riskScore) {
        double risk = Math.max(0.0, Math.min(1.0, riskScore));
        if (risk < tier1) {
            return Tier.TIER1;
        }
        if (risk < tier2) {
            return Tier.TIER2;
        }
        return Tier.TIER3;
    }

    /**
     * Shift thresholds by tier performance: a tier succeeding more than half
     * the time widens its band. Tier 1 stays in [0.1, 0.5], Tier 2 in
     * [tier1 + 0.1, 0.9].
     */
    public SelectionThresholds adjust(Map<Tier, Double> successRates, double rate) {
        double t1 = tier1 + rate * (successRates.getOrDefault(Tier.TIER1, 0.5) - 0.5);
        t1 = Math.max(TIER1_MIN, Math.min(TIER1_MAX, t1));
        double t2 = tier2 + rate * (successRates.getOrDefault(Tier.TIER2, 0.5) - 0.5);
        t2 = Math.max(t1 + MIN_GAP, Math.min(TIER2_MAX, t2));
        return new SelectionThresholds(t1, t2);
    }
}
