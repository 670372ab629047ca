package io.github.manjago.mutagen.config;

import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.selection.Phase;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single authoritative mutation probability table.
 *
 * Holds the exit-versus-tier split, the tier distribution for each phase
 * and the Tier 2 operator distribution for each phase. Every distribution
 * must sum to 1.0 within {@link #SUM_TOLERANCE}.
 */
public record ProbabilityTable(
    double exitProbability,
    Map<Phase, Map<Tier, Double>> tiers,
    Map<Phase, Map<String, Double>> operators
) {

    public static final double SUM_TOLERANCE = 0.05;

    public ProbabilityTable {
        if (exitProbability < 0 || exitProbability > 1 || Double.isNaN(exitProbability)) {
            throw new ConfigurationException("Exit mutation probability must be in [0, 1]: " + exitProbability);
        }
        Map<Phase, Map<Tier, Double>> tierCopy = new EnumMap<>(Phase.class);
        Map<Phase, Map<String, Double>> operatorCopy = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            Map<Tier, Double> t = tiers.get(phase);
            if (t == null) {
                throw new ConfigurationException("Missing tier distribution for phase " + phase.key());
            }
            Map<Tier, Double> tCopy = new EnumMap<>(Tier.class);
            for (Tier tier : Tier.values()) {
                tCopy.put(tier, t.getOrDefault(tier, 0.0));
            }
            checkDistribution("tiers." + phase.key(), tCopy);
            tierCopy.put(phase, Collections.unmodifiableMap(tCopy));

            Map<String, Double> o = operators.get(phase);
            if (o == null || o.isEmpty()) {
                throw new ConfigurationException("Missing operator distribution for phase " + phase.key());
            }
            checkDistribution("operators." + phase.key(), o);
            operatorCopy.put(phase, Collections.unmodifiableMap(new LinkedHashMap<>(o)));
        }
        tiers = Collections.unmodifiableMap(tierCopy);
        operators = Collections.unmodifiableMap(operatorCopy);
    }

    public Map<Tier, Double> tiersFor(Phase phase) {
        return tiers.get(phase);
    }

    public Map<String, Double> operatorsFor(Phase phase) {
        return operators.get(phase);
    }

    private static void checkDistribution(String name, Map<?, Double> distribution) {
        double sum = 0;
        for (Map.Entry<?, Double> e : distribution.entrySet()) {
            double p = e.getValue();
            if (p < 0 || p > 1 || Double.isNaN(p)) {
                throw new ConfigurationException(String.format(
                    "Probability %s.%s must be in [0, 1]: %s", name, e.getKey(), p));
            }
            sum += p;
        }
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            throw new ConfigurationException(String.format(
                "Probabilities in %s must sum to 1.0 (+/- %.2f), got %.4f", name, SUM_TOLERANCE, sum));
        }
    }

    /**
     * Built-in table, identical to reference.conf.
     */
    public static ProbabilityTable defaults() {
        Map<Phase, Map<Tier, Double>> tiers = new EnumMap<>(Phase.class);
        tiers.put(Phase.EARLY, tierMap(0.15, 0.45, 0.40));
        tiers.put(Phase.MID, tierMap(0.25, 0.50, 0.25));
        tiers.put(Phase.LATE, tierMap(0.40, 0.50, 0.10));

        Map<Phase, Map<String, Double>> operators = new EnumMap<>(Phase.class);
        operators.put(Phase.EARLY, operatorMap(0.50, 0.20, 0.20, 0.10));
        operators.put(Phase.MID, operatorMap(0.25, 0.25, 0.25, 0.25));
        operators.put(Phase.LATE, operatorMap(0.15, 0.15, 0.20, 0.50));
        return new ProbabilityTable(0.20, tiers, operators);
    }

    public ProbabilityTable withExitProbability(double probability) {
        return new ProbabilityTable(probability, tiers, operators);
    }

    public ProbabilityTable withTiers(Phase phase, Map<Tier, Double> distribution) {
        Map<Phase, Map<Tier, Double>> copy = new EnumMap<>(tiers);
        copy.put(phase, distribution);
        return new ProbabilityTable(exitProbability, copy, operators);
    }

    public ProbabilityTable withOperators(Phase phase, Map<String, Double> distribution) {
        Map<Phase, Map<String, Double>> copy = new EnumMap<>(operators);
        copy.put(phase, distribution);
        return new ProbabilityTable(exitProbability, tiers, copy);
    }

    static Map<Tier, Double> tierMap(double t1, double t2, double t3) {
        Map<Tier, Double> m = new EnumMap<>(Tier.class);
        m.put(Tier.TIER1, t1);
        m.put(Tier.TIER2, t2);
        m.put(Tier.TIER3, t3);
        return m;
    }

    static Map<String, Double> operatorMap(double add, double remove, double replace, double mutate) {
        Map<String, Double> m = new LinkedHashMap<>();
        m.put("add_factor", add);
        m.put("remove_factor", remove);
        m.put("replace_factor", replace);
        m.put("mutate_parameters", mutate);
        return m;
    }
}
