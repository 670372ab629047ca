package io.github.manjago.mutagen.selection;

import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.config.ProbabilityTable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Generation-dependent mutation rate and probability distributions.
 *
 * <h2>Mutation rate</h2>
 * <pre>
 * rate = phaseRate
 *      + diversityBoost                      if diversity &lt; diversityThreshold
 *      + stagnationStep * (stagnation / stagnationWindow)
 * clamped to [0, 1]
 * </pre>
 *
 * <h2>Adapted distribution</h2>
 * <pre>
 * p'(k) = max(minProbability, p(k) + weight * (successRate(k) - 0.5))
 * normalized to sum 1
 * </pre>
 * A key without a success rate counts as neutral (0.5).
 *
 * Stateless apart from configuration; safe to share.
 */
public class MutationScheduler {

    static final double NEUTRAL_RATE = 0.5;

    private final MutagenConfig.ScheduleSettings schedule;
    private final ProbabilityTable probabilities;

    public MutationScheduler(MutagenConfig.ScheduleSettings schedule, ProbabilityTable probabilities) {
        this.schedule = schedule;
        this.probabilities = probabilities;
    }

    public Phase phaseOf(int generation) {
        return schedule.phaseOf(generation);
    }

    public double getMutationRate(int generation, double diversity, int stagnation) {
        double rate = schedule.rates().get(phaseOf(generation));
        if (diversity < schedule.diversityThreshold()) {
            rate += schedule.diversityBoost();
        }
        rate += schedule.stagnationStep() * (stagnation / schedule.stagnationWindow());
        return clamp(rate);
    }

    /**
     * Tier 2 operator distribution for the generation's phase, adapted by
     * the operators' success rates.
     */
    public Map<String, Double> getOperatorProbabilities(int generation, Map<String, Double> successRates) {
        return adapt(probabilities.operatorsFor(phaseOf(generation)), successRates);
    }

    /**
     * Adjust a base distribution by success rates; unchanged (but
     * normalized) when adaptation is disabled.
     */
    public <K> Map<K, Double> adapt(Map<K, Double> base, Map<K, Double> successRates) {
        Map<K, Double> adjusted = new LinkedHashMap<>();
        for (Map.Entry<K, Double> e : base.entrySet()) {
            double p = e.getValue();
            if (schedule.adaptationEnabled()) {
                double rate = successRates.getOrDefault(e.getKey(), NEUTRAL_RATE);
                p = Math.max(schedule.minProbability(), p + schedule.successRateWeight() * (rate - NEUTRAL_RATE));
            }
            adjusted.put(e.getKey(), p);
        }
        return normalize(adjusted);
    }

    /**
     * Scale to sum 1; a zero total becomes the uniform distribution.
     */
    public static <K> Map<K, Double> normalize(Map<K, Double> weights) {
        double total = 0;
        for (double w : weights.values()) {
            total += w;
        }
        Map<K, Double> result = new LinkedHashMap<>();
        for (Map.Entry<K, Double> e : weights.entrySet()) {
            result.put(e.getKey(), total > 0 ? e.getValue() / total : 1.0 / weights.size());
        }
        return result;
    }

    public MutagenConfig.ScheduleSettings getSchedule() {
        return schedule;
    }

    public ProbabilityTable getProbabilities() {
        return probabilities;
    }

    static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
