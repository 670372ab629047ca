package io.github.manjago.mutagen.selection;

import io.github.manjago.mutagen.config.ConfigurationException;
import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.config.ProbabilityTable;
import io.github.manjago.mutagen.core.MutationContext;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.tracking.TierPerformanceTracker;
import io.github.manjago.mutagen.tracking.TierStats;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Chooses the tier and mutation type for each request.
 *
 * <h2>Tier selection:</h2>
 * <pre>
 * 1. override tier from the context wins
 * 2. phase tier distribution, adapted by the tracker's tier success rates
 * 3. + riskBias on the tier the risk thresholds prefer
 * 4. + explorationBoost on Tier 3 when diversity is low or the run stagnates
 * 5. clamp to [0, 1], normalize, sample
 * </pre>
 *
 * Success rates come from the shared {@link TierPerformanceTracker}, so
 * records restored from a store steer selection as well. Every
 * {@code updateInterval} results reported through {@link #resultRecorded}
 * the risk thresholds are re-tuned from the same rates.
 */
public class TierSelectionManager {

    private static final Logger log = LoggerFactory.getLogger(TierSelectionManager.class);

    static final double THRESHOLD_ADJUSTMENT_RATE = 0.05;

    private final MutagenConfig.ScheduleSettings schedule;
    private final MutationScheduler scheduler;
    private final Map<Tier, List<String>> mutationTypes;
    private final RiskAssessor riskAssessor;
    private final TierPerformanceTracker tracker;
    private final SeededRandom random;

    // Threshold tuning, guarded by lock
    private final ReentrantLock lock = new ReentrantLock();
    private SelectionThresholds thresholds;
    private long recorded;

    /**
     * @param mutationTypes mutation types each tier's mutator understands
     * @throws ConfigurationException when the operator table names an unknown Tier 2 operator
     */
    public TierSelectionManager(MutagenConfig.ScheduleSettings schedule,
                                ProbabilityTable probabilities,
                                Map<Tier, Set<String>> mutationTypes,
                                RiskAssessor riskAssessor,
                                TierPerformanceTracker tracker,
                                SeededRandom random) {
        this.schedule = schedule;
        this.scheduler = new MutationScheduler(schedule, probabilities);
        this.riskAssessor = riskAssessor;
        this.tracker = tracker;
        this.random = random;
        this.thresholds = schedule.thresholds();

        Map<Tier, List<String>> types = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            Set<String> known = mutationTypes.get(tier);
            if (known == null || known.isEmpty()) {
                throw new ConfigurationException("No mutation types registered for " + tier);
            }
            // sorted for replayable sampling
            types.put(tier, List.copyOf(new TreeSet<>(known)));
        }
        this.mutationTypes = types;

        for (Phase phase : Phase.values()) {
            for (String operator : probabilities.operatorsFor(phase).keySet()) {
                if (!types.get(Tier.TIER2).contains(operator)) {
                    throw new ConfigurationException(String.format(
                        "Unknown operator '%s' in probabilities.operators.%s (known: %s)",
                        operator, phase.key(), types.get(Tier.TIER2)));
                }
            }
        }
    }

    public TierSelectionManager(MutagenConfig config, Map<Tier, Set<String>> mutationTypes,
                                TierPerformanceTracker tracker, SeededRandom random) {
        this(config.schedule(), config.probabilities(), mutationTypes, new RiskAssessor(), tracker, random);
    }

    // ========== Selection ==========

    /**
     * Plan without looking at the code (neutral strategy risk).
     */
    public MutationPlan selectTier(MutationContext context) {
        return selectTier(null, context);
    }

    public MutationPlan selectTier(@Nullable String code, MutationContext context) {
        Map<Tier, Double> tierRates = tierSuccessRates();
        double risk = riskAssessor.assess(code, tierRates);

        if (context.overrideTier() != null) {
            Tier tier = context.overrideTier();
            return plan(tier, context, risk, "Tier " + tier.level() + " forced by request", context.target());
        }

        Phase phase = scheduler.phaseOf(context.generation());
        Map<Tier, Double> weights = new EnumMap<>(scheduler.adapt(
            scheduler.getProbabilities().tiersFor(phase), tierRates));

        SelectionThresholds current = getThresholds();
        Tier preferred = current.tierFor(risk);
        weights.merge(preferred, schedule.riskBias(), Double::sum);

        boolean explore = context.diversity() < schedule.diversityThreshold()
            || context.stagnation() >= schedule.stagnationWindow();
        if (explore) {
            weights.merge(Tier.TIER3, schedule.explorationBoost(), Double::sum);
        }
        weights.replaceAll((t, p) -> MutationScheduler.clamp(p));
        Map<Tier, Double> distribution = new EnumMap<>(MutationScheduler.normalize(weights));

        Tier tier = random.weightedChoice(distribution);
        String rationale = String.format("%s phase, risk %.2f prefers tier %d%s; sampled tier %d (p=%.2f)",
            phase.key(), risk, preferred.level(),
            explore ? ", exploration boosted" : "",
            tier.level(), distribution.get(tier));
        MutationPlan plan = plan(tier, context, risk, rationale, context.target());
        log.debug("Selected {}", plan);
        return plan;
    }

    /**
     * Plan for a given tier, used for fallback attempts. The request's
     * target names something inside the original tier, so it is dropped.
     */
    public MutationPlan planFor(Tier tier, @Nullable String code, MutationContext context, String rationale) {
        return plan(tier, context, riskAssessor.assess(code, tierSuccessRates()), rationale, null);
    }

    private MutationPlan plan(Tier tier, MutationContext context, double risk, String rationale,
                              @Nullable String target) {
        List<String> types = mutationTypes.get(tier);
        String type;
        if (context.mutationType() != null && types.contains(context.mutationType())) {
            type = context.mutationType();
        } else if (tier == Tier.TIER2) {
            type = random.weightedChoice(scheduler.getOperatorProbabilities(context.generation(), operatorSuccessRates()));
        } else {
            type = random.choice(types);
        }
        return new MutationPlan(tier, type, risk, rationale, target);
    }

    // ========== Feedback ==========

    /**
     * Note that one more result has been recorded in the tracker. Every
     * {@code updateInterval} results the risk thresholds are re-tuned.
     */
    public void resultRecorded() {
        lock.lock();
        try {
            recorded++;
            if (schedule.adaptationEnabled() && recorded % schedule.updateInterval() == 0) {
                SelectionThresholds adjusted = thresholds.adjust(tierSuccessRates(), THRESHOLD_ADJUSTMENT_RATE);
                if (!adjusted.equals(thresholds)) {
                    log.info("Adjusted tier thresholds {} -> {}", thresholds, adjusted);
                    thresholds = adjusted;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Success rate of each tier with at least one tracked result.
     */
    public Map<Tier, Double> tierSuccessRates() {
        Map<Tier, Double> rates = new EnumMap<>(Tier.class);
        for (TierStats stats : tracker.summary().tiers().values()) {
            if (stats.attempts() > 0) {
                rates.put(stats.tier(), stats.successRate());
            }
        }
        return rates;
    }

    /**
     * Success rate of each tracked mutation type.
     */
    public Map<String, Double> operatorSuccessRates() {
        return tracker.operatorSuccessRates();
    }

    // ========== Thresholds ==========

    public SelectionThresholds getThresholds() {
        lock.lock();
        try {
            return thresholds;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the risk thresholds. Validation happens when the record is built.
     */
    public void setThresholds(SelectionThresholds newThresholds) {
        lock.lock();
        try {
            log.info("Tier thresholds set to {}", newThresholds);
            thresholds = newThresholds;
        } finally {
            lock.unlock();
        }
    }

    public TierPerformanceTracker getTracker() {
        return tracker;
    }

    public MutationScheduler getScheduler() {
        return scheduler;
    }

    public List<String> mutationTypes(Tier tier) {
        return mutationTypes.get(tier);
    }

    /**
     * Restart the tuning cadence and restore the configured thresholds. The
     * tracker is left alone; reset it separately to forget the records.
     */
    public void reset() {
        lock.lock();
        try {
            recorded = 0;
            thresholds = schedule.thresholds();
        } finally {
            lock.unlock();
        }
    }
}
