package io.github.manjago.mutagen.operator;

import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.core.MutationContext;
import io.github.manjago.mutagen.core.MutationListener;
import io.github.manjago.mutagen.core.MutationOutcome;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.MutationResult;
import io.github.manjago.mutagen.core.Mutator;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.exit.ExitMutationResult;
import io.github.manjago.mutagen.exit.ExitParameterMutator;
import io.github.manjago.mutagen.security.SecurityValidator;
import io.github.manjago.mutagen.security.ValidationResult;
import io.github.manjago.mutagen.selection.TierSelectionManager;
import io.github.manjago.mutagen.tier1.ConfigMutator;
import io.github.manjago.mutagen.tier2.DomainMutator;
import io.github.manjago.mutagen.tier3.AstMutator;
import io.github.manjago.mutagen.tier3.AstValidator;
import io.github.manjago.mutagen.tracking.TierPerformanceTracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Single entry point for mutations.
 *
 * <h2>Routing:</h2>
 * <pre>
 * forceExit            → exit-parameter mutation
 * overrideTier         → tier cascade starting at that tier
 * otherwise            → exit with exit-probability, else tier cascade
 * </pre>
 *
 * <h2>Tier cascade:</h2>
 * The planned tier is attempted first (mutation plus security validation).
 * When it fails and fallback is enabled the fixed chain 3 → 2 → 1 continues
 * from there; each tier is attempted at most once. The final outcome is
 * recorded once in the tracker and once in the selection manager.
 * Failures are returned as results, never thrown.
 */
public class UnifiedMutationOperator {

    private static final Logger log = LoggerFactory.getLogger(UnifiedMutationOperator.class);

    private final ExitParameterMutator exitMutator;
    private final Map<Tier, Mutator> mutators;
    private final TierSelectionManager selection;
    private final TierPerformanceTracker tracker;
    private final SecurityValidator security;
    private final SeededRandom random;
    private final double exitProbability;
    private final boolean fallbackEnabled;
    private final boolean validationEnabled;

    private MutationListener listener = MutationListener.NOOP;

    // Statistics, guarded by this
    private long requests;
    private long exitRequests;
    private long exitSuccesses;
    private long tierRequests;
    private long tierSuccesses;
    private long fallbackRecoveries;
    private long exhausted;
    private long validationFailures;
    private final Map<Tier, Long> tierAttempts = new EnumMap<>(Tier.class);
    private final Map<Tier, Long> tierAttemptSuccesses = new EnumMap<>(Tier.class);

    public UnifiedMutationOperator(MutagenConfig config,
                                   ExitParameterMutator exitMutator,
                                   Map<Tier, Mutator> mutators,
                                   TierSelectionManager selection,
                                   TierPerformanceTracker tracker,
                                   SecurityValidator security,
                                   SeededRandom random) {
        for (Tier tier : Tier.values()) {
            Mutator m = mutators.get(tier);
            if (m == null || m.tier() != tier) {
                throw new IllegalArgumentException("Missing or misplaced mutator for " + tier);
            }
        }
        if (selection.getTracker() != tracker) {
            throw new IllegalArgumentException("Selection must read the tracker the operator records to");
        }
        this.exitMutator = exitMutator;
        this.mutators = new EnumMap<>(mutators);
        this.selection = selection;
        this.tracker = tracker;
        this.security = security;
        this.random = random;
        this.exitProbability = config.probabilities().exitProbability();
        this.fallbackEnabled = config.operator().fallbackEnabled();
        this.validationEnabled = config.operator().validationEnabled();
    }

    /**
     * Fully wired operator: all mutators share one random source seeded
     * from the configuration.
     */
    public static UnifiedMutationOperator create(MutagenConfig config, TierPerformanceTracker tracker) {
        SeededRandom random = new SeededRandom(config.effectiveSeed());
        SecurityValidator security = new SecurityValidator();
        Map<Tier, Mutator> mutators = new EnumMap<>(Tier.class);
        mutators.put(Tier.TIER1, new ConfigMutator(config.tiers(), random));
        mutators.put(Tier.TIER2, DomainMutator.standard(config.tiers(), random));
        mutators.put(Tier.TIER3, new AstMutator(config.tiers(), new AstValidator(security), random));

        Map<Tier, Set<String>> types = new EnumMap<>(Tier.class);
        mutators.forEach((tier, m) -> types.put(tier, m.mutationTypes()));
        TierSelectionManager selection = new TierSelectionManager(config, types, tracker, random);
        ExitParameterMutator exit = new ExitParameterMutator(config.exit(), random);
        return new UnifiedMutationOperator(config, exit, mutators, selection, tracker, security, random);
    }

    public void setListener(MutationListener listener) {
        this.listener = listener != null ? listener : MutationListener.NOOP;
    }

    // ========== Mutation ==========

    public synchronized MutationResult mutate(String code, MutationContext context) {
        requests++;
        boolean exit = context.forceExit()
            || (context.overrideTier() == null && random.nextBoolean(exitProbability));
        MutationResult result = exit ? mutateExit(code, context) : mutateTier(code, context);
        listener.onMutation(result);
        return result;
    }

    private MutationResult mutateExit(String code, MutationContext context) {
        exitRequests++;
        ExitMutationResult r = exitMutator.mutate(code, context.exitParameter());
        if (!r.success()) {
            log.debug("Exit mutation failed: {}", r.error());
            return failure(code, null, MutationResult.EXIT_MUTATION, List.of(), r.error(), -1);
        }
        if (validationEnabled) {
            ValidationResult v = security.validate(r.mutatedCode());
            if (!v.success()) {
                validationFailures++;
                return failure(code, null, MutationResult.EXIT_MUTATION, List.of(),
                    "Validation failed: " + String.join("; ", v.errors()), -1);
            }
        }
        exitSuccesses++;
        log.info("Exit mutation {}", r.change());
        return new MutationResult(r.mutatedCode(), true, null, MutationResult.EXIT_MUTATION, List.of(),
            r.change().toMetadata(), null, -1);
    }

    private MutationResult mutateTier(String code, MutationContext context) {
        tierRequests++;
        MutationPlan initial = selection.selectTier(code, context);
        List<Tier> chain = new ArrayList<>();
        List<Tier> remaining = new ArrayList<>(initial.tier().fallbacks());
        MutationPlan plan = initial;

        while (true) {
            chain.add(plan.tier());
            tierAttempts.merge(plan.tier(), 1L, Long::sum);
            MutationOutcome outcome = attempt(code, plan);

            if (outcome instanceof MutationOutcome.Applied applied) {
                tierAttemptSuccesses.merge(plan.tier(), 1L, Long::sum);
                return succeeded(applied, plan, chain, context);
            }

            String reason = ((MutationOutcome.Rejected) outcome).reason();
            if (!fallbackEnabled || remaining.isEmpty()) {
                return exhausted(code, initial, chain, reason, context);
            }
            Tier next = remaining.remove(0);
            log.warn("Tier {} {} failed ({}), falling back to tier {}",
                plan.tier().level(), plan.mutationType(), reason, next.level());
            listener.onFallback(plan.tier(), next, reason);
            plan = selection.planFor(next, code, context,
                "Fallback from tier " + plan.tier().level() + ": " + reason);
        }
    }

    /**
     * One tier attempt: mutation, then security validation of the candidate.
     */
    private MutationOutcome attempt(String code, MutationPlan plan) {
        MutationOutcome outcome;
        try {
            outcome = mutators.get(plan.tier()).mutate(code, plan);
        } catch (RuntimeException e) {
            log.warn("Tier {} mutator threw on {}", plan.tier().level(), plan.mutationType(), e);
            return MutationOutcome.rejected("Unexpected mutator error: " + e.getMessage());
        }
        if (validationEnabled && outcome instanceof MutationOutcome.Applied applied) {
            ValidationResult v = security.validate(applied.code());
            if (!v.success()) {
                validationFailures++;
                return MutationOutcome.rejected("Validation failed: " + String.join("; ", v.errors()));
            }
        }
        return outcome;
    }

    private MutationResult succeeded(MutationOutcome.Applied applied, MutationPlan plan,
                                     List<Tier> chain, MutationContext context) {
        tierSuccesses++;
        Map<String, Object> metadata = new LinkedHashMap<>(applied.metadata());
        metadata.put("risk_score", plan.riskScore());
        metadata.put("rationale", plan.rationale());
        long recordId = tracker.record(plan.tier(), applied.mutationType(), true, 0.0,
            context.strategyId(), metadata);
        selection.resultRecorded();

        if (chain.size() > 1) {
            fallbackRecoveries++;
            log.info("Recovered via tier {} {} after fallback chain {} {}", plan.tier().level(),
                applied.mutationType(), levels(chain), applied.metadata());
        } else {
            log.info("Tier {} {} applied {}", plan.tier().level(), applied.mutationType(), applied.metadata());
        }
        return new MutationResult(applied.code(), true, plan.tier(), applied.mutationType(), chain,
            metadata, null, recordId);
    }

    private MutationResult exhausted(String code, MutationPlan initial, List<Tier> chain,
                                     String lastReason, MutationContext context) {
        exhausted++;
        String error = fallbackEnabled
            ? "All fallback tiers failed. Attempted: " + levels(chain)
            : "Tier " + initial.tier().level() + " mutation failed: " + lastReason;
        long recordId = tracker.record(initial.tier(), initial.mutationType(), false, 0.0,
            context.strategyId(), Map.of("error", lastReason));
        selection.resultRecorded();
        MutationResult result = failure(code, null, initial.mutationType(), chain, error, recordId);
        log.warn("{} (last error: {})", error, lastReason);
        listener.onExhausted(result);
        return result;
    }

    private static MutationResult failure(String code, Tier tier, String type, List<Tier> chain,
                                          String error, long recordId) {
        return new MutationResult(code, false, tier, type, chain, Map.of(), error, recordId);
    }

    private static List<Integer> levels(List<Tier> chain) {
        return chain.stream().map(Tier::level).collect(Collectors.toList());
    }

    // ========== Accessors ==========

    public synchronized OperatorStatistics getStatistics() {
        return new OperatorStatistics(requests, exitRequests, exitSuccesses, tierRequests, tierSuccesses,
            fallbackRecoveries, exhausted, validationFailures, tierAttempts, tierAttemptSuccesses,
            exitMutator.getStatistics());
    }

    public synchronized void resetStatistics() {
        requests = 0;
        exitRequests = 0;
        exitSuccesses = 0;
        tierRequests = 0;
        tierSuccesses = 0;
        fallbackRecoveries = 0;
        exhausted = 0;
        validationFailures = 0;
        tierAttempts.clear();
        tierAttemptSuccesses.clear();
        exitMutator.resetStatistics();
    }

    public TierPerformanceTracker getTracker() {
        return tracker;
    }

    public TierSelectionManager getSelection() {
        return selection;
    }

    public ExitParameterMutator getExitMutator() {
        return exitMutator;
    }
}
