package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.config.ConfigurationException;
import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.core.MutationContext;
import io.github.manjago.mutagen.core.MutationListener;
import io.github.manjago.mutagen.core.MutationResult;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.operator.OperatorStatistics;
import io.github.manjago.mutagen.operator.UnifiedMutationOperator;
import io.github.manjago.mutagen.persistence.TrackerStore;
import io.github.manjago.mutagen.sandbox.SandboxExecutionWrapper;
import io.github.manjago.mutagen.sandbox.SandboxOutcome;
import io.github.manjago.mutagen.sandbox.SandboxStatistics;
import io.github.manjago.mutagen.tracking.TierComparison;
import io.github.manjago.mutagen.tracking.TierPerformanceTracker;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.concurrent.Callable;

/**
 * Hill-climb a strategy: mutate the current best, backtest the candidate,
 * keep it when the fitness metric improves.
 *
 * Every mutation attempt is recorded in the tracker, whose success rates
 * drive the adaptive tier selection. The fitness change of each backtested
 * candidate is then attached to its record.
 *
 * Examples:
 *   mutagen evolve strategy.py -g 50                 # 50 generations
 *   mutagen evolve strategy.py --direct --save run.mv
 *   mutagen evolve strategy.py -o best.py --metric annual_return
 */
@Command(
    name = "evolve",
    description = "Evolve a strategy with the mutation engine and the sandbox",
    mixinStandardHelpOptions = true
)
public class EvolveCommand implements Callable<Integer> {

    static final int DIVERSITY_WINDOW = 10;

    @Mixin
    private ConfigOptions configOptions;

    @Parameters(index = "0", description = "Seed strategy file ('-' for stdin)")
    private Path file;

    @Option(names = {"-g", "--generations"}, defaultValue = "20", description = "Generations to run")
    private int generations;

    @Option(names = {"--metric"}, defaultValue = "sharpe_ratio", description = "Fitness metric (higher is better)")
    private String metric;

    @Option(names = {"--direct"}, description = "Skip isolation, evaluate in-process")
    private boolean direct;

    @Option(names = {"-o", "--output"}, description = "Write the best strategy to this file")
    private Path output;

    @Option(names = {"--save"}, description = "Save mutation records to an MVStore file")
    private Path saveFile;

    @Option(names = {"-q", "--quiet"}, description = "Quiet mode (final report only)")
    private boolean quiet;

    @Override
    public Integer call() {
        if (generations < 1) {
            System.err.println("❌ --generations must be at least 1");
            return 2;
        }
        try {
            String seed = Snippets.read(file);
            MutagenConfig.Builder builder = configOptions.load().toBuilder().maxGenerations(generations);
            if (direct) {
                builder.sandboxEnabled(false);
            }
            MutagenConfig config = builder.build();
            return evolve(seed, config);
        } catch (IOException e) {
            System.err.println("❌ I/O error: " + e.getMessage());
            return 1;
        } catch (ConfigurationException e) {
            System.err.println("❌ Configuration error: " + e.getMessage());
            return 1;
        }
    }

    private int evolve(String seed, MutagenConfig config) throws IOException {
        TierPerformanceTracker tracker = new TierPerformanceTracker();
        UnifiedMutationOperator operator = UnifiedMutationOperator.create(config, tracker);
        if (!quiet) {
            operator.setListener(new FallbackPrinter());
        }

        try (SandboxExecutionWrapper sandbox = SandboxExecutionWrapper.create(config)) {
            SandboxOutcome baseline = sandbox.execute(seed);
            if (!baseline.success()) {
                System.err.println("❌ Seed strategy failed: " + baseline.error());
                return 1;
            }

            String best = seed;
            double bestFitness = fitness(baseline);
            int stagnation = 0;
            int improvements = 0;
            Deque<String> recent = new ArrayDeque<>();

            if (!quiet) {
                System.out.printf("🌱 Seed %s = %.4f%n%n", metric, bestFitness);
            }

            long startTime = System.currentTimeMillis();
            for (int gen = 0; gen < generations; gen++) {
                MutationContext context = MutationContext.builder()
                    .generation(gen)
                    .diversity(diversity(recent))
                    .stagnation(stagnation)
                    .strategyId("gen-" + gen)
                    .build();

                MutationResult result = operator.mutate(best, context);
                if (!result.success()) {
                    stagnation++;
                    progress(gen, "❌", result.mutationType() + ": " + result.error(), bestFitness);
                    continue;
                }
                remember(recent, result.mutatedCode());

                SandboxOutcome outcome = sandbox.execute(result.mutatedCode());
                if (!outcome.success()) {
                    stagnation++;
                    progress(gen, "💀", result.mutationType() + ": " + outcome.error(), bestFitness);
                    continue;
                }

                double candidate = fitness(outcome);
                if (result.recordId() > 0 && Double.isFinite(candidate)) {
                    tracker.recordPerformance(result.recordId(), candidate - bestFitness);
                }
                if (candidate > bestFitness) {
                    best = result.mutatedCode();
                    bestFitness = candidate;
                    stagnation = 0;
                    improvements++;
                    progress(gen, "🧬", describe(result) + String.format(" → %.4f", candidate), bestFitness);
                } else {
                    stagnation++;
                    progress(gen, "·", describe(result) + String.format(" → %.4f", candidate), bestFitness);
                }
            }
            long elapsed = System.currentTimeMillis() - startTime;

            printFinalReport(bestFitness, improvements, elapsed, operator.getStatistics(),
                sandbox.getStatistics(), tracker.comparison());

            if (output != null) {
                Files.writeString(output, best, StandardCharsets.UTF_8);
                System.out.println("💾 Best strategy written to " + output);
            }
            if (saveFile != null) {
                TrackerStore.save(saveFile, tracker);
                System.out.println("💾 Mutation records saved to " + saveFile);
            }
            return 0;
        }
    }

    private double fitness(SandboxOutcome outcome) {
        Double value = outcome.metrics().get(metric);
        return value == null || value.isNaN() ? Double.NEGATIVE_INFINITY : value;
    }

    /**
     * Share of distinct snippets among the recent candidates, 1.0 when none yet.
     */
    static double diversity(Deque<String> recent) {
        return recent.isEmpty() ? 1.0 : (double) new HashSet<>(recent).size() / recent.size();
    }

    private static void remember(Deque<String> recent, String code) {
        recent.addLast(code);
        if (recent.size() > DIVERSITY_WINDOW) {
            recent.removeFirst();
        }
    }

    private static String describe(MutationResult result) {
        return result.isExitMutation()
            ? result.mutationType() + " " + result.metadata().get("parameter")
            : "tier " + result.tierUsed().level() + " " + result.mutationType();
    }

    private void progress(int gen, String mark, String message, double bestFitness) {
        if (!quiet) {
            System.out.printf("%s Gen %3d  |  best %.4f  |  %s%n", mark, gen, bestFitness, message);
        }
    }

    private void printFinalReport(double bestFitness, int improvements, long elapsedMs,
                                  OperatorStatistics ops, SandboxStatistics sandbox, TierComparison tiers) {
        System.out.println();
        System.out.println("═══════════════════════════════════════");
        System.out.println("          EVOLUTION COMPLETE           ");
        System.out.println("═══════════════════════════════════════");
        System.out.println();

        System.out.printf("⏱️  Time: %,d ms  |  Best %s: %.4f  |  Improvements: %d%n",
                elapsedMs, metric, bestFitness, improvements);
        System.out.println();

        System.out.println("🧬 Mutations:");
        System.out.printf("   Requests: %d  |  Success: %.1f%%  |  Exit share: %.1f%%%n",
                ops.requests(), ops.successRate() * 100, ops.exitShare() * 100);
        System.out.printf("   Fallback recoveries: %d  |  Exhausted: %d  |  Rejected by validator: %d%n",
                ops.fallbackRecoveries(), ops.exhausted(), ops.validationFailures());
        for (Tier tier : Tier.values()) {
            System.out.printf("   Tier %d: %4d attempts, %5.1f%% success%n", tier.level(),
                    tiers.distribution().get(tier), tiers.successRates().get(tier) * 100);
        }
        System.out.println();

        System.out.println("📦 Sandbox:");
        System.out.printf("   Mode: %s  |  Executions: %d  |  Fallbacks: %d  |  Last isolation: %s%n",
                sandbox.mode(), sandbox.executionCount(), sandbox.fallbackCount(), sandbox.lastIsolationResult());

        System.out.println();
        System.out.println("═══════════════════════════════════════");
    }

    /**
     * Prints fallback and exhaustion events as they happen.
     */
    private static class FallbackPrinter implements MutationListener {
        @Override
        public void onFallback(Tier from, Tier to, String reason) {
            System.out.printf("   ↘ tier %d → tier %d (%s)%n", from.level(), to.level(), reason);
        }
    }
}
