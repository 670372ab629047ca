package io.github.manjago.mutagen.integration;

import io.github.manjago.mutagen.TestStrategies;
import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.core.MutationContext;
import io.github.manjago.mutagen.core.MutationResult;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.exec.BacktestReport;
import io.github.manjago.mutagen.operator.OperatorStatistics;
import io.github.manjago.mutagen.operator.UnifiedMutationOperator;
import io.github.manjago.mutagen.persistence.TrackerStore;
import io.github.manjago.mutagen.sandbox.ExecutionMode;
import io.github.manjago.mutagen.sandbox.SandboxExecutionWrapper;
import io.github.manjago.mutagen.sandbox.SandboxOutcome;
import io.github.manjago.mutagen.tracking.TierPerformanceTracker;
import io.github.manjago.mutagen.tracking.TrackerSummary;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end checks: mutation, sandboxed backtest and performance
 * feedback on the bundled momentum strategy.
 */
@DisplayName("Smoke Tests")
class SmokeTest {

    @TempDir
    Path tempDir;

    private static String strategy;

    @BeforeAll
    static void loadStrategy() {
        strategy = TestStrategies.momentum();
    }

    private static MutagenConfig config() {
        return MutagenConfig.builder()
            .randomSeed(42)
            .maxGenerations(20)
            .sandboxEnabled(false)
            .market(new MutagenConfig.MarketSettings(10, 160, 5))
            .build();
    }

    @Test
    @DisplayName("Seed strategy backtests in direct mode")
    void baseline() {
        try (SandboxExecutionWrapper sandbox = SandboxExecutionWrapper.create(config())) {
            SandboxOutcome outcome = sandbox.execute(strategy);

            assertTrue(outcome.success(), outcome.error());
            assertEquals(ExecutionMode.DIRECT, outcome.mode());
            assertTrue(Double.isFinite(outcome.metrics().get(BacktestReport.SHARPE_RATIO)));
        }
    }

    @Test
    @DisplayName("Hill climb for 20 generations with feedback")
    void hillClimb() throws Exception {
        MutagenConfig config = config();
        TierPerformanceTracker tracker = new TierPerformanceTracker();
        UnifiedMutationOperator operator = UnifiedMutationOperator.create(config, tracker);

        try (SandboxExecutionWrapper sandbox = SandboxExecutionWrapper.create(config)) {
            String best = strategy;
            double bestFitness = sandbox.execute(best).metrics().get(BacktestReport.SHARPE_RATIO);
            int executed = 0;

            for (int g = 0; g < 20; g++) {
                MutationContext context = MutationContext.builder()
                    .generation(g)
                    .strategyId("g" + g)
                    .build();
                MutationResult result = operator.mutate(best, context);
                if (!result.success()) {
                    assertEquals(best, result.mutatedCode());
                    continue;
                }
                SandboxOutcome outcome = sandbox.execute(result.mutatedCode());
                if (!outcome.success()) {
                    continue;
                }
                executed++;
                double fitness = outcome.metrics().get(BacktestReport.SHARPE_RATIO);
                if (result.recordId() > 0 && Double.isFinite(fitness)) {
                    assertTrue(tracker.recordPerformance(result.recordId(), fitness - bestFitness));
                }
                if (fitness > bestFitness) {
                    best = result.mutatedCode();
                    bestFitness = fitness;
                }
            }

            OperatorStatistics stats = operator.getStatistics();
            assertEquals(20, stats.requests());
            assertEquals(stats.requests(), stats.exitRequests() + stats.tierRequests());
            assertTrue(executed > 0, "no mutated candidate executed");
            assertEquals(0, sandbox.getStatistics().rejectedCount());
        }

        TrackerSummary summary = tracker.summary();
        assertEquals(operator.getStatistics().tierRequests(), tracker.size());
        assertEquals(tracker.size(), summary.totalRecords());

        Path file = tempDir.resolve("run.mv.db");
        TrackerStore.save(file, tracker);
        assertEquals(tracker.size(), TrackerStore.loadTracker(file).size());
    }

    @Test
    @DisplayName("Each tier alone mutates the seed strategy")
    void everyTier() {
        UnifiedMutationOperator operator = UnifiedMutationOperator.create(
            config().toBuilder().fallbackEnabled(false).build(), new TierPerformanceTracker());

        for (Tier tier : Tier.values()) {
            boolean applied = false;
            for (int attempt = 0; attempt < 10 && !applied; attempt++) {
                MutationResult result = operator.mutate(strategy,
                    MutationContext.builder().overrideTier(tier).generation(attempt).build());
                applied = result.success() && tier == result.tierUsed();
            }
            assertTrue(applied, "tier " + tier.level() + " never applied");
        }
    }

    @Test
    @DisplayName("Forced exit mutation keeps the strategy runnable")
    void exitMutation() {
        MutagenConfig config = config();
        UnifiedMutationOperator operator = UnifiedMutationOperator.create(config, new TierPerformanceTracker());

        MutationResult result = operator.mutate(strategy,
            MutationContext.builder().forceExit(true).exitParameter("holding_period_days").build());

        assertTrue(result.success(), result.error());
        try (SandboxExecutionWrapper sandbox = SandboxExecutionWrapper.create(config)) {
            assertTrue(sandbox.execute(result.mutatedCode()).success());
        }
    }
}
