package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.persistence.TrackerStore;
import io.github.manjago.mutagen.tracking.OperatorStats;
import io.github.manjago.mutagen.tracking.RecentTrends;
import io.github.manjago.mutagen.tracking.TierComparison;
import io.github.manjago.mutagen.tracking.TierPerformanceTracker;
import io.github.manjago.mutagen.tracking.TierStats;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Show tier statistics from a saved run.
 *
 * Examples:
 *   mutagen stats run.mv             # Tables
 *   mutagen stats run.mv --json      # Full JSON export
 *   mutagen stats run.mv --recent 50 # Trends over the last 50 records
 */
@Command(
    name = "stats",
    description = "Show tier performance statistics from a saved run",
    mixinStandardHelpOptions = true
)
public class StatsCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "MVStore file written by 'evolve --save'")
    private Path storeFile;

    @Option(names = {"--json"}, description = "Print the JSON export instead of tables")
    private boolean json;

    @Option(names = {"--recent"}, defaultValue = "20", description = "Window for recent trends")
    private int recentWindow;

    @Override
    public Integer call() {
        TierPerformanceTracker tracker;
        try {
            tracker = TrackerStore.loadTracker(storeFile);
        } catch (IOException e) {
            System.err.println("❌ Error reading " + storeFile + ": " + e.getMessage());
            return 1;
        }

        if (json) {
            System.out.println(tracker.toJson());
            return 0;
        }
        if (recentWindow < 1) {
            System.err.println("❌ --recent must be at least 1");
            return 2;
        }

        TierComparison comparison = tracker.comparison();
        System.out.println();
        System.out.printf("📊 %s: %,d mutation records%n", storeFile, comparison.total());
        System.out.println();

        System.out.println("Tier   Attempts  Success   Avg Δ      Max Δ      Trend");
        System.out.println("─────  ────────  ────────  ─────────  ─────────  ─────────────────");
        for (Tier tier : Tier.values()) {
            TierStats s = tracker.tierStats(tier);
            System.out.printf("%-5d  %8d  %7.1f%%  %9.4f  %9s  %s%n",
                tier.level(), s.attempts(), s.successRate() * 100, s.averageImprovement(),
                s.attempts() == 0 ? "-" : String.format("%.4f", s.maxImprovement()),
                tracker.trend(tier));
        }
        System.out.println();
        System.out.printf("Best by success: tier %d  |  Best by improvement: tier %d  |  Most used: tier %d%n",
            comparison.bestBySuccessRate().level(), comparison.bestByImprovement().level(),
            comparison.mostUsed().level());
        System.out.println();

        System.out.println("Mutation types:");
        for (OperatorStats op : tracker.mutationTypeAnalysis().values()) {
            System.out.printf("   %-26s %5d attempts  %5.1f%% success  avg Δ %.4f%n",
                op.mutationType(), op.attempts(), op.successRate() * 100, op.averageImprovement());
        }
        System.out.println();

        RecentTrends recent = tracker.recentTrends(recentWindow);
        System.out.printf("Last %d records: %.1f%% success, distribution %s%n",
            recent.size(), recent.overallSuccessRate() * 100, recent.distribution());
        return 0;
    }
}
