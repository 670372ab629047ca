package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.config.ConfigurationException;
import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.exit.ExitParameter;
import io.github.manjago.mutagen.operator.UnifiedMutationOperator;
import io.github.manjago.mutagen.security.SecurityValidator;
import io.github.manjago.mutagen.tier2.FactorLibrary;
import io.github.manjago.mutagen.tier2.FactorTemplate;
import io.github.manjago.mutagen.tracking.TierPerformanceTracker;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.concurrent.Callable;

/**
 * Show information about Mutagen.
 */
@Command(
    name = "info",
    description = "Show version, configuration and available mutations",
    mixinStandardHelpOptions = true
)
public class InfoCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions configOptions;

    @Override
    public Integer call() {
        MutagenConfig config;
        try {
            config = configOptions.load();
        } catch (ConfigurationException e) {
            System.err.println("❌ Configuration error: " + e.getMessage());
            return 1;
        }

        System.out.println();
        System.out.println("╔═══════════════════════════════════════╗");
        System.out.println("║              MUTAGEN                  ║");
        System.out.println("║   Strategy Mutation & Safe Execution  ║");
        System.out.println("║          Version 1.0.0                ║");
        System.out.println("╚═══════════════════════════════════════╝");
        System.out.println();

        System.out.println("Configuration:");
        System.out.println(config);

        UnifiedMutationOperator operator = UnifiedMutationOperator.create(config, new TierPerformanceTracker());
        System.out.println("Mutation types:");
        for (Tier tier : Tier.values()) {
            System.out.printf("  Tier %d (%s): %s%n", tier.level(), tier.label(),
                operator.getSelection().mutationTypes(tier));
        }
        System.out.println();

        System.out.println("Exit parameters:");
        for (ExitParameter p : ExitParameter.values()) {
            System.out.println("  " + operator.getExitMutator().getBounds(p));
        }
        System.out.println();

        System.out.println("Factor library:");
        for (FactorTemplate t : FactorLibrary.defaults().all()) {
            System.out.printf("  %-22s %s%n", t.name(), t.category().key());
        }
        System.out.println();

        System.out.println("Forbidden calls: " + SecurityValidator.FORBIDDEN_CALLS);
        return 0;
    }
}
