package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.config.ConfigurationException;
import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.core.MutationContext;
import io.github.manjago.mutagen.core.MutationResult;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.operator.UnifiedMutationOperator;
import io.github.manjago.mutagen.tracking.TierPerformanceTracker;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Apply mutations to a snippet.
 *
 * The mutated snippet goes to stdout (or --output), the report to stderr,
 * so the command can sit in a pipeline.
 *
 * Examples:
 *   mutagen mutate strategy.py                      # Routed by the operator
 *   mutagen mutate strategy.py --tier 3             # Tier cascade from tier 3
 *   mutagen mutate strategy.py --exit stop_loss_pct # Exit parameter mutation
 *   mutagen mutate strategy.py -n 5 -s 42           # Five chained mutations
 */
@Command(
    name = "mutate",
    description = "Mutate a strategy snippet",
    mixinStandardHelpOptions = true
)
public class MutateCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions configOptions;

    @Parameters(index = "0", description = "Snippet file ('-' for stdin)")
    private Path file;

    @Option(names = {"-t", "--tier"}, converter = TierConverter.class,
            description = "Force a tier: 1, 2, 3 or config, domain, ast")
    private Tier tier;

    @Option(names = {"-e", "--exit"}, arity = "0..1", fallbackValue = "",
            description = "Force an exit parameter mutation, optionally of the named parameter")
    private String exitParameter;

    @Option(names = {"--type"}, description = "Mutation type within the tier (e.g. add_factor, ast_comparator_swap)")
    private String mutationType;

    @Option(names = {"--target"}, description = "Config key or factor to mutate")
    private String target;

    @Option(names = {"-g", "--generation"}, defaultValue = "0", description = "Generation for phase scheduling")
    private int generation;

    @Option(names = {"-n", "--count"}, defaultValue = "1", description = "Number of chained mutations")
    private int count;

    @Option(names = {"--no-fallback"}, description = "Disable the 3 → 2 → 1 fallback cascade")
    private boolean noFallback;

    @Option(names = {"-o", "--output"}, description = "Write the mutated snippet to this file")
    private Path output;

    @Override
    public Integer call() {
        if (tier != null && exitParameter != null) {
            System.err.println("❌ --tier and --exit are mutually exclusive");
            return 2;
        }
        if (count < 1) {
            System.err.println("❌ --count must be at least 1");
            return 2;
        }

        try {
            String code = Snippets.read(file);
            MutagenConfig config = configOptions.load();
            if (noFallback) {
                config = config.toBuilder().fallbackEnabled(false).build();
            }
            UnifiedMutationOperator operator = UnifiedMutationOperator.create(config, new TierPerformanceTracker());

            int applied = 0;
            for (int i = 0; i < count; i++) {
                MutationResult result = operator.mutate(code, context(i));
                report(i + 1, result);
                if (result.success()) {
                    code = result.mutatedCode();
                    applied++;
                }
            }

            if (output != null) {
                Files.writeString(output, code, StandardCharsets.UTF_8);
                System.err.println("💾 Written to " + output);
            } else {
                System.out.print(code);
                System.out.flush();
            }
            return applied > 0 ? 0 : 1;

        } catch (IOException e) {
            System.err.println("❌ I/O error: " + e.getMessage());
            return 1;
        } catch (ConfigurationException e) {
            System.err.println("❌ Configuration error: " + e.getMessage());
            return 1;
        }
    }

    private MutationContext context(int step) {
        MutationContext.Builder builder = MutationContext.builder()
            .generation(generation + step)
            .overrideTier(tier)
            .mutationType(mutationType)
            .target(target);
        if (exitParameter != null) {
            builder.forceExit(true).exitParameter(exitParameter.isEmpty() ? null : exitParameter);
        }
        return builder.build();
    }

    private static void report(int step, MutationResult result) {
        if (!result.success()) {
            System.err.printf("❌ #%d %s failed: %s%n", step, result.mutationType(), result.error());
            return;
        }
        if (result.isExitMutation()) {
            System.err.printf("✅ #%d exit: %s%n", step, result.metadata());
        } else {
            System.err.printf("✅ #%d tier %d %s (chain %s): %s%n", step, result.tierUsed().level(),
                result.mutationType(), result.fallbackLevels(), result.metadata());
        }
    }

    /**
     * Accepts every spelling {@link Tier#parse} does.
     */
    static class TierConverter implements CommandLine.ITypeConverter<Tier> {
        @Override
        public Tier convert(String value) {
            try {
                return Tier.parse(value);
            } catch (IllegalArgumentException e) {
                throw new CommandLine.TypeConversionException(e.getMessage());
            }
        }
    }
}
