package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.config.ConfigurationException;
import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.sandbox.SandboxExecutionWrapper;
import io.github.manjago.mutagen.sandbox.SandboxOutcome;
import io.github.manjago.mutagen.sandbox.SandboxStatistics;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Backtest a snippet through the sandbox wrapper.
 *
 * Examples:
 *   mutagen execute strategy.py               # Isolated, direct on failure
 *   mutagen execute strategy.py --direct      # In-process only
 *   mutagen execute strategy.py --timeout 30  # Seconds per attempt
 */
@Command(
    name = "execute",
    description = "Validate and backtest a strategy snippet",
    mixinStandardHelpOptions = true
)
public class ExecuteCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions configOptions;

    @Parameters(index = "0", description = "Snippet file ('-' for stdin)")
    private Path file;

    @Option(names = {"--direct"}, description = "Skip isolation, evaluate in-process")
    private boolean direct;

    @Option(names = {"--timeout"}, description = "Timeout in seconds (default from config)")
    private Long timeoutSeconds;

    @Override
    public Integer call() {
        try {
            String code = Snippets.read(file);
            MutagenConfig config = configOptions.load();
            if (direct) {
                config = config.toBuilder().sandboxEnabled(false).build();
            }
            Duration timeout = timeoutSeconds != null
                ? Duration.ofSeconds(timeoutSeconds)
                : config.sandbox().timeout();

            try (SandboxExecutionWrapper sandbox = SandboxExecutionWrapper.create(config)) {
                SandboxOutcome outcome = sandbox.execute(code, timeout);
                SandboxStatistics stats = sandbox.getStatistics();

                if (!outcome.success()) {
                    System.out.println("❌ Execution failed (" + outcome.mode() + "): " + outcome.error());
                    return 1;
                }
                System.out.println("✅ Executed (" + outcome.mode() + ")"
                    + (stats.fallbackCount() > 0 ? " after isolation fallback" : ""));
                System.out.println();
                outcome.metrics().forEach((name, value) ->
                    System.out.printf("   %-16s %12.4f%n", name, value));
                return 0;
            }

        } catch (IOException e) {
            System.err.println("❌ Cannot read " + file + ": " + e.getMessage());
            return 1;
        } catch (ConfigurationException e) {
            System.err.println("❌ Configuration error: " + e.getMessage());
            return 1;
        }
    }
}
