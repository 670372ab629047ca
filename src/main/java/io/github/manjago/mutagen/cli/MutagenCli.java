package io.github.manjago.mutagen.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

/**
 * Mutagen CLI - mutation and safe execution of generated trading strategies.
 *
 * Usage:
 *   mutagen validate <file>          - Security-check a snippet
 *   mutagen mutate <file> [options]  - Apply one mutation
 *   mutagen execute <file>           - Backtest a snippet in the sandbox
 *   mutagen evolve <file> [options]  - Hill-climb a strategy
 *   mutagen stats <store>            - Show saved tier statistics
 *   mutagen info                     - Show version and config
 */
@Command(
    name = "mutagen",
    description = "Mutation and execution-safety engine for generated trading strategies",
    mixinStandardHelpOptions = true,
    version = "Mutagen 1.0.0",
    subcommands = {
        ValidateCommand.class,
        MutateCommand.class,
        ExecuteCommand.class,
        EvolveCommand.class,
        StatsCommand.class,
        InfoCommand.class,
        SandboxRunCommand.class,
        CommandLine.HelpCommand.class
    }
)
public class MutagenCli implements Runnable {

    @Override
    public void run() {
        // If no subcommand, show help
        CommandLine.usage(this, System.out);
    }

    static CommandLine commandLine() {
        return new CommandLine(new MutagenCli())
                .setCaseInsensitiveEnumValuesAllowed(true);
    }

    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
