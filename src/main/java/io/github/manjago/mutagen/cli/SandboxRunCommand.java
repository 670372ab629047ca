package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.exec.BacktestReport;
import io.github.manjago.mutagen.exec.DirectExecutor;
import io.github.manjago.mutagen.exec.EvaluationException;
import io.github.manjago.mutagen.sandbox.SignalCodec;
import io.github.manjago.mutagen.security.SecurityValidator;
import io.github.manjago.mutagen.security.ValidationResult;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.Callable;

/**
 * Entry point inside the isolation container: snippet on stdin, metrics
 * signal on stdout, diagnostics on stderr.
 */
@Command(
    name = "sandbox-run",
    description = "Execute a snippet from stdin and print the metrics signal",
    hidden = true
)
public class SandboxRunCommand implements Callable<Integer> {

    @Mixin
    private ConfigOptions configOptions;

    @Override
    public Integer call() {
        try {
            String code = new String(System.in.readAllBytes(), StandardCharsets.UTF_8);
            ValidationResult validation = new SecurityValidator().validate(code);
            if (!validation.success()) {
                System.err.println("Validation failed: " + String.join("; ", validation.errors()));
                return 3;
            }
            MutagenConfig config = configOptions.load();
            BacktestReport report = DirectExecutor.fromConfig(config).run(code, config.sandbox().timeout());
            System.out.println(SignalCodec.encode(report.metrics()));
            return 0;
        } catch (IOException e) {
            System.err.println("Cannot read snippet: " + e.getMessage());
            return 1;
        } catch (SnippetSyntaxException e) {
            System.err.println("Syntax error: " + e.getMessage());
            return 2;
        } catch (EvaluationException e) {
            System.err.println("Execution failed: " + e.getMessage());
            return 2;
        }
    }
}
