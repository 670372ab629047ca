package io.github.manjago.mutagen.cli;

import io.github.manjago.mutagen.security.SecurityValidator;
import io.github.manjago.mutagen.security.ValidationResult;
import io.github.manjago.mutagen.tier3.AstValidator;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Run the security validator over a snippet.
 *
 * Examples:
 *   mutagen validate strategy.py            # Security policy only
 *   mutagen validate --strict strategy.py   # Plus loop-termination checks
 *   cat strategy.py | mutagen validate -    # From stdin
 */
@Command(
    name = "validate",
    description = "Check a snippet against the security policy",
    mixinStandardHelpOptions = true
)
public class ValidateCommand implements Callable<Integer> {

    @Parameters(index = "0", description = "Snippet file ('-' for stdin)")
    private Path file;

    @Option(names = {"--strict"}, description = "Also apply the AST validator used for tier-3 candidates")
    private boolean strict;

    @Override
    public Integer call() {
        String code;
        try {
            code = Snippets.read(file);
        } catch (IOException e) {
            System.err.println("❌ Cannot read " + file + ": " + e.getMessage());
            return 1;
        }

        SecurityValidator security = new SecurityValidator();
        ValidationResult result = strict
            ? new AstValidator(security).validate(code)
            : security.validate(code);

        for (String warning : result.warnings()) {
            System.out.println("⚠️  " + warning);
        }
        if (result.success()) {
            System.out.println("✅ " + file + ": OK");
            return 0;
        }
        System.out.println("❌ " + file + ": " + result.errors().size() + " violation(s)");
        for (String error : result.errors()) {
            System.out.println("   " + error);
        }
        return 1;
    }
}
