package io.github.manjago.mutagen.tier3;

import io.github.manjago.mutagen.security.PolicyViolation;
import io.github.manjago.mutagen.security.SecurityValidator;
import io.github.manjago.mutagen.security.ValidationResult;
import io.github.manjago.mutagen.snippet.AstWalker;
import io.github.manjago.mutagen.snippet.Expr;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.SnippetParser;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import io.github.manjago.mutagen.snippet.Stmt;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks transformed code before it is accepted: it must parse, pass the
 * security policy and contain no obviously unbounded {@code while} loop.
 *
 * The loop check is a heuristic: a loop without {@code break} whose
 * condition reads no variable assigned in its body can never terminate.
 */
public class AstValidator {

    private final SecurityValidator security;

    public AstValidator(SecurityValidator security) {
        this.security = security;
    }

    public AstValidator() {
        this(new SecurityValidator());
    }

    public ValidationResult validate(String code) {
        Script script;
        try {
            script = SnippetParser.parse(code);
        } catch (SnippetSyntaxException e) {
            return ValidationResult.failure("Syntax error: " + e.getMessage());
        }
        return validate(script);
    }

    public ValidationResult validate(Script script) {
        List<String> errors = new ArrayList<>();
        for (PolicyViolation v : security.violations(script.body())) {
            errors.add(v.message());
        }
        AstWalker.forEachStmt(script.body(), stmt -> {
            if (stmt instanceof Stmt.While loop && isUnbounded(loop)) {
                errors.add("Potentially unbounded while loop (line " + loop.line() + ")");
            }
        });
        return ValidationResult.of(errors, List.of());
    }

    private static boolean isUnbounded(Stmt.While loop) {
        if (hasBreak(loop.body())) {
            return false;
        }
        Set<String> conditionNames = new HashSet<>();
        AstWalker.forEachExpr(loop.test(), e -> {
            if (e instanceof Expr.Name n) {
                conditionNames.add(n.id());
            }
        });
        conditionNames.retainAll(AstWalker.assignedNames(loop.body()));
        return conditionNames.isEmpty();
    }

    /**
     * A break that exits this loop, i.e. not one inside a nested loop.
     */
    private static boolean hasBreak(List<Stmt> body) {
        for (Stmt stmt : body) {
            if (stmt instanceof Stmt.Break) {
                return true;
            }
            if (stmt instanceof Stmt.If s && (hasBreak(s.body()) || hasBreak(s.orElse()))) {
                return true;
            }
        }
        return false;
    }
}
