package io.github.manjago.mutagen.security;

import io.github.manjago.mutagen.snippet.AstWalker;
import io.github.manjago.mutagen.snippet.Expr;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.SnippetParser;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import io.github.manjago.mutagen.snippet.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Static security policy for candidate snippets.
 *
 * <h2>Rejected constructs:</h2>
 * <ul>
 *   <li>every {@code import} and {@code from ... import} statement</li>
 *   <li>calls to (or references of) {@code eval}, {@code exec}, {@code compile},
 *       {@code __import__}, {@code open}, also as attribute calls</li>
 *   <li>double-underscore attribute access ({@code x.__class__})</li>
 *   <li>{@code .shift(n)} with a literal {@code n <= 0}: shifting by a negative
 *       lag reads future rows (look-ahead bias)</li>
 * </ul>
 *
 * The snippet is parsed once and walked once. Unparseable input produces a
 * single "Syntax error" entry instead of an exception. The validator has no
 * state and can be shared.
 */
public final class SecurityValidator {

    private static final Logger log = LoggerFactory.getLogger(SecurityValidator.class);

    /**
     * Builtins that evaluate code or touch the file system.
     */
    public static final Set<String> FORBIDDEN_CALLS = Set.of("eval", "exec", "compile", "__import__", "open");

    private static final String SHIFT = "shift";

    /**
     * Validate snippet source.
     */
    public ValidationResult validate(String code) {
        Script script;
        try {
            script = SnippetParser.parse(code);
        } catch (SnippetSyntaxException e) {
            log.debug("Rejecting unparseable snippet: {}", e.getMessage());
            return ValidationResult.failure("Syntax error: " + e.getMessage());
        }
        return validate(script);
    }

    /**
     * Validate an already parsed snippet.
     */
    public ValidationResult validate(Script script) {
        List<PolicyViolation> violations = violations(script.body());
        if (violations.isEmpty()) {
            return ValidationResult.ok();
        }
        List<String> errors = violations.stream().map(PolicyViolation::message).collect(Collectors.toList());
        log.debug("Snippet rejected with {} violation(s): {}", errors.size(), errors);
        return ValidationResult.of(errors, List.of());
    }

    /**
     * Validate and throw on the first rejection.
     *
     * @throws PolicyViolationException when the snippet violates the policy
     */
    public void requireValid(String code) {
        ValidationResult result = validate(code);
        if (!result.success()) {
            throw new PolicyViolationException(result.errors());
        }
    }

    /**
     * Every policy violation in the statements, in source order.
     */
    public List<PolicyViolation> violations(List<Stmt> body) {
        List<PolicyViolation> violations = new ArrayList<>();
        Set<Expr> callees = Collections.newSetFromMap(new IdentityHashMap<>());

        AstWalker.forEachStmt(body, stmt -> {
            if (stmt instanceof Stmt.Import imp) {
                for (Stmt.Alias alias : imp.names()) {
                    violations.add(new PolicyViolation("import", imp.line(),
                        "Import statement not allowed: " + alias.name() + " (line " + imp.line() + ")"));
                }
            } else if (stmt instanceof Stmt.ImportFrom imp) {
                violations.add(new PolicyViolation("import", imp.line(),
                    "Import statement not allowed: from " + imp.module() + " (line " + imp.line() + ")"));
            }
            for (Expr root : AstWalker.expressions(stmt)) {
                AstWalker.forEachExpr(root, expr -> checkExpr(expr, callees, violations));
            }
        });
        return violations;
    }

    // ========== Expression checks ==========

    private void checkExpr(Expr expr, Set<Expr> callees, List<PolicyViolation> violations) {
        if (expr instanceof Expr.Call call) {
            callees.add(call.function());
            String callee = call.calleeName();
            if (callee != null && FORBIDDEN_CALLS.contains(callee)) {
                violations.add(new PolicyViolation(callee, call.line(),
                    "Dangerous function call not allowed: " + callee + " (line " + call.line() + ")"));
            }
            if (SHIFT.equals(callee) && call.function() instanceof Expr.Attribute) {
                checkShift(call, violations);
            }
        } else if (expr instanceof Expr.Name name) {
            if (!callees.contains(expr) && FORBIDDEN_CALLS.contains(name.id())) {
                violations.add(new PolicyViolation(name.id(), name.line(),
                    "Dangerous function reference not allowed: " + name.id() + " (line " + name.line() + ")"));
            }
        } else if (expr instanceof Expr.Attribute attr) {
            if (attr.name().startsWith("__") && attr.name().endsWith("__")) {
                violations.add(new PolicyViolation(attr.name(), attr.line(),
                    "Dunder attribute access not allowed: " + attr.name() + " (line " + attr.line() + ")"));
            }
        }
    }

    private void checkShift(Expr.Call call, List<PolicyViolation> violations) {
        Expr arg = null;
        if (!call.args().isEmpty()) {
            arg = call.args().get(0);
        } else {
            for (Expr.Keyword kw : call.keywords()) {
                if (kw.name().equals("periods")) {
                    arg = kw.value();
                }
            }
        }
        if (arg == null) {
            return;
        }
        Double lag = literalValue(arg);
        if (lag == null) {
            return;
        }
        if (lag < 0) {
            violations.add(new PolicyViolation(SHIFT, call.line(),
                "Negative shift not allowed: shift(" + render(lag) + ") introduces look-ahead bias (line "
                    + call.line() + ")"));
        } else if (lag == 0) {
            violations.add(new PolicyViolation(SHIFT, call.line(),
                "Non-positive shift not allowed: shift(0) uses same-bar data (line " + call.line() + ")"));
        }
    }

    /**
     * Value of a numeric literal, optionally signed; null for anything else.
     */
    private static Double literalValue(Expr expr) {
        if (expr instanceof Expr.Num n) {
            return n.value();
        }
        if (expr instanceof Expr.Unary u && u.operand() instanceof Expr.Num n) {
            if (u.op() == Expr.UnaryOperator.NEG) {
                return -n.value();
            }
            if (u.op() == Expr.UnaryOperator.POS) {
                return n.value();
            }
        }
        return null;
    }

    private static String render(double value) {
        return value == Math.rint(value) ? Long.toString((long) value) : Double.toString(value);
    }
}
