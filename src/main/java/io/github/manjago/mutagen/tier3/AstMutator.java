package io.github.manjago.mutagen.tier3;

import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.core.MutationOutcome;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.Mutator;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.security.ValidationResult;
import io.github.manjago.mutagen.snippet.AstRewriter;
import io.github.manjago.mutagen.snippet.Expr;
import io.github.manjago.mutagen.snippet.Literals;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.SnippetParser;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import io.github.manjago.mutagen.snippet.SourceWriter;
import io.github.manjago.mutagen.snippet.Stmt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tier 3: syntax tree transforms inside one factor function.
 *
 * <h2>Algorithm:</h2>
 * <pre>
 * 1. pick      factor function (plan target or uniform)
 * 2. collect   eligible nodes for the transform, in rewriter order
 * 3. choose    each node with probability node-mutation-rate,
 *              exactly one forced when none was chosen
 * 4. rewrite   chosen nodes, render the script
 * 5. validate  AstValidator; any error rejects the candidate
 * 6. compile   the rewritten factor into a CompiledFactor
 * </pre>
 */
public class AstMutator implements Mutator {

    private static final Logger log = LoggerFactory.getLogger(AstMutator.class);

    private final double nodeMutationRate;
    private final double scaleMin;
    private final double scaleMax;
    private final AstValidator validator;
    private final SeededRandom random;

    public AstMutator(double nodeMutationRate, double scaleMin, double scaleMax,
                      AstValidator validator, SeededRandom random) {
        if (nodeMutationRate < 0 || nodeMutationRate > 1) {
            throw new IllegalArgumentException("nodeMutationRate must be in [0, 1]: " + nodeMutationRate);
        }
        if (!(0 < scaleMin && scaleMin < scaleMax)) {
            throw new IllegalArgumentException("Scale range must satisfy 0 < min < max");
        }
        this.nodeMutationRate = nodeMutationRate;
        this.scaleMin = scaleMin;
        this.scaleMax = scaleMax;
        this.validator = validator;
        this.random = random;
    }

    public AstMutator(MutagenConfig.TierSettings settings, AstValidator validator, SeededRandom random) {
        this(settings.tier3NodeMutationRate(), settings.tier3ScaleMin(), settings.tier3ScaleMax(), validator, random);
    }

    @Override
    public Tier tier() {
        return Tier.TIER3;
    }

    @Override
    public Set<String> mutationTypes() {
        return Arrays.stream(AstTransform.values()).map(AstTransform::type).collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public synchronized MutationOutcome mutate(String code, MutationPlan plan) {
        AstTransform transform = AstTransform.fromType(plan.mutationType());
        if (transform == null) {
            return MutationOutcome.rejected("Unknown AST transform: " + plan.mutationType());
        }
        Script script;
        try {
            script = SnippetParser.parse(code);
        } catch (SnippetSyntaxException e) {
            return MutationOutcome.rejected("Syntax error: " + e.getMessage());
        }

        // 1. Pick
        List<Stmt.FunctionDef> functions = script.functions();
        if (functions.isEmpty()) {
            return MutationOutcome.rejected("No factor functions to transform");
        }
        Stmt.FunctionDef target;
        if (plan.target() != null) {
            target = script.findFunction(plan.target());
            if (target == null) {
                return MutationOutcome.rejected("Factor " + plan.target() + " not found");
            }
        } else {
            target = random.choice(functions);
        }

        // 2. Collect
        int eligible = countEligible(target, transform);
        if (eligible == 0) {
            return MutationOutcome.rejected("No eligible nodes for " + transform.type() + " in " + target.name());
        }

        // 3. Choose
        Set<Integer> chosen = new HashSet<>();
        for (int i = 0; i < eligible; i++) {
            if (random.nextBoolean(nodeMutationRate)) {
                chosen.add(i);
            }
        }
        if (chosen.isEmpty()) {
            chosen.add(random.nextInt(eligible));
        }

        // 4. Rewrite
        Stmt rewritten = new Transformer(transform, chosen).rewriteStmt(target);
        Script mutatedScript = script.replace(target, rewritten);
        String mutated = SourceWriter.write(mutatedScript);

        // 5. Validate
        ValidationResult validation = validator.validate(mutated);
        if (!validation.success()) {
            log.debug("AST transform {} on {} failed validation: {}", transform, target.name(), validation.errors());
            return MutationOutcome.rejected("Validation failed: " + String.join("; ", validation.errors()));
        }

        // 6. Compile
        try {
            CompiledFactor.compile(mutatedScript, target.name());
        } catch (IllegalArgumentException e) {
            return MutationOutcome.rejected("Cannot compile " + target.name() + ": " + e.getMessage());
        }

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("factor", target.name());
        metadata.put("transform", transform.type());
        metadata.put("eligible_nodes", eligible);
        metadata.put("nodes_mutated", chosen.size());
        log.debug("AST transform {} applied to {} node(s) of {}", transform, chosen.size(), target.name());
        return MutationOutcome.applied(mutated, transform.type(), metadata);
    }

    /**
     * Compile one factor of a snippet for evaluation.
     *
     * @throws SnippetSyntaxException when the code does not parse
     */
    public CompiledFactor compile(String code, String factorName) throws SnippetSyntaxException {
        return CompiledFactor.compile(SnippetParser.parse(code), factorName);
    }

    private static int countEligible(Stmt.FunctionDef def, AstTransform transform) {
        int[] count = {0};
        new AstRewriter() {
            @Override
            protected Expr visit(Expr expr) {
                if (transform.isEligible(expr)) {
                    count[0]++;
                }
                return expr;
            }
        }.rewriteStmt(def);
        return count[0];
    }

    /**
     * Rewrites the eligible nodes whose ordinal is in the chosen set.
     */
    private final class Transformer extends AstRewriter {
        private final AstTransform transform;
        private final Set<Integer> chosen;
        private int index;

        Transformer(AstTransform transform, Set<Integer> chosen) {
            this.transform = transform;
            this.chosen = chosen;
        }

        @Override
        protected Expr visit(Expr expr) {
            if (!transform.isEligible(expr)) {
                return expr;
            }
            if (!chosen.contains(index++)) {
                return expr;
            }
            return switch (transform) {
                case COMPARATOR_SWAP -> {
                    Expr.Comparison c = (Expr.Comparison) expr;
                    yield new Expr.Comparison(c.left(), AstTransform.swapped(c.op()), c.right(), c.line());
                }
                case ARITHMETIC_SWAP -> {
                    Expr.Binary b = (Expr.Binary) expr;
                    yield new Expr.Binary(b.left(), AstTransform.swapped(b.op()), b.right(), b.line());
                }
                case THRESHOLD_SCALE -> {
                    Expr.Comparison c = (Expr.Comparison) expr;
                    double scale = random.nextDouble(scaleMin, scaleMax);
                    if (c.right() instanceof Expr.Num n) {
                        yield new Expr.Comparison(c.left(), c.op(), scaled(n, scale), c.line());
                    }
                    yield new Expr.Comparison(scaled((Expr.Num) c.left(), scale), c.op(), c.right(), c.line());
                }
            };
        }

        private Expr.Num scaled(Expr.Num n, double scale) {
            double value = n.value() * scale;
            return n.withValue(n.integer() ? Math.round(value) : Literals.roundToPrecision(value));
        }
    }
}
