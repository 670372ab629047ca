package io.github.manjago.mutagen.tier2;

import io.github.manjago.mutagen.core.MutationOutcome;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.Perturbation;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.snippet.AstRewriter;
import io.github.manjago.mutagen.snippet.Expr;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.Stmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Perturbs every numeric literal of one factor function.
 */
public class ParameterMutationOperator implements FactorOperator {

    public static final String NAME = "mutate_parameters";

    private final double sigma;
    private final SeededRandom random;

    public ParameterMutationOperator(double sigma, SeededRandom random) {
        this.sigma = sigma;
        this.random = random;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MutationOutcome mutate(Script script, MutationPlan plan) {
        List<String> factors = new ArrayList<>();
        PositionChain chain = PositionChain.of(script);
        if (chain != null) {
            factors.addAll(chain.factorNames(script));
        }
        if (factors.isEmpty()) {
            script.functions().forEach(f -> factors.add(f.name()));
        }
        if (factors.isEmpty()) {
            return MutationOutcome.rejected("No factor functions to mutate");
        }

        String name = plan.target() != null ? plan.target() : random.choice(factors);
        Stmt.FunctionDef def = script.findFunction(name);
        if (def == null) {
            return MutationOutcome.rejected("Factor " + name + " not found");
        }

        int[] changed = {0};
        Stmt mutated = new AstRewriter() {
            @Override
            protected Expr visit(Expr expr) {
                if (expr instanceof Expr.Num n) {
                    changed[0]++;
                    return n.withValue(Perturbation.gaussian(random, n.value(), n.integer(), sigma));
                }
                return expr;
            }
        }.rewriteStmt(def);
        if (changed[0] == 0) {
            return MutationOutcome.rejected("Factor " + name + " has no numeric parameters");
        }

        return FactorOperator.applied(script.replace(def, mutated), NAME, Map.of(
            "factor", name,
            "parameters_changed", changed[0]));
    }
}
