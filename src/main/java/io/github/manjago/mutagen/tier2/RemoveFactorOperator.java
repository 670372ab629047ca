package io.github.manjago.mutagen.tier2;

import io.github.manjago.mutagen.core.MutationOutcome;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.snippet.AstWalker;
import io.github.manjago.mutagen.snippet.Expr;
import io.github.manjago.mutagen.snippet.Script;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drops one factor from the position chain, and its definition when
 * nothing else calls it. Needs at least two factors in the chain.
 */
public class RemoveFactorOperator implements FactorOperator {

    public static final String NAME = "remove_factor";

    private final SeededRandom random;

    public RemoveFactorOperator(SeededRandom random) {
        this.random = random;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public MutationOutcome mutate(Script script, MutationPlan plan) {
        PositionChain chain = PositionChain.of(script);
        if (chain == null) {
            return MutationOutcome.rejected("Strategy has no position assignment");
        }
        List<String> factors = chain.factorNames(script);
        if (factors.size() < 2) {
            return MutationOutcome.rejected("Need at least two factors in position to remove one, found " + factors.size());
        }

        String victim = plan.target() != null ? plan.target() : random.choice(factors);
        if (!factors.contains(victim)) {
            return MutationOutcome.rejected("Factor " + victim + " is not part of the position");
        }

        List<Expr> operands = new ArrayList<>();
        for (Expr operand : chain.operands()) {
            if (!victim.equals(PositionChain.factorName(operand))) {
                operands.add(operand);
            }
        }
        Script edited = script.replace(chain.statement(), chain.withOperands(operands));
        boolean definitionRemoved = false;
        if (!isReferenced(edited, victim)) {
            edited = edited.remove(edited.findFunction(victim));
            definitionRemoved = true;
        }

        return FactorOperator.applied(edited, NAME, Map.of(
            "factor", victim,
            "definition_removed", definitionRemoved));
    }

    private static boolean isReferenced(Script script, String name) {
        AtomicBoolean found = new AtomicBoolean();
        AstWalker.forEachExpr(script.body(), e -> {
            if (e instanceof Expr.Name n && n.id().equals(name)) {
                found.set(true);
            }
        });
        return found.get();
    }
}
