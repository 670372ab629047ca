package io.github.manjago.mutagen.tier2;

import io.github.manjago.mutagen.core.MutationOutcome;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.snippet.Expr;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.Stmt;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Inserts a library factor the strategy does not define yet and joins its
 * call into the position chain.
 */
public class AddFactorOperator implements FactorOperator {

    public static final String NAME = "add_factor";

    private final FactorLibrary library;
    private final SeededRandom random;

    public AddFactorOperator(FactorLibrary library, SeededRandom random) {
        this.library = library;
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

        FactorTemplate template;
        if (plan.target() != null) {
            template = library.find(plan.target());
            if (template == null) {
                return MutationOutcome.rejected("Unknown factor template: " + plan.target());
            }
            if (script.findFunction(template.name()) != null) {
                return MutationOutcome.rejected("Factor " + template.name() + " already defined");
            }
        } else {
            List<FactorTemplate> candidates = new ArrayList<>();
            for (FactorTemplate t : library.all()) {
                if (script.findFunction(t.name()) == null) {
                    candidates.add(t);
                }
            }
            if (candidates.isEmpty()) {
                return MutationOutcome.rejected("All library factors are already present");
            }
            template = random.choice(candidates);
        }

        Stmt.FunctionDef definition = template.definition();
        List<Expr> operands = new ArrayList<>(chain.operands());
        operands.add(PositionChain.factorCall(template.name()));
        Script edited = script
            .insertBefore(chain.statement(), definition)
            .replace(chain.statement(), chain.withOperands(operands));

        return FactorOperator.applied(edited, NAME, Map.of(
            "factor", template.name(),
            "category", template.category().key()));
    }
}
