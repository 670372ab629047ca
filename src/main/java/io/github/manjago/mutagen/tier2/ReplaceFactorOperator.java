package io.github.manjago.mutagen.tier2;

import io.github.manjago.mutagen.core.MutationOutcome;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.snippet.AstRewriter;
import io.github.manjago.mutagen.snippet.Expr;
import io.github.manjago.mutagen.snippet.Script;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Swaps one position factor for a library factor of the same category
 * (any category when the factor is not from the library) and renames
 * its call sites.
 */
public class ReplaceFactorOperator implements FactorOperator {

    public static final String NAME = "replace_factor";

    private final FactorLibrary library;
    private final SeededRandom random;

    public ReplaceFactorOperator(FactorLibrary library, SeededRandom random) {
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
        List<String> factors = chain.factorNames(script);
        if (factors.isEmpty()) {
            return MutationOutcome.rejected("Position references no factor functions");
        }
        String old = plan.target() != null ? plan.target() : random.choice(factors);
        if (!factors.contains(old)) {
            return MutationOutcome.rejected("Factor " + old + " is not part of the position");
        }

        FactorCategory category = library.categoryOf(old);
        List<FactorTemplate> pool = category == null ? library.all() : library.byCategory(category);
        List<FactorTemplate> candidates = new ArrayList<>();
        for (FactorTemplate t : pool) {
            if (script.findFunction(t.name()) == null) {
                candidates.add(t);
            }
        }
        if (candidates.isEmpty()) {
            return MutationOutcome.rejected("No replacement available for " + old);
        }
        FactorTemplate replacement = random.choice(candidates);

        Script swapped = script.replace(script.findFunction(old), replacement.definition());
        Script edited = new AstRewriter() {
            @Override
            protected Expr visit(Expr expr) {
                if (expr instanceof Expr.Name n && n.id().equals(old)) {
                    return new Expr.Name(replacement.name(), n.line());
                }
                return expr;
            }
        }.rewrite(swapped);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("factor", old);
        metadata.put("replacement", replacement.name());
        metadata.put("category", category == null ? "any" : category.key());
        return FactorOperator.applied(edited, NAME, metadata);
    }
}
