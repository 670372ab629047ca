package io.github.manjago.mutagen.tier2;

import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.core.MutationOutcome;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.Mutator;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.SnippetParser;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tier 2: structural factor edits, dispatched to the {@link FactorOperator}
 * named by the plan.
 *
 * The edited tree is written back with the SourceWriter, so comments in
 * the original snippet do not survive a Tier 2 mutation.
 */
public class DomainMutator implements Mutator {

    private static final Logger log = LoggerFactory.getLogger(DomainMutator.class);

    private final Map<String, FactorOperator> operators = new LinkedHashMap<>();

    public DomainMutator(List<FactorOperator> operators) {
        for (FactorOperator op : operators) {
            if (this.operators.putIfAbsent(op.name(), op) != null) {
                throw new IllegalArgumentException("Duplicate factor operator: " + op.name());
            }
        }
    }

    /**
     * The four standard operators over the given library.
     */
    public static DomainMutator standard(FactorLibrary library, double parameterSigma, SeededRandom random) {
        return new DomainMutator(List.of(
            new AddFactorOperator(library, random),
            new RemoveFactorOperator(random),
            new ReplaceFactorOperator(library, random),
            new ParameterMutationOperator(parameterSigma, random)));
    }

    public static DomainMutator standard(MutagenConfig.TierSettings settings, SeededRandom random) {
        return standard(FactorLibrary.defaults(), settings.tier2ParameterSigma(), random);
    }

    @Override
    public Tier tier() {
        return Tier.TIER2;
    }

    @Override
    public Set<String> mutationTypes() {
        return Set.copyOf(operators.keySet());
    }

    @Override
    public synchronized MutationOutcome mutate(String code, MutationPlan plan) {
        FactorOperator operator = operators.get(plan.mutationType());
        if (operator == null) {
            return MutationOutcome.rejected("Unknown domain operator: " + plan.mutationType());
        }
        Script script;
        try {
            script = SnippetParser.parse(code);
        } catch (SnippetSyntaxException e) {
            return MutationOutcome.rejected("Syntax error: " + e.getMessage());
        }

        MutationOutcome outcome = operator.mutate(script, plan);
        if (outcome instanceof MutationOutcome.Applied applied) {
            try {
                SnippetParser.parse(applied.code());
            } catch (SnippetSyntaxException e) {
                log.warn("Domain operator {} rendered unparseable code: {}", operator.name(), e.getMessage());
                return MutationOutcome.rejected("Syntax error after mutation: " + e.getMessage());
            }
            log.debug("Domain operator {} applied: {}", operator.name(), applied.metadata());
        } else {
            log.debug("Domain operator {} rejected: {}", operator.name(), ((MutationOutcome.Rejected) outcome).reason());
        }
        return outcome;
    }
}
