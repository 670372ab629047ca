package io.github.manjago.mutagen.tier2;

import io.github.manjago.mutagen.core.MutationOutcome;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.SourceWriter;

import java.util.Map;

/**
 * One structural edit of a strategy's factors.
 */
public interface FactorOperator {

    /**
     * Operator name as used in mutation plans.
     */
    String name();

    /**
     * Edit the parsed strategy. {@link MutationPlan#target()} may name the
     * factor or template to use.
     */
    MutationOutcome mutate(Script script, MutationPlan plan);

    /**
     * Render an edited script as the operator's result.
     */
    static MutationOutcome applied(Script edited, String operator, Map<String, Object> metadata) {
        return MutationOutcome.applied(SourceWriter.write(edited), operator, metadata);
    }
}
