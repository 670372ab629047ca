package io.github.manjago.mutagen.selection;

import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.snippet.AstWalker;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.SnippetParser;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import org.jetbrains.annotations.Nullable;

import java.util.Map;

/**
 * Risk score of mutating a candidate, in [0, 1].
 *
 * Combines strategy complexity (syntax tree size, factor count, nesting
 * depth) with mutation history (how often recent mutations failed).
 */
public class RiskAssessor {

    static final double COMPLEXITY_WEIGHT = 0.7;
    static final double HISTORY_WEIGHT = 0.3;
    static final double UNKNOWN_RISK = 0.5;

    private static final double NODE_SCALE = 400;
    private static final double FACTOR_SCALE = 8;
    private static final double DEPTH_SCALE = 4;

    public double assess(@Nullable String code, Map<Tier, Double> tierSuccessRates) {
        return clamp(COMPLEXITY_WEIGHT * strategyRisk(code) + HISTORY_WEIGHT * mutationRisk(tierSuccessRates));
    }

    /**
     * Complexity of the code; unknown (0.5) when absent or unparseable.
     */
    public double strategyRisk(@Nullable String code) {
        if (code == null) {
            return UNKNOWN_RISK;
        }
        try {
            return strategyRisk(SnippetParser.parse(code));
        } catch (SnippetSyntaxException e) {
            return UNKNOWN_RISK;
        }
    }

    public double strategyRisk(Script script) {
        double size = Math.min(1.0, AstWalker.countNodes(script.body()) / NODE_SCALE);
        double factors = Math.min(1.0, script.functions().size() / FACTOR_SCALE);
        double depth = Math.min(1.0, Math.max(0, AstWalker.blockDepth(script.body()) - 1) / DEPTH_SCALE);
        return (size + factors + depth) / 3.0;
    }

    /**
     * One minus the mean tier success rate; unknown (0.5) without history.
     */
    public double mutationRisk(Map<Tier, Double> tierSuccessRates) {
        if (tierSuccessRates.isEmpty()) {
            return UNKNOWN_RISK;
        }
        double sum = 0;
        for (double rate : tierSuccessRates.values()) {
            sum += rate;
        }
        return clamp(1.0 - sum / tierSuccessRates.size());
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
