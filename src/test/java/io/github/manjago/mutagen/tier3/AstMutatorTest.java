package io.github.manjago.mutagen.tier3;

import io.github.manjago.mutagen.TestStrategies;
import io.github.manjago.mutagen.core.MutationOutcome;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.exec.EvaluationException;
import io.github.manjago.mutagen.exec.Frame;
import io.github.manjago.mutagen.exec.SyntheticMarketData;
import io.github.manjago.mutagen.snippet.SnippetParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class AstMutatorTest {

    private AstMutator mutator;

    @BeforeEach
    void setUp() {
        mutator = new AstMutator(0.3, 0.8, 1.2, new AstValidator(), new SeededRandom(42));
    }

    private static MutationPlan plan(AstTransform transform, String target) {
        return new MutationPlan(Tier.TIER3, transform.type(), 0.8, "test", target);
    }

    private static MutationOutcome.Applied applied(MutationOutcome outcome) {
        return assertInstanceOf(MutationOutcome.Applied.class, outcome,
            () -> "rejected: " + ((MutationOutcome.Rejected) outcome).reason());
    }

    @Test
    @DisplayName("Three transforms, tier 3")
    void identity() {
        assertEquals(Tier.TIER3, mutator.tier());
        assertEquals(Set.of("ast_comparator_swap", "ast_threshold_scale", "ast_arithmetic_swap"),
            mutator.mutationTypes());
    }

    // ========== Transforms ==========

    @Nested
    @DisplayName("Transforms")
    class Transforms {

        @Test
        @DisplayName("Comparator swap turns < into <=")
        void comparatorSwap() {
            MutationOutcome.Applied result = applied(mutator.mutate(TestStrategies.momentum(),
                plan(AstTransform.COMPARATOR_SWAP, "rsi_not_overbought")));

            assertTrue(result.code().contains("return rsi <= 70"));
            assertEquals("rsi_not_overbought", result.metadata().get("factor"));
            assertEquals(1, result.metadata().get("nodes_mutated"));
        }

        @Test
        @DisplayName("Threshold scale keeps the literal inside the scale range")
        void thresholdScale() throws Exception {
            for (int i = 0; i < 10; i++) {
                MutationOutcome.Applied result = applied(mutator.mutate(
                    "def f(data):\n    return data.get('close') > 100\n\nposition = f(data)\n",
                    plan(AstTransform.THRESHOLD_SCALE, "f")));
                String line = result.code().lines().filter(l -> l.contains("return")).findFirst().orElseThrow();
                long threshold = Long.parseLong(line.substring(line.indexOf('>') + 1).trim());
                assertTrue(threshold >= 80 && threshold <= 120, line);
                assertTrue(SnippetParser.isValid(result.code()));
            }
        }

        @Test
        @DisplayName("Arithmetic swap exchanges * and /")
        void arithmeticSwap() {
            MutationOutcome.Applied result = applied(mutator.mutate(
                "def f(data):\n    return data.get('volume') * 2 > 10\n\nposition = f(data)\n",
                plan(AstTransform.ARITHMETIC_SWAP, "f")));
            assertTrue(result.code().contains("data.get('volume') / 2 > 10"), result.code());
        }

        @Test
        @DisplayName("At least one node changes even at rate zero")
        void forcedNode() {
            AstMutator lazy = new AstMutator(0.0, 0.8, 1.2, new AstValidator(), new SeededRandom(1));
            MutationOutcome.Applied result = applied(lazy.mutate(
                "def f(data):\n    a = data.get('close') < 1\n    b = data.get('open') < 2\n    return a & b\n",
                plan(AstTransform.COMPARATOR_SWAP, "f")));
            assertEquals(1, result.metadata().get("nodes_mutated"));
            assertEquals(2, result.metadata().get("eligible_nodes"));
        }

        @Test
        @DisplayName("Only the chosen factor is touched")
        void otherFactorsUntouched() {
            MutationOutcome.Applied result = applied(mutator.mutate(TestStrategies.momentum(),
                plan(AstTransform.COMPARATOR_SWAP, "ma_cross")));
            assertTrue(result.code().contains("return rsi < 70"));
            assertTrue(result.code().contains("close.average(ma_short) >= close.average(ma_long)"));
        }
    }

    // ========== Rejections ==========

    @Nested
    @DisplayName("Rejections")
    class Rejections {

        @Test
        @DisplayName("Factor without eligible nodes")
        void noEligible() {
            MutationOutcome outcome = mutator.mutate(TestStrategies.momentum(),
                plan(AstTransform.COMPARATOR_SWAP, "momentum_rank"));
            assertFalse(outcome.isApplied());
            assertTrue(((MutationOutcome.Rejected) outcome).reason().startsWith("No eligible nodes"));
        }

        @Test
        @DisplayName("Snippet without functions")
        void noFunctions() {
            assertFalse(mutator.mutate("position = data.get('close') > 1\n",
                plan(AstTransform.COMPARATOR_SWAP, null)).isApplied());
        }

        @Test
        @DisplayName("Unknown transform and unknown factor")
        void unknown() {
            assertFalse(mutator.mutate(TestStrategies.momentum(),
                new MutationPlan(Tier.TIER3, "ast_invert", 0.5, "test")).isApplied());
            assertFalse(mutator.mutate(TestStrategies.momentum(),
                plan(AstTransform.COMPARATOR_SWAP, "missing")).isApplied());
        }

        @Test
        @DisplayName("Result failing the validator is rejected")
        void validatorRejects() {
            String code = "def f(data):\n    x = data.get('close').shift(-1)\n    return x > 1\n";
            MutationOutcome outcome = mutator.mutate(code, plan(AstTransform.COMPARATOR_SWAP, "f"));
            assertFalse(outcome.isApplied());
            assertTrue(((MutationOutcome.Rejected) outcome).reason().contains("Negative shift"));
        }

        @Test
        @DisplayName("Factor that cannot be called with data alone is rejected")
        void notCompilable() {
            String code = "def f(data, level):\n    return data.get('close') > level + 1\n";
            assertFalse(mutator.mutate(code, plan(AstTransform.ARITHMETIC_SWAP, "f")).isApplied());
        }
    }

    // ========== Compilation ==========

    @Test
    @DisplayName("Compiled factor sees config values and helpers")
    void compiledFactor() throws Exception {
        CompiledFactor factor = mutator.compile(TestStrategies.momentum(), "ma_cross");
        Frame mask = factor.evaluate(new SyntheticMarketData(10, 100, 2));

        assertEquals("ma_cross", factor.name());
        assertEquals(100, mask.rows());
        assertEquals(10, mask.columns());
    }

    @Test
    @DisplayName("Factor returning a non-frame fails on evaluation")
    void nonFrameFactor() throws Exception {
        CompiledFactor factor = mutator.compile("def f(data):\n    return 1\n", "f");
        assertThrows(EvaluationException.class, () -> factor.evaluate(new SyntheticMarketData(2, 10, 1)));
    }

    @Test
    @DisplayName("Invalid construction arguments")
    void constructorChecks() {
        assertThrows(IllegalArgumentException.class,
            () -> new AstMutator(1.5, 0.8, 1.2, new AstValidator(), new SeededRandom(1)));
        assertThrows(IllegalArgumentException.class,
            () -> new AstMutator(0.3, 1.2, 0.8, new AstValidator(), new SeededRandom(1)));
    }
}
