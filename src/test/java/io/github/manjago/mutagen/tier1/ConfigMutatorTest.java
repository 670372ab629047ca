package io.github.manjago.mutagen.tier1;

import io.github.manjago.mutagen.TestStrategies;
import io.github.manjago.mutagen.core.MutationOutcome;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.exit.ParameterBounds;
import io.github.manjago.mutagen.snippet.SnippetParser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ConfigMutatorTest {

    private ConfigMutator mutator;

    @BeforeEach
    void setUp() {
        mutator = new ConfigMutator(0.15,
            Map.of("top_n", ParameterBounds.of("top_n", 1, 12, true)),
            new SeededRandom(42));
    }

    private static MutationPlan plan(String target) {
        return new MutationPlan(Tier.TIER1, ConfigMutator.CONFIG_PERTURBATION, 0.1, "test", target);
    }

    @Test
    @DisplayName("Config extraction skips exit parameters and keeps source order")
    void extract() throws Exception {
        StrategyConfig config = StrategyConfig.extract(SnippetParser.parse(TestStrategies.momentum()));
        assertEquals(List.of("lookback", "top_n", "ma_short", "ma_long", "position_limit"), config.keys());
    }

    @Test
    @DisplayName("Targeted key changes and nothing else does")
    void targetedKey() {
        String code = TestStrategies.momentum();
        MutationOutcome outcome = mutator.mutate(code, plan("ma_long"));

        MutationOutcome.Applied applied = assertInstanceOf(MutationOutcome.Applied.class, outcome);
        assertEquals("ma_long", applied.metadata().get("parameter"));
        assertNotEquals(60.0, applied.metadata().get("new_value"));

        List<String> before = code.lines().toList();
        List<String> after = applied.code().lines().toList();
        assertEquals(before.size(), after.size());
        for (int i = 0; i < before.size(); i++) {
            if (!before.get(i).startsWith("ma_long")) {
                assertEquals(before.get(i), after.get(i));
            }
        }
        assertTrue(after.stream().anyMatch(l -> l.matches("ma_long = \\d+")));
    }

    @Test
    @DisplayName("Integer values always move by at least one")
    void integerMoves() {
        for (int i = 0; i < 30; i++) {
            MutationOutcome.Applied applied = (MutationOutcome.Applied) mutator.mutate("lookback = 3\n", plan("lookback"));
            assertNotEquals("lookback = 3\n", applied.code());
        }
    }

    @Test
    @DisplayName("Configured bounds clamp the value")
    void bounded() {
        ConfigMutator wild = new ConfigMutator(5.0,
            Map.of("top_n", ParameterBounds.of("top_n", 1, 12, true)), new SeededRandom(3));
        for (int i = 0; i < 30; i++) {
            MutationOutcome.Applied applied = (MutationOutcome.Applied) wild.mutate("top_n = 10\n", plan("top_n"));
            double v = (double) applied.metadata().get("new_value");
            assertTrue(v >= 1 && v <= 12, "top_n " + v);
        }
    }

    @Test
    @DisplayName("Unknown target is rejected")
    void unknownTarget() {
        MutationOutcome outcome = mutator.mutate(TestStrategies.momentum(), plan("leverage"));
        assertFalse(outcome.isApplied());
        assertTrue(((MutationOutcome.Rejected) outcome).reason().contains("leverage"));
    }

    @Test
    @DisplayName("Snippet without config values is rejected")
    void noConfig() {
        assertFalse(mutator.mutate("stop_loss_pct = 0.1\nposition = data.get('close') > 0\n", plan(null)).isApplied());
    }

    @Test
    @DisplayName("Unparseable input is rejected")
    void syntaxError() {
        assertFalse(mutator.mutate("lookback = (\n", plan(null)).isApplied());
    }

    @Test
    @DisplayName("Tier 1 with a single mutation type")
    void identity() {
        assertEquals(Tier.TIER1, mutator.tier());
        assertEquals(Set.of("config_perturbation"), mutator.mutationTypes());
    }
}
