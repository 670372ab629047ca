package io.github.manjago.mutagen.config;

import com.typesafe.config.ConfigFactory;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.exit.ExitParameter;
import io.github.manjago.mutagen.selection.Phase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MutagenConfigTest {

    private static MutagenConfig parse(String hocon) {
        return MutagenConfig.fromConfig(ConfigFactory.parseString(hocon).withFallback(ConfigFactory.load()));
    }

    @Nested
    @DisplayName("Defaults")
    class Defaults {

        private final MutagenConfig config = MutagenConfig.defaults();

        @Test
        @DisplayName("exit settings match the four parameter bounds")
        void exit() {
            assertEquals(0.15, config.exit().sigma());
            assertEquals(0.01, config.exit().bounds().get(ExitParameter.STOP_LOSS_PCT).min());
            assertEquals(0.20, config.exit().bounds().get(ExitParameter.STOP_LOSS_PCT).max());
            assertEquals(60, config.exit().bounds().get(ExitParameter.HOLDING_PERIOD_DAYS).max());
            assertTrue(config.exit().bounds().get(ExitParameter.HOLDING_PERIOD_DAYS).integer());
        }

        @Test
        @DisplayName("probability table equals the built-in one")
        void probabilities() {
            assertEquals(ProbabilityTable.defaults(), config.probabilities());
            assertEquals(0.20, config.probabilities().exitProbability());
            assertEquals(0.40, config.probabilities().tiersFor(Phase.EARLY).get(Tier.TIER3));
        }

        @Test
        @DisplayName("schedule and operator switches")
        void schedule() {
            assertEquals(100, config.schedule().maxGenerations());
            assertEquals(0.3, config.schedule().thresholds().tier1());
            assertEquals(0.7, config.schedule().thresholds().tier2());
            assertEquals(5, config.schedule().updateInterval());
            assertTrue(config.schedule().adaptationEnabled());
            assertTrue(config.operator().fallbackEnabled());
            assertTrue(config.operator().validationEnabled());
        }

        @Test
        @DisplayName("sandbox runs docker with a ten minute limit")
        void sandbox() {
            assertTrue(config.sandbox().enabled());
            assertEquals(Duration.ofMinutes(10), config.sandbox().timeout());
            assertEquals("docker", config.sandbox().command().get(0));
            assertTrue(config.sandbox().command().contains("none"));
        }

        @Test
        @DisplayName("tier settings")
        void tiers() {
            assertEquals(0.3, config.tiers().tier3NodeMutationRate());
            assertEquals(0.8, config.tiers().tier3ScaleMin());
            assertEquals(1.2, config.tiers().tier3ScaleMax());
            assertTrue(config.tiers().tier1Bounds().get("lookback").integer());
        }
    }

    @Nested
    @DisplayName("Overrides")
    class Overrides {

        @Test
        @DisplayName("string overrides fall back to reference values")
        void parseString() {
            MutagenConfig config = parse("""
                mutagen {
                  random-seed = 42
                  exit.sigma = 0.3
                  probabilities.exit = 0.5
                  operator.fallback-enabled = false
                }
                """);

            assertEquals(42, config.randomSeed());
            assertEquals(42, config.effectiveSeed());
            assertEquals(0.3, config.exit().sigma());
            assertEquals(0.5, config.probabilities().exitProbability());
            assertFalse(config.operator().fallbackEnabled());
            assertEquals(100, config.schedule().maxGenerations());
        }

        @Test
        @DisplayName("a partial exit bound keeps the other limits")
        void partialBounds() {
            MutagenConfig config = parse("mutagen.exit.bounds.stop_loss_pct { max = 0.15 }");

            assertEquals(0.15, config.exit().bounds().get(ExitParameter.STOP_LOSS_PCT).max());
            assertEquals(0.01, config.exit().bounds().get(ExitParameter.STOP_LOSS_PCT).min());
        }

        @Test
        @DisplayName("file configuration is merged over the reference")
        void fromFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("mutagen.conf");
            Files.writeString(file, """
                mutagen.sandbox {
                  enabled = false
                  timeout = 30s
                }
                mutagen.tier1.bounds.top_n { min = 5, max = 50, integer = true }
                """);

            MutagenConfig config = MutagenConfig.fromFile(file);

            assertFalse(config.sandbox().enabled());
            assertEquals(Duration.ofSeconds(30), config.sandbox().timeout());
            assertEquals(5, config.tiers().tier1Bounds().get("top_n").min());
            assertEquals(0.15, config.exit().sigma());
        }

        @Test
        @DisplayName("builder changes one knob at a time")
        void builder() {
            MutagenConfig config = MutagenConfig.builder()
                .randomSeed(9)
                .exitSigma(0.05)
                .maxGenerations(20)
                .adaptationEnabled(false)
                .sandboxCommand(List.of("sh", "-c", "cat"))
                .build();

            assertEquals(9, config.randomSeed());
            assertEquals(0.05, config.exit().sigma());
            assertEquals(20, config.schedule().maxGenerations());
            assertFalse(config.schedule().adaptationEnabled());
            assertEquals(List.of("sh", "-c", "cat"), config.sandbox().command());
            assertEquals(MutagenConfig.defaults().probabilities(), config.probabilities());
        }

        @Test
        @DisplayName("toString names the main knobs")
        void describe() {
            String text = MutagenConfig.defaults().toString();

            assertTrue(text.contains("exit.sigma"));
            assertTrue(text.contains("sandbox.command"));
        }
    }

    @Nested
    @DisplayName("Invalid values")
    class Invalid {

        @ParameterizedTest
        @ValueSource(strings = {
            "mutagen.exit.sigma = 0",
            "mutagen.exit.bounds.stop_loss_pct { min = 0.3, max = 0.2 }",
            "mutagen.probabilities.exit = 1.5",
            "mutagen.probabilities.tiers.mid { tier1 = 0.9, tier2 = 0.9, tier3 = 0.9 }",
            "mutagen.schedule.thresholds { tier1 = 0.8, tier2 = 0.2 }",
            "mutagen.schedule.early-phase-end = 0.9",
            "mutagen.schedule.max-generations = 0",
            "mutagen.schedule.adaptation.min-probability = 0.3",
            "mutagen.tier3.threshold-scale { min = 1.2, max = 0.8 }",
            "mutagen.sandbox.timeout = 0s",
            "mutagen.sandbox.command = []",
            "mutagen.market.days = 1",
            "mutagen.exit.sigma = fast"
        })
        @DisplayName("are reported as configuration errors")
        void rejected(String hocon) {
            assertThrows(ConfigurationException.class, () -> parse(hocon));
        }

        @Test
        @DisplayName("operator distribution must sum to one")
        void operatorSum() {
            ProbabilityTable table = ProbabilityTable.defaults();

            ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> table.withOperators(Phase.LATE, Map.of("add_factor", 0.5)));

            assertTrue(e.getMessage().contains("operators.late"), e.getMessage());
        }

        @Test
        @DisplayName("missing phase distribution is rejected")
        void missingPhase() {
            assertThrows(ConfigurationException.class,
                () -> new ProbabilityTable(0.2, Map.of(), ProbabilityTable.defaults().operators()));
        }
    }
}
