package io.github.manjago.mutagen.selection;

import io.github.manjago.mutagen.config.ConfigurationException;
import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.config.ProbabilityTable;
import io.github.manjago.mutagen.core.MutationContext;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.tracking.TierPerformanceTracker;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class TierSelectionManagerTest {

    static final Map<Tier, Set<String>> TYPES = Map.of(
        Tier.TIER1, Set.of("config_perturbation"),
        Tier.TIER2, Set.of("add_factor", "remove_factor", "replace_factor", "mutate_parameters"),
        Tier.TIER3, Set.of("ast_comparator_swap", "ast_threshold_scale", "ast_arithmetic_swap"));

    private TierPerformanceTracker tracker;
    private TierSelectionManager manager;

    @BeforeEach
    void setUp() {
        tracker = new TierPerformanceTracker();
        manager = new TierSelectionManager(MutagenConfig.defaults(), TYPES, tracker, new SeededRandom(42));
    }

    private Map<Tier, Integer> sample(MutationContext context, int n) {
        return sample(manager, context, n);
    }

    private static Map<Tier, Integer> sample(TierSelectionManager manager, MutationContext context, int n) {
        Map<Tier, Integer> counts = new EnumMap<>(Tier.class);
        for (Tier tier : Tier.values()) {
            counts.put(tier, 0);
        }
        for (int i = 0; i < n; i++) {
            counts.merge(manager.selectTier(context).tier(), 1, Integer::sum);
        }
        return counts;
    }

    // ========== Selection ==========

    @Nested
    @DisplayName("Selection")
    class Selection {

        @Test
        @DisplayName("Override tier and mutation type are honored")
        void override() {
            MutationPlan plan = manager.selectTier(MutationContext.builder()
                .overrideTier(Tier.TIER3)
                .mutationType("ast_threshold_scale")
                .target("ma_cross")
                .build());

            assertEquals(Tier.TIER3, plan.tier());
            assertEquals("ast_threshold_scale", plan.mutationType());
            assertEquals("ma_cross", plan.target());
        }

        @Test
        @DisplayName("Mutation type of another tier is ignored")
        void foreignType() {
            MutationPlan plan = manager.selectTier(MutationContext.builder()
                .overrideTier(Tier.TIER1)
                .mutationType("add_factor")
                .build());
            assertEquals("config_perturbation", plan.mutationType());
        }

        @Test
        @DisplayName("Every tier is sampled in the early phase")
        void allTiers() {
            Map<Tier, Integer> counts = sample(MutationContext.atGeneration(0), 2000);
            for (Tier tier : Tier.values()) {
                assertTrue(counts.get(tier) > 100, tier + " " + counts);
            }
            assertTrue(counts.get(Tier.TIER2) > counts.get(Tier.TIER1));
        }

        @Test
        @DisplayName("Late phase favors Tier 1 over Tier 3")
        void latePhase() {
            Map<Tier, Integer> counts = sample(MutationContext.atGeneration(95), 2000);
            assertTrue(counts.get(Tier.TIER1) > 2 * counts.get(Tier.TIER3), counts.toString());
        }

        @Test
        @DisplayName("Low diversity boosts Tier 3")
        void explorationBoost() {
            int normal = sample(MutationContext.builder().generation(50).diversity(1.0).build(), 4000).get(Tier.TIER3);
            int boosted = sample(MutationContext.builder().generation(50).diversity(0.05).build(), 4000).get(Tier.TIER3);
            assertTrue(boosted > normal, "boosted=" + boosted + " normal=" + normal);
        }

        @Test
        @DisplayName("Risk score and rationale are filled in")
        void rationale() {
            MutationPlan plan = manager.selectTier("x = 1\n", MutationContext.atGeneration(0));
            assertTrue(plan.riskScore() >= 0 && plan.riskScore() <= 1);
            assertTrue(plan.rationale().startsWith("early phase"));
        }

        @Test
        @DisplayName("Fallback plans drop the request's target")
        void planForDropsTarget() {
            MutationContext context = MutationContext.builder().target("lookback").build();
            MutationPlan plan = manager.planFor(Tier.TIER2, null, context, "fallback");

            assertEquals(Tier.TIER2, plan.tier());
            assertNull(plan.target());
            assertTrue(TYPES.get(Tier.TIER2).contains(plan.mutationType()));
        }
    }

    // ========== Feedback ==========

    @Nested
    @DisplayName("Feedback")
    class Feedback {

        private void record(Tier tier, String type, boolean success) {
            tracker.record(tier, type, success, success ? 0.1 : 0.0);
            manager.resultRecorded();
        }

        @Test
        @DisplayName("Success rates per tier and operator come from the tracker")
        void successRates() {
            assertTrue(manager.tierSuccessRates().isEmpty());

            record(Tier.TIER1, "config_perturbation", true);
            record(Tier.TIER1, "config_perturbation", false);

            assertEquals(Map.of(Tier.TIER1, 0.5), manager.tierSuccessRates());
            assertEquals(0.5, manager.operatorSuccessRates().get("config_perturbation"));
        }

        @Test
        @DisplayName("Tracked results shift the tier distribution")
        void trackedResultsShiftDistribution() {
            MutationContext mid = MutationContext.atGeneration(50);
            Map<Tier, Integer> before = sample(
                new TierSelectionManager(MutagenConfig.defaults(), TYPES, new TierPerformanceTracker(),
                    new SeededRandom(42)), mid, 4000);

            for (int i = 0; i < 20; i++) {
                tracker.record(Tier.TIER1, "config_perturbation", false, 0.0);
                tracker.record(Tier.TIER3, "ast_comparator_swap", true, 0.2);
            }
            Map<Tier, Integer> after = sample(mid, 4000);

            assertTrue(after.get(Tier.TIER3) > before.get(Tier.TIER3), before + " -> " + after);
            assertTrue(after.get(Tier.TIER1) < before.get(Tier.TIER1), before + " -> " + after);
        }

        @Test
        @DisplayName("Records restored into the tracker count as well")
        void restoredRecords() {
            TierPerformanceTracker source = new TierPerformanceTracker();
            source.record(Tier.TIER2, "add_factor", true, 0.3);
            source.record(Tier.TIER2, "add_factor", false, 0.0);
            source.record(Tier.TIER2, "remove_factor", false, 0.0);
            tracker.restore(source.records());

            assertEquals(1.0 / 3, manager.tierSuccessRates().get(Tier.TIER2), 1e-9);
            assertEquals(0.5, manager.operatorSuccessRates().get("add_factor"), 1e-9);
        }

        @Test
        @DisplayName("Thresholds are re-tuned every update interval")
        void thresholdAdjustment() {
            for (int i = 0; i < 4; i++) {
                record(Tier.TIER1, "config_perturbation", true);
            }
            assertEquals(SelectionThresholds.DEFAULT, manager.getThresholds());

            record(Tier.TIER1, "config_perturbation", true);
            assertEquals(0.325, manager.getThresholds().tier1(), 1e-9);
            assertEquals(0.7, manager.getThresholds().tier2(), 1e-9);

            manager.reset();
            assertEquals(SelectionThresholds.DEFAULT, manager.getThresholds());
            assertEquals(Map.of(Tier.TIER1, 1.0), manager.tierSuccessRates());
        }
    }

    // ========== Thresholds ==========

    @Test
    @DisplayName("Thresholds map risk to the preferred tier")
    void tierFor() {
        SelectionThresholds t = SelectionThresholds.DEFAULT;
        assertEquals(Tier.TIER1, t.tierFor(0.1));
        assertEquals(Tier.TIER2, t.tierFor(0.3));
        assertEquals(Tier.TIER3, t.tierFor(0.7));
        assertEquals(Tier.TIER3, t.tierFor(7.0));
    }

    @Test
    @DisplayName("Adjusted thresholds stay inside their ranges")
    void adjustBounds() {
        SelectionThresholds t = new SelectionThresholds(0.45, 0.5);
        SelectionThresholds adjusted = t.adjust(Map.of(Tier.TIER1, 1.0, Tier.TIER2, 0.0), 1.0);
        assertEquals(0.5, adjusted.tier1(), 1e-9);
        assertEquals(0.6, adjusted.tier2(), 1e-9);
        assertThrows(ConfigurationException.class, () -> new SelectionThresholds(0.8, 0.2));
    }

    @Test
    @DisplayName("Operator table naming an unknown operator is a configuration error")
    void unknownOperator() {
        MutagenConfig config = MutagenConfig.defaults();
        ProbabilityTable table = config.probabilities().withOperators(Phase.MID, Map.of("crossover", 1.0));
        assertThrows(ConfigurationException.class, () -> new TierSelectionManager(
            config.schedule(), table, TYPES, new RiskAssessor(), new TierPerformanceTracker(), new SeededRandom(1)));
    }

    @Test
    @DisplayName("Every tier needs mutation types")
    void missingTypes() {
        assertThrows(ConfigurationException.class, () -> new TierSelectionManager(
            MutagenConfig.defaults(), Map.of(Tier.TIER1, Set.of("config_perturbation")),
            new TierPerformanceTracker(), new SeededRandom(1)));
    }

    @Test
    @DisplayName("Complex strategies carry more risk than trivial ones")
    void riskAssessor() {
        RiskAssessor risk = new RiskAssessor();
        String complex = """
            def a(data):
                for i in range(3):
                    if i > 1:
                        x = i
                return data.get('close') > 1


            def b(data):
                return data.get('open') > 1


            position = a(data) & b(data)
            """;
        assertTrue(risk.strategyRisk(complex) > risk.strategyRisk("x = 1\n"));
        assertEquals(RiskAssessor.UNKNOWN_RISK, risk.strategyRisk("def (:\n"));
        assertEquals(0.0, risk.mutationRisk(Map.of(Tier.TIER1, 1.0)));
    }
}
