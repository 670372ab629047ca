package io.github.manjago.mutagen.tier1;

import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.core.MutationOutcome;
import io.github.manjago.mutagen.core.MutationPlan;
import io.github.manjago.mutagen.core.Mutator;
import io.github.manjago.mutagen.core.Perturbation;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.exit.ParameterBounds;
import io.github.manjago.mutagen.snippet.Literals;
import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.SnippetParser;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Tier 1: Gaussian perturbation of one configuration value.
 *
 * Only the literal's characters are replaced, so the rest of the snippet
 * (layout, comments) is preserved byte for byte.
 */
public class ConfigMutator implements Mutator {

    private static final Logger log = LoggerFactory.getLogger(ConfigMutator.class);

    public static final String CONFIG_PERTURBATION = "config_perturbation";

    private final double sigma;
    private final Map<String, ParameterBounds> bounds;
    private final SeededRandom random;

    public ConfigMutator(double sigma, Map<String, ParameterBounds> bounds, SeededRandom random) {
        this.sigma = sigma;
        this.bounds = Map.copyOf(bounds);
        this.random = random;
    }

    public ConfigMutator(MutagenConfig.TierSettings settings, SeededRandom random) {
        this(settings.tier1Sigma(), settings.tier1Bounds(), random);
    }

    @Override
    public Tier tier() {
        return Tier.TIER1;
    }

    @Override
    public Set<String> mutationTypes() {
        return Set.of(CONFIG_PERTURBATION);
    }

    @Override
    public synchronized MutationOutcome mutate(String code, MutationPlan plan) {
        Script script;
        try {
            script = SnippetParser.parse(code);
        } catch (SnippetSyntaxException e) {
            return MutationOutcome.rejected("Syntax error: " + e.getMessage());
        }

        StrategyConfig config = StrategyConfig.extract(script);
        if (config.isEmpty()) {
            return MutationOutcome.rejected("No configuration values to mutate");
        }
        ConfigEntry entry;
        if (plan.target() != null) {
            entry = config.find(plan.target());
            if (entry == null) {
                return MutationOutcome.rejected("Config key " + plan.target() + " not found");
            }
        } else {
            entry = random.choice(config.entries());
        }

        double oldValue = entry.value();
        double newValue = Perturbation.gaussian(random, oldValue, entry.integer(), sigma);
        boolean clamped = false;
        ParameterBounds b = bounds.get(entry.name());
        if (b != null) {
            double limited = b.clamp(newValue);
            clamped = limited != newValue;
            newValue = limited;
        }

        String literal = Literals.formatNumber(newValue, entry.integer());
        String mutated = code.substring(0, entry.literal().start()) + literal + code.substring(entry.literal().end());
        try {
            SnippetParser.parse(mutated);
        } catch (SnippetSyntaxException e) {
            return MutationOutcome.rejected("Syntax error after mutation: " + e.getMessage());
        }

        log.debug("Config {}: {} -> {}{}", entry.name(), entry.literal().text(), literal, clamped ? " (clamped)" : "");
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("parameter", entry.name());
        metadata.put("old_value", oldValue);
        metadata.put("new_value", newValue);
        metadata.put("clamped", clamped);
        return MutationOutcome.applied(mutated, CONFIG_PERTURBATION, metadata);
    }
}
