package io.github.manjago.mutagen.exit;

import io.github.manjago.mutagen.config.ConfigurationException;
import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.core.SeededRandom;
import io.github.manjago.mutagen.snippet.Literals;
import io.github.manjago.mutagen.snippet.SnippetParser;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Bounded Gaussian mutation of exit parameters.
 *
 * <h2>Algorithm:</h2>
 * <pre>
 * 1. select    parameter (given, or uniform among the four)
 * 2. identify  first "name = number" assignment via the parameter's pattern
 * 3. perturb   new = old * (1 + N(0, sigma)), negative results sign-flipped
 * 4. clamp     to bounds; integer parameters round half-up
 * 5. rewrite   the literal of that first occurrence only
 * 6. validate  syntax of the rewritten snippet
 * </pre>
 *
 * Works on text rather than the syntax tree: numeric literal edits stay
 * exact and leave formatting and comments untouched. The full security
 * policy is not checked here; callers run the SecurityValidator before
 * execution.
 *
 * Any failure returns the original code with {@code success=false}.
 */
public class ExitParameterMutator {

    private static final Logger log = LoggerFactory.getLogger(ExitParameterMutator.class);

    public static final double DEFAULT_SIGMA = 0.15;

    private static final List<ExitParameter> PARAMETERS = List.of(ExitParameter.values());

    private final Map<ExitParameter, ParameterBounds> bounds;
    private final double sigma;
    private final SeededRandom random;

    // Statistics
    private long total;
    private long successes;
    private long notFound;
    private long unknownParameter;
    private long syntaxFailures;
    private long clamped;

    /**
     * Create mutator with default bounds.
     */
    public ExitParameterMutator(double sigma, SeededRandom random) {
        this(sigma, defaultBounds(), random);
    }

    public ExitParameterMutator(MutagenConfig.ExitSettings settings, SeededRandom random) {
        this(settings.sigma(), settings.bounds(), random);
    }

    public ExitParameterMutator(double sigma, Map<ExitParameter, ParameterBounds> bounds, SeededRandom random) {
        if (!(sigma > 0) || Double.isInfinite(sigma)) {
            throw new ConfigurationException("Exit mutation sigma must be > 0: " + sigma);
        }
        for (ExitParameter p : ExitParameter.values()) {
            if (!bounds.containsKey(p)) {
                throw new ConfigurationException("Missing bounds for exit parameter " + p.key());
            }
        }
        this.sigma = sigma;
        this.bounds = new EnumMap<>(bounds);
        this.random = random;
    }

    public static Map<ExitParameter, ParameterBounds> defaultBounds() {
        Map<ExitParameter, ParameterBounds> map = new EnumMap<>(ExitParameter.class);
        for (ExitParameter p : ExitParameter.values()) {
            map.put(p, p.defaultBounds());
        }
        return map;
    }

    // ========== Mutation ==========

    /**
     * Mutate a randomly chosen exit parameter.
     */
    public ExitMutationResult mutate(String code) {
        return mutate(code, null);
    }

    /**
     * Mutate the named exit parameter (random one when null).
     */
    public synchronized ExitMutationResult mutate(String code, @Nullable String parameterName) {
        total++;

        // 1. Select
        ExitParameter parameter;
        if (parameterName == null) {
            parameter = random.choice(PARAMETERS);
        } else {
            parameter = ExitParameter.fromKey(parameterName);
            if (parameter == null) {
                unknownParameter++;
                log.debug("Unknown exit parameter '{}'", parameterName);
                return ExitMutationResult.failure(code, "Unknown parameter: " + parameterName);
            }
        }
        ParameterBounds b = bounds.get(parameter);

        // 2. Identify
        Matcher m = parameter.pattern().matcher(code);
        if (!m.find()) {
            notFound++;
            log.debug("Exit parameter {} not present in snippet", parameter.key());
            return ExitMutationResult.failure(code, "Parameter " + parameter.key() + " not found in code");
        }
        double oldValue = Double.parseDouble(m.group(2));

        // 3. Perturb
        double perturbed = Math.abs(oldValue * (1 + random.nextGaussian(0, sigma)));

        // 4. Clamp
        double newValue = b.clamp(perturbed);
        newValue = b.integer() ? Math.floor(newValue + 0.5) : Literals.roundToPrecision(newValue);
        newValue = b.clamp(newValue);
        boolean wasClamped = perturbed < b.min() || perturbed > b.max();
        if (wasClamped) {
            clamped++;
            log.info("Clamped {}: perturbed {} to bound {} (range [{}, {}])",
                parameter.key(), perturbed, newValue, b.min(), b.max());
        }

        // 5. Rewrite first occurrence
        String literal = Literals.formatNumber(newValue, b.integer());
        String mutated = code.substring(0, m.start(2)) + literal + code.substring(m.end(2));

        // 6. Syntax only
        try {
            SnippetParser.parse(mutated);
        } catch (SnippetSyntaxException e) {
            syntaxFailures++;
            log.debug("Exit mutation of {} produced invalid syntax: {}", parameter.key(), e.getMessage());
            return ExitMutationResult.failure(code, "Syntax error after mutation: " + e.getMessage());
        }

        successes++;
        ParameterChange change = new ParameterChange(parameter, oldValue, newValue, wasClamped);
        log.debug("Exit mutation {}", change);
        return ExitMutationResult.success(mutated, change);
    }

    // ========== Accessors ==========

    public double getSigma() {
        return sigma;
    }

    public ParameterBounds getBounds(ExitParameter parameter) {
        return bounds.get(parameter);
    }

    public synchronized ExitMutationStats getStatistics() {
        return new ExitMutationStats(total, successes, notFound, unknownParameter, syntaxFailures, clamped);
    }

    public synchronized void resetStatistics() {
        total = 0;
        successes = 0;
        notFound = 0;
        unknownParameter = 0;
        syntaxFailures = 0;
        clamped = 0;
    }
}
