package io.github.manjago.mutagen.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import io.github.manjago.mutagen.core.Tier;
import io.github.manjago.mutagen.exit.ExitParameter;
import io.github.manjago.mutagen.exit.ParameterBounds;
import io.github.manjago.mutagen.selection.Phase;
import io.github.manjago.mutagen.selection.SelectionThresholds;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Configuration for the mutation engine.
 *
 * Loads from HOCON files using typesafe-config.
 * Default values are in reference.conf.
 *
 * Built once and passed to component constructors; every section validates
 * itself on construction and throws {@link ConfigurationException}.
 */
public record MutagenConfig(
    long randomSeed,              // 0 = derive from clock
    ExitSettings exit,
    OperatorSettings operator,
    ProbabilityTable probabilities,
    ScheduleSettings schedule,
    TierSettings tiers,
    SandboxSettings sandbox,
    MarketSettings market
) {

    // ========== Sections ==========

    /**
     * Exit-parameter mutation: Gaussian sigma and the four bounds.
     */
    public record ExitSettings(double sigma, Map<ExitParameter, ParameterBounds> bounds) {
        public ExitSettings {
            if (!(sigma > 0)) {
                throw new ConfigurationException("exit.sigma must be > 0: " + sigma);
            }
            Map<ExitParameter, ParameterBounds> copy = new EnumMap<>(ExitParameter.class);
            for (ExitParameter p : ExitParameter.values()) {
                ParameterBounds b = bounds.get(p);
                if (b == null) {
                    throw new ConfigurationException("Missing exit bounds for " + p.key());
                }
                if (b.integer() != p.isInteger()) {
                    throw new ConfigurationException("Exit parameter " + p.key() + " integer flag cannot change");
                }
                copy.put(p, b);
            }
            bounds = Collections.unmodifiableMap(copy);
        }
    }

    public record OperatorSettings(boolean fallbackEnabled, boolean validationEnabled) {
    }

    /**
     * Generation schedule, adaptation and selection thresholds.
     */
    public record ScheduleSettings(
        int maxGenerations,
        double earlyPhaseEnd,
        double midPhaseEnd,
        Map<Phase, Double> rates,
        double diversityThreshold,
        double diversityBoost,
        int stagnationWindow,
        double stagnationStep,
        double explorationBoost,
        boolean adaptationEnabled,
        double successRateWeight,
        double minProbability,
        int updateInterval,
        SelectionThresholds thresholds,
        double riskBias
    ) {
        public ScheduleSettings {
            if (maxGenerations <= 0) {
                throw new ConfigurationException("schedule.max-generations must be > 0: " + maxGenerations);
            }
            if (!(0 < earlyPhaseEnd && earlyPhaseEnd <= midPhaseEnd && midPhaseEnd <= 1)) {
                throw new ConfigurationException(String.format(
                    "Phase boundaries must satisfy 0 < early (%s) <= mid (%s) <= 1", earlyPhaseEnd, midPhaseEnd));
            }
            Map<Phase, Double> copy = new EnumMap<>(Phase.class);
            for (Phase phase : Phase.values()) {
                Double rate = rates.get(phase);
                if (rate == null) {
                    throw new ConfigurationException("Missing mutation rate for phase " + phase.key());
                }
                requireUnit("schedule.rates." + phase.key(), rate);
                copy.put(phase, rate);
            }
            rates = Collections.unmodifiableMap(copy);
            requireUnit("schedule.diversity-threshold", diversityThreshold);
            requireUnit("schedule.diversity-boost", diversityBoost);
            requireUnit("schedule.stagnation-step", stagnationStep);
            requireUnit("schedule.exploration-boost", explorationBoost);
            requireUnit("schedule.adaptation.success-rate-weight", successRateWeight);
            requireUnit("schedule.risk-bias", riskBias);
            if (stagnationWindow <= 0) {
                throw new ConfigurationException("schedule.stagnation-window must be > 0: " + stagnationWindow);
            }
            if (minProbability < 0 || minProbability >= 0.25) {
                throw new ConfigurationException(
                    "schedule.adaptation.min-probability must be in [0, 0.25): " + minProbability);
            }
            if (updateInterval <= 0) {
                throw new ConfigurationException("schedule.adaptation.update-interval must be > 0: " + updateInterval);
            }
        }

        public double progress(int generation) {
            return Math.min(1.0, (double) generation / maxGenerations);
        }

        public Phase phaseOf(int generation) {
            return Phase.of(progress(generation), earlyPhaseEnd, midPhaseEnd);
        }

        public ScheduleSettings withMaxGenerations(int max) {
            return new ScheduleSettings(max, earlyPhaseEnd, midPhaseEnd, rates, diversityThreshold,
                diversityBoost, stagnationWindow, stagnationStep, explorationBoost, adaptationEnabled,
                successRateWeight, minProbability, updateInterval, thresholds, riskBias);
        }

        public ScheduleSettings withAdaptation(boolean enabled) {
            return new ScheduleSettings(maxGenerations, earlyPhaseEnd, midPhaseEnd, rates, diversityThreshold,
                diversityBoost, stagnationWindow, stagnationStep, explorationBoost, enabled,
                successRateWeight, minProbability, updateInterval, thresholds, riskBias);
        }

        public ScheduleSettings withThresholds(SelectionThresholds newThresholds) {
            return new ScheduleSettings(maxGenerations, earlyPhaseEnd, midPhaseEnd, rates, diversityThreshold,
                diversityBoost, stagnationWindow, stagnationStep, explorationBoost, adaptationEnabled,
                successRateWeight, minProbability, updateInterval, newThresholds, riskBias);
        }
    }

    /**
     * Per-tier mutator knobs.
     */
    public record TierSettings(
        double tier1Sigma,
        Map<String, ParameterBounds> tier1Bounds,
        double tier2ParameterSigma,
        double tier3NodeMutationRate,
        double tier3ScaleMin,
        double tier3ScaleMax
    ) {
        public TierSettings {
            if (!(tier1Sigma > 0)) {
                throw new ConfigurationException("tier1.sigma must be > 0: " + tier1Sigma);
            }
            if (!(tier2ParameterSigma > 0)) {
                throw new ConfigurationException("tier2.parameter-sigma must be > 0: " + tier2ParameterSigma);
            }
            requireUnit("tier3.node-mutation-rate", tier3NodeMutationRate);
            if (!(0 < tier3ScaleMin && tier3ScaleMin < tier3ScaleMax)) {
                throw new ConfigurationException(String.format(
                    "tier3.threshold-scale must satisfy 0 < min (%s) < max (%s)", tier3ScaleMin, tier3ScaleMax));
            }
            tier1Bounds = Collections.unmodifiableMap(new LinkedHashMap<>(tier1Bounds));
        }
    }

    /**
     * Execution: isolation switch, timeout, interpreter step budget and the
     * isolation command line.
     */
    public record SandboxSettings(boolean enabled, Duration timeout, long maxSteps, List<String> command) {
        public SandboxSettings {
            if (timeout.isNegative() || timeout.isZero()) {
                throw new ConfigurationException("sandbox.timeout must be positive: " + timeout);
            }
            if (maxSteps <= 0) {
                throw new ConfigurationException("sandbox.max-steps must be > 0: " + maxSteps);
            }
            if (enabled && command.isEmpty()) {
                throw new ConfigurationException("sandbox.command must not be empty when the sandbox is enabled");
            }
            command = List.copyOf(command);
        }

        public SandboxSettings withEnabled(boolean on) {
            return new SandboxSettings(on, timeout, maxSteps, command);
        }
    }

    /**
     * Synthetic market data used for direct execution.
     */
    public record MarketSettings(int symbols, int days, long seed) {
        public MarketSettings {
            if (symbols <= 0 || days <= 1) {
                throw new ConfigurationException(String.format(
                    "market needs symbols > 0 and days > 1, got %d x %d", symbols, days));
            }
        }
    }

    // ========== Loading ==========

    /**
     * Load default configuration.
     */
    public static MutagenConfig defaults() {
        return fromConfig(ConfigFactory.load());
    }

    /**
     * Load configuration from a specific file.
     */
    public static MutagenConfig fromFile(Path configFile) {
        Config fileConfig = ConfigFactory.parseFile(configFile.toFile());
        Config merged = fileConfig.withFallback(ConfigFactory.load());
        return fromConfig(merged);
    }

    /**
     * Load from Config object.
     */
    public static MutagenConfig fromConfig(Config config) {
        try {
            Config c = config.getConfig("mutagen");
            return new MutagenConfig(
                c.getLong("random-seed"),
                readExit(c.getConfig("exit")),
                new OperatorSettings(
                    c.getBoolean("operator.fallback-enabled"),
                    c.getBoolean("operator.validation-enabled")),
                readProbabilities(c.getConfig("probabilities")),
                readSchedule(c.getConfig("schedule")),
                readTiers(c),
                new SandboxSettings(
                    c.getBoolean("sandbox.enabled"),
                    c.getDuration("sandbox.timeout"),
                    c.getLong("sandbox.max-steps"),
                    c.getStringList("sandbox.command")),
                new MarketSettings(
                    c.getInt("market.symbols"),
                    c.getInt("market.days"),
                    c.getLong("market.seed"))
            );
        } catch (ConfigException e) {
            throw new ConfigurationException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    private static ExitSettings readExit(Config c) {
        Map<ExitParameter, ParameterBounds> bounds = new EnumMap<>(ExitParameter.class);
        for (ExitParameter p : ExitParameter.values()) {
            ParameterBounds defaults = p.defaultBounds();
            String path = "bounds." + p.key();
            if (!c.hasPath(path)) {
                bounds.put(p, defaults);
                continue;
            }
            Config b = c.getConfig(path);
            bounds.put(p, new ParameterBounds(
                p.key(),
                b.hasPath("min") ? b.getDouble("min") : defaults.min(),
                b.hasPath("max") ? b.getDouble("max") : defaults.max(),
                b.hasPath("default") ? b.getDouble("default") : defaults.defaultValue(),
                p.isInteger()));
        }
        return new ExitSettings(c.getDouble("sigma"), bounds);
    }

    private static ProbabilityTable readProbabilities(Config c) {
        Map<Phase, Map<Tier, Double>> tiers = new EnumMap<>(Phase.class);
        Map<Phase, Map<String, Double>> operators = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            Config t = c.getConfig("tiers." + phase.key());
            Map<Tier, Double> tierMap = new EnumMap<>(Tier.class);
            for (Tier tier : Tier.values()) {
                tierMap.put(tier, t.getDouble(tier.name().toLowerCase()));
            }
            tiers.put(phase, tierMap);

            Config o = c.getConfig("operators." + phase.key());
            Map<String, Double> operatorMap = new LinkedHashMap<>();
            for (String name : new TreeSet<>(o.root().keySet())) {
                operatorMap.put(name, o.getDouble(name));
            }
            operators.put(phase, operatorMap);
        }
        return new ProbabilityTable(c.getDouble("exit"), tiers, operators);
    }

    private static ScheduleSettings readSchedule(Config c) {
        Map<Phase, Double> rates = new EnumMap<>(Phase.class);
        for (Phase phase : Phase.values()) {
            rates.put(phase, c.getDouble("rates." + phase.key()));
        }
        return new ScheduleSettings(
            c.getInt("max-generations"),
            c.getDouble("early-phase-end"),
            c.getDouble("mid-phase-end"),
            rates,
            c.getDouble("diversity-threshold"),
            c.getDouble("diversity-boost"),
            c.getInt("stagnation-window"),
            c.getDouble("stagnation-step"),
            c.getDouble("exploration-boost"),
            c.getBoolean("adaptation.enabled"),
            c.getDouble("adaptation.success-rate-weight"),
            c.getDouble("adaptation.min-probability"),
            c.getInt("adaptation.update-interval"),
            new SelectionThresholds(c.getDouble("thresholds.tier1"), c.getDouble("thresholds.tier2")),
            c.getDouble("risk-bias")
        );
    }

    private static TierSettings readTiers(Config c) {
        Map<String, ParameterBounds> tier1Bounds = new LinkedHashMap<>();
        Config b = c.getConfig("tier1.bounds");
        for (String key : new TreeSet<>(b.root().keySet())) {
            Config entry = b.getConfig(key);
            boolean integer = entry.hasPath("integer") && entry.getBoolean("integer");
            tier1Bounds.put(key, ParameterBounds.of(key, entry.getDouble("min"), entry.getDouble("max"), integer));
        }
        return new TierSettings(
            c.getDouble("tier1.sigma"),
            tier1Bounds,
            c.getDouble("tier2.parameter-sigma"),
            c.getDouble("tier3.node-mutation-rate"),
            c.getDouble("tier3.threshold-scale.min"),
            c.getDouble("tier3.threshold-scale.max")
        );
    }

    private static void requireUnit(String name, double value) {
        if (value < 0 || value > 1 || Double.isNaN(value)) {
            throw new ConfigurationException(name + " must be in [0, 1]: " + value);
        }
    }

    /**
     * Seed to use: configured value, or clock-derived when 0.
     */
    public long effectiveSeed() {
        return randomSeed != 0 ? randomSeed : System.nanoTime();
    }

    // ========== Builder ==========

    /**
     * Builder for programmatic configuration, starting from reference.conf.
     */
    public static Builder builder() {
        return new Builder(defaults());
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    public static class Builder {
        private long randomSeed;
        private ExitSettings exit;
        private OperatorSettings operator;
        private ProbabilityTable probabilities;
        private ScheduleSettings schedule;
        private TierSettings tiers;
        private SandboxSettings sandbox;
        private MarketSettings market;

        private Builder(MutagenConfig base) {
            this.randomSeed = base.randomSeed;
            this.exit = base.exit;
            this.operator = base.operator;
            this.probabilities = base.probabilities;
            this.schedule = base.schedule;
            this.tiers = base.tiers;
            this.sandbox = base.sandbox;
            this.market = base.market;
        }

        public Builder randomSeed(long seed) { this.randomSeed = seed; return this; }
        public Builder exit(ExitSettings settings) { this.exit = settings; return this; }
        public Builder operator(OperatorSettings settings) { this.operator = settings; return this; }
        public Builder probabilities(ProbabilityTable table) { this.probabilities = table; return this; }
        public Builder schedule(ScheduleSettings settings) { this.schedule = settings; return this; }
        public Builder tiers(TierSettings settings) { this.tiers = settings; return this; }
        public Builder sandbox(SandboxSettings settings) { this.sandbox = settings; return this; }
        public Builder market(MarketSettings settings) { this.market = settings; return this; }

        public Builder exitSigma(double sigma) { this.exit = new ExitSettings(sigma, exit.bounds()); return this; }
        public Builder exitProbability(double p) { this.probabilities = probabilities.withExitProbability(p); return this; }
        public Builder fallbackEnabled(boolean on) { this.operator = new OperatorSettings(on, operator.validationEnabled()); return this; }
        public Builder validationEnabled(boolean on) { this.operator = new OperatorSettings(operator.fallbackEnabled(), on); return this; }
        public Builder maxGenerations(int max) { this.schedule = schedule.withMaxGenerations(max); return this; }
        public Builder adaptationEnabled(boolean on) { this.schedule = schedule.withAdaptation(on); return this; }
        public Builder sandboxEnabled(boolean on) { this.sandbox = sandbox.withEnabled(on); return this; }
        public Builder sandboxCommand(List<String> command) {
            this.sandbox = new SandboxSettings(sandbox.enabled(), sandbox.timeout(), sandbox.maxSteps(), command);
            return this;
        }
        public Builder sandboxTimeout(Duration timeout) {
            this.sandbox = new SandboxSettings(sandbox.enabled(), timeout, sandbox.maxSteps(), sandbox.command());
            return this;
        }

        public MutagenConfig build() {
            return new MutagenConfig(randomSeed, exit, operator, probabilities, schedule, tiers, sandbox, market);
        }
    }

    @Override
    public String toString() {
        return String.format("""
            MutagenConfig:
              random-seed:            %s
              exit.sigma:             %.3f
              exit.bounds:            %s
              operator.fallback:      %s
              operator.validation:    %s
              probabilities.exit:     %.2f
              probabilities.tiers:    %s
              schedule.generations:   %d
              schedule.thresholds:    tier1=%.2f tier2=%.2f
              schedule.adaptation:    %s
              sandbox.enabled:        %s
              sandbox.timeout:        %s
              sandbox.command:        %s
              market:                 %d symbols x %d days
            """,
            randomSeed == 0 ? "clock" : String.valueOf(randomSeed),
            exit.sigma(),
            exit.bounds().values(),
            operator.fallbackEnabled(),
            operator.validationEnabled(),
            probabilities.exitProbability(),
            probabilities.tiers(),
            schedule.maxGenerations(),
            schedule.thresholds().tier1(), schedule.thresholds().tier2(),
            schedule.adaptationEnabled() ? "on" : "off",
            sandbox.enabled(),
            sandbox.timeout(),
            String.join(" ", sandbox.command()),
            market.symbols(), market.days()
        );
    }
}
