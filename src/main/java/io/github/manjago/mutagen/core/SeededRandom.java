package io.github.manjago.mutagen.core;

import org.apache.commons.rng.RestorableUniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ContinuousSampler;
import org.apache.commons.rng.sampling.distribution.ZigguratSampler;
import org.apache.commons.rng.simple.RandomSource;

import java.util.List;
import java.util.Map;

/**
 * Deterministic random source shared by the mutators.
 *
 * Uses Apache Commons RNG XO_RO_SHI_RO_128_PP:
 * - Fast and high quality
 * - Small state (128 bits)
 * - Same seed gives the same sequence on every platform
 *
 * IMPORTANT: Do not change RandomSource between versions!
 * Mutation replay relies on the exact sequence.
 */
public final class SeededRandom {

    private static final RandomSource ALGORITHM = RandomSource.XO_RO_SHI_RO_128_PP;

    private final long seed;
    private final RestorableUniformRandomProvider rng;
    private final ContinuousSampler gaussian;

    public SeededRandom(long seed) {
        this.seed = seed;
        this.rng = ALGORITHM.create(seed);
        this.gaussian = ZigguratSampler.NormalizedGaussian.of(rng);
    }

    // ========== Uniform ==========

    /**
     * Returns uniformly distributed int in [0, bound).
     */
    public int nextInt(int bound) {
        return rng.nextInt(bound);
    }

    /**
     * Returns uniformly distributed double in [0, 1).
     */
    public double nextDouble() {
        return rng.nextDouble();
    }

    /**
     * Returns uniformly distributed double in [low, high).
     */
    public double nextDouble(double low, double high) {
        return low + (high - low) * rng.nextDouble();
    }

    /**
     * Returns true with probability p.
     */
    public boolean nextBoolean(double probability) {
        return rng.nextDouble() < probability;
    }

    public long nextLong() {
        return rng.nextLong();
    }

    // ========== Gaussian ==========

    /**
     * Sample from N(0, 1).
     */
    public double nextGaussian() {
        return gaussian.sample();
    }

    /**
     * Sample from N(mean, sigma).
     */
    public double nextGaussian(double mean, double sigma) {
        return mean + sigma * gaussian.sample();
    }

    // ========== Choice ==========

    /**
     * Uniform choice from a non-empty list.
     */
    public <T> T choice(List<T> items) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty list");
        }
        return items.get(rng.nextInt(items.size()));
    }

    /**
     * Choice proportional to weights. Iteration order of the map decides
     * ties, so pass an ordered map (LinkedHashMap, EnumMap) for replayable runs.
     */
    public <T> T weightedChoice(Map<T, Double> weights) {
        if (weights.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose from an empty distribution");
        }
        double total = 0;
        for (double w : weights.values()) {
            total += Math.max(0, w);
        }
        double r = rng.nextDouble() * total;
        T last = null;
        for (Map.Entry<T, Double> e : weights.entrySet()) {
            double w = Math.max(0, e.getValue());
            if (w <= 0) {
                continue;
            }
            last = e.getKey();
            if (r < w) {
                return e.getKey();
            }
            r -= w;
        }
        if (last == null) {
            throw new IllegalArgumentException("Distribution has no positive weight: " + weights);
        }
        return last;
    }

    /**
     * Get initial seed (for logging/debugging).
     */
    public long getSeed() {
        return seed;
    }
}
