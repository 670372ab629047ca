package io.github.manjago.mutagen.core;

import io.github.manjago.mutagen.snippet.Literals;

/**
 * Multiplicative Gaussian perturbation shared by the literal mutators.
 */
public final class Perturbation {

    private Perturbation() {}

    /**
     * {@code |value * (1 + N(0, sigma))|}. Floats are rounded to literal
     * precision. Integers stay integral; a value of at least 1 stays at
     * least 1 and always moves by at least one step.
     */
    public static double gaussian(SeededRandom random, double value, boolean integer, double sigma) {
        double perturbed = Math.abs(value * (1 + random.nextGaussian(0, sigma)));
        if (!integer) {
            return Literals.roundToPrecision(perturbed);
        }
        long rounded = Math.round(perturbed);
        if (value >= 1) {
            if (rounded == (long) value) {
                rounded += rounded > 1 && random.nextBoolean(0.5) ? -1 : 1;
            }
            rounded = Math.max(1, rounded);
        }
        return rounded;
    }
}
