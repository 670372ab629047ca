package io.github.manjago.mutagen.exit;

import io.github.manjago.mutagen.config.ConfigurationException;

/**
 * Allowed range of a mutable numeric parameter.
 *
 * @param name         parameter name as written in snippets
 * @param min          inclusive lower bound
 * @param max          inclusive upper bound
 * @param defaultValue value assumed when none is present
 * @param integer      whether values are whole numbers
 */
public record ParameterBounds(String name, double min, double max, double defaultValue, boolean integer) {

    public ParameterBounds {
        if (!(min < max)) {
            throw new ConfigurationException(String.format(
                "Invalid bounds for %s: min (%s) must be < max (%s)", name, min, max));
        }
        if (defaultValue < min || defaultValue > max) {
            throw new ConfigurationException(String.format(
                "Invalid bounds for %s: default %s outside [%s, %s]", name, defaultValue, min, max));
        }
    }

    /**
     * Bounds without an explicit default (midpoint is used).
     */
    public static ParameterBounds of(String name, double min, double max, boolean integer) {
        return new ParameterBounds(name, min, max, (min + max) / 2, integer);
    }

    public double clamp(double value) {
        return Math.max(min, Math.min(max, value));
    }

    public boolean contains(double value) {
        return value >= min && value <= max;
    }

    @Override
    public String toString() {
        return integer
            ? String.format("%s [%d, %d]", name, (long) min, (long) max)
            : String.format("%s [%s, %s]", name, min, max);
    }
}
