package io.github.manjago.mutagen.tier2;

import java.util.Locale;

/**
 * Groups of interchangeable factors; replacement stays within a category.
 */
public enum FactorCategory {
    MOMENTUM,
    TREND,
    VOLUME,
    QUALITY,
    VALUE,
    RISK;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
