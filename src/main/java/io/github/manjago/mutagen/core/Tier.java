package io.github.manjago.mutagen.core;

import java.util.List;

/**
 * Mutation tiers, in increasing order of structural risk.
 */
public enum Tier {
    /** Edits numeric configuration values only. */
    TIER1(1, "config"),
    /** Adds, removes, replaces or re-parameterises factors. */
    TIER2(2, "domain"),
    /** Rewrites operators and thresholds inside one factor's syntax tree. */
    TIER3(3, "ast");

    private final int level;
    private final String label;

    Tier(int level, String label) {
        this.level = level;
        this.label = label;
    }

    public int level() {
        return level;
    }

    public String label() {
        return label;
    }

    /**
     * Tiers to try, in order, after this one fails.
     * The cascade is fixed: 3 falls back to 2 then 1, 2 falls back to 1,
     * 1 has no fallback.
     */
    public List<Tier> fallbacks() {
        return switch (this) {
            case TIER3 -> List.of(TIER2, TIER1);
            case TIER2 -> List.of(TIER1);
            case TIER1 -> List.of();
        };
    }

    /**
     * Lookup by numeric level.
     *
     * @throws IllegalArgumentException for anything but 1, 2 or 3
     */
    public static Tier of(int level) {
        for (Tier tier : values()) {
            if (tier.level == level) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Invalid tier: " + level + " (must be 1, 2 or 3)");
    }

    /**
     * Lookup by level ("2"), name ("TIER2", "tier2") or label ("domain").
     */
    public static Tier parse(String text) {
        String t = text.trim();
        for (Tier tier : values()) {
            if (tier.name().equalsIgnoreCase(t) || tier.label.equalsIgnoreCase(t)
                    || String.valueOf(tier.level).equals(t)) {
                return tier;
            }
        }
        throw new IllegalArgumentException("Invalid tier: " + text);
    }
}
