package io.github.manjago.mutagen.exit;

import org.jetbrains.annotations.Nullable;

import java.util.regex.Pattern;

/**
 * The four exit-logic parameters a strategy may assign at top level.
 */
public enum ExitParameter {
    STOP_LOSS_PCT("stop_loss_pct", 0.01, 0.20, 0.10, false),
    TAKE_PROFIT_PCT("take_profit_pct", 0.05, 0.50, 0.20, false),
    TRAILING_STOP_OFFSET("trailing_stop_offset", 0.005, 0.05, 0.02, false),
    HOLDING_PERIOD_DAYS("holding_period_days", 1, 60, 20, true);

    private static final String NUMBER = "[-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][-+]?\\d+)?";

    private final String key;
    private final ParameterBounds defaultBounds;
    private final Pattern pattern;

    ExitParameter(String key, double min, double max, double defaultValue, boolean integer) {
        this.key = key;
        this.defaultBounds = new ParameterBounds(key, min, max, defaultValue, integer);
        // group 1: "name = " prefix, group 2: the literal; the name must be
        // followed by '=' so trailing_stop_offset never matches a longer name
        this.pattern = Pattern.compile(
            "(?m)^([ \\t]*" + Pattern.quote(key) + "[ \\t]*=[ \\t]*)(" + NUMBER + ")(?![\\w.])");
    }

    /**
     * Name as written in snippets.
     */
    public String key() {
        return key;
    }

    public ParameterBounds defaultBounds() {
        return defaultBounds;
    }

    /**
     * Assignment pattern; group 2 is the numeric literal.
     */
    public Pattern pattern() {
        return pattern;
    }

    public boolean isInteger() {
        return defaultBounds.integer();
    }

    @Nullable
    public static ExitParameter fromKey(String key) {
        for (ExitParameter p : values()) {
            if (p.key.equals(key)) {
                return p;
            }
        }
        return null;
    }

    public static boolean isExitKey(String key) {
        return fromKey(key) != null;
    }
}
