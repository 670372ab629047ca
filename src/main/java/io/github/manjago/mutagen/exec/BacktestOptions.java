package io.github.manjago.mutagen.exec;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settings of one simulated backtest, as passed to {@code sim(...)}.
 *
 * A zero stop / take / trail / holding value disables that exit rule.
 */
public record BacktestOptions(
        int rebalanceDays,
        double stopLoss,
        double takeProfit,
        double trailStop,
        int holdingDays,
        double positionLimit
) {

    public static final BacktestOptions DEFAULTS = new BacktestOptions(21, 0, 0, 0, 0, 1.0);

    public BacktestOptions {
        if (rebalanceDays <= 0) {
            throw new EvaluationException("Rebalance period must be positive: " + rebalanceDays);
        }
        if (stopLoss < 0 || takeProfit < 0 || trailStop < 0 || holdingDays < 0) {
            throw new EvaluationException("Exit settings must not be negative");
        }
        if (positionLimit <= 0 || positionLimit > 1) {
            throw new EvaluationException("position_limit must be in (0, 1]: " + positionLimit);
        }
    }

    /**
     * Options from {@code sim} keyword arguments.
     */
    public static BacktestOptions fromArguments(Map<String, Object> kwargs) {
        Object resample = kwargs.get("resample");
        int rebalance = resample == null ? DEFAULTS.rebalanceDays : rebalanceDays(resample);
        return new BacktestOptions(
            rebalance,
            Builtins.doubleArg(List.of(), kwargs, -1, "stop_loss", 0.0),
            Builtins.doubleArg(List.of(), kwargs, -1, "take_profit", 0.0),
            Builtins.doubleArg(List.of(), kwargs, -1, "trail_stop", 0.0),
            Builtins.intArg(List.of(), kwargs, -1, "holding_days", 0),
            Builtins.doubleArg(List.of(), kwargs, -1, "position_limit", 1.0));
    }

    private static int rebalanceDays(Object resample) {
        if (!(resample instanceof String s)) {
            throw new EvaluationException("resample must be a string, got " + Operators.typeName(resample));
        }
        return switch (s.toUpperCase(Locale.ROOT)) {
            case "D" -> 1;
            case "W" -> 5;
            case "M" -> 21;
            case "Q" -> 63;
            default -> throw new EvaluationException("Unsupported resample frequency: " + s);
        };
    }
}
