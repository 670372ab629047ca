package io.github.manjago.mutagen.exec;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Metrics of a finished backtest. Reachable from snippets as {@code report},
 * with each metric as an attribute and through {@code report['name']}.
 */
public record BacktestReport(Map<String, Double> metrics) implements ScriptObject {

    public static final String TOTAL_RETURN = "total_return";
    public static final String ANNUAL_RETURN = "annual_return";
    public static final String SHARPE_RATIO = "sharpe_ratio";
    public static final String MAX_DRAWDOWN = "max_drawdown";
    public static final String WIN_RATE = "win_rate";
    public static final String TRADE_COUNT = "trade_count";

    public BacktestReport {
        metrics = Collections.unmodifiableMap(new TreeMap<>(metrics));
    }

    public double metric(String name) {
        Double v = metrics.get(name);
        if (v == null) {
            throw new IllegalArgumentException("Unknown metric: " + name);
        }
        return v;
    }

    @Override
    public Object getAttribute(String name) {
        if ("get_stats".equals(name)) {
            return new BuiltinFunction(name, (i, a, k) -> this);
        }
        Double v = metrics.get(name);
        if (v == null) {
            throw new EvaluationException("report has no metric '" + name + "'");
        }
        return v;
    }

    @Override
    public Object getItem(Object key) {
        return getAttribute(String.valueOf(key));
    }
}
