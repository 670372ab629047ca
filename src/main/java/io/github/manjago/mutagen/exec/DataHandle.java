package io.github.manjago.mutagen.exec;

import java.util.List;

/**
 * The {@code data} object snippets see: {@code data.get(key)},
 * {@code data.indicator(name, timeperiod=n)} and {@code data[key]}.
 */
public final class DataHandle implements ScriptObject {

    private final MarketData market;

    public DataHandle(MarketData market) {
        this.market = market;
    }

    @Override
    public Object getAttribute(String name) {
        return switch (name) {
            case "get" -> new BuiltinFunction(name, (i, args, kw) -> market.get(key(Builtins.arg(args, kw, 0, "key"))));
            case "indicator" -> new BuiltinFunction(name, (i, args, kw) -> {
                String indicator = key(Builtins.arg(args, kw, 0, "name"));
                return market.indicator(indicator, kw);
            });
            case "symbols" -> List.copyOf(market.symbols());
            default -> throw new EvaluationException("data has no attribute '" + name + "'");
        };
    }

    @Override
    public Object getItem(Object key) {
        return market.get(key(key));
    }

    private static String key(Object value) {
        if (value instanceof String s) {
            return s;
        }
        throw new EvaluationException("Dataset key must be a string, got " + Operators.typeName(value));
    }

    @Override
    public String toString() {
        return "<data " + market.days() + "x" + market.symbols().size() + ">";
    }
}
