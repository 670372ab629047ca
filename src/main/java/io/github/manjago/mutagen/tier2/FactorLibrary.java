package io.github.manjago.mutagen.tier2;

import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Catalog of factor templates used by the domain operators.
 */
public final class FactorLibrary {

    private final Map<String, FactorTemplate> templates = new LinkedHashMap<>();

    public FactorLibrary(List<FactorTemplate> templates) {
        for (FactorTemplate t : templates) {
            if (this.templates.putIfAbsent(t.name(), t) != null) {
                throw new IllegalArgumentException("Factor '" + t.name() + "' already registered");
            }
        }
    }

    public List<FactorTemplate> all() {
        return List.copyOf(templates.values());
    }

    public List<FactorTemplate> byCategory(FactorCategory category) {
        List<FactorTemplate> result = new ArrayList<>();
        for (FactorTemplate t : templates.values()) {
            if (t.category() == category) {
                result.add(t);
            }
        }
        return result;
    }

    @Nullable
    public FactorTemplate find(String name) {
        return templates.get(name);
    }

    @Nullable
    public FactorCategory categoryOf(String factorName) {
        FactorTemplate t = templates.get(factorName);
        return t == null ? null : t.category();
    }

    // ========== Built-in catalog ==========

    public static FactorLibrary defaults() {
        return new FactorLibrary(List.of(
            template("momentum_rank", FactorCategory.MOMENTUM, """
                def momentum_rank(data):
                    close = data.get('price:close')
                    return close.pct_change(20).is_largest(10)
                """),
            template("roc_leaders", FactorCategory.MOMENTUM, """
                def roc_leaders(data):
                    close = data.get('price:close')
                    return (close / close.shift(60)).is_largest(15)
                """),
            template("ma_cross", FactorCategory.TREND, """
                def ma_cross(data):
                    close = data.get('price:close')
                    return close.average(20) > close.average(60)
                """),
            template("above_long_ma", FactorCategory.TREND, """
                def above_long_ma(data):
                    close = data.get('price:close')
                    return close > close.rolling(120).mean()
                """),
            template("volume_surge", FactorCategory.VOLUME, """
                def volume_surge(data):
                    vol = data.get('price:volume')
                    return vol.average(5) > vol.average(20) * 1.2
                """),
            template("liquidity_filter", FactorCategory.VOLUME, """
                def liquidity_filter(data):
                    vol = data.get('price:volume')
                    close = data.get('price:close')
                    return (vol * close).average(20) > 50000000
                """),
            template("high_roe", FactorCategory.QUALITY, """
                def high_roe(data):
                    roe = data.get('fundamental:roe')
                    return roe > 15
                """),
            template("roe_leaders", FactorCategory.QUALITY, """
                def roe_leaders(data):
                    roe = data.get('fundamental:roe')
                    return roe.average(20).is_largest(20)
                """),
            template("low_pe", FactorCategory.VALUE, """
                def low_pe(data):
                    pe = data.get('fundamental:pe')
                    return pe.is_smallest(15)
                """),
            template("revenue_growth", FactorCategory.VALUE, """
                def revenue_growth(data):
                    growth = data.get('fundamental:revenue_growth')
                    return growth > 10
                """),
            template("low_volatility", FactorCategory.RISK, """
                def low_volatility(data):
                    close = data.get('price:close')
                    return close.pct_change(1).rolling(20).std().is_smallest(20)
                """),
            template("rsi_not_overbought", FactorCategory.RISK, """
                def rsi_not_overbought(data):
                    rsi = data.indicator('RSI', timeperiod=14)
                    return rsi < 70
                """)
        ));
    }

    private static FactorTemplate template(String name, FactorCategory category, String source) {
        return new FactorTemplate(name, category, source);
    }
}
