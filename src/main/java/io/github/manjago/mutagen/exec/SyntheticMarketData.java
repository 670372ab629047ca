package io.github.manjago.mutagen.exec;

import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.core.SeededRandom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Deterministic generated market: prices follow a seeded random walk with
 * per-symbol drift and volatility; every other key gets a mean-reverting
 * series seeded from the key name, so the same key always returns the
 * same data for the same seed.
 */
public final class SyntheticMarketData implements MarketData {

    private static final Logger log = LoggerFactory.getLogger(SyntheticMarketData.class);

    private final List<String> symbols;
    private final int days;
    private final long seed;
    private final Map<String, Frame> cache = new ConcurrentHashMap<>();

    public SyntheticMarketData(int symbols, int days, long seed) {
        if (symbols <= 0 || days <= 1) {
            throw new IllegalArgumentException("Need at least one symbol and two days: " + symbols + "x" + days);
        }
        List<String> names = new ArrayList<>(symbols);
        for (int i = 0; i < symbols; i++) {
            names.add(String.format(Locale.ROOT, "S%03d", i + 1));
        }
        this.symbols = List.copyOf(names);
        this.days = days;
        this.seed = seed;
    }

    public SyntheticMarketData(MutagenConfig.MarketSettings settings) {
        this(settings.symbols(), settings.days(), settings.seed());
    }

    @Override
    public List<String> symbols() {
        return symbols;
    }

    @Override
    public int days() {
        return days;
    }

    @Override
    public Frame get(String key) {
        String normalized = normalize(key);
        Frame cached = cache.get(normalized);
        if (cached != null) {
            return cached;
        }
        // derived series read other keys, so no computeIfAbsent here
        Frame generated = generate(normalized);
        Frame previous = cache.putIfAbsent(normalized, generated);
        return previous != null ? previous : generated;
    }

    @Override
    public Frame indicator(String name, Map<String, Object> params) {
        String upper = name.toUpperCase(Locale.ROOT);
        int period = Builtins.intArg(List.of(), params, -1, "timeperiod", defaultPeriod(upper));
        if (period <= 0) {
            throw new EvaluationException("Indicator period must be positive: " + period);
        }
        Frame close = get("price:close");
        return switch (upper) {
            case "SMA" -> close.rolling(period).mean();
            case "EMA" -> ema(close, period);
            case "RSI" -> rsi(close, period);
            case "MOM", "MOMENTUM" -> close.diff(period);
            case "ROC" -> close.pctChange(period);
            default -> throw new EvaluationException("Unknown indicator: " + name);
        };
    }

    private static int defaultPeriod(String indicator) {
        return switch (indicator) {
            case "RSI" -> 14;
            case "MOM", "MOMENTUM", "ROC" -> 10;
            default -> 20;
        };
    }

    // ========== Generation ==========

    private static String normalize(String key) {
        String k = key.trim().toLowerCase(Locale.ROOT);
        return switch (k) {
            case "close", "price" -> "price:close";
            case "open", "high", "low", "volume" -> "price:" + k;
            default -> k;
        };
    }

    private Frame generate(String key) {
        log.debug("Generating synthetic series '{}' ({} days x {} symbols)", key, days, symbols.size());
        return switch (key) {
            case "price:close" -> closes();
            case "price:open" -> ohlc(0.004, 0.0);
            case "price:high" -> ohlc(0.01, 1.0);
            case "price:low" -> ohlc(0.01, -1.0);
            case "price:volume" -> volumes();
            default -> meanReverting(key);
        };
    }

    private Frame closes() {
        SeededRandom rng = new SeededRandom(seed);
        double[][] v = new double[days][symbols.size()];
        for (int c = 0; c < symbols.size(); c++) {
            double drift = rng.nextGaussian(0.0003, 0.0004);
            double vol = rng.nextDouble(0.008, 0.03);
            double price = rng.nextDouble(20, 200);
            for (int r = 0; r < days; r++) {
                if (r > 0) {
                    price *= Math.exp(drift + vol * rng.nextGaussian());
                }
                v[r][c] = price;
            }
        }
        return new Frame(symbols, v);
    }

    private Frame ohlc(double spread, double direction) {
        Frame close = get("price:close");
        SeededRandom rng = new SeededRandom(seed ^ (long) (spread * 1e6) ^ (long) (direction * 31));
        return close.map(p -> {
            double noise = Math.abs(rng.nextGaussian()) * spread;
            return direction == 0.0 ? p * (1 + rng.nextGaussian() * spread) : p * (1 + direction * noise);
        });
    }

    private Frame volumes() {
        SeededRandom rng = new SeededRandom(seed * 31 + 17);
        double[][] v = new double[days][symbols.size()];
        for (int c = 0; c < symbols.size(); c++) {
            double base = rng.nextDouble(1e5, 5e6);
            for (int r = 0; r < days; r++) {
                v[r][c] = Math.floor(base * Math.exp(rng.nextGaussian(0, 0.3)));
            }
        }
        return new Frame(symbols, v);
    }

    private Frame meanReverting(String key) {
        SeededRandom rng = new SeededRandom(seed ^ key.hashCode());
        double[][] v = new double[days][symbols.size()];
        for (int c = 0; c < symbols.size(); c++) {
            double mean = rng.nextDouble(5, 25);
            double x = mean;
            for (int r = 0; r < days; r++) {
                x = mean + 0.95 * (x - mean) + rng.nextGaussian(0, 1);
                v[r][c] = x;
            }
        }
        return new Frame(symbols, v);
    }

    // ========== Indicators ==========

    private static Frame ema(Frame close, int period) {
        double alpha = 2.0 / (period + 1);
        double[][] out = new double[close.rows()][close.columns()];
        for (int c = 0; c < close.columns(); c++) {
            double e = Double.NaN;
            for (int r = 0; r < close.rows(); r++) {
                double p = close.get(r, c);
                e = Double.isNaN(e) ? p : alpha * p + (1 - alpha) * e;
                out[r][c] = r < period - 1 ? Double.NaN : e;
            }
        }
        return new Frame(close.symbols(), out);
    }

    private static Frame rsi(Frame close, int period) {
        Frame change = close.diff(1);
        Frame gain = change.map(d -> Double.isNaN(d) ? Double.NaN : Math.max(d, 0)).rolling(period).mean();
        Frame loss = change.map(d -> Double.isNaN(d) ? Double.NaN : Math.max(-d, 0)).rolling(period).mean();
        return gain.combine(loss, (g, l) -> {
            if (Double.isNaN(g) || Double.isNaN(l)) {
                return Double.NaN;
            }
            if (l == 0) {
                return 100.0;
            }
            return 100.0 - 100.0 / (1 + g / l);
        });
    }
}
