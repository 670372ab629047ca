package io.github.manjago.mutagen.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Equal-weight long-only backtest over closing prices.
 *
 * <p>The selection on day {@code r} is traded from day {@code r + 1}, so a
 * strategy never earns the return of the bar it was computed on. Holdings
 * are rebuilt every {@code rebalanceDays}; between rebalances the exit rules
 * may close individual positions, whose weight then stays in cash.
 */
public final class SimpleBacktester implements Backtester {

    private static final Logger log = LoggerFactory.getLogger(SimpleBacktester.class);

    static final int TRADING_DAYS = 252;

    private final MarketData market;

    public SimpleBacktester(MarketData market) {
        this.market = market;
    }

    private static final class Holding {
        final double entryPrice;
        final int entryDay;
        final double weight;
        double peak;

        Holding(double entryPrice, int entryDay, double weight) {
            this.entryPrice = entryPrice;
            this.entryDay = entryDay;
            this.weight = weight;
            this.peak = entryPrice;
        }
    }

    @Override
    public BacktestReport run(Frame position, BacktestOptions options) {
        Frame close = market.get("price:close");
        if (position.rows() != close.rows() || position.columns() != close.columns()) {
            throw new EvaluationException(String.format("Position shape %dx%d does not match market %dx%d",
                position.rows(), position.columns(), close.rows(), close.columns()));
        }

        Map<Integer, Holding> holdings = new LinkedHashMap<>();
        double equity = 1.0;
        double peakEquity = 1.0;
        double maxDrawdown = 0.0;
        double sum = 0;
        double sumSquares = 0;
        int trades = 0;
        int wins = 0;

        for (int day = 1; day < close.rows(); day++) {
            double dailyReturn = 0;
            for (Map.Entry<Integer, Holding> e : holdings.entrySet()) {
                int c = e.getKey();
                double prev = close.get(day - 1, c);
                double now = close.get(day, c);
                if (prev > 0 && !Double.isNaN(now)) {
                    dailyReturn += e.getValue().weight * (now / prev - 1);
                }
            }
            equity *= 1 + dailyReturn;
            peakEquity = Math.max(peakEquity, equity);
            maxDrawdown = Math.min(maxDrawdown, equity / peakEquity - 1);
            sum += dailyReturn;
            sumSquares += dailyReturn * dailyReturn;

            Iterator<Map.Entry<Integer, Holding>> it = holdings.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<Integer, Holding> e = it.next();
                Holding h = e.getValue();
                double price = close.get(day, e.getKey());
                h.peak = Math.max(h.peak, price);
                if (shouldExit(h, price, day, options)) {
                    trades++;
                    if (price > h.entryPrice) {
                        wins++;
                    }
                    it.remove();
                }
            }

            // signal from the previous day
            if ((day - 1) % options.rebalanceDays() == 0) {
                Map<Integer, Holding> next = new HashMap<>();
                int selected = 0;
                for (int c = 0; c < position.columns(); c++) {
                    if (Frame.truthy(position.get(day - 1, c))) {
                        selected++;
                    }
                }
                double weight = selected == 0 ? 0 : Math.min(1.0 / selected, options.positionLimit());
                for (int c = 0; c < position.columns(); c++) {
                    if (!Frame.truthy(position.get(day - 1, c))) {
                        continue;
                    }
                    Holding kept = holdings.remove(c);
                    double price = close.get(day, c);
                    next.put(c, kept != null
                        ? new Holding(kept.entryPrice, kept.entryDay, weight)
                        : new Holding(price, day, weight));
                }
                for (Map.Entry<Integer, Holding> e : holdings.entrySet()) {
                    trades++;
                    if (close.get(day, e.getKey()) > e.getValue().entryPrice) {
                        wins++;
                    }
                }
                holdings.clear();
                holdings.putAll(next);
            }
        }

        int n = close.rows() - 1;
        double mean = sum / n;
        double variance = Math.max(0, sumSquares / n - mean * mean);
        double std = Math.sqrt(variance);

        Map<String, Double> metrics = new HashMap<>();
        metrics.put(BacktestReport.TOTAL_RETURN, equity - 1);
        metrics.put(BacktestReport.ANNUAL_RETURN, equity <= 0 ? -1.0 : Math.pow(equity, (double) TRADING_DAYS / n) - 1);
        metrics.put(BacktestReport.SHARPE_RATIO, std == 0 ? 0.0 : mean / std * Math.sqrt(TRADING_DAYS));
        metrics.put(BacktestReport.MAX_DRAWDOWN, maxDrawdown);
        metrics.put(BacktestReport.WIN_RATE, trades == 0 ? 0.0 : (double) wins / trades);
        metrics.put(BacktestReport.TRADE_COUNT, (double) trades);
        log.debug("Backtest finished: {} days, {} trades, total return {}", n, trades, equity - 1);
        return new BacktestReport(metrics);
    }

    private static boolean shouldExit(Holding h, double price, int day, BacktestOptions options) {
        if (Double.isNaN(price)) {
            return false;
        }
        double ret = price / h.entryPrice - 1;
        if (options.stopLoss() > 0 && ret <= -options.stopLoss()) {
            return true;
        }
        if (options.takeProfit() > 0 && ret >= options.takeProfit()) {
            return true;
        }
        if (options.trailStop() > 0 && price <= h.peak * (1 - options.trailStop())) {
            return true;
        }
        return options.holdingDays() > 0 && day - h.entryDay >= options.holdingDays();
    }
}
