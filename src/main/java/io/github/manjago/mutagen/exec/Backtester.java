package io.github.manjago.mutagen.exec;

/**
 * Turns a position mask into performance metrics.
 */
public interface Backtester {

    /**
     * @param position 1/0 (or truthy) selection per day and symbol
     */
    BacktestReport run(Frame position, BacktestOptions options);
}
