package io.github.manjago.mutagen.sandbox;

import java.time.Duration;
import java.util.Map;

/**
 * Runs a snippet outside this process and returns its backtest metrics.
 */
public interface IsolationBackend extends AutoCloseable {

    /**
     * @param timeout hard limit; the isolated run is killed when it expires
     * @throws IsolationException on any failure, timeout included
     */
    Map<String, Double> execute(String code, Duration timeout) throws IsolationException;

    /**
     * Release every isolated resource still held.
     */
    @Override
    void close();
}
