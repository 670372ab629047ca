package io.github.manjago.mutagen.sandbox;

import org.jetbrains.annotations.Nullable;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of one sandboxed execution.
 *
 * @param success whether metrics were produced
 * @param metrics backtest metrics by name, empty on failure
 * @param error   failure description, null on success
 * @param mode    path that produced this outcome
 */
public record SandboxOutcome(
    boolean success,
    Map<String, Double> metrics,
    @Nullable String error,
    ExecutionMode mode
) {

    public SandboxOutcome {
        metrics = Collections.unmodifiableMap(new TreeMap<>(metrics));
    }

    public static SandboxOutcome succeeded(Map<String, Double> metrics, ExecutionMode mode) {
        return new SandboxOutcome(true, metrics, null, mode);
    }

    public static SandboxOutcome failed(String error, ExecutionMode mode) {
        return new SandboxOutcome(false, Map.of(), error, mode);
    }
}
