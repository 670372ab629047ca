package io.github.manjago.mutagen.sandbox;

/**
 * Snapshot of the wrapper's counters.
 *
 * @param mode                configured mode
 * @param executionCount      calls to execute
 * @param fallbackCount       isolated attempts that fell back to direct execution
 * @param rejectedCount       snippets refused by the security validator
 * @param failureCount        executions that ended without metrics
 * @param lastIsolationResult outcome of the latest isolated attempt
 */
public record SandboxStatistics(
    ExecutionMode mode,
    long executionCount,
    long fallbackCount,
    long rejectedCount,
    long failureCount,
    IsolationResult lastIsolationResult
) {

    public double fallbackRate() {
        return executionCount == 0 ? 0.0 : (double) fallbackCount / executionCount;
    }
}
