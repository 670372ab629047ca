package io.github.manjago.mutagen.exec;

import java.time.Duration;

/**
 * Step and wall-clock limits for one evaluation.
 *
 * Every executed statement, loop iteration and call consumes one step.
 * The deadline is checked on every step.
 */
public final class ExecutionBudget {

    private final long maxSteps;
    private final long deadlineNanos;
    private long steps;

    public ExecutionBudget(long maxSteps, Duration timeout) {
        this.maxSteps = maxSteps;
        this.deadlineNanos = System.nanoTime() + timeout.toNanos();
    }

    public static ExecutionBudget unlimited() {
        return new ExecutionBudget(Long.MAX_VALUE, Duration.ofDays(1));
    }

    /**
     * Consume one step.
     *
     * @throws EvaluationException when steps or time are exhausted
     */
    public void tick(int line) {
        steps++;
        if (steps > maxSteps) {
            throw new EvaluationException("Step budget exceeded (" + maxSteps + " steps)", line);
        }
        if (System.nanoTime() - deadlineNanos > 0) {
            throw new EvaluationException("Execution deadline exceeded", line);
        }
    }

    public long getSteps() {
        return steps;
    }

    public long getMaxSteps() {
        return maxSteps;
    }
}
