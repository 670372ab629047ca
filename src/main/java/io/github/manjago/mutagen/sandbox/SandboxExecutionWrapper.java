package io.github.manjago.mutagen.sandbox;

import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.exec.BacktestReport;
import io.github.manjago.mutagen.exec.DirectExecutor;
import io.github.manjago.mutagen.exec.EvaluationException;
import io.github.manjago.mutagen.security.SecurityValidator;
import io.github.manjago.mutagen.security.ValidationResult;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Executes strategy snippets with two layers of defense.
 *
 * <h2>Execution:</h2>
 * <pre>
 * 1. SecurityValidator     always; a violation ends the call
 * 2. ISOLATED mode         backend once, bounded by the timeout
 *      failure / timeout → fallbackCount++, lastIsolationResult = FAILED
 * 3. direct evaluation     DIRECT mode, or after an isolation failure
 * </pre>
 *
 * Execution failures come back as unsuccessful outcomes, never as
 * exceptions. Counters are atomics, so one wrapper can serve several
 * workers.
 */
public class SandboxExecutionWrapper implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(SandboxExecutionWrapper.class);

    private final ExecutionMode mode;
    private final DirectExecutor direct;
    @Nullable
    private final IsolationBackend backend;
    private final SecurityValidator security;
    private final Duration defaultTimeout;

    private final AtomicLong executionCount = new AtomicLong();
    private final AtomicLong fallbackCount = new AtomicLong();
    private final AtomicLong rejectedCount = new AtomicLong();
    private final AtomicLong failureCount = new AtomicLong();
    private final AtomicReference<IsolationResult> lastIsolationResult = new AtomicReference<>(IsolationResult.UNKNOWN);
    private final AtomicBoolean closed = new AtomicBoolean();

    /**
     * @param backend isolation backend, null for direct-only execution
     */
    public SandboxExecutionWrapper(DirectExecutor direct,
                                   @Nullable IsolationBackend backend,
                                   SecurityValidator security,
                                   Duration defaultTimeout) {
        this.mode = backend == null ? ExecutionMode.DIRECT : ExecutionMode.ISOLATED;
        this.direct = direct;
        this.backend = backend;
        this.security = security;
        this.defaultTimeout = defaultTimeout;
    }

    /**
     * Wrapper over the configured isolation command, or direct-only when
     * the sandbox is disabled.
     */
    public static SandboxExecutionWrapper create(MutagenConfig config) {
        MutagenConfig.SandboxSettings sandbox = config.sandbox();
        IsolationBackend backend = sandbox.enabled() ? new ProcessIsolationBackend(sandbox.command()) : null;
        return new SandboxExecutionWrapper(DirectExecutor.fromConfig(config), backend,
            new SecurityValidator(), sandbox.timeout());
    }

    public ExecutionMode getMode() {
        return mode;
    }

    // ========== Execution ==========

    public SandboxOutcome execute(String code) {
        return execute(code, defaultTimeout);
    }

    /**
     * @throws IllegalStateException when the wrapper has been closed
     */
    public SandboxOutcome execute(String code, Duration timeout) {
        if (closed.get()) {
            throw new IllegalStateException("Sandbox wrapper is closed");
        }
        long n = executionCount.incrementAndGet();

        ValidationResult validation = security.validate(code);
        if (!validation.success()) {
            rejectedCount.incrementAndGet();
            failureCount.incrementAndGet();
            log.info("Execution #{} rejected: {}", n, validation.errors());
            return SandboxOutcome.failed("Validation failed: " + String.join("; ", validation.errors()), mode);
        }

        if (mode == ExecutionMode.ISOLATED) {
            try {
                SandboxOutcome outcome = SandboxOutcome.succeeded(backend.execute(code, timeout), ExecutionMode.ISOLATED);
                lastIsolationResult.set(IsolationResult.SUCCEEDED);
                log.debug("Execution #{} succeeded in isolation", n);
                return outcome;
            } catch (IsolationException | RuntimeException e) {
                lastIsolationResult.set(IsolationResult.FAILED);
                long fallbacks = fallbackCount.incrementAndGet();
                log.warn("Isolated execution #{} failed ({}: {}), falling back to direct execution "
                    + "[{} fallback(s) in {} execution(s)]",
                    n, e.getClass().getSimpleName(), e.getMessage(), fallbacks, n);
            }
        }
        return executeDirect(code, timeout);
    }

    private SandboxOutcome executeDirect(String code, Duration timeout) {
        try {
            BacktestReport report = direct.run(code, timeout);
            return SandboxOutcome.succeeded(report.metrics(), ExecutionMode.DIRECT);
        } catch (SnippetSyntaxException e) {
            failureCount.incrementAndGet();
            return SandboxOutcome.failed("Syntax error: " + e.getMessage(), ExecutionMode.DIRECT);
        } catch (EvaluationException e) {
            failureCount.incrementAndGet();
            log.debug("Direct execution failed: {}", e.getMessage());
            return SandboxOutcome.failed("Execution failed: " + e.getMessage(), ExecutionMode.DIRECT);
        }
    }

    // ========== Lifecycle ==========

    public SandboxStatistics getStatistics() {
        return new SandboxStatistics(mode, executionCount.get(), fallbackCount.get(),
            rejectedCount.get(), failureCount.get(), lastIsolationResult.get());
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Release the isolation backend. Later calls do nothing.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (backend != null) {
            backend.close();
        }
        SandboxStatistics stats = getStatistics();
        log.info("Sandbox closed after {} execution(s), {} fallback(s)", stats.executionCount(), stats.fallbackCount());
    }
}
