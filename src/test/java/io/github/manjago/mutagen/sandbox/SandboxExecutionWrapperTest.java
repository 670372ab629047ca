package io.github.manjago.mutagen.sandbox;

import io.github.manjago.mutagen.config.MutagenConfig;
import io.github.manjago.mutagen.exec.BacktestReport;
import io.github.manjago.mutagen.exec.DirectExecutor;
import io.github.manjago.mutagen.exec.SimpleBacktester;
import io.github.manjago.mutagen.exec.SyntheticMarketData;
import io.github.manjago.mutagen.security.SecurityValidator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SandboxExecutionWrapperTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(30);

    private static final String STRATEGY = """
        close = data.get('price:close')
        position = close > close.average(20)
        """;

    /**
     * Backend that answers from a script and remembers what it was given.
     */
    private static final class FakeBackend implements IsolationBackend {
        final List<String> received = new ArrayList<>();
        final Map<String, Double> metrics;
        final String failure;
        boolean closed;

        FakeBackend(Map<String, Double> metrics, String failure) {
            this.metrics = metrics;
            this.failure = failure;
        }

        static FakeBackend failing(String reason) {
            return new FakeBackend(Map.of(), reason);
        }

        static FakeBackend returning(Map<String, Double> metrics) {
            return new FakeBackend(metrics, null);
        }

        @Override
        public Map<String, Double> execute(String code, Duration timeout) throws IsolationException {
            received.add(code);
            if (failure != null) {
                throw new IsolationException(failure);
            }
            return metrics;
        }

        @Override
        public void close() {
            closed = true;
        }
    }

    private static DirectExecutor direct() {
        SyntheticMarketData market = new SyntheticMarketData(6, 120, 11);
        return new DirectExecutor(market, new SimpleBacktester(market), 1_000_000);
    }

    private static SandboxExecutionWrapper wrapper(IsolationBackend backend) {
        return new SandboxExecutionWrapper(direct(), backend, new SecurityValidator(), TIMEOUT);
    }

    // ========== Isolated mode ==========

    @Nested
    @DisplayName("Isolated mode")
    class Isolated {

        @Test
        @DisplayName("isolation failure falls back to direct execution")
        void fallbackToDirect() {
            FakeBackend backend = FakeBackend.failing("docker: command not found");
            try (SandboxExecutionWrapper wrapper = wrapper(backend)) {
                SandboxOutcome outcome = wrapper.execute(STRATEGY);

                assertTrue(outcome.success(), outcome.error());
                assertEquals(ExecutionMode.DIRECT, outcome.mode());
                assertTrue(outcome.metrics().containsKey(BacktestReport.SHARPE_RATIO));

                SandboxStatistics stats = wrapper.getStatistics();
                assertEquals(ExecutionMode.ISOLATED, stats.mode());
                assertEquals(1, stats.fallbackCount());
                assertEquals(IsolationResult.FAILED, stats.lastIsolationResult());
                assertEquals(1.0, stats.fallbackRate());
            }
        }

        @Test
        @DisplayName("isolated metrics are returned without direct execution")
        void isolatedSuccess() {
            FakeBackend backend = FakeBackend.returning(Map.of("sharpe_ratio", 1.5));
            try (SandboxExecutionWrapper wrapper = wrapper(backend)) {
                SandboxOutcome outcome = wrapper.execute(STRATEGY);

                assertTrue(outcome.success());
                assertEquals(ExecutionMode.ISOLATED, outcome.mode());
                assertEquals(Map.of("sharpe_ratio", 1.5), outcome.metrics());
                assertEquals(IsolationResult.SUCCEEDED, wrapper.getStatistics().lastIsolationResult());
                assertEquals(0, wrapper.getStatistics().fallbackCount());
                assertEquals(List.of(STRATEGY), backend.received);
            }
        }

        @Test
        @DisplayName("a backend runtime failure also falls back")
        void runtimeFailure() {
            IsolationBackend broken = new IsolationBackend() {
                @Override
                public Map<String, Double> execute(String code, Duration timeout) {
                    throw new IllegalStateException("pipe closed");
                }

                @Override
                public void close() {
                }
            };
            try (SandboxExecutionWrapper wrapper = wrapper(broken)) {
                SandboxOutcome outcome = wrapper.execute(STRATEGY);

                assertTrue(outcome.success());
                assertEquals(ExecutionMode.DIRECT, outcome.mode());
                assertEquals(1, wrapper.getStatistics().fallbackCount());
            }
        }

        @Test
        @DisplayName("every failed isolated attempt counts a fallback")
        void repeatedFallbacks() {
            FakeBackend backend = FakeBackend.failing("boom");
            try (SandboxExecutionWrapper wrapper = wrapper(backend)) {
                wrapper.execute(STRATEGY);
                wrapper.execute(STRATEGY);

                SandboxStatistics stats = wrapper.getStatistics();
                assertEquals(2, stats.executionCount());
                assertEquals(2, stats.fallbackCount());
            }
        }
    }

    // ========== Validation ==========

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("unsafe snippets are never executed")
        void rejected() {
            FakeBackend backend = FakeBackend.returning(Map.of("sharpe_ratio", 9.0));
            try (SandboxExecutionWrapper wrapper = wrapper(backend)) {
                SandboxOutcome outcome = wrapper.execute("import os\n" + STRATEGY);

                assertFalse(outcome.success());
                assertTrue(outcome.error().startsWith("Validation failed"), outcome.error());
                assertTrue(outcome.metrics().isEmpty());
                assertTrue(backend.received.isEmpty());
                assertEquals(1, wrapper.getStatistics().rejectedCount());
                assertEquals(0, wrapper.getStatistics().fallbackCount());
            }
        }

        @Test
        @DisplayName("look-ahead shifts are rejected before execution")
        void negativeShift() {
            try (SandboxExecutionWrapper wrapper = wrapper(null)) {
                SandboxOutcome outcome = wrapper.execute("""
                    close = data.get('price:close')
                    position = close.shift(-1) > close
                    """);

                assertFalse(outcome.success());
                assertTrue(outcome.error().contains("shift"), outcome.error());
            }
        }
    }

    // ========== Direct mode ==========

    @Nested
    @DisplayName("Direct mode")
    class Direct {

        @Test
        @DisplayName("no backend means direct mode")
        void directOnly() {
            try (SandboxExecutionWrapper wrapper = wrapper(null)) {
                assertEquals(ExecutionMode.DIRECT, wrapper.getMode());

                SandboxOutcome outcome = wrapper.execute(STRATEGY);

                assertTrue(outcome.success());
                assertEquals(ExecutionMode.DIRECT, outcome.mode());
                assertEquals(IsolationResult.UNKNOWN, wrapper.getStatistics().lastIsolationResult());
            }
        }

        @Test
        @DisplayName("syntax errors become failed outcomes")
        void syntaxError() {
            try (SandboxExecutionWrapper wrapper = wrapper(null)) {
                SandboxOutcome outcome = wrapper.execute("position = (");

                assertFalse(outcome.success());
                assertNotNull(outcome.error());
            }
        }

        @Test
        @DisplayName("runtime errors become failed outcomes")
        void executionError() {
            try (SandboxExecutionWrapper wrapper = wrapper(null)) {
                SandboxOutcome outcome = wrapper.execute("x = 1 / 0\n");

                assertFalse(outcome.success());
                assertTrue(outcome.error().startsWith("Execution failed"), outcome.error());
                assertEquals(1, wrapper.getStatistics().failureCount());
            }
        }

        @Test
        @DisplayName("configured wrapper without sandbox runs directly")
        void fromConfig() {
            MutagenConfig config = MutagenConfig.defaults().toBuilder().sandboxEnabled(false).build();
            try (SandboxExecutionWrapper wrapper = SandboxExecutionWrapper.create(config)) {
                assertEquals(ExecutionMode.DIRECT, wrapper.getMode());
            }
        }
    }

    // ========== Lifecycle ==========

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("close releases the backend once")
        void closeReleasesBackend() {
            FakeBackend backend = FakeBackend.returning(Map.of());
            SandboxExecutionWrapper wrapper = wrapper(backend);

            wrapper.close();
            wrapper.close();

            assertTrue(wrapper.isClosed());
            assertTrue(backend.closed);
        }

        @Test
        @DisplayName("execution after close is refused")
        void executeAfterClose() {
            SandboxExecutionWrapper wrapper = wrapper(null);
            wrapper.close();

            assertThrows(IllegalStateException.class, () -> wrapper.execute(STRATEGY));
        }
    }
}
