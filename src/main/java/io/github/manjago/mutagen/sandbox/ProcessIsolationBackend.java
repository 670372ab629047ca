package io.github.manjago.mutagen.sandbox;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Isolation through an external command, by default a locked-down
 * {@code docker run} of this tool's {@code sandbox-run} command.
 *
 * <h2>Protocol:</h2>
 * <pre>
 * stdin   snippet text, then EOF
 * stdout  anything, plus one {@link SignalCodec} frame with the metrics
 * exit    0 on success
 * </pre>
 *
 * The timeout covers the whole call, sending the snippet included; a run
 * that outlives it is destroyed forcibly. Processes still
 * running when the backend is closed are destroyed as well.
 */
public class ProcessIsolationBackend implements IsolationBackend {

    private static final Logger log = LoggerFactory.getLogger(ProcessIsolationBackend.class);

    private static final long OUTPUT_DRAIN_MILLIS = 5_000;
    private static final int ERROR_TAIL = 300;

    private final List<String> command;
    private final Set<Process> active = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final ExecutorService readers;

    public ProcessIsolationBackend(List<String> command) {
        if (command.isEmpty()) {
            throw new IllegalArgumentException("Isolation command must not be empty");
        }
        this.command = List.copyOf(command);
        AtomicInteger counter = new AtomicInteger();
        this.readers = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sandbox-output-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public List<String> getCommand() {
        return command;
    }

    /**
     * Number of isolated processes currently running.
     */
    public int activeCount() {
        return active.size();
    }

    @Override
    public Map<String, Double> execute(String code, Duration timeout) throws IsolationException {
        if (closed.get()) {
            throw new IsolationException("Isolation backend is closed");
        }
        long deadline = System.nanoTime() + timeout.toNanos();

        Process process;
        try {
            process = new ProcessBuilder(command)
                .redirectErrorStream(true)
                .start();
        } catch (IOException e) {
            throw new IsolationException("Cannot start '" + command.get(0) + "': " + e.getMessage(), e);
        }
        active.add(process);
        log.debug("Started isolated process {} ({})", process.pid(), command.get(0));

        try {
            // Both pipes are served off this thread: a process that never reads
            // stdin or floods stdout cannot hold the call past the deadline
            CompletableFuture<String> output = CompletableFuture.supplyAsync(
                () -> readAll(process.getInputStream()), readers);
            CompletableFuture<Void> input = CompletableFuture.runAsync(
                () -> writeAll(process.getOutputStream(), code), readers);

            long remaining = deadline - System.nanoTime();
            if (remaining <= 0 || !process.waitFor(remaining, TimeUnit.NANOSECONDS)) {
                process.destroyForcibly();
                input.cancel(true);
                throw new IsolationException("Isolated execution timed out after " + timeout.toMillis() + " ms");
            }

            String text = drain(output);
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                throw new IsolationException("Isolated process exited with code " + exitCode + ": " + tail(text));
            }
            if (input.isCompletedExceptionally()) {
                log.debug("Isolated process {} exited before reading the whole snippet", process.pid());
            }
            return SignalCodec.decode(text);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IsolationException("Interrupted while waiting for isolated process", e);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
            active.remove(process);
        }
    }

    private static void writeAll(OutputStream out, String code) {
        try (out) {
            out.write(code.getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String drain(CompletableFuture<String> output) throws IsolationException, InterruptedException {
        try {
            return output.get(OUTPUT_DRAIN_MILLIS, TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            throw new IsolationException("Cannot read isolated output: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new IsolationException("Isolated output was not closed after exit", e);
        }
    }

    private static String readAll(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static String tail(String text) {
        String trimmed = text.strip();
        return trimmed.length() <= ERROR_TAIL ? trimmed : "..." + trimmed.substring(trimmed.length() - ERROR_TAIL);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        int leftovers = 0;
        for (Process process : active) {
            if (process.isAlive()) {
                process.destroyForcibly();
                leftovers++;
            }
        }
        active.clear();
        readers.shutdownNow();
        if (leftovers > 0) {
            log.warn("Destroyed {} isolated process(es) still running at close", leftovers);
        }
        log.debug("Isolation backend closed");
    }
}
