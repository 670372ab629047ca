package io.github.manjago.mutagen.sandbox;

/**
 * Isolated execution could not produce metrics: the backend failed to
 * start, timed out, exited abnormally or printed no signal.
 */
public class IsolationException extends Exception {

    public IsolationException(String message) {
        super(message);
    }

    public IsolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
