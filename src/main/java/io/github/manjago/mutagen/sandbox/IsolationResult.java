package io.github.manjago.mutagen.sandbox;

/**
 * Outcome of the most recent isolated attempt.
 */
public enum IsolationResult {
    /** No isolated attempt yet, or the wrapper runs in direct mode. */
    UNKNOWN,
    SUCCEEDED,
    FAILED
}
