package io.github.manjago.mutagen.sandbox;

/**
 * How the wrapper runs snippets.
 */
public enum ExecutionMode {
    /** In-process evaluation only. */
    DIRECT,
    /** Isolation backend first, direct evaluation when it fails. */
    ISOLATED
}
