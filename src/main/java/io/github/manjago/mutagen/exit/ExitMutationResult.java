package io.github.manjago.mutagen.exit;

import org.jetbrains.annotations.Nullable;

/**
 * Outcome of an exit-parameter mutation.
 * On failure {@code mutatedCode} is the unmodified input and {@code change} is null.
 */
public record ExitMutationResult(
    String mutatedCode,
    boolean success,
    @Nullable ParameterChange change,
    @Nullable String error
) {

    static ExitMutationResult success(String code, ParameterChange change) {
        return new ExitMutationResult(code, true, change, null);
    }

    static ExitMutationResult failure(String originalCode, String error) {
        return new ExitMutationResult(originalCode, false, null, error);
    }
}
