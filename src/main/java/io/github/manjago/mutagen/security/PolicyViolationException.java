package io.github.manjago.mutagen.security;

import java.util.List;

/**
 * Thrown by {@link SecurityValidator#requireValid(String)} for callers that
 * treat a rejected candidate as fatal.
 */
public class PolicyViolationException extends RuntimeException {
    private final List<String> errors;

    public PolicyViolationException(List<String> errors) {
        super("Security policy violation: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
