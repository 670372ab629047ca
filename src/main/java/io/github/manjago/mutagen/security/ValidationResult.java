package io.github.manjago.mutagen.security;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a validation pass.
 *
 * Results aggregate: {@link #combine(List)} succeeds only when every part
 * succeeds, and concatenates errors and warnings in order.
 */
public record ValidationResult(boolean success, List<String> errors, List<String> warnings) {

    private static final ValidationResult OK = new ValidationResult(true, List.of(), List.of());

    public ValidationResult {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        if (success && !errors.isEmpty()) {
            throw new IllegalArgumentException("Successful validation cannot carry errors");
        }
    }

    public static ValidationResult ok() {
        return OK;
    }

    public static ValidationResult ok(List<String> warnings) {
        return new ValidationResult(true, List.of(), warnings);
    }

    public static ValidationResult failure(String error) {
        return new ValidationResult(false, List.of(error), List.of());
    }

    /**
     * Failure when {@code errors} is non-empty, success otherwise.
     */
    public static ValidationResult of(List<String> errors, List<String> warnings) {
        return new ValidationResult(errors.isEmpty(), errors, warnings);
    }

    public static ValidationResult combine(ValidationResult... results) {
        return combine(List.of(results));
    }

    public static ValidationResult combine(List<ValidationResult> results) {
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        boolean success = true;
        for (ValidationResult r : results) {
            success &= r.success();
            errors.addAll(r.errors());
            warnings.addAll(r.warnings());
        }
        return new ValidationResult(success, errors, warnings);
    }

    /**
     * First error, or null when successful.
     */
    public String firstError() {
        return errors.isEmpty() ? null : errors.get(0);
    }
}
