package io.github.manjago.mutagen.tier1;

import io.github.manjago.mutagen.snippet.Expr;

/**
 * One top-level {@code name = <number>} assignment.
 *
 * @param name    assigned variable
 * @param literal the numeric literal, with its source span
 */
public record ConfigEntry(String name, Expr.Num literal) {

    public double value() {
        return literal.value();
    }

    public boolean integer() {
        return literal.integer();
    }
}
