package io.github.manjago.mutagen.tier2;

import io.github.manjago.mutagen.snippet.Script;
import io.github.manjago.mutagen.snippet.SnippetParser;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import io.github.manjago.mutagen.snippet.Stmt;

/**
 * Library factor: a single {@code def name(data)} returning a selection mask.
 */
public record FactorTemplate(String name, FactorCategory category, String source) {

    /**
     * Parsed definition. Templates are fixed library code, so a parse
     * failure is a programming error.
     */
    public Stmt.FunctionDef definition() {
        try {
            Script script = SnippetParser.parse(source);
            Stmt.FunctionDef def = script.findFunction(name);
            if (def == null || script.body().size() != 1) {
                throw new IllegalStateException("Template " + name + " must define exactly def " + name);
            }
            return def;
        } catch (SnippetSyntaxException e) {
            throw new IllegalStateException("Template " + name + " does not parse: " + e.getMessage(), e);
        }
    }
}
