package io.github.manjago.mutagen.snippet;

/**
 * Raised when a snippet cannot be tokenized or parsed.
 */
public class SnippetSyntaxException extends Exception {
    private final int lineNum;

    public SnippetSyntaxException(String message, int lineNum) {
        super("Line " + lineNum + ": " + message);
        this.lineNum = lineNum;
    }

    /**
     * 1-based line of the offending token.
     */
    public int getLineNum() {
        return lineNum;
    }
}
