package io.github.manjago.mutagen.exec;

/**
 * Runtime failure while evaluating a snippet: unknown name, type mismatch,
 * exhausted step budget, deadline passed.
 */
public class EvaluationException extends RuntimeException {
    private final int lineNum;

    public EvaluationException(String message) {
        super(message);
        this.lineNum = -1;
    }

    public EvaluationException(String message, int lineNum) {
        super(lineNum > 0 ? "Line " + lineNum + ": " + message : message);
        this.lineNum = lineNum;
    }

    public EvaluationException(String message, Throwable cause) {
        super(message, cause);
        this.lineNum = -1;
    }

    /**
     * 1-based line of the failing statement, -1 when unknown.
     */
    public int getLineNum() {
        return lineNum;
    }
}
