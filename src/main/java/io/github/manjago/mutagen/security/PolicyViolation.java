package io.github.manjago.mutagen.security;

/**
 * One rejected construct.
 *
 * @param construct offending name or statement kind (e.g. "import", "eval", "shift")
 * @param line      1-based source line
 * @param message   human-readable description, includes the line
 */
public record PolicyViolation(String construct, int line, String message) {

    @Override
    public String toString() {
        return message;
    }
}
