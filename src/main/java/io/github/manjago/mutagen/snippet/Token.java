package io.github.manjago.mutagen.snippet;

/**
 * Single lexical token.
 *
 * @param type   token category
 * @param text   raw source text (decoded value for strings)
 * @param line   1-based line number
 * @param column 0-based column
 * @param start  offset of the first character in the source
 * @param end    offset just past the last character in the source
 */
public record Token(TokenType type, String text, int line, int column, int start, int end) {

    public boolean isOp(String op) {
        return type == TokenType.OP && text.equals(op);
    }

    public boolean isKeyword(String keyword) {
        return type == TokenType.NAME && text.equals(keyword);
    }

    @Override
    public String toString() {
        return switch (type) {
            case NEWLINE, INDENT, DEDENT, EOF -> type.name();
            default -> type + "(" + text + ")@" + line;
        };
    }
}
