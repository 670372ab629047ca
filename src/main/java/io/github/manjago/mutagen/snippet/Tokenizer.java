package io.github.manjago.mutagen.snippet;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Converts snippet text into tokens.
 *
 * Indentation is significant: a deeper line emits INDENT, a shallower one
 * emits one DEDENT per closed level. Line breaks inside brackets and after a
 * trailing backslash are ignored. Comments ({@code #} to end of line) are
 * dropped.
 */
public final class Tokenizer {

    private static final int TAB_SIZE = 8;

    private static final Set<String> THREE_CHAR_OPS = Set.of("//=", "**=", ">>=", "<<=");
    private static final Set<String> TWO_CHAR_OPS = Set.of(
        "==", "!=", "<=", ">=", "//", "**", "+=", "-=", "*=", "/=", "%=",
        "&=", "|=", "^=", "->", "<<", ">>"
    );
    private static final String ONE_CHAR_OPS = "+-*/%<>=()[]{},:.;&|~^@";

    private final String src;
    private final List<Token> tokens = new ArrayList<>();
    private final Deque<Integer> indents = new ArrayDeque<>();

    private int pos;
    private int line = 1;
    private int lineStart;
    private int depth;

    public Tokenizer(String source) {
        this.src = source;
        this.indents.push(0);
    }

    /**
     * Tokenize the whole source. Always ends with NEWLINE (if any tokens),
     * the closing DEDENTs and EOF.
     */
    public List<Token> tokenize() throws SnippetSyntaxException {
        boolean atLineStart = true;

        while (pos < src.length()) {
            if (atLineStart && depth == 0) {
                if (!readIndentation()) {
                    continue;
                }
                atLineStart = false;
            }

            char c = src.charAt(pos);

            if (c == '\n' || c == '\r') {
                consumeNewline();
                if (depth == 0) {
                    emitNewline();
                    atLineStart = true;
                }
                continue;
            }
            if (c == ' ' || c == '\t' || c == '\f') {
                pos++;
                continue;
            }
            if (c == '#') {
                skipComment();
                continue;
            }
            if (c == '\\') {
                pos++;
                if (pos < src.length() && (src.charAt(pos) == '\n' || src.charAt(pos) == '\r')) {
                    consumeNewline();
                    continue;
                }
                throw error("Unexpected character after line continuation");
            }
            if (Character.isDigit(c) || (c == '.' && pos + 1 < src.length() && Character.isDigit(src.charAt(pos + 1)))) {
                readNumber();
                continue;
            }
            if (c == '\'' || c == '"') {
                readString();
                continue;
            }
            if (Character.isLetter(c) || c == '_') {
                readName();
                continue;
            }
            readOperator();
        }

        if (depth > 0) {
            throw error("Unexpected end of input: unclosed bracket");
        }
        emitNewline();
        while (indents.peek() > 0) {
            indents.pop();
            add(TokenType.DEDENT, "", pos, pos);
        }
        add(TokenType.EOF, "", pos, pos);
        return tokens;
    }

    // ========== Line structure ==========

    /**
     * Measures indentation of the current line and emits INDENT/DEDENT.
     * Returns false when the line was blank or comment-only and has been consumed.
     */
    private boolean readIndentation() throws SnippetSyntaxException {
        int width = 0;
        while (pos < src.length()) {
            char c = src.charAt(pos);
            if (c == ' ') {
                width++;
            } else if (c == '\t') {
                width = (width / TAB_SIZE + 1) * TAB_SIZE;
            } else if (c == '\f') {
                width = 0;
            } else {
                break;
            }
            pos++;
        }

        if (pos >= src.length()) {
            return false;
        }
        char c = src.charAt(pos);
        if (c == '#') {
            skipComment();
            if (pos < src.length()) {
                consumeNewline();
            }
            return false;
        }
        if (c == '\n' || c == '\r') {
            consumeNewline();
            return false;
        }

        int current = indents.peek();
        if (width > current) {
            indents.push(width);
            add(TokenType.INDENT, "", pos, pos);
        } else if (width < current) {
            while (indents.peek() > width) {
                indents.pop();
                add(TokenType.DEDENT, "", pos, pos);
            }
            if (indents.peek() != width) {
                throw error("Unindent does not match any outer indentation level");
            }
        }
        return true;
    }

    private void consumeNewline() {
        if (src.charAt(pos) == '\r' && pos + 1 < src.length() && src.charAt(pos + 1) == '\n') {
            pos++;
        }
        pos++;
        line++;
        lineStart = pos;
    }

    private void skipComment() {
        while (pos < src.length() && src.charAt(pos) != '\n' && src.charAt(pos) != '\r') {
            pos++;
        }
    }

    private void emitNewline() {
        if (tokens.isEmpty()) {
            return;
        }
        TokenType last = tokens.get(tokens.size() - 1).type();
        if (last != TokenType.NEWLINE && last != TokenType.INDENT && last != TokenType.DEDENT) {
            add(TokenType.NEWLINE, "", pos, pos);
        }
    }

    // ========== Literals and names ==========

    private void readNumber() throws SnippetSyntaxException {
        int start = pos;
        digits();
        if (pos < src.length() && src.charAt(pos) == '.') {
            pos++;
            digits();
        }
        if (pos < src.length() && (src.charAt(pos) == 'e' || src.charAt(pos) == 'E')) {
            int mark = pos;
            pos++;
            if (pos < src.length() && (src.charAt(pos) == '+' || src.charAt(pos) == '-')) {
                pos++;
            }
            if (pos >= src.length() || !Character.isDigit(src.charAt(pos))) {
                pos = mark;
                throw error("Malformed number exponent");
            }
            digits();
        }
        if (pos < src.length() && (Character.isLetter(src.charAt(pos)) || src.charAt(pos) == '_')) {
            throw error("Invalid number literal '" + src.substring(start, pos + 1) + "'");
        }
        add(TokenType.NUMBER, src.substring(start, pos), start, pos);
    }

    private void digits() {
        while (pos < src.length() && (Character.isDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
    }

    private void readName() {
        int start = pos;
        while (pos < src.length() && (Character.isLetterOrDigit(src.charAt(pos)) || src.charAt(pos) == '_')) {
            pos++;
        }
        add(TokenType.NAME, src.substring(start, pos), start, pos);
    }

    private void readString() throws SnippetSyntaxException {
        int start = pos;
        int startLine = line;
        char quote = src.charAt(pos);
        boolean triple = src.startsWith(String.valueOf(quote).repeat(3), pos);
        pos += triple ? 3 : 1;

        StringBuilder value = new StringBuilder();
        while (true) {
            if (pos >= src.length()) {
                throw new SnippetSyntaxException("Unterminated string literal", startLine);
            }
            char c = src.charAt(pos);
            if (c == quote) {
                if (!triple) {
                    pos++;
                    break;
                }
                if (src.startsWith(String.valueOf(quote).repeat(3), pos)) {
                    pos += 3;
                    break;
                }
            }
            if ((c == '\n' || c == '\r') && !triple) {
                throw new SnippetSyntaxException("Unterminated string literal", startLine);
            }
            if (c == '\\' && pos + 1 < src.length()) {
                char next = src.charAt(pos + 1);
                switch (next) {
                    case 'n' -> value.append('\n');
                    case 't' -> value.append('\t');
                    case 'r' -> value.append('\r');
                    case '\\' -> value.append('\\');
                    case '\'' -> value.append('\'');
                    case '"' -> value.append('"');
                    default -> value.append('\\').append(next);
                }
                pos += 2;
                continue;
            }
            if (c == '\n' || c == '\r') {
                value.append('\n');
                consumeNewline();
                continue;
            }
            value.append(c);
            pos++;
        }
        tokens.add(new Token(TokenType.STRING, value.toString(), startLine, start - lineStart, start, pos));
    }

    // ========== Operators ==========

    private void readOperator() throws SnippetSyntaxException {
        int start = pos;
        if (pos + 3 <= src.length() && THREE_CHAR_OPS.contains(src.substring(pos, pos + 3))) {
            pos += 3;
        } else if (pos + 2 <= src.length() && TWO_CHAR_OPS.contains(src.substring(pos, pos + 2))) {
            pos += 2;
        } else if (ONE_CHAR_OPS.indexOf(src.charAt(pos)) >= 0) {
            char c = src.charAt(pos);
            if (c == '(' || c == '[' || c == '{') {
                depth++;
            } else if (c == ')' || c == ']' || c == '}') {
                if (depth == 0) {
                    throw error("Unmatched '" + c + "'");
                }
                depth--;
            }
            pos++;
        } else {
            throw error("Unexpected character '" + src.charAt(pos) + "'");
        }
        add(TokenType.OP, src.substring(start, pos), start, pos);
    }

    private void add(TokenType type, String text, int start, int end) {
        tokens.add(new Token(type, text, line, Math.max(0, start - lineStart), start, end));
    }

    private SnippetSyntaxException error(String message) {
        return new SnippetSyntaxException(message, line);
    }
}
