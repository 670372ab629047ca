package io.github.manjago.mutagen.snippet;

/**
 * Token categories produced by {@link Tokenizer}.
 */
public enum TokenType {
    NAME,
    NUMBER,
    STRING,
    OP,
    NEWLINE,
    INDENT,
    DEDENT,
    EOF
}
