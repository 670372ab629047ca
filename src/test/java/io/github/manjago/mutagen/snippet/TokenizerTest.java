package io.github.manjago.mutagen.snippet;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class TokenizerTest {

    private static List<TokenType> types(String source) throws SnippetSyntaxException {
        return new Tokenizer(source).tokenize().stream().map(Token::type).collect(Collectors.toList());
    }

    private static List<String> texts(String source) throws SnippetSyntaxException {
        return new Tokenizer(source).tokenize().stream()
            .filter(t -> t.type() != TokenType.NEWLINE && t.type() != TokenType.EOF)
            .map(Token::text)
            .collect(Collectors.toList());
    }

    // ========== Line structure ==========

    @Nested
    @DisplayName("Line structure")
    class LineStructure {

        @Test
        @DisplayName("Indented block emits INDENT and DEDENT")
        void indentDedent() throws Exception {
            assertEquals(List.of(
                TokenType.NAME, TokenType.NAME, TokenType.OP, TokenType.OP, TokenType.OP, TokenType.NEWLINE,
                TokenType.INDENT, TokenType.NAME, TokenType.NEWLINE,
                TokenType.DEDENT, TokenType.EOF
            ), types("def f():\n    pass\n"));
        }

        @Test
        @DisplayName("Blank and comment-only lines do not affect indentation")
        void blankLinesIgnored() throws Exception {
            List<TokenType> withBlanks = types("if x:\n\n    # note\n    y = 1\n");
            List<TokenType> without = types("if x:\n    y = 1\n");
            assertEquals(without, withBlanks);
        }

        @Test
        @DisplayName("Line breaks inside brackets are joined")
        void bracketContinuation() throws Exception {
            assertEquals(texts("f(a, b)"), texts("f(a,\n  b)"));
        }

        @Test
        @DisplayName("Backslash continues a line")
        void backslashContinuation() throws Exception {
            assertEquals(texts("x = 1 + 2"), texts("x = 1 + \\\n    2"));
        }

        @Test
        @DisplayName("Inconsistent dedent is rejected")
        void badDedent() {
            SnippetSyntaxException e = assertThrows(SnippetSyntaxException.class,
                () -> types("if x:\n        y = 1\n    z = 2\n"));
            assertTrue(e.getMessage().contains("Unindent"));
            assertEquals(3, e.getLineNum());
        }

        @Test
        @DisplayName("Unclosed bracket is rejected")
        void unclosedBracket() {
            SnippetSyntaxException e = assertThrows(SnippetSyntaxException.class, () -> types("f(1, 2\n"));
            assertTrue(e.getMessage().contains("unclosed bracket"));
        }
    }

    // ========== Literals ==========

    @Nested
    @DisplayName("Literals")
    class LiteralsTokens {

        @Test
        @DisplayName("Numbers keep their source text")
        void numbers() throws Exception {
            assertEquals(List.of("0.10", "1e-3", ".5", "1_000"), texts("0.10 1e-3 .5 1_000"));
        }

        @Test
        @DisplayName("Malformed exponent is rejected")
        void badExponent() {
            assertThrows(SnippetSyntaxException.class, () -> types("x = 1e"));
        }

        @Test
        @DisplayName("Strings are decoded")
        void strings() throws Exception {
            List<Token> tokens = new Tokenizer("'a\\'b' \"c\\nd\"").tokenize();
            assertEquals("a'b", tokens.get(0).text());
            assertEquals("c\nd", tokens.get(1).text());
        }

        @Test
        @DisplayName("Unterminated string reports its starting line")
        void unterminatedString() {
            SnippetSyntaxException e = assertThrows(SnippetSyntaxException.class, () -> types("x = 1\ny = 'abc\n"));
            assertEquals(2, e.getLineNum());
        }

        @Test
        @DisplayName("Token offsets locate the literal in the source")
        void offsets() throws Exception {
            String src = "stop_loss_pct = 0.10";
            Token number = new Tokenizer(src).tokenize().get(2);
            assertEquals("0.10", src.substring(number.start(), number.end()));
        }
    }

    @Test
    @DisplayName("Multi-character operators are matched greedily")
    void operators() throws Exception {
        assertEquals(List.of("a", "//=", "b", "**", "c", "<=", "d"), texts("a //= b ** c <= d"));
    }

    @Test
    @DisplayName("Comments are dropped")
    void comments() throws Exception {
        assertEquals(List.of("x", "=", "1"), texts("x = 1  # one"));
    }
}
