package io.github.manjago.mutagen.snippet;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class SnippetParserTest {

    // ========== Statements ==========

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        @DisplayName("Top-level assignments and functions")
        void assignmentsAndFunctions() throws Exception {
            Script script = SnippetParser.parse("""
                lookback = 20

                def factor(data, window=5):
                    close = data.get('price:close')
                    return close.average(window) > 0
                """);

            assertEquals(2, script.body().size());
            Stmt.Assign assign = script.findAssignment("lookback");
            assertNotNull(assign);
            assertEquals(20.0, ((Expr.Num) assign.value()).value());

            Stmt.FunctionDef def = script.findFunction("factor");
            assertNotNull(def);
            assertEquals(2, def.params().size());
            assertNull(def.params().get(0).defaultValue());
            assertNotNull(def.params().get(1).defaultValue());
            assertEquals(2, def.body().size());
        }

        @Test
        @DisplayName("if / elif / else nests into orElse")
        void ifElif() throws Exception {
            Script script = SnippetParser.parse("""
                if a:
                    x = 1
                elif b:
                    x = 2
                else:
                    x = 3
                """);
            Stmt.If outer = (Stmt.If) script.body().get(0);
            assertEquals(1, outer.orElse().size());
            Stmt.If inner = (Stmt.If) outer.orElse().get(0);
            assertEquals(1, inner.orElse().size());
        }

        @Test
        @DisplayName("Imports are parsed (so the validator can reject them)")
        void imports() throws Exception {
            Script script = SnippetParser.parse("import os, sys as system\nfrom os.path import join\n");
            Stmt.Import imp = (Stmt.Import) script.body().get(0);
            assertEquals(2, imp.names().size());
            assertEquals("system", imp.names().get(1).asName());
            Stmt.ImportFrom from = (Stmt.ImportFrom) script.body().get(1);
            assertEquals("os.path", from.module());
        }

        @Test
        @DisplayName("Semicolons separate simple statements")
        void semicolons() throws Exception {
            assertEquals(3, SnippetParser.parse("a = 1; b = 2; c = 3\n").body().size());
        }

        @Test
        @DisplayName("Augmented assignment")
        void augmented() throws Exception {
            Stmt.AugAssign s = (Stmt.AugAssign) SnippetParser.parse("total += 1").body().get(0);
            assertEquals(Expr.BinaryOperator.ADD, s.op());
        }

        @Test
        @DisplayName("Numeric literal keeps its source span")
        void literalSpan() throws Exception {
            String src = "x = 1\nstop_loss_pct = 0.10\n";
            Expr.Num n = (Expr.Num) SnippetParser.parse(src).findAssignment("stop_loss_pct").value();
            assertTrue(n.hasSpan());
            assertEquals("0.10", src.substring(n.start(), n.end()));
            assertFalse(n.integer());
            assertEquals(2, n.line());
        }
    }

    // ========== Expressions ==========

    @Nested
    @DisplayName("Expressions")
    class Expressions {

        @Test
        @DisplayName("Multiplication binds tighter than addition")
        void precedence() throws Exception {
            Expr.Binary e = (Expr.Binary) SnippetParser.parseExpression("1 + 2 * 3");
            assertEquals(Expr.BinaryOperator.ADD, e.op());
            assertInstanceOf(Expr.Binary.class, e.right());
        }

        @Test
        @DisplayName("& binds tighter than comparison")
        void bitAndVsComparison() throws Exception {
            Expr e = SnippetParser.parseExpression("a & b > c");
            assertInstanceOf(Expr.Comparison.class, e);
        }

        @Test
        @DisplayName("Power is right-associative")
        void power() throws Exception {
            Expr.Binary e = (Expr.Binary) SnippetParser.parseExpression("2 ** 3 ** 2");
            assertInstanceOf(Expr.Num.class, e.left());
            assertInstanceOf(Expr.Binary.class, e.right());
        }

        @Test
        @DisplayName("Method call chain with keyword arguments")
        void callChain() throws Exception {
            Expr.Call call = (Expr.Call) SnippetParser.parseExpression("data.indicator('RSI', timeperiod=14)");
            assertEquals("indicator", call.calleeName());
            assertEquals(1, call.args().size());
            assertEquals("timeperiod", call.keywords().get(0).name());
        }

        @Test
        @DisplayName("Negative literal is a unary minus")
        void negative() throws Exception {
            Expr.Unary u = (Expr.Unary) SnippetParser.parseExpression("-1");
            assertEquals(Expr.UnaryOperator.NEG, u.op());
        }

        @Test
        @DisplayName("Constants and lists")
        void constants() throws Exception {
            Expr.ListLiteral l = (Expr.ListLiteral) SnippetParser.parseExpression("[True, None, 'x']");
            assertEquals(3, l.elements().size());
            assertNull(((Expr.Constant) l.elements().get(1)).value());
        }
    }

    // ========== Rejections ==========

    @ParameterizedTest
    @DisplayName("Constructs outside the grammar are rejected")
    @ValueSource(strings = {
        "class A:\n    pass\n",
        "f = lambda x: x\n",
        "x = [i for i in y]\n",
        "a, b = 1, 2\n",
        "x = y[1:2]\n",
        "x = {'a': 1}\n",
        "a = b = 1\n",
        "x = 1 < y < 3\n",
        "try:\n    pass\n",
        "def f(*args):\n    pass\n"
    })
    void rejectsUnsupported(String source) {
        assertThrows(SnippetSyntaxException.class, () -> SnippetParser.parse(source));
        assertFalse(SnippetParser.isValid(source));
    }

    @Test
    @DisplayName("Error carries the line number")
    void errorLine() {
        SnippetSyntaxException e = assertThrows(SnippetSyntaxException.class,
            () -> SnippetParser.parse("x = 1\ny = 2\nz = (\n"));
        assertTrue(e.getMessage().startsWith("Line "));
    }

    @Test
    @DisplayName("Unexpected indent at top level")
    void unexpectedIndent() {
        assertFalse(SnippetParser.isValid("x = 1\n    y = 2\n"));
    }

    @Test
    @DisplayName("Nesting up to the limit parses")
    void nestingAtLimit() throws Exception {
        int depth = SnippetParser.MAX_NESTING - 1;
        SnippetParser.parse("x = " + "(".repeat(depth) + "1" + ")".repeat(depth) + "\n");
    }

    @Test
    @DisplayName("Nesting past the limit is a syntax error")
    void nestingPastLimit() {
        int depth = SnippetParser.MAX_NESTING + 1;
        SnippetSyntaxException e = assertThrows(SnippetSyntaxException.class,
            () -> SnippetParser.parse("x = " + "(".repeat(depth) + "1" + ")".repeat(depth) + "\n"));
        assertTrue(e.getMessage().contains("nested too deeply"), e.getMessage());
    }

    @Test
    @DisplayName("Deeply nested blocks are a syntax error")
    void deepBlocks() {
        StringBuilder code = new StringBuilder();
        for (int i = 0; i <= SnippetParser.MAX_NESTING; i++) {
            code.append("    ".repeat(i)).append("if x:\n");
        }
        code.append("    ".repeat(SnippetParser.MAX_NESTING + 1)).append("pass\n");

        assertFalse(SnippetParser.isValid(code.toString()));
    }
}
