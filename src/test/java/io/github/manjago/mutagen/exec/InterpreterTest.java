package io.github.manjago.mutagen.exec;

import io.github.manjago.mutagen.snippet.SnippetParser;
import io.github.manjago.mutagen.snippet.SnippetSyntaxException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InterpreterTest {

    private static Interpreter run(String code) throws SnippetSyntaxException {
        Interpreter interpreter = new Interpreter(ExecutionBudget.unlimited());
        interpreter.run(SnippetParser.parse(code));
        return interpreter;
    }

    // ========== Arithmetic ==========

    @Nested
    @DisplayName("Arithmetic")
    class Arithmetic {

        @Test
        @DisplayName("Integer literals stay integral")
        void integers() throws Exception {
            Interpreter i = run("x = 7 // 2\ny = 2 ** 10\nz = -3 + 1\n");
            assertEquals(3L, i.global("x"));
            assertEquals(1024L, i.global("y"));
            assertEquals(-2L, i.global("z"));
        }

        @Test
        @DisplayName("True division always yields a float")
        void division() throws Exception {
            assertEquals(3.5, run("x = 7 / 2\n").global("x"));
        }

        @Test
        @DisplayName("Integer division by zero fails")
        void divisionByZero() {
            assertThrows(EvaluationException.class, () -> run("x = 1 / 0\n"));
        }

        @Test
        @DisplayName("String concatenation")
        void strings() throws Exception {
            assertEquals("ab", run("x = 'a' + 'b'\n").global("x"));
        }
    }

    // ========== Control flow ==========

    @Nested
    @DisplayName("Control flow")
    class ControlFlow {

        @Test
        @DisplayName("for over range accumulates")
        void forLoop() throws Exception {
            Interpreter i = run("""
                total = 0
                for k in range(5):
                    total = total + k
                """);
            assertEquals(10L, i.global("total"));
        }

        @Test
        @DisplayName("if / elif / else picks one branch")
        void branches() throws Exception {
            Interpreter i = run("""
                x = 5
                if x > 10:
                    y = 'big'
                elif x > 3:
                    y = 'mid'
                else:
                    y = 'small'
                """);
            assertEquals("mid", i.global("y"));
        }

        @Test
        @DisplayName("Functions take defaults and keywords")
        void functions() throws Exception {
            Interpreter i = run("""
                def scale(x, factor=2):
                    return x * factor
                a = scale(3)
                b = scale(3, factor=10)
                """);
            assertEquals(6L, i.global("a"));
            assertEquals(30L, i.global("b"));
        }

        @Test
        @DisplayName("Missing argument is reported")
        void missingArgument() {
            EvaluationException e = assertThrows(EvaluationException.class,
                () -> run("def f(a, b):\n    return a\nx = f(1)\n"));
            assertTrue(e.getMessage().contains("missing required argument 'b'"));
        }

        @Test
        @DisplayName("Unbounded recursion hits the depth limit")
        void recursion() {
            EvaluationException e = assertThrows(EvaluationException.class,
                () -> run("def f(n):\n    return f(n + 1)\nx = f(0)\n"));
            assertTrue(e.getMessage().contains("Maximum call depth"));
        }
    }

    // ========== Isolation ==========

    @Nested
    @DisplayName("Runtime isolation")
    class RuntimeIsolation {

        @Test
        @DisplayName("Imports fail at runtime")
        void imports() {
            assertThrows(EvaluationException.class, () -> run("import os\n"));
        }

        @Test
        @DisplayName("Dunder attributes are not reachable")
        void dunder() {
            EvaluationException e = assertThrows(EvaluationException.class, () -> run("x = 'a'.__class__\n"));
            assertTrue(e.getMessage().contains("__class__"));
        }

        @Test
        @DisplayName("Undefined names are reported with their line")
        void undefinedName() {
            EvaluationException e = assertThrows(EvaluationException.class, () -> run("x = 1\ny = open\n"));
            assertEquals(2, e.getLineNum());
        }

        @Test
        @DisplayName("Step budget stops endless loops")
        void stepBudget() throws Exception {
            Interpreter interpreter = new Interpreter(new ExecutionBudget(1_000, Duration.ofMinutes(1)));
            EvaluationException e = assertThrows(EvaluationException.class,
                () -> interpreter.run(SnippetParser.parse("while True:\n    x = 1\n")));
            assertTrue(e.getMessage().contains("Step budget exceeded"));
        }
    }

    @Test
    @DisplayName("Host globals are visible to the snippet")
    void hostGlobals() throws Exception {
        Frame ones = Frame.filled(List.of("A"), 3, 1.0);
        Interpreter interpreter = new Interpreter(ExecutionBudget.unlimited(), Map.of("ones", ones));
        interpreter.run(SnippetParser.parse("x = (ones + 1).rolling(2).sum()\n"));

        Frame x = (Frame) interpreter.global("x");
        assertEquals(4.0, x.get(2, 0));
    }
}
