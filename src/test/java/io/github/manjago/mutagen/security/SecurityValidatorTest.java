package io.github.manjago.mutagen.security;

import io.github.manjago.mutagen.snippet.SnippetParser;
import io.github.manjago.mutagen.snippet.Stmt;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SecurityValidatorTest {

    private SecurityValidator validator;

    @BeforeEach
    void setUp() {
        validator = new SecurityValidator();
    }

    // ========== Imports ==========

    @Nested
    @DisplayName("Imports")
    class Imports {

        @Test
        @DisplayName("import os is rejected")
        void importRejected() {
            ValidationResult result = validator.validate("import os\nx=1");

            assertFalse(result.success());
            assertTrue(result.firstError().contains("Import statement not allowed"));
        }

        @Test
        @DisplayName("from-import is rejected")
        void fromImportRejected() {
            ValidationResult result = validator.validate("from subprocess import call\n");
            assertFalse(result.success());
            assertTrue(result.firstError().contains("from subprocess"));
        }

        @Test
        @DisplayName("Import inside a function is found")
        void nestedImport() {
            ValidationResult result = validator.validate("""
                def f(data):
                    if True:
                        import socket
                    return data
                """);
            assertFalse(result.success());
            assertTrue(result.firstError().contains("line 3"));
        }

        @Test
        @DisplayName("Each imported module is reported")
        void everyModuleReported() {
            assertEquals(2, validator.validate("import os, sys\n").errors().size());
        }
    }

    // ========== Calls ==========

    @Nested
    @DisplayName("Dangerous calls")
    class DangerousCalls {

        @ParameterizedTest
        @DisplayName("Forbidden builtins are rejected")
        @ValueSource(strings = {"eval('1')", "exec('x = 1')", "compile('x', 'f', 'exec')",
            "__import__('os')", "open('/etc/passwd')"})
        void forbiddenCalls(String code) {
            ValidationResult result = validator.validate(code);
            assertFalse(result.success());
            assertTrue(result.firstError().startsWith("Dangerous function call not allowed"));
        }

        @Test
        @DisplayName("Forbidden name called as an attribute is rejected")
        void attributeCall() {
            assertFalse(validator.validate("x = builtins.eval('1')").success());
        }

        @Test
        @DisplayName("Aliasing a forbidden builtin is rejected")
        void reference() {
            ValidationResult result = validator.validate("f = eval\n");
            assertFalse(result.success());
            assertTrue(result.firstError().startsWith("Dangerous function reference"));
        }

        @Test
        @DisplayName("Dunder attribute access is rejected")
        void dunder() {
            ValidationResult result = validator.validate("x = data.__class__\n");
            assertFalse(result.success());
            assertTrue(result.firstError().contains("__class__"));
        }

        @Test
        @DisplayName("Ordinary calls pass")
        void ordinaryCalls() {
            assertTrue(validator.validate("close = data.get('price:close')\nx = close.average(20)\n").success());
        }
    }

    // ========== Look-ahead ==========

    @Nested
    @DisplayName("Shift")
    class Shift {

        @Test
        @DisplayName("Negative shift is rejected")
        void negativeShift() {
            ValidationResult result = validator.validate("close.shift(-1)");

            assertFalse(result.success());
            assertTrue(result.firstError().contains("Negative shift not allowed"));
        }

        @Test
        @DisplayName("Negative shift by keyword is rejected")
        void negativeShiftKeyword() {
            assertFalse(validator.validate("x = close.shift(periods=-5)").success());
        }

        @Test
        @DisplayName("shift(0) is rejected")
        void zeroShift() {
            ValidationResult result = validator.validate("x = close.shift(0)");
            assertFalse(result.success());
            assertTrue(result.firstError().contains("shift(0)"));
        }

        @ParameterizedTest
        @DisplayName("Positive or non-literal lags pass")
        @ValueSource(strings = {"x = close.shift(1)", "x = close.shift(+3)", "x = close.shift(n)", "x = close.shift()"})
        void allowedShift(String code) {
            assertTrue(validator.validate(code).success(), code);
        }

        @Test
        @DisplayName("A plain function named shift is not a lag")
        void plainShift() {
            assertTrue(validator.validate("def shift(x):\n    return x\ny = shift(-1)\n").success());
        }
    }

    // ========== Results ==========

    @Test
    @DisplayName("Unparseable code yields a single syntax error")
    void syntaxError() {
        ValidationResult result = validator.validate("def f(:\n");
        assertFalse(result.success());
        assertEquals(1, result.errors().size());
        assertTrue(result.firstError().startsWith("Syntax error"));
    }

    @ParameterizedTest
    @ValueSource(strings = {"(", "[", "-", "not "})
    @DisplayName("Deeply nested input is a syntax error, not a crash")
    void deepNesting(String opener) {
        String closer = opener.equals("(") ? ")" : opener.equals("[") ? "]" : "";
        String code = "x = " + opener.repeat(20_000) + "1" + closer.repeat(20_000) + "\n";

        ValidationResult result = validator.validate(code);

        assertFalse(result.success());
        assertEquals(1, result.errors().size());
        assertTrue(result.firstError().contains("nested too deeply"), result.firstError());
    }

    @Test
    @DisplayName("All violations are collected in source order")
    void allViolations() throws Exception {
        List<Stmt> body = SnippetParser.parse("""
            import os
            x = close.shift(-2)
            y = eval('1')
            """).body();
        List<PolicyViolation> violations = validator.violations(body);

        assertEquals(3, violations.size());
        assertEquals(List.of(1, 2, 3), violations.stream().map(PolicyViolation::line).toList());
        assertEquals("import", violations.get(0).construct());
    }

    @Test
    @DisplayName("requireValid throws with every error")
    void requireValid() {
        PolicyViolationException e = assertThrows(PolicyViolationException.class,
            () -> validator.requireValid("import os\nimport sys\n"));
        assertEquals(2, e.getErrors().size());
        assertDoesNotThrow(() -> validator.requireValid("x = 1\n"));
    }

    @Test
    @DisplayName("combine keeps every error and warning")
    void combine() {
        ValidationResult merged = ValidationResult.combine(
            ValidationResult.ok(List.of("w1")),
            ValidationResult.failure("e1"),
            ValidationResult.of(List.of("e2"), List.of("w2")));

        assertFalse(merged.success());
        assertEquals(List.of("e1", "e2"), merged.errors());
        assertEquals(List.of("w1", "w2"), merged.warnings());
    }
}
