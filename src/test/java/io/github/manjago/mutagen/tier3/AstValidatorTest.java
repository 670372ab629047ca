package io.github.manjago.mutagen.tier3;

import io.github.manjago.mutagen.security.ValidationResult;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AstValidatorTest {

    private final AstValidator validator = new AstValidator();

    @Test
    @DisplayName("Clean factor passes")
    void clean() {
        assertTrue(validator.validate("def f(data):\n    return data.get('close') > 1\n").success());
    }

    @Test
    @DisplayName("Security violations are reported")
    void security() {
        ValidationResult result = validator.validate("import os\n");
        assertFalse(result.success());
        assertTrue(result.firstError().contains("Import statement not allowed"));
    }

    @Test
    @DisplayName("Unparseable code is a syntax error")
    void syntax() {
        assertTrue(validator.validate("def f(:\n").firstError().startsWith("Syntax error"));
    }

    @Test
    @DisplayName("Loop whose condition never changes is unbounded")
    void unboundedLoop() {
        ValidationResult result = validator.validate("""
            n = 0
            while n < 10:
                x = 1
            """);
        assertFalse(result.success());
        assertTrue(result.firstError().contains("unbounded while loop (line 2)"));
    }

    @Test
    @DisplayName("Loop updating its condition passes")
    void boundedLoop() {
        assertTrue(validator.validate("""
            n = 0
            while n < 10:
                n = n + 1
            """).success());
    }

    @Test
    @DisplayName("Loop with a break passes")
    void breakLoop() {
        assertTrue(validator.validate("""
            while True:
                if 1 > 0:
                    break
            """).success());
    }

    @Test
    @DisplayName("A break of a nested loop does not bound the outer loop")
    void nestedBreak() {
        assertFalse(validator.validate("""
            while True:
                for i in range(3):
                    break
            """).success());
    }
}
