package com.raditha.unnest.syntax;

import com.raditha.unnest.model.Dialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CodeEmitter} with the brace and Python styles.
 */
class CodeEmitterTest {

    @Test
    void testBraceConditional() {
        CodeEmitter emitter = new CodeEmitter(new BraceStyle(Dialect.JAVA), "    ", "    ", "\n");
        emitter.conditional(0, List.of(
                CodeEmitter.Arm.when("a > 0", level -> emitter.statement(level, "return 1")),
                CodeEmitter.Arm.otherwise(level -> { })));

        assertEquals("""
                if (a > 0) {
                        return 1;
                    } else {
                    }""", emitter.text());
        assertTrue(emitter.block().startsWith("    if (a > 0) {"));
    }

    @Test
    void testPythonConditionalUsesPass() {
        CodeEmitter emitter = new CodeEmitter(new PythonStyle(), "", "    ", "\n");
        emitter.conditional(0, List.of(
                CodeEmitter.Arm.when("x", level -> { }),
                CodeEmitter.Arm.when("y", level -> emitter.statement(level, "return 2")),
                CodeEmitter.Arm.otherwise(level -> emitter.statement(level, "return 1"))));

        assertEquals("if x:\n    pass\nelif y:\n    return 2\nelse:\n    return 1", emitter.text());
    }

    @Test
    void testComments() {
        CodeEmitter java = new CodeEmitter(new BraceStyle(Dialect.JAVA), "", "  ", "\n");
        java.comment(0, "one");
        java.comment(1, "two\nlines");
        assertEquals("/** one */\n  /**\n   * two\n   * lines\n   */", java.text());

        CodeEmitter c = new CodeEmitter(new BraceStyle(Dialect.C), "", "  ", "\n");
        c.comment(0, "note");
        assertEquals("// note", c.text());
    }

    @Test
    void testStylesAndIdentifiers() {
        assertInstanceOf(PythonStyle.class, CodeStyles.forDialect(Dialect.PYTHON));
        assertInstanceOf(BraceStyle.class, CodeStyles.forDialect(Dialect.CSHARP));
        assertThrows(IllegalArgumentException.class, () -> CodeStyles.forDialect(Dialect.GENERIC));
        assertFalse(CodeStyles.supports(Dialect.GENERIC));

        CodeStyle java = CodeStyles.forDialect(Dialect.JAVA);
        assertTrue(java.isValidIdentifier("branch_1"));
        assertFalse(java.isValidIdentifier("class"));
        assertFalse(java.isValidIdentifier("1st"));
        assertFalse(CodeStyles.forDialect(Dialect.PYTHON).isValidIdentifier("lambda"));
    }
}
