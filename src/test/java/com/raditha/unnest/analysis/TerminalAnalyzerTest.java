package com.raditha.unnest.analysis;

import com.raditha.unnest.adapter.DelimiterAdapter;
import com.raditha.unnest.adapter.IndentationAdapter;
import com.raditha.unnest.adapter.MalformedStructureException;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.Dialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for terminal statement detection.
 */
class TerminalAnalyzerTest {

    @Test
    void testTerminalStatementsAndConditionals() throws MalformedStructureException {
        String code = """
                int f(int a) {
                    if (a > 0) {
                        return 1;
                    } else {
                        throw_error();
                        return 2;
                    }
                    if (a < 0) {
                        return 3;
                    }
                    a++;
                    return a;
                }
                """;
        Block function = new DelimiterAdapter(Dialect.C).index(code).children().get(0);
        List<Block> statements = function.body().children();
        TerminalAnalyzer terminals = new TerminalAnalyzer(Dialect.C);

        assertTrue(terminals.isTerminal(statements.get(0)), "if/else with both branches returning");
        assertFalse(terminals.isTerminal(statements.get(1)), "if without else");
        assertFalse(terminals.isTerminal(statements.get(2)));
        assertTrue(terminals.isTerminal(statements.get(3)));
        assertTrue(terminals.endsTerminal(function.body()));
        assertTrue(terminals.containsExit(statements.get(1)));
        assertTrue(terminals.containsReturn(function));
    }

    @Test
    void testPythonRaiseIsTerminal() throws MalformedStructureException {
        Block root = new IndentationAdapter(Dialect.PYTHON).index("raise ValueError('x')\n");
        assertTrue(new TerminalAnalyzer(Dialect.PYTHON).isTerminal(root.children().get(0)));
        assertFalse(new TerminalAnalyzer(Dialect.C).isTerminal(root.children().get(0)));
    }

    @Test
    void testNestedFunctionsDoNotCount() throws MalformedStructureException {
        String code = """
                function outer(xs) {
                  xs.map(function (x) {
                    return x * 2
                  })
                }
                """;
        Block function = new DelimiterAdapter(Dialect.JAVASCRIPT).index(code).children().get(0);
        assertFalse(new TerminalAnalyzer(Dialect.JAVASCRIPT).containsReturn(function.body()));
    }

    @Test
    void testLeadingWord() {
        assertEquals("return", TerminalAnalyzer.leadingWord("  return x;"));
        assertEquals("", TerminalAnalyzer.leadingWord("(x)"));
    }
}
