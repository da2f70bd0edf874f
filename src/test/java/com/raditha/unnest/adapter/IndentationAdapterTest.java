package com.raditha.unnest.adapter;

import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Dialect;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the indentation tracking adapter.
 */
class IndentationAdapterTest {

    @Test
    void testPythonIfElifElse() throws MalformedStructureException {
        String code = """
                def grade(score):
                    if score >= 90:
                        return "A"
                    elif score >= 80:
                        return "B"
                    else:
                        return "C"
                """;
        Block root = new IndentationAdapter(Dialect.PYTHON).index(code);

        Block function = root.children().get(0);
        assertEquals(BlockKind.FUNCTION, function.kind());
        assertEquals("def grade(score):", function.header());

        Block conditional = function.body().children().get(0);
        assertTrue(conditional.isConditional());
        assertEquals(3, conditional.branches().size());
        assertEquals("score >= 90", conditional.branches().get(0).condition());
        assertEquals("score >= 80", conditional.branches().get(1).condition());
        assertTrue(conditional.hasTrailingElse());
        assertEquals("return \"C\"", conditional.branches().get(2).body().children().get(0).header());
    }

    @Test
    void testBracketsContinueLogicalLines() throws MalformedStructureException {
        String code = """
                if (a and
                        b):
                    x = [1,
                         2]
                    y = 3
                """;
        Block root = new IndentationAdapter(Dialect.PYTHON).index(code);

        Block conditional = root.children().get(0);
        assertTrue(conditional.isConditional());
        List<Block> body = conditional.branches().get(0).body().children();
        assertEquals(2, body.size());
        assertTrue(body.get(0).header().startsWith("x = [1,"));
    }

    @Test
    void testPythonLoopsAndTry() throws MalformedStructureException {
        String code = """
                for item in items:
                    try:
                        process(item)
                    except ValueError:
                        continue
                """;
        Block root = new IndentationAdapter(Dialect.PYTHON).index(code);

        Block loop = root.children().get(0);
        assertEquals(BlockKind.LOOP, loop.kind());
        Block tryBlock = loop.body().children().get(0);
        assertEquals(BlockKind.OTHER, tryBlock.kind());
        assertEquals(2, tryBlock.children().size());
    }

    @Test
    void testGenericHeadersFollowIndentation() throws MalformedStructureException {
        String code = """
                function check(x)
                  if x > 1 then
                    if x > 2 then
                      print(x)
                    end
                  end
                end
                """;
        Block root = new IndentationAdapter(Dialect.GENERIC).index(code);

        Block function = root.children().get(0);
        assertEquals(BlockKind.FUNCTION, function.kind());
        Block outer = function.body().children().get(0);
        assertTrue(outer.isConditional());
        assertEquals("x > 1", outer.branches().get(0).condition());
        Block inner = outer.branches().get(0).body().children().get(0);
        assertTrue(inner.isConditional());
        assertEquals(1, outer.branches().get(0).body().children().size());
    }

    @Test
    void testMixedTabsAndSpacesAreMalformed() {
        String code = "if a:\n    x = 1\nif b:\n\ty = 2\n";
        MalformedStructureException e = assertThrows(MalformedStructureException.class,
                () -> new IndentationAdapter(Dialect.PYTHON).index(code));
        assertEquals(4, e.getLine());
    }

    @Test
    void testUnexpectedIndentIsMalformed() {
        String code = "x = 1\n    y = 2\n";
        assertThrows(MalformedStructureException.class, () -> new IndentationAdapter(Dialect.PYTHON).index(code));
    }

    @Test
    void testMissingColonIsMalformed() {
        String code = "if a\n    x = 1\n";
        assertThrows(MalformedStructureException.class, () -> new IndentationAdapter(Dialect.PYTHON).index(code));
    }

    @Test
    void testUnclosedBracketIsMalformed() {
        assertThrows(MalformedStructureException.class,
                () -> new IndentationAdapter(Dialect.PYTHON).index("x = (1,\n"));
    }

    @Test
    void testAdaptersSelectedByDialect() {
        assertInstanceOf(JavaTreeAdapter.class, DialectAdapters.forDialect(Dialect.JAVA));
        assertInstanceOf(DelimiterAdapter.class, DialectAdapters.forDialect(Dialect.TYPESCRIPT));
        assertInstanceOf(IndentationAdapter.class, DialectAdapters.forDialect(Dialect.PYTHON));
        assertInstanceOf(IndentationAdapter.class, DialectAdapters.forDialect(Dialect.GENERIC));
        assertEquals(Dialect.CSHARP, DialectAdapters.forDialect(Dialect.CSHARP).dialect());
    }
}
