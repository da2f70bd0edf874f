package com.raditha.unnest.adapter;

import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Branch;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the JavaParser based adapter.
 */
class JavaTreeAdapterTest {

    private JavaTreeAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new JavaTreeAdapter();
    }

    @Test
    void testIfElseIfElseIsOneConditional() throws MalformedStructureException {
        String code = """
                class Grades {
                    String grade(int score) {
                        if (score >= 90) {
                            return "A";
                        } else if (score >= 80) {
                            return "B";
                        } else {
                            return "C";
                        }
                    }
                }
                """;
        Block root = adapter.index(code);

        List<Block> conditionals = root.walk().filter(Block::isConditional).toList();
        assertEquals(1, conditionals.size());
        Block conditional = conditionals.get(0);
        assertEquals(3, conditional.branches().size());
        assertEquals("score >= 90", conditional.branches().get(0).condition());
        assertEquals("score >= 80", conditional.branches().get(1).condition());
        assertTrue(conditional.hasTrailingElse());
        assertEquals("if (score >= 90)", conditional.header());
    }

    @Test
    void testStructureAndDepths() throws MalformedStructureException {
        String code = """
                class A {
                    void f(int a) {
                        for (int i = 0; i < a; i++) {
                            if (i > 2) {
                                System.out.println(i);
                            }
                        }
                    }
                }
                """;
        Block root = adapter.index(code);

        assertEquals(BlockKind.BODY, root.kind());
        assertEquals(0, root.depth());
        assertEquals(code.length(), root.span().end());

        Block type = root.children().get(0);
        assertEquals(BlockKind.TYPE, type.kind());
        assertEquals("class A", type.header());

        Block function = type.body().children().get(0);
        assertEquals(BlockKind.FUNCTION, function.kind());
        assertEquals("void f(int a)", function.header());

        Block loop = function.body().children().get(0);
        assertEquals(BlockKind.LOOP, loop.kind());
        Block conditional = loop.body().children().get(0);
        assertTrue(conditional.isConditional());
        assertEquals(3, conditional.depth());

        Block statement = conditional.branches().get(0).body().children().get(0);
        assertEquals(BlockKind.STATEMENT, statement.kind());
        assertEquals("System.out.println(i);", statement.header());
    }

    @Test
    void testSpansAreCharacterOffsets() throws MalformedStructureException {
        String code = """
                class A {
                    void f(boolean b) {
                        if (b) {
                            run();
                        }
                    }
                }
                """;
        Block root = adapter.index(code);
        Block conditional = root.walk().filter(Block::isConditional).findFirst().orElseThrow();

        String source = code.substring(conditional.span().start(), conditional.span().end());
        assertTrue(source.startsWith("if (b) {"));
        assertTrue(source.endsWith("}"));
        assertEquals(3, conditional.span().startLine());
        assertEquals(5, conditional.span().endLine());

        Branch branch = conditional.branches().get(0);
        String body = code.substring(branch.body().span().start(), branch.body().span().end());
        assertEquals("run();", body.strip());
    }

    @Test
    void testUnbracedBranchBecomesSingleStatementBody() throws MalformedStructureException {
        String code = """
                class A {
                    int f(int x) {
                        if (x > 0) return 1;
                        else return 2;
                    }
                }
                """;
        Block conditional = adapter.index(code).walk().filter(Block::isConditional).findFirst().orElseThrow();

        assertEquals(2, conditional.branches().size());
        assertEquals(1, conditional.branches().get(0).body().children().size());
        assertEquals("return 1;", conditional.branches().get(0).body().children().get(0).header());
    }

    @Test
    void testLambdaBodiesAreFunctions() throws MalformedStructureException {
        String code = """
                class A {
                    void f(java.util.List<String> xs) {
                        xs.forEach(x -> {
                            if (x.isEmpty()) {
                                return;
                            }
                        });
                    }
                }
                """;
        Block root = adapter.index(code);

        long functions = root.walk().filter(b -> b.kind() == BlockKind.FUNCTION).count();
        assertEquals(2, functions);
        assertEquals(1, root.walk().filter(Block::isConditional).count());
    }

    @Test
    void testBraceInsideCommentBeforeBodyIsSkipped() throws MalformedStructureException {
        String code = """
                class A /* { */ implements Runnable {
                    public void run() {
                        switch (mode) /* { */ {
                            case 1:
                                go();
                        }
                    }
                }
                """;
        Block root = adapter.index(code);

        Block type = root.children().get(0);
        assertEquals("class A /* { */ implements Runnable", type.header());
        assertEquals(code.indexOf("Runnable {") + "Runnable {".length(), type.body().span().start());
        Block method = type.body().children().get(0);
        assertEquals(BlockKind.FUNCTION, method.kind());
        Block switchBlock = method.body().children().get(0);
        assertEquals("switch (mode) /* { */", switchBlock.header());
        assertEquals(1, switchBlock.body().children().size());
    }

    @Test
    void testUnbalancedBracesAreMalformed() {
        String code = """
                class A {
                    void f(boolean b) {
                        if (b) {
                            run();
                    }
                }
                """;
        MalformedStructureException e = assertThrows(MalformedStructureException.class, () -> adapter.index(code));
        assertTrue(e.getLine() >= 1);
        assertTrue(e.getMessage().contains("(line "));
    }
}
