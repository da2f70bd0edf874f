package com.raditha.unnest.refactoring;

import com.raditha.unnest.adapter.MalformedStructureException;
import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.RefactoringPattern;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link GuardClauseTransformer}.
 */
class GuardClauseTransformerTest {

    private GuardClauseTransformer transformer;

    @BeforeEach
    void setUp() {
        transformer = new GuardClauseTransformer();
    }

    @Test
    void testInvertsEveryLevel() throws Exception {
        RegionContext context = RegionFixtures.context(Dialect.JAVA, RegionFixtures.GUARD_SAMPLE);

        assertTrue(transformer.ineligibility(context).isEmpty());
        RefactoringCandidate candidate = transformer.transform(context, 0);

        assertEquals(RefactoringPattern.GUARD_CLAUSE, candidate.pattern());
        assertEquals(RegionFixtures.GUARD_RESULT, candidate.fullText());
        assertTrue(candidate.subroutines().isEmpty());
        assertTrue(candidate.rewrittenText().startsWith("if (!(a > 0)) {"));
        assertTrue(candidate.rewrittenText().endsWith("return 1;"));
    }

    @Test
    void testTrailingReturnIsAbsorbed() throws Exception {
        RegionContext context = RegionFixtures.context(Dialect.JAVA, RegionFixtures.GUARD_SAMPLE);
        RefactoringCandidate candidate = transformer.transform(context, 0);

        int trailing = RegionFixtures.GUARD_SAMPLE.indexOf("return 6;") + "return 6;".length();
        assertEquals(context.region().span().start(), candidate.replacedSpan().start());
        assertEquals(trailing, candidate.replacedSpan().end());
    }

    @Test
    void testRevertedLevelStaysNested() throws Exception {
        RegionContext context = RegionFixtures.context(Dialect.JAVA, RegionFixtures.GUARD_SAMPLE);
        assertEquals(4, transformer.maxRevertedLevels(context));

        String text = transformer.transform(context, 1).fullText();
        assertTrue(text.contains("""
                        if (!(d > 0)) {
                            return 3;
                        }
                        if (e > 0) {
                            return 1;
                        }
                        return 2;
                """));
        assertFalse(text.contains("if (!(e > 0))"));
    }

    @Test
    void testRevertingEverythingIsInfeasible() throws Exception {
        RegionContext context = RegionFixtures.context(Dialect.JAVA, RegionFixtures.GUARD_SAMPLE);
        assertThrows(TransformInfeasibleException.class, () -> transformer.transform(context, 5));
    }

    @Test
    void testElseBranchBecomesTheGuardBody() throws Exception {
        String code = """
                class A {
                    int f(int a, int b, int c) {
                        if (a > 0) {
                            if (b > 0) {
                                if (c > 0) {
                                    return 1;
                                }
                                return 2;
                            }
                            return 3;
                        } else {
                            return -1;
                        }
                    }
                }
                """;
        RegionContext context = RegionFixtures.context(Dialect.JAVA, code);

        assertEquals("""
                if (!(a > 0)) {
                            return -1;
                        }
                        if (!(b > 0)) {
                            return 3;
                        }
                        if (!(c > 0)) {
                            return 2;
                        }
                        return 1;""", transformer.transform(context, 0).rewrittenText());
    }

    @Test
    void testVoidFunctionGetsExplicitReturns() throws Exception {
        String code = """
                class A {
                    void run(int a, int b, int c) {
                        if (a > 0) {
                            if (b > 0) {
                                if (c > 0) {
                                    go();
                                    return;
                                }
                            }
                        }
                    }
                }
                """;
        RegionContext context = RegionFixtures.context(Dialect.JAVA, code);

        assertTrue(transformer.ineligibility(context).isEmpty());
        assertEquals("""
                if (!(a > 0)) {
                            return;
                        }
                        if (!(b > 0)) {
                            return;
                        }
                        if (!(c > 0)) {
                            return;
                        }
                        go();
                        return;""", transformer.transform(context, 0).rewrittenText());
    }

    @Test
    void testFloatingPointComparisonsAreNegatedWhole() throws Exception {
        String code = """
                class A {
                    int f(double a, double b, double c) {
                        if (a < 1.0) {
                            if (b < 1.0) {
                                if (c < 1.0) {
                                    return 1;
                                }
                            }
                        }
                        return 0;
                    }
                }
                """;
        String rewritten = transformer.transform(RegionFixtures.context(Dialect.JAVA, code), 0).rewrittenText();

        assertTrue(rewritten.startsWith("if (!(a < 1.0)) {"), rewritten);
        assertTrue(rewritten.contains("if (!(b < 1.0)) {"), rewritten);
        assertTrue(rewritten.contains("if (!(c < 1.0)) {"), rewritten);
        assertFalse(rewritten.contains(">="), rewritten);
        assertTrue(rewritten.endsWith("return 1;"), rewritten);
    }

    @Test
    void testScriptComparisonsAreNegatedWhole() throws Exception {
        String code = """
                function f(a, b, c) {
                    if (a > 0) {
                        if (b > 0) {
                            if (c > 0) {
                                return 1;
                            }
                        }
                    }
                    return 0;
                }
                """;
        String rewritten = transformer.transform(RegionFixtures.context(Dialect.JAVASCRIPT, code), 0).rewrittenText();

        assertTrue(rewritten.startsWith("if (!(a > 0)) {"), rewritten);
        assertFalse(rewritten.contains("<="), rewritten);
    }

    @Test
    void testIneligibleRegions() throws MalformedStructureException {
        Optional<String> ladder = transformer.ineligibility(
                RegionFixtures.context(Dialect.JAVA, RegionFixtures.LADDER_SAMPLE));
        assertEquals(Optional.of("the chain only continues through else branches"), ladder);

        Optional<String> fallThrough = transformer.ineligibility(
                RegionFixtures.context(Dialect.JAVA, RegionFixtures.EXTRACTION_SAMPLE));
        assertEquals(Optional.of("an innermost branch falls through"), fallThrough);
    }

    @Test
    void testNonTerminalStatementAfterRegion() throws MalformedStructureException {
        String code = """
                class A {
                    int f(int a, int b, int c) {
                        if (a > 0) {
                            if (b > 0) {
                                if (c > 0) {
                                    return 1;
                                }
                            }
                        }
                        a++;
                        return a;
                    }
                }
                """;
        Optional<String> reason = transformer.ineligibility(RegionFixtures.context(Dialect.JAVA, code));
        assertTrue(reason.isPresent());
        assertTrue(reason.get().startsWith("no exit for the"), reason.get());
    }

    @Test
    void testPythonGuards() throws Exception {
        String code = """
                def check(a, b, c):
                    if a:
                        if b is not None:
                            if c in allowed:
                                return True
                    return False
                """;
        RegionContext context = RegionFixtures.context(Dialect.PYTHON, code);

        assertTrue(transformer.ineligibility(context).isEmpty());
        String text = transformer.transform(context, 0).fullText();
        assertTrue(text.contains("    if not a:\n        return False\n"), text);
        assertTrue(text.contains("    if b is None:\n        return False\n"), text);
        assertTrue(text.contains("    if c not in allowed:\n        return False\n"), text);
        assertTrue(text.contains("    return True"), text);
    }
}
