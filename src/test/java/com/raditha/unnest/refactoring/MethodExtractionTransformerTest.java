package com.raditha.unnest.refactoring;

import com.raditha.unnest.adapter.MalformedStructureException;
import com.raditha.unnest.config.DetectionConfig;
import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.ExtractedSubroutine;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.suggestion.Suggestion;
import com.raditha.unnest.suggestion.SuggestionProvider;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link MethodExtractionTransformer}.
 */
class MethodExtractionTransformerTest {

    private final MethodExtractionTransformer transformer = new MethodExtractionTransformer();

    private static RegionContext withSuggestion(String code, Suggestion suggestion) throws MalformedStructureException {
        SuggestionProvider provider = (fingerprint, ordinal) -> Optional.of(suggestion);
        return RegionFixtures.context(Dialect.JAVA, code, DetectionConfig.defaults(), provider);
    }

    @Test
    void testExtractsBranchBody() throws Exception {
        RegionContext context = RegionFixtures.context(Dialect.JAVA, RegionFixtures.EXTRACTION_SAMPLE);

        assertTrue(transformer.ineligibility(context).isEmpty());
        RefactoringCandidate candidate = transformer.transform(context, 0);

        assertEquals(RegionFixtures.EXTRACTION_RESULT, candidate.fullText());
        assertEquals(1, candidate.subroutines().size());

        ExtractedSubroutine sub = candidate.subroutines().get(0);
        assertEquals("branch_1", sub.name());
        assertEquals(1, sub.branchOrdinal());
        assertEquals(List.of("flag", "name", "count"), sub.parameters());
        assertFalse(sub.suggested());
        assertTrue(sub.insertionOffset() > context.region().span().end());
        assertEquals(context.region().span().start(), candidate.rewrittenStart());
    }

    @Test
    void testSuggestedNameAndComment() throws Exception {
        RegionContext context = withSuggestion(RegionFixtures.EXTRACTION_SAMPLE,
                new Suggestion("recordEmptyName", "Records names that are empty."));
        RefactoringCandidate candidate = transformer.transform(context, 0);

        ExtractedSubroutine sub = candidate.subroutines().get(0);
        assertEquals("recordEmptyName", sub.name());
        assertTrue(sub.suggested());
        assertTrue(candidate.rewrittenText().contains("recordEmptyName(flag, name, count);"));
        assertTrue(candidate.fullText().contains("""
                    /** Records names that are empty. */
                    private void recordEmptyName(boolean flag, String name, int count) {
                """));
    }

    @Test
    void testUnusableSuggestionsFallBackToPlaceholders() throws Exception {
        assertEquals("branch_1", transformer.transform(
                withSuggestion(RegionFixtures.EXTRACTION_SAMPLE, Suggestion.named("class")), 0)
                .subroutines().get(0).name());
        assertEquals("branch_1", transformer.transform(
                withSuggestion(RegionFixtures.EXTRACTION_SAMPLE, Suggestion.named("process")), 0)
                .subroutines().get(0).name());
        assertFalse(transformer.transform(
                withSuggestion(RegionFixtures.EXTRACTION_SAMPLE, Suggestion.named("total")), 0)
                .subroutines().get(0).suggested());
    }

    @Test
    void testTerminalBranchReturnsTheCall() throws Exception {
        String code = """
                class Pricing {
                    int price(int base, boolean member, boolean sale) {
                        if (base > 0) {
                            if (member) {
                                if (sale) {
                                    return base / 2;
                                }
                                return base - 1;
                            }
                            return base;
                        }
                        return 0;
                    }
                }
                """;
        RefactoringCandidate candidate = transformer.transform(RegionFixtures.context(Dialect.JAVA, code), 0);

        assertEquals("""
                if (base > 0) {
                            return branch_1(member, sale, base);
                        }""", candidate.rewrittenText());
        assertTrue(candidate.fullText().contains(
                "    private int branch_1(boolean member, boolean sale, int base) {\n"));
    }

    @Test
    void testStaticAndThrowsAreCarried() throws Exception {
        String code = """
                class Loader {
                    static void load(String path, boolean strict, int retries) throws IOException {
                        if (path != null) {
                            if (strict) {
                                if (retries > 0) {
                                    read(path, retries);
                                }
                            }
                        }
                    }
                }
                """;
        RefactoringCandidate candidate = transformer.transform(RegionFixtures.context(Dialect.JAVA, code), 0);
        assertTrue(candidate.fullText().contains(
                "private static void branch_1(boolean strict, int retries, String path) throws IOException {"),
                candidate.fullText());
    }

    @Test
    void testAssignedParameterIsInfeasible() throws MalformedStructureException {
        String code = """
                class A {
                    void f(int a, int b, int c) {
                        if (a > 0) {
                            if (b > 0) {
                                if (c > 0) {
                                    b = 0;
                                }
                            }
                        }
                    }
                }
                """;
        assertEquals(Optional.of("branch 1 assigns 'b', which it would receive as a parameter"),
                transformer.ineligibility(RegionFixtures.context(Dialect.JAVA, code)));
    }

    @Test
    void testBranchKeepingDeepChainIsInfeasible() throws MalformedStructureException {
        String code = """
                class A {
                    void f(int a, int b, int c, int d, int e) {
                        if (a > 0) {
                            if (b > 0) {
                                if (c > 0) {
                                    if (d > 0) {
                                        if (e > 0) {
                                            go(e);
                                        }
                                    }
                                }
                            }
                        }
                    }
                }
                """;
        RegionContext context = RegionFixtures.context(Dialect.JAVA, code);

        assertEquals(Optional.of("branch 1 keeps a chain of depth 4 (threshold 3)"), transformer.ineligibility(context));
        assertThrows(TransformInfeasibleException.class, () -> transformer.transform(context, 0));
    }

    @Test
    void testBreakOutOfEnclosingLoopIsInfeasible() throws MalformedStructureException {
        String code = """
                class A {
                    void f(int a, int b, int c) {
                        while (true) {
                            if (a > 0) {
                                if (b > 0) {
                                    if (c > 0) {
                                        go();
                                    }
                                }
                                break;
                            }
                        }
                    }
                }
                """;
        assertEquals(Optional.of("branch 1 leaves an enclosing loop or switch"),
                transformer.ineligibility(RegionFixtures.context(Dialect.JAVA, code)));
        assertEquals(0, transformer.maxRevertedLevels(RegionFixtures.context(Dialect.JAVA, code)));
    }

    @Test
    void testEachBranchGetsItsOwnSubroutine() throws Exception {
        String code = """
                class A {
                    void f(int a, int b) {
                        if (a > 0) {
                            if (b > 0) {
                                if (a > b) {
                                    up(a);
                                }
                            }
                        } else {
                            down(b);
                        }
                    }
                }
                """;
        RegionContext context = RegionFixtures.context(Dialect.JAVA, code);
        assertEquals(1, transformer.maxRevertedLevels(context));

        RefactoringCandidate both = transformer.transform(context, 0);
        assertEquals(List.of("branch_1", "branch_2"), both.subroutines().stream().map(ExtractedSubroutine::name).toList());
        assertTrue(both.rewrittenText().contains("} else {"));
        assertTrue(both.rewrittenText().contains("branch_2(b);"));

        RefactoringCandidate reverted = transformer.transform(context, 1);
        assertEquals(1, reverted.subroutines().size());
        assertTrue(reverted.rewrittenText().contains("down(b);"));
    }

    @Test
    void testPythonTopLevelSubroutineGoesFirst() throws Exception {
        String code = """
                import sys

                if len(sys.argv) > 1:
                    if sys.argv[1] == "run":
                        if verbose:
                            print("running")
                """;
        RefactoringCandidate candidate = transformer.transform(RegionFixtures.context(Dialect.PYTHON, code), 0);

        assertEquals("if len(sys.argv) > 1:\n    branch_1()", candidate.rewrittenText());
        String text = candidate.fullText();
        assertTrue(text.contains("""
                def branch_1():
                    if sys.argv[1] == "run":
                        if verbose:
                            print("running")
                """), text);
        assertTrue(text.indexOf("def branch_1():") < text.indexOf("if len(sys.argv) > 1:"));
        assertTrue(candidate.rewrittenStart() > context(code).region().span().start());
    }

    private static RegionContext context(String python) throws MalformedStructureException {
        return RegionFixtures.context(Dialect.PYTHON, python);
    }
}
