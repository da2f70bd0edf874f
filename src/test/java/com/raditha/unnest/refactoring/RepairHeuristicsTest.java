package com.raditha.unnest.refactoring;

import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.RefactoringPattern;
import com.raditha.unnest.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link RepairHeuristics}.
 */
class RepairHeuristicsTest {

    private static final String PYTHON_SAMPLE = """
            def check(a, b, c):
                if a:
                    if b is not None:
                        if c in allowed:
                            return True
                return False
            """;

    private RepairHeuristics heuristics;
    private RegionTransformer transformer;
    private RegionContext java;

    @BeforeEach
    void setUp() throws Exception {
        heuristics = new RepairHeuristics();
        transformer = mock(RegionTransformer.class);
        java = RegionFixtures.context(Dialect.JAVA, RegionFixtures.GUARD_SAMPLE);
    }

    private static RefactoringCandidate candidate(RegionContext context, String rewritten, int reverted) {
        return new RefactoringCandidate(RefactoringPattern.GUARD_CLAUSE, context.region().span(), rewritten,
                List.of(), "broken", reverted);
    }

    @Test
    void testClosesOpenBrace() {
        RefactoringCandidate broken = candidate(java, "if (!(a > 0)) {\n            return 6;", 0);

        Optional<RepairHeuristics.Repair> repair = heuristics.repair(broken, ValidationResult.malformed("eof"),
                java, transformer);

        assertTrue(repair.isPresent());
        assertEquals(RepairHeuristics.Heuristic.DELIMITER_BALANCING, repair.get().heuristic());
        RefactoringCandidate fixed = repair.get().candidate();
        assertEquals("if (!(a > 0)) {\n            return 6;\n        }", fixed.rewrittenText());
        assertTrue(fixed.fullText().startsWith("class Calc {"));
        assertTrue(fixed.fullText().contains(fixed.rewrittenText()));
    }

    @Test
    void testDropsStrayCloser() {
        RefactoringCandidate broken = candidate(java, "return 1;\n}", 0);

        RefactoringCandidate fixed = heuristics.balanceDelimiters(broken, java).orElseThrow().candidate();

        assertEquals("return 1;\n", fixed.rewrittenText());
    }

    @Test
    void testBalancedTextIsLeftAlone() {
        assertTrue(heuristics.balanceDelimiters(candidate(java, "if (a) {\n}", 0), java).isEmpty());
        assertTrue(heuristics.insertTrailingColons(candidate(java, "if (a) {\n}", 0), java).isEmpty());
    }

    @Test
    void testInsertsMissingColon() throws Exception {
        RegionContext python = RegionFixtures.context(Dialect.PYTHON, PYTHON_SAMPLE);
        RefactoringCandidate broken = candidate(python, "if not a\n        return False\n    return True", 0);

        Optional<RepairHeuristics.Repair> repair = heuristics.repair(broken, ValidationResult.malformed("colon"),
                python, transformer);

        assertEquals(RepairHeuristics.Heuristic.TRAILING_COLON, repair.orElseThrow().heuristic());
        assertEquals("if not a:\n        return False\n    return True", repair.get().candidate().rewrittenText());
    }

    @Test
    void testRevertsOneMoreLevel() throws Exception {
        RefactoringCandidate produced = candidate(java, "x", 0);
        RefactoringCandidate reverted = candidate(java, "y", 1);
        when(transformer.maxRevertedLevels(java)).thenReturn(2);
        when(transformer.transform(java, 1)).thenReturn(reverted);

        Optional<RepairHeuristics.Repair> repair = heuristics.repair(produced,
                ValidationResult.roundTripFailed("missing", 1, null), java, transformer);

        assertEquals(RepairHeuristics.Heuristic.REVERT_LAST_LEVEL, repair.orElseThrow().heuristic());
        assertSame(reverted, repair.get().candidate());
    }

    @Test
    void testNoRevertPastTheLimit() throws Exception {
        when(transformer.maxRevertedLevels(java)).thenReturn(2);

        Optional<RepairHeuristics.Repair> repair = heuristics.repair(candidate(java, "x", 2),
                ValidationResult.roundTripFailed("missing", 1, null), java, transformer);

        assertTrue(repair.isEmpty());
        verify(transformer, never()).transform(any(), anyInt());
    }

    @Test
    void testRevertFailureGivesNothing() throws Exception {
        when(transformer.maxRevertedLevels(java)).thenReturn(3);
        when(transformer.transform(java, 1)).thenThrow(new TransformInfeasibleException("no"));

        assertTrue(heuristics.repair(candidate(java, "x", 0), ValidationResult.roundTripFailed("missing", 1, null),
                java, transformer).isEmpty());
    }

    @Test
    void testDepthFailureIsNotRepaired() {
        assertTrue(heuristics.repair(candidate(java, "if (a) {", 0),
                ValidationResult.depthNotReduced("depth not reduced", 5, null), java, transformer).isEmpty());
    }
}
