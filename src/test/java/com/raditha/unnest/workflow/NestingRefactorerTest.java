package com.raditha.unnest.workflow;

import com.raditha.unnest.adapter.MalformedStructureException;
import com.raditha.unnest.config.DetectionConfig;
import com.raditha.unnest.model.ConditionalRegion;
import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.ErrorKind;
import com.raditha.unnest.model.OutcomeFlag;
import com.raditha.unnest.model.RefactoringPattern;
import com.raditha.unnest.model.RefactoringReport;
import com.raditha.unnest.model.RegionOutcome;
import com.raditha.unnest.model.SourceUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link NestingRefactorer}.
 */
class NestingRefactorerTest {

    private NestingRefactorer refactorer;

    @BeforeEach
    void setUp() {
        refactorer = new NestingRefactorer(DetectionConfig.defaults());
    }

    @Test
    void testGuardClauses() {
        SourceUnit unit = new SourceUnit("Calc.java", Dialect.JAVA, WorkflowSamples.GUARDS);

        RefactoringReport report = refactorer.refactor(unit);

        assertTrue(report.isModified());
        assertEquals(WorkflowSamples.GUARDS_RESULT, report.rewrittenText());
        assertEquals(WorkflowSamples.GUARDS, report.source().text());
        assertEquals(1, report.getApplied().size());
        assertEquals(1, report.passes());
        assertEquals("Calc.java: 1 regions, 1 refactored, 0 not refactored (depth threshold: 3)",
                report.getSummary());
    }

    @Test
    void testPythonGuardClauses() {
        RefactoringReport report = refactorer.refactor(new SourceUnit("check.py", Dialect.PYTHON,
                WorkflowSamples.PYTHON));

        assertEquals(RefactoringPattern.GUARD_CLAUSE, report.outcomes().get(0).pattern());
        assertTrue(report.rewrittenText().contains("""
                    if not a:
                        return False
                    if b is None:
                        return False
                    if c not in allowed:
                        return False
                    return True
                """), report.rewrittenText());
    }

    @Test
    void testNothingToDo() {
        SourceUnit unit = new SourceUnit("Flat.java", Dialect.JAVA, WorkflowSamples.FLAT);

        RefactoringReport report = refactorer.refactor(unit);

        assertFalse(report.isModified());
        assertTrue(report.outcomes().isEmpty());
        assertEquals(1, report.passes());
        assertTrue(report.getDetailedReport().contains("No nested conditional regions found."));
    }

    @Test
    void testMalformedUnit() {
        String broken = "class A {\n    void f() {\n        if (a) {\n    }\n";
        SourceUnit unit = new SourceUnit("A.java", Dialect.JAVA, broken);

        RefactoringReport report = refactorer.refactor(unit);

        assertEquals(1, report.outcomes().size());
        RegionOutcome outcome = report.outcomes().get(0);
        assertEquals(ErrorKind.MALFORMED_STRUCTURE, outcome.error());
        assertNull(outcome.region());
        String message = outcome.message();
        assertTrue(message.contains("(line "), message);
        assertEquals(message.indexOf("(line "), message.lastIndexOf("(line "), message);
        assertEquals(broken, report.rewrittenText());
        assertThrows(MalformedStructureException.class, () -> refactorer.detect(unit));
    }

    @Test
    void testBrokenFunctionLeavesSiblingsRefactorable() {
        String broken = """
                int f(int a) {
                    if (a > 0) {
                        return 1;
                    return 0;
                }

                """;
        String valid = """
                int g(int a, int b, int c) {
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

        RefactoringReport report = refactorer.refactor(new SourceUnit("units.c", Dialect.C, broken + valid));

        assertEquals(2, report.outcomes().size());
        RegionOutcome malformed = report.outcomes().get(0);
        assertEquals(ErrorKind.MALFORMED_STRUCTURE, malformed.error());
        assertNull(malformed.region());
        assertTrue(malformed.message().endsWith("(line 1)"), malformed.message());

        RegionOutcome flattened = report.outcomes().get(1);
        assertTrue(flattened.applied());
        assertEquals(RefactoringPattern.GUARD_CLAUSE, flattened.pattern());
        assertEquals(8, flattened.region().span().startLine());

        String text = report.rewrittenText();
        assertTrue(text.startsWith(broken), text);
        String rewritten = text.substring(broken.length());
        assertTrue(rewritten.contains("if (!(a > 0)) {"), rewritten);
        assertFalse(rewritten.contains("if (b > 0)"), rewritten);
    }

    @Test
    void testBrokenPythonFunctionLeavesSiblingsRefactorable() {
        String broken = """
                def f(a):
                    if a:
                        return 1
                  return 0

                """;
        String valid = """
                def g(a, b, c):
                    if a:
                        if b:
                            if c:
                                return 1
                    return 0
                """;

        RefactoringReport report = refactorer.refactor(new SourceUnit("units.py", Dialect.PYTHON, broken + valid));

        assertEquals(2, report.outcomes().size());
        assertEquals(ErrorKind.MALFORMED_STRUCTURE, report.outcomes().get(0).error());
        assertTrue(report.outcomes().get(0).message().endsWith("(line 4)"), report.outcomes().get(0).message());
        assertTrue(report.outcomes().get(1).applied());
        assertTrue(report.rewrittenText().startsWith(broken));
        assertTrue(report.rewrittenText().contains("    if not a:\n"), report.rewrittenText());
    }

    @Test
    void testDetectOnly() throws Exception {
        List<ConditionalRegion> regions = refactorer.detect(
                new SourceUnit("Calc.java", Dialect.JAVA, WorkflowSamples.GUARDS));

        assertEquals(1, regions.size());
        assertEquals(3, regions.get(0).maxDepth());
    }

    @Test
    void testRegionInsideRewrittenRangeIsSkipped() {
        RefactoringReport report = refactorer.refactor(new SourceUnit("Overlap.java", Dialect.JAVA, WorkflowSamples.OVERLAP));

        assertEquals(2, report.outcomes().size());
        RegionOutcome first = report.outcomes().get(0);
        assertTrue(first.applied());
        assertEquals(RefactoringPattern.METHOD_EXTRACTION, first.pattern());

        RegionOutcome second = report.outcomes().get(1);
        assertFalse(second.applied());
        assertTrue(second.hasFlag(OutcomeFlag.OVERLAPS_REWRITTEN_REGION));
        assertEquals("range already rewritten by an earlier region", second.message());
        assertTrue(report.rewrittenText().contains("private void branch_1("));
    }

    @Test
    void testSecondPassFlattensSkippedRegion() {
        NestingRefactorer twoPass = new NestingRefactorer(DetectionConfig.defaults().withMaxPasses(2));

        RefactoringReport report = twoPass.refactor(new SourceUnit("Overlap.java", Dialect.JAVA, WorkflowSamples.OVERLAP));

        assertEquals(2, report.passes());
        assertEquals(3, report.outcomes().size());
        assertEquals(2, report.getApplied().size());
        assertTrue(report.outcomes().get(1).hasFlag(OutcomeFlag.OVERLAPS_REWRITTEN_REGION));
        assertTrue(report.rewrittenText().contains("branch_2(x);"));
        assertTrue(report.rewrittenText().contains("private void branch_2(int x) {"));
    }

    @Test
    void testSinglePassStopsAfterFirstRewrite() {
        RefactoringReport report = refactorer.refactor(new SourceUnit("Overlap.java", Dialect.JAVA, WorkflowSamples.OVERLAP));

        assertEquals(1, report.passes());
        assertEquals(1, report.getApplied().size());
        assertFalse(report.rewrittenText().contains("branch_2"));
    }

    @Test
    void testExtractedSubroutinesHoldNoReportableChain() throws MalformedStructureException {
        RefactoringReport report = refactorer.refactor(new SourceUnit("Overlap.java", Dialect.JAVA, WorkflowSamples.OVERLAP));

        List<ConditionalRegion> again = refactorer.detect(report.source().withText(report.rewrittenText()));

        // only the loop chain that was skipped as overlapping remains
        assertEquals(1, again.size());
        assertTrue(report.rewrittenText().substring(again.get(0).span().start()).startsWith("if (x > 0)"));
    }
}
