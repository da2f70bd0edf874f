package com.raditha.unnest.refactoring;

import com.raditha.unnest.adapter.DialectAdapters;
import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.ExtractedSubroutine;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.RefactoringPattern;
import com.raditha.unnest.model.Span;
import com.raditha.unnest.model.ValidationResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for {@link CandidateValidator}.
 */
class CandidateValidatorTest {

    private static final String PREFIX = "class A {\n    void f(int a, int b, int c, int d) {\n        ";

    private CandidateValidator validator;

    @BeforeEach
    void setUp() {
        validator = new CandidateValidator(DialectAdapters.forDialect(Dialect.JAVA));
    }

    private static RefactoringCandidate candidate(String rewritten, String extra, List<ExtractedSubroutine> subs) {
        String full = PREFIX + rewritten + "\n    }\n" + extra + "}\n";
        Span span = new Span(PREFIX.length(), PREFIX.length() + rewritten.length(), 3, 3);
        return new RefactoringCandidate(RefactoringPattern.METHOD_EXTRACTION, span, rewritten, subs, full, 0);
    }

    @Test
    void testAcceptsFlatGuards() throws Exception {
        RegionContext context = RegionFixtures.context(Dialect.JAVA, RegionFixtures.GUARD_SAMPLE);
        RefactoringCandidate candidate = new GuardClauseTransformer().transform(context, 0);

        ValidationResult result = validator.validate(candidate, 5, 3);

        assertTrue(result.valid());
        assertEquals(ValidationResult.Failure.NONE, result.failure());
        assertEquals(1, result.depthAfter());
        assertNotNull(result.reindexed());
        assertNull(result.error());
    }

    @Test
    void testMalformedText() {
        RefactoringCandidate candidate = candidate("if (a > 0) { go();", "", List.of());

        ValidationResult result = validator.validate(candidate, 5, 3);

        assertFalse(result.valid());
        assertEquals(ValidationResult.Failure.MALFORMED_STRUCTURE, result.failure());
        assertEquals(-1, result.depthAfter());
        assertNull(result.reindexed());
    }

    @Test
    void testDepthNotReduced() {
        RefactoringCandidate candidate = candidate(
                "if (a > 0) { if (b > 0) { if (c > 0) { if (d > 0) { go(); } } } }", "", List.of());

        ValidationResult result = validator.validate(candidate, 5, 3);

        assertEquals(ValidationResult.Failure.DEPTH_NOT_REDUCED, result.failure());
        assertEquals("depth not reduced: 5 -> 4 (threshold 3)", result.error());
        assertEquals(4, result.depthAfter());
    }

    @Test
    void testSubroutineNotDeclared() {
        ExtractedSubroutine helper = new ExtractedSubroutine("helper", 1, List.of("a"), "", 0, false);
        RefactoringCandidate candidate = candidate("if (a > 0) { helper(a); }", "", List.of(helper));

        ValidationResult result = validator.validate(candidate, 5, 3);

        assertEquals(ValidationResult.Failure.EXTRACTION_ROUND_TRIP, result.failure());
        assertEquals("subroutine helper is not declared", result.error());
        assertFalse(result.extractionRoundTrip());
    }

    @Test
    void testSubroutineNeverCalled() {
        ExtractedSubroutine helper = new ExtractedSubroutine("helper", 1, List.of("a"), "", 0, false);
        RefactoringCandidate candidate = candidate("if (a > 0) { run(a); }",
                "    private void helper(int a) {\n    }\n", List.of(helper));

        ValidationResult result = validator.validate(candidate, 5, 3);

        assertEquals(ValidationResult.Failure.EXTRACTION_ROUND_TRIP, result.failure());
        assertEquals("subroutine helper is never called", result.error());
    }

    @Test
    void testSubroutineKeepingDeepChain() {
        ExtractedSubroutine helper = new ExtractedSubroutine("helper", 1, List.of("b", "c", "d"), "", 0, false);
        RefactoringCandidate candidate = candidate("if (a > 0) { helper(b, c, d); }",
                "    private void helper(int b, int c, int d) {\n"
                        + "        if (b > 0) { if (c > 0) { if (d > 0) { go(); } } }\n"
                        + "    }\n", List.of(helper));

        ValidationResult result = validator.validate(candidate, 4, 3);

        assertFalse(result.valid());
        assertEquals(ValidationResult.Failure.DEPTH_NOT_REDUCED, result.failure());
        assertEquals("depth not reduced: subroutine helper keeps a chain of depth 3 (threshold 3)", result.error());
        assertEquals(1, result.depthAfter());
    }

    @Test
    void testExtractionRoundTrip() throws Exception {
        RegionContext context = RegionFixtures.context(Dialect.JAVA, RegionFixtures.EXTRACTION_SAMPLE);
        RefactoringCandidate candidate = new MethodExtractionTransformer().transform(context, 0);

        ValidationResult result = validator.validate(candidate, 3, 3);

        assertTrue(result.valid(), result.error());
        assertTrue(result.extractionRoundTrip());
    }
}
