package com.raditha.unnest.refactoring;

import com.raditha.unnest.config.DetectionConfig;
import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.RefactoringReport;
import com.raditha.unnest.model.SourceUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiffGeneratorTest {

    private DiffGenerator generator;

    @BeforeEach
    void setUp() {
        generator = new DiffGenerator();
    }

    @Test
    void testUnmodifiedReportHasNoDiff() {
        SourceUnit unit = new SourceUnit("Calc.java", Dialect.JAVA, RegionFixtures.GUARD_SAMPLE);
        RefactoringReport report = new RefactoringReport(unit, unit.text(), List.of(), 1, DetectionConfig.defaults());

        assertEquals("", generator.generateUnifiedDiff(report));
    }

    @Test
    void testReportDiff() {
        SourceUnit unit = new SourceUnit("Calc.java", Dialect.JAVA, RegionFixtures.GUARD_SAMPLE);
        RefactoringReport report = new RefactoringReport(unit, RegionFixtures.GUARD_RESULT, List.of(), 1,
                DetectionConfig.defaults());

        String diff = generator.generateUnifiedDiff(report);

        assertTrue(diff.startsWith("--- a/Calc.java\n+++ b/Calc.java\n@@ "));
        assertTrue(diff.contains("-        if (a > 0) {"));
        assertTrue(diff.contains("+        if (!(a > 0)) {"));
    }

    @Test
    void testContextLines() {
        String original = "a\nb\nc\nd\ne\n";
        String revised = "a\nb\nC\nd\ne\n";

        String wide = generator.generateUnifiedDiff("x.txt", original, revised, 3);
        String narrow = generator.generateUnifiedDiff("x.txt", original, revised, 0);

        assertTrue(wide.contains("\n a\n"));
        assertTrue(narrow.contains("-c\n+C"));
        assertFalse(narrow.contains("\n a"));
    }
}
