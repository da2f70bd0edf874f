package com.raditha.unnest.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.raditha.unnest.config.DetectionConfig;
import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.RefactoringReport;
import com.raditha.unnest.model.SourceUnit;
import com.raditha.unnest.workflow.NestingRefactorer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDateTime;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MetricsExporter - CSV and JSON export functionality.
 */
class MetricsExporterTest {

    private static final LocalDateTime WHEN = LocalDateTime.of(2026, 1, 2, 3, 4, 5);

    private static final String NESTED = """
            class Calc {
                int f(int a, int b, int c, int d, int e) {
                    if (a > 0) {
                        if (b > 0) {
                            if (c > 0) {
                                if (d > 0) {
                                    if (e > 0) {
                                        return 1;
                                    }
                                    return 2;
                                }
                                return 3;
                            }
                            return 4;
                        }
                        return 5;
                    }
                    return 6;
                }
            }
            """;

    private static final String FLAT = """
            class Flat {
                int g(int a) {
                    if (a > 0) {
                        return 1;
                    }
                    return 0;
                }
            }
            """;

    private MetricsExporter exporter;
    private List<RefactoringReport> reports;

    @BeforeEach
    void setUp() {
        exporter = new MetricsExporter();
        NestingRefactorer refactorer = new NestingRefactorer(DetectionConfig.defaults());
        reports = List.of(
                refactorer.refactor(new SourceUnit("Calc.java", Dialect.JAVA, NESTED)),
                refactorer.refactor(new SourceUnit("Flat.java", Dialect.JAVA, FLAT)));
    }

    @Test
    void testBuildMetrics() {
        MetricsExporter.ProjectMetrics metrics = exporter.buildMetrics(reports, "demo", WHEN);

        assertEquals("demo", metrics.projectName());
        assertEquals(WHEN, metrics.timestamp());
        assertEquals(2, metrics.totalUnits());
        assertEquals(1, metrics.totalRegions());
        assertEquals(1, metrics.totalApplied());
        assertEquals(0, metrics.totalNotRefactored());
        assertEquals(4.0, metrics.averageDepthReduction(), 1e-9);
        assertEquals(0.85, metrics.averageConfidence(), 1e-9);

        MetricsExporter.UnitMetrics calc = metrics.units().get(0);
        assertEquals("Calc.java", calc.identity());
        assertEquals("JAVA", calc.dialect());
        assertEquals(List.of("guard-clause"), calc.patterns());
        assertEquals(0, metrics.units().get(1).regionCount());
    }

    @Test
    void testEmptyProject() {
        MetricsExporter.ProjectMetrics metrics = exporter.buildMetrics(List.of(), "empty");

        assertEquals(0, metrics.totalRegions());
        assertEquals(0.0, metrics.averageConfidence());
        assertNotNull(metrics.timestamp());
    }

    @Test
    void testJsonExport() throws Exception {
        String json = exporter.toJson(exporter.buildMetrics(reports, "demo", WHEN));

        JsonNode root = new ObjectMapper().readTree(json);
        assertEquals("demo", root.get("projectName").asText());
        assertEquals("2026-01-02T03:04:05", root.get("timestamp").asText());
        assertEquals(1, root.get("totalApplied").asInt());

        JsonNode region = root.get("units").get(0).get("regions").get(0);
        assertEquals("guard-clause", region.get("pattern").asText());
        assertEquals(5, region.get("depthBefore").asInt());
        assertEquals(1, region.get("depthAfter").asInt());
        assertEquals("high", region.get("severity").asText());
        assertTrue(region.get("error").isNull());
    }

    @Test
    void testSingleReportJson() throws Exception {
        JsonNode unit = new ObjectMapper().readTree(exporter.toJson(reports.get(0)));

        assertEquals("Calc.java", unit.get("identity").asText());
        assertEquals(1, unit.get("appliedCount").asInt());
    }

    @Test
    void testCsvExport() {
        String csv = exporter.toCsv(exporter.buildMetrics(reports, "demo", WHEN));
        List<String> lines = csv.lines().toList();

        assertEquals("# Project Summary", lines.get(0));
        assertEquals("2026-01-02T03:04:05,demo,2,1,1,0,4.00,0.850", lines.get(2));
        assertEquals("", lines.get(3));
        assertEquals("# Per-Region Metrics", lines.get(4));
        assertEquals("Calc.java,JAVA,3,17,high,guard-clause,5,1,0.850,,", lines.get(6));
        assertEquals(7, lines.size());
    }

    @Test
    void testCsvQuotesProjectName() {
        String csv = exporter.toCsv(exporter.buildMetrics(reports, "demo, \"beta\"", WHEN));

        assertTrue(csv.contains(",\"demo, \"\"beta\"\"\",2,"));
    }
}
