package com.raditha.unnest.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.raditha.unnest.model.ErrorKind;
import com.raditha.unnest.model.MetricsSnapshot;
import com.raditha.unnest.model.OutcomeFlag;
import com.raditha.unnest.model.RefactoringReport;
import com.raditha.unnest.model.RegionOutcome;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Renders refactoring reports as JSON and CSV for dashboards and historical tracking.
 */
public class MetricsExporter {

    private static final DateTimeFormatter TIMESTAMP_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss");

    private final ObjectMapper mapper;

    public MetricsExporter() {
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Metrics aggregated over every processed unit.
     */
    public record ProjectMetrics(
            String projectName,
            LocalDateTime timestamp,
            int totalUnits,
            int totalRegions,
            int totalApplied,
            int totalNotRefactored,
            double averageDepthReduction,
            double averageConfidence,
            List<UnitMetrics> units) {
    }

    /**
     * Per-unit metrics.
     */
    public record UnitMetrics(
            String identity,
            String dialect,
            int regionCount,
            int appliedCount,
            int lowConfidenceCount,
            int malformedCount,
            int infeasibleCount,
            int exhaustedCount,
            List<String> patterns,
            List<RegionMetrics> regions) {
    }

    /**
     * Per-region metrics. Depths and confidence are null when no candidate was measured.
     */
    public record RegionMetrics(
            Integer startLine,
            Integer endLine,
            String severity,
            String pattern,
            Integer depthBefore,
            Integer depthAfter,
            Double confidence,
            List<String> flags,
            String error,
            String message) {
    }

    public ProjectMetrics buildMetrics(List<RefactoringReport> reports, String projectName) {
        return buildMetrics(reports, projectName, LocalDateTime.now());
    }

    /**
     * Build aggregated metrics from refactoring reports.
     */
    public ProjectMetrics buildMetrics(List<RefactoringReport> reports, String projectName, LocalDateTime timestamp) {
        List<UnitMetrics> units = reports.stream().map(this::buildUnitMetrics).toList();
        List<RegionOutcome> outcomes = reports.stream().flatMap(r -> r.outcomes().stream()).toList();

        int applied = (int) outcomes.stream().filter(RegionOutcome::applied).count();
        double averageReduction = outcomes.stream()
                .filter(RegionOutcome::applied)
                .map(RegionOutcome::metrics)
                .mapToInt(MetricsSnapshot::depthReduction)
                .average()
                .orElse(0.0);
        double averageConfidence = outcomes.stream()
                .map(RegionOutcome::confidence)
                .filter(Objects::nonNull)
                .mapToDouble(Double::doubleValue)
                .average()
                .orElse(0.0);

        return new ProjectMetrics(
                projectName,
                timestamp,
                reports.size(),
                outcomes.size(),
                applied,
                outcomes.size() - applied,
                averageReduction,
                averageConfidence,
                units);
    }

    private UnitMetrics buildUnitMetrics(RefactoringReport report) {
        List<String> patterns = report.getApplied().stream()
                .map(RegionOutcome::patternLabel)
                .distinct()
                .toList();
        int lowConfidence = (int) report.outcomes().stream()
                .filter(o -> o.hasFlag(OutcomeFlag.LOW_CONFIDENCE))
                .count();
        return new UnitMetrics(
                report.source().identity(),
                report.source().dialect().name(),
                report.outcomes().size(),
                report.getApplied().size(),
                lowConfidence,
                (int) report.countErrors(ErrorKind.MALFORMED_STRUCTURE),
                (int) report.countErrors(ErrorKind.TRANSFORM_INFEASIBLE),
                (int) report.countErrors(ErrorKind.VALIDATION_EXHAUSTED),
                patterns,
                report.outcomes().stream().map(MetricsExporter::regionMetrics).toList());
    }

    private static RegionMetrics regionMetrics(RegionOutcome outcome) {
        MetricsSnapshot metrics = outcome.metrics();
        return new RegionMetrics(
                outcome.region() == null ? null : outcome.region().span().startLine(),
                outcome.region() == null ? null : outcome.region().span().endLine(),
                outcome.region() == null ? null : outcome.region().severity().label(),
                outcome.patternLabel(),
                metrics == null ? null : metrics.depthBefore(),
                metrics == null ? null : metrics.depthAfter(),
                outcome.confidence(),
                outcome.flags().stream().map(Enum::name).sorted().toList(),
                outcome.error() == null ? null : outcome.error().name(),
                outcome.message());
    }

    /**
     * Render metrics as JSON.
     */
    public String toJson(ProjectMetrics metrics) throws JsonProcessingException {
        return mapper.writeValueAsString(metrics);
    }

    /**
     * Render a single report as JSON.
     */
    public String toJson(RefactoringReport report) throws JsonProcessingException {
        return mapper.writeValueAsString(buildUnitMetrics(report));
    }

    /**
     * Render metrics as CSV: a summary section followed by one row per region.
     */
    public String toCsv(ProjectMetrics metrics) {
        StringBuilder csv = new StringBuilder();

        // Header - Summary
        csv.append("# Project Summary\n");
        csv.append("timestamp,project,total_units,total_regions,applied,not_refactored,avg_depth_reduction,avg_confidence\n");
        csv.append(String.format(Locale.ROOT, "%s,%s,%d,%d,%d,%d,%.2f,%.3f\n",
                metrics.timestamp().format(TIMESTAMP_FORMAT),
                csvField(metrics.projectName()),
                metrics.totalUnits(),
                metrics.totalRegions(),
                metrics.totalApplied(),
                metrics.totalNotRefactored(),
                metrics.averageDepthReduction(),
                metrics.averageConfidence()));

        csv.append("\n");

        // Header - Per-region metrics
        csv.append("# Per-Region Metrics\n");
        csv.append("unit,dialect,start_line,end_line,severity,pattern,depth_before,depth_after,confidence,flags,error\n");
        for (UnitMetrics unit : metrics.units()) {
            for (RegionMetrics region : unit.regions()) {
                csv.append(String.join(",",
                        csvField(unit.identity()),
                        unit.dialect(),
                        orEmpty(region.startLine()),
                        orEmpty(region.endLine()),
                        orEmpty(region.severity()),
                        region.pattern(),
                        orEmpty(region.depthBefore()),
                        orEmpty(region.depthAfter()),
                        region.confidence() == null ? "" : String.format(Locale.ROOT, "%.3f", region.confidence()),
                        String.join(";", region.flags()),
                        orEmpty(region.error())));
                csv.append("\n");
            }
        }
        return csv.toString();
    }

    private static String orEmpty(Object value) {
        return value == null ? "" : value.toString();
    }

    private static String csvField(String value) {
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }
}
