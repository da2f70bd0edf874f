package com.raditha.unnest.model;

import com.raditha.unnest.config.DetectionConfig;

import java.util.List;

/**
 * Result of processing one source unit: the rewritten text and an ordered outcome per region.
 *
 * @param source        the unit as supplied by the caller
 * @param rewrittenText full text after every applied rewrite
 * @param outcomes      per-region outcomes, ordered by region start offset within each pass
 * @param passes        detection passes actually run
 * @param config        configuration used
 */
public record RefactoringReport(
        SourceUnit source,
        String rewrittenText,
        List<RegionOutcome> outcomes,
        int passes,
        DetectionConfig config) {

    public RefactoringReport {
        outcomes = List.copyOf(outcomes);
    }

    public boolean isModified() {
        return !source.text().equals(rewrittenText);
    }

    public List<RegionOutcome> getApplied() {
        return outcomes.stream().filter(RegionOutcome::applied).toList();
    }

    public List<RegionOutcome> getNotRefactored() {
        return outcomes.stream().filter(o -> !o.applied()).toList();
    }

    public long countErrors(ErrorKind kind) {
        return outcomes.stream().filter(o -> o.error() == kind).count();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "%s: %d regions, %d refactored, %d not refactored (depth threshold: %d)",
                source.identity(),
                outcomes.size(),
                getApplied().size(),
                getNotRefactored().size(),
                config.depthThreshold());
    }

    /**
     * Get detailed report string.
     */
    public String getDetailedReport() {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(80)).append("\n");
        sb.append("NESTED CONDITIONAL REPORT\n");
        sb.append("=".repeat(80)).append("\n\n");

        sb.append("Unit: ").append(source.identity()).append("\n");
        sb.append("Dialect: ").append(source.dialect()).append("\n");
        sb.append("Depth threshold: ").append(config.depthThreshold()).append("\n");
        sb.append("Passes: ").append(passes).append("\n\n");

        sb.append(getSummary()).append("\n\n");

        if (outcomes.isEmpty()) {
            sb.append("No nested conditional regions found.\n");
            return sb.toString();
        }

        for (int i = 0; i < outcomes.size(); i++) {
            RegionOutcome outcome = outcomes.get(i);
            sb.append(String.format("Region #%d - %s%n", i + 1, outcome.patternLabel()));
            if (outcome.region() != null) {
                sb.append("  ").append(outcome.region().formatSummary()).append("\n");
            }
            if (outcome.metrics() != null) {
                MetricsSnapshot m = outcome.metrics();
                sb.append(String.format("  Depth: %d -> %d, branches: %d -> %d, confidence: %s%n",
                        m.depthBefore(), m.depthAfter(), m.branchesBefore(), m.branchesAfter(),
                        m.formatConfidence()));
            }
            if (!outcome.flags().isEmpty()) {
                sb.append("  Flags: ").append(outcome.flags()).append("\n");
            }
            if (outcome.error() != null) {
                sb.append("  Error: ").append(outcome.error()).append(" - ").append(outcome.message()).append("\n");
            }
            sb.append("\n");
        }
        return sb.toString();
    }
}
