package com.raditha.unnest.refactoring;

import com.raditha.unnest.adapter.DialectAdapters;
import com.raditha.unnest.analysis.BlockIndex;
import com.raditha.unnest.config.DetectionConfig;
import com.raditha.unnest.metrics.MetricsComparator;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.ConditionalRegion;
import com.raditha.unnest.model.ErrorKind;
import com.raditha.unnest.model.MetricsSnapshot;
import com.raditha.unnest.model.OutcomeFlag;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.RefactoringPattern;
import com.raditha.unnest.model.RegionOutcome;
import com.raditha.unnest.model.SourceUnit;
import com.raditha.unnest.suggestion.SuggestionProvider;
import com.raditha.unnest.syntax.CodeStyles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumSet;
import java.util.Set;

/**
 * Runs one region through selection, transformation, validation and scoring.
 * <p>
 * Failures of any kind end up in the region's outcome. The engine holds no per-unit state
 * and can be shared between threads.
 */
public class RefactoringEngine {

    private static final Logger logger = LoggerFactory.getLogger(RefactoringEngine.class);

    private final DetectionConfig config;
    private final SuggestionProvider suggestions;
    private final PatternSelector selector;
    private final RepairHeuristics heuristics;
    private final MetricsComparator metrics;

    public RefactoringEngine(DetectionConfig config, SuggestionProvider suggestions) {
        this(config, suggestions, new PatternSelector());
    }

    public RefactoringEngine(DetectionConfig config, SuggestionProvider suggestions, PatternSelector selector) {
        this.config = config;
        this.suggestions = suggestions;
        this.selector = selector;
        this.heuristics = new RepairHeuristics();
        this.metrics = new MetricsComparator();
    }

    /**
     * Outcome of one region.
     *
     * @param outcome   the report entry
     * @param applied   the accepted candidate when it was applied, otherwise null
     * @param reindexed block tree of the applied candidate's text, otherwise null
     */
    public record RegionResult(RegionOutcome outcome, RefactoringCandidate applied, Block reindexed) {

        public boolean isApplied() {
            return applied != null;
        }

        static RegionResult notApplied(RegionOutcome outcome) {
            return new RegionResult(outcome, null, null);
        }
    }

    /**
     * Refactor one region of the current unit text.
     *
     * @param unit     the unit with its current text
     * @param tree     block tree of the current text
     * @param index    parent links of the tree
     * @param region   the region located in the current text
     * @param reported the region as originally detected, which the outcome refers to
     */
    public RegionResult refactorRegion(SourceUnit unit, Block tree, BlockIndex index, ConditionalRegion region,
            ConditionalRegion reported) {
        if (!CodeStyles.supports(unit.dialect())) {
            return RegionResult.notApplied(RegionOutcome.failed(reported, null, ErrorKind.TRANSFORM_INFEASIBLE,
                    "no rendering syntax for dialect " + unit.dialect(), 0));
        }

        RefactoringPattern pattern = null;
        try {
            // 1. pick and apply a pattern
            RegionContext context = RegionContext.of(unit, tree, index, region, suggestions, config);
            RegionTransformer transformer = selector.select(context);
            pattern = transformer.pattern();
            RefactoringCandidate produced = transformer.transform(context, 0);

            // 2. validate, repairing where possible
            ValidationLoop loop = new ValidationLoop(
                    new CandidateValidator(DialectAdapters.forDialect(unit.dialect())), heuristics);
            ValidationLoop.Result result = loop.run(produced, context, transformer);
            if (!result.accepted()) {
                logger.warn("Rejected {} candidate for {} in {}: {}", pattern.tag(), reported.formatSummary(),
                        unit.identity(), result.reason());
                return RegionResult.notApplied(RegionOutcome.failed(reported, pattern,
                        ErrorKind.VALIDATION_EXHAUSTED, result.reason(), result.repairAttempts()));
            }

            // 3. score it
            RefactoringCandidate candidate = result.candidate();
            MetricsSnapshot snapshot = metrics.compare(region, candidate, result.validation().reindexed(),
                    result.repairAttempts());
            Set<OutcomeFlag> flags = EnumSet.noneOf(OutcomeFlag.class);
            if (result.repairAttempts() > 0) {
                flags.add(OutcomeFlag.REPAIRED);
            }
            if (candidate.subroutines().stream().anyMatch(s -> s.suggested())) {
                flags.add(OutcomeFlag.SUGGESTION_APPLIED);
            }
            if (snapshot.confidence() < config.acceptanceConfidence()) {
                logger.warn("Low confidence {} for {} candidate in {}, left unapplied", snapshot.formatConfidence(),
                        pattern.tag(), unit.identity());
                return RegionResult.notApplied(RegionOutcome.lowConfidence(reported, pattern, snapshot, flags,
                        result.repairAttempts(), candidate.rewrittenText()));
            }
            logger.debug("Applied {} to {}: depth {} -> {}", pattern.tag(), reported.formatSummary(),
                    snapshot.depthBefore(), snapshot.depthAfter());
            return new RegionResult(
                    RegionOutcome.applied(reported, pattern, snapshot, flags, result.repairAttempts()),
                    candidate,
                    result.validation().reindexed());
        } catch (TransformInfeasibleException e) {
            logger.debug("No safe rewrite for {}: {}", reported.formatSummary(), e.getMessage());
            return RegionResult.notApplied(RegionOutcome.failed(reported, pattern, ErrorKind.TRANSFORM_INFEASIBLE,
                    e.getMessage(), 0));
        } catch (RuntimeException e) {
            logger.warn("Unexpected failure on {} in {}", reported.formatSummary(), unit.identity(), e);
            return RegionResult.notApplied(RegionOutcome.failed(reported, pattern, ErrorKind.TRANSFORM_INFEASIBLE,
                    "unexpected failure: " + e.getMessage(), 0));
        }
    }

    public DetectionConfig getConfig() {
        return config;
    }
}
