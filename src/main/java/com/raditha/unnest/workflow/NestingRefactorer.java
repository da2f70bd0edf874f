package com.raditha.unnest.workflow;

import com.raditha.unnest.adapter.DialectAdapter;
import com.raditha.unnest.adapter.DialectAdapters;
import com.raditha.unnest.adapter.MalformedStructureException;
import com.raditha.unnest.analysis.BlockIndex;
import com.raditha.unnest.analysis.ChainMeasure;
import com.raditha.unnest.config.DetectionConfig;
import com.raditha.unnest.detection.NestedConditionalDetector;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.ConditionalRegion;
import com.raditha.unnest.model.ErrorKind;
import com.raditha.unnest.model.ExtractedSubroutine;
import com.raditha.unnest.model.OutcomeFlag;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.RefactoringReport;
import com.raditha.unnest.model.RegionOutcome;
import com.raditha.unnest.model.SourceUnit;
import com.raditha.unnest.refactoring.RefactoringEngine;
import com.raditha.unnest.suggestion.SuggestionProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Processes one source unit: detects regions, rewrites them one after another on the evolving
 * text, and repeats on the result while passes remain and something changed.
 * <p>
 * The source unit is never modified. A region whose range was already rewritten by an earlier
 * region in the same pass is skipped and flagged.
 */
public class NestingRefactorer {

    private static final Logger logger = LoggerFactory.getLogger(NestingRefactorer.class);

    private final DetectionConfig config;
    private final RefactoringEngine engine;

    public NestingRefactorer(DetectionConfig config) {
        this(config, SuggestionProvider.none());
    }

    public NestingRefactorer(DetectionConfig config, SuggestionProvider suggestions) {
        this(config, new RefactoringEngine(config, suggestions));
    }

    public NestingRefactorer(DetectionConfig config, RefactoringEngine engine) {
        this.config = config;
        this.engine = engine;
    }

    /**
     * A change to the text: {@code removed} characters at {@code offset} replaced by
     * {@code inserted} characters.
     */
    private record Edit(int offset, int removed, int inserted) {
    }

    /**
     * Detect regions without rewriting anything.
     *
     * @throws MalformedStructureException when the unit cannot be indexed
     */
    public List<ConditionalRegion> detect(SourceUnit unit) throws MalformedStructureException {
        Block tree = DialectAdapters.forDialect(unit.dialect()).index(unit.text());
        return new NestedConditionalDetector(config, unit.dialect()).detect(tree);
    }

    /**
     * Text reached after some passes.
     */
    private record Progress(String text, int passes) {
    }

    /**
     * Refactor a unit and report every region.
     * <p>
     * A unit that does not index as a whole is split into its top-level declarations. Each one
     * is refactored on its own, and the ones that still do not index are reported as malformed.
     */
    public RefactoringReport refactor(SourceUnit unit) {
        List<RegionOutcome> outcomes = new ArrayList<>();
        Progress progress;
        try {
            progress = run(unit, unit.text(), outcomes);
        } catch (MalformedStructureException e) {
            logger.warn("Cannot index {}: {}", unit.identity(), e.getMessage());
            progress = runByDeclaration(unit, e, outcomes);
        }

        RefactoringReport report = new RefactoringReport(unit, progress.text(), outcomes, progress.passes(), config);
        logger.info(report.getSummary());
        return report;
    }

    /**
     * The pass loop over one text.
     *
     * @throws MalformedStructureException when the text does not index on the first pass
     */
    private Progress run(SourceUnit unit, String original, List<RegionOutcome> outcomes)
            throws MalformedStructureException {
        DialectAdapter adapter = DialectAdapters.forDialect(unit.dialect());
        NestedConditionalDetector detector = new NestedConditionalDetector(config, unit.dialect());
        String text = original;
        List<int[]> touched = null;
        int passes = 0;

        while (passes < config.maxPasses()) {
            passes++;
            Block tree;
            try {
                tree = adapter.index(text);
            } catch (MalformedStructureException e) {
                if (passes == 1) {
                    throw e;
                }
                // later passes only see text that already re-indexed during validation
                logger.warn("Cannot index {} after pass {}: {}", unit.identity(), passes - 1, e.getMessage());
                outcomes.add(RegionOutcome.failed(null, null, ErrorKind.MALFORMED_STRUCTURE, e.getMessage(), 0));
                break;
            }
            List<int[]> changed = new ArrayList<>();
            String rewritten = runPass(unit.withText(text), tree, detector, touched, changed, outcomes);
            if (rewritten.equals(text)) {
                break;
            }
            text = rewritten;
            touched = changed;
        }
        return new Progress(text, passes);
    }

    /**
     * Refactor each top-level declaration of a unit that failed to index as a whole. Every
     * declaration is run on the unit text with the rest blanked, so offsets and line numbers
     * stay those of the unit. Declarations are spliced back last to first.
     */
    private Progress runByDeclaration(SourceUnit unit, MalformedStructureException failure,
            List<RegionOutcome> outcomes) {
        String original = unit.text();
        List<int[]> parts = DeclarationSplitter.split(original, unit.dialect());
        if (parts.size() < 2) {
            outcomes.add(RegionOutcome.failed(null, null, ErrorKind.MALFORMED_STRUCTURE, failure.getMessage(), 0));
            return new Progress(original, 1);
        }

        List<List<RegionOutcome>> perPart = new ArrayList<>();
        String text = original;
        int passes = 1;
        for (int i = parts.size() - 1; i >= 0; i--) {
            int start = parts.get(i)[0];
            int end = parts.get(i)[1];
            String isolated = DeclarationSplitter.isolate(original, start, end);
            List<RegionOutcome> partOutcomes = new ArrayList<>();
            perPart.add(0, partOutcomes);
            try {
                Progress progress = run(unit, isolated, partOutcomes);
                String part = progress.text().substring(start, progress.text().length() - (isolated.length() - end));
                text = text.substring(0, start) + part + text.substring(end);
                passes = Math.max(passes, progress.passes());
            } catch (MalformedStructureException e) {
                logger.debug("Declaration at line {} of {} does not index: {}",
                        lineOf(original, start), unit.identity(), e.getMessage());
                partOutcomes.add(RegionOutcome.failed(null, null, ErrorKind.MALFORMED_STRUCTURE, e.getMessage(), 0));
            }
        }
        perPart.forEach(outcomes::addAll);
        return new Progress(text, passes);
    }

    private static int lineOf(String text, int offset) {
        return (int) text.substring(0, offset).chars().filter(c -> c == '\n').count() + 1;
    }

    /**
     * One detection pass over the current text.
     *
     * @param touched ranges rewritten by the previous pass, null on the first pass
     * @param changed receives the ranges this pass rewrites
     * @return the text after this pass
     */
    private String runPass(SourceUnit current, Block tree, NestedConditionalDetector detector,
            List<int[]> touched, List<int[]> changed, List<RegionOutcome> outcomes) {
        BlockIndex index = new BlockIndex(tree);
        List<ConditionalRegion> regions = detector.detect(tree, index);
        List<List<Edit>> applied = new ArrayList<>();
        SourceUnit unit = current;

        for (ConditionalRegion region : regions) {
            // regions outside last pass's rewrites were already reported
            if (touched != null && !within(touched, region.span().start())) {
                continue;
            }

            // 1. follow the region through the rewrites made so far in this pass
            int start = region.span().start();
            for (List<Edit> edits : applied) {
                start = map(start, edits);
                if (start < 0) {
                    break;
                }
            }
            if (start < 0) {
                outcomes.add(RegionOutcome.skipped(region, OutcomeFlag.OVERLAPS_REWRITTEN_REGION,
                        "range already rewritten by an earlier region"));
                continue;
            }
            Optional<Block> root = chainRootAt(tree, index, start);
            if (root.isEmpty()) {
                outcomes.add(RegionOutcome.failed(region, null, ErrorKind.TRANSFORM_INFEASIBLE,
                        "region no longer present after earlier rewrites", 0));
                continue;
            }

            // 2. rewrite it
            RefactoringEngine.RegionResult result = engine.refactorRegion(unit, tree, index,
                    detector.toRegion(root.get()), region);
            outcomes.add(result.outcome());
            if (result.isApplied()) {
                RefactoringCandidate candidate = result.applied();
                List<Edit> edits = edits(candidate);
                applied.add(edits);
                track(changed, edits);
                unit = unit.withText(candidate.fullText());
                tree = result.reindexed();
                index = new BlockIndex(tree);
            }
        }
        return unit.text();
    }

    private static Optional<Block> chainRootAt(Block tree, BlockIndex index, int start) {
        return ChainMeasure.chainRoots(tree, index).stream()
                .filter(b -> b.span().start() == start)
                .findFirst();
    }

    /**
     * Edits of a candidate in the coordinates of the text it was made from, in splice order.
     */
    private static List<Edit> edits(RefactoringCandidate candidate) {
        List<Edit> edits = new ArrayList<>();
        for (ExtractedSubroutine sub : candidate.subroutines()) {
            edits.add(new Edit(sub.insertionOffset(), 0, sub.text().length()));
        }
        edits.add(new Edit(candidate.replacedSpan().start(), candidate.replacedSpan().length(),
                candidate.rewrittenText().length()));
        edits.sort(Comparator.comparingInt(Edit::offset).thenComparingInt(e -> e.removed() == 0 ? 0 : 1));
        return edits;
    }

    /**
     * Position after a set of edits, or -1 when the edits replaced it.
     */
    private static int map(int position, List<Edit> edits) {
        int shift = 0;
        for (Edit edit : edits) {
            if (edit.removed() == 0) {
                if (position >= edit.offset()) {
                    shift += edit.inserted();
                }
            } else if (position >= edit.offset() + edit.removed()) {
                shift += edit.inserted() - edit.removed();
            } else if (position >= edit.offset()) {
                return -1;
            }
        }
        return position + shift;
    }

    /**
     * Keep the rewritten ranges of a pass in the coordinates of the latest text.
     */
    private static void track(List<int[]> ranges, List<Edit> edits) {
        List<int[]> moved = new ArrayList<>();
        for (int[] range : ranges) {
            int from = map(range[0], edits);
            int to = map(range[1] - 1, edits);
            if (from >= 0 && to >= 0) {
                moved.add(new int[] {from, to + 1});
            }
        }
        int shift = 0;
        for (Edit edit : edits) {
            int at = edit.offset() + shift;
            moved.add(new int[] {at, at + edit.inserted()});
            shift += edit.inserted() - edit.removed();
        }
        ranges.clear();
        ranges.addAll(moved);
    }

    private static boolean within(List<int[]> ranges, int position) {
        return ranges.stream().anyMatch(r -> position >= r[0] && position < r[1]);
    }

    public DetectionConfig getConfig() {
        return config;
    }
}
