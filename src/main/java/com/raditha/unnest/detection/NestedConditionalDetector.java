package com.raditha.unnest.detection;

import com.raditha.unnest.analysis.BlockIndex;
import com.raditha.unnest.analysis.ChainMeasure;
import com.raditha.unnest.analysis.TerminalAnalyzer;
import com.raditha.unnest.config.DetectionConfig;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.Branch;
import com.raditha.unnest.model.ConditionalRegion;
import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.RegionFingerprint;
import com.raditha.unnest.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds maximal chains of nested conditionals whose depth reaches the configured threshold.
 * <p>
 * Only chain roots are considered, so an interior part of a reported chain is never
 * reported again. A chain that starts below a loop or other block inside a region is a
 * separate chain and is reported on its own.
 */
public class NestedConditionalDetector {

    private static final Logger logger = LoggerFactory.getLogger(NestedConditionalDetector.class);

    private final DetectionConfig config;
    private final TerminalAnalyzer terminals;

    public NestedConditionalDetector(DetectionConfig config, Dialect dialect) {
        this.config = config;
        this.terminals = new TerminalAnalyzer(dialect);
    }

    /**
     * Detect regions in an indexed unit.
     *
     * @param root the unit's root block
     * @return regions ordered by start offset
     */
    public List<ConditionalRegion> detect(Block root) {
        return detect(root, new BlockIndex(root));
    }

    public List<ConditionalRegion> detect(Block root, BlockIndex index) {
        List<ConditionalRegion> regions = new ArrayList<>();
        for (Block chainRoot : ChainMeasure.chainRoots(root, index)) {
            int depth = ChainMeasure.depthBelow(chainRoot);
            if (depth >= config.depthThreshold()) {
                regions.add(toRegion(chainRoot, depth));
            }
        }
        regions.sort(Comparator.comparingInt(r -> r.span().start()));
        logger.debug("Detected {} regions at depth threshold {}", regions.size(), config.depthThreshold());
        return regions;
    }

    /**
     * Region for a chain root, whatever its depth.
     */
    public ConditionalRegion toRegion(Block chainRoot) {
        return toRegion(chainRoot, ChainMeasure.depthBelow(chainRoot));
    }

    private ConditionalRegion toRegion(Block chainRoot, int depth) {
        return new ConditionalRegion(chainRoot, depth, severity(depth), chainRoot.span(),
                fingerprint(chainRoot, depth));
    }

    /**
     * Classify severity by depth.
     */
    public Severity severity(int depth) {
        if (depth >= config.highSeverityDepth()) {
            return Severity.HIGH;
        }
        if (depth >= config.mediumSeverityDepth()) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    private RegionFingerprint fingerprint(Block chainRoot, int depth) {
        StringBuilder pattern = new StringBuilder();
        for (Branch branch : chainRoot.branches()) {
            pattern.append(terminals.endsTerminal(branch.body()) ? 'T' : 'F');
        }
        return new RegionFingerprint(
                depth,
                ChainMeasure.branchCount(chainRoot),
                chainRoot.hasTrailingElse(),
                terminals.containsExit(chainRoot),
                pattern.toString());
    }
}
