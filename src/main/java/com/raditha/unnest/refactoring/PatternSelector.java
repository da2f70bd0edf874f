package com.raditha.unnest.refactoring;

import com.raditha.unnest.analysis.ChainMeasure;
import com.raditha.unnest.analysis.ConditionAnalyzer;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.Branch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Picks the flattening pattern for a region: guard clauses first, then early returns, then
 * method extraction. The first pattern whose preconditions hold wins.
 */
public class PatternSelector {

    private static final Logger logger = LoggerFactory.getLogger(PatternSelector.class);

    private final List<RegionTransformer> transformers;

    public PatternSelector() {
        this(List.of(new GuardClauseTransformer(), new EarlyReturnTransformer(), new MethodExtractionTransformer()));
    }

    public PatternSelector(List<RegionTransformer> transformers) {
        this.transformers = List.copyOf(transformers);
    }

    /**
     * Select the transformer for a region.
     *
     * @throws TransformInfeasibleException when a condition has side effects or no pattern applies
     */
    public RegionTransformer select(RegionContext context) throws TransformInfeasibleException {
        ConditionAnalyzer conditions = new ConditionAnalyzer(context.dialect());
        for (Block member : ChainMeasure.members(context.root())) {
            for (Branch branch : member.branches()) {
                if (!branch.isElse() && conditions.hasSideEffects(branch.condition())) {
                    throw new TransformInfeasibleException(
                            "condition '" + branch.condition().strip() + "' has side effects");
                }
            }
        }

        List<String> reasons = new ArrayList<>();
        for (RegionTransformer transformer : transformers) {
            Optional<String> reason = transformer.ineligibility(context);
            if (reason.isEmpty()) {
                logger.debug("Selected {} for {}", transformer.pattern().tag(), context.region().formatSummary());
                return transformer;
            }
            logger.debug("{} does not apply to {}: {}", transformer.pattern().tag(),
                    context.region().formatSummary(), reason.get());
            reasons.add(transformer.pattern().tag() + ": " + reason.get());
        }
        throw new TransformInfeasibleException("no pattern applies (" + String.join("; ", reasons) + ")");
    }

    public List<RegionTransformer> getTransformers() {
        return transformers;
    }
}
