package com.raditha.unnest.refactoring;

import com.raditha.unnest.analysis.BlockIndex;
import com.raditha.unnest.analysis.ChainAnalyzer;
import com.raditha.unnest.analysis.NestingChain;
import com.raditha.unnest.config.DetectionConfig;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.ConditionalRegion;
import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.SourceUnit;
import com.raditha.unnest.suggestion.Suggestion;
import com.raditha.unnest.suggestion.SuggestionProvider;
import com.raditha.unnest.syntax.CodeEmitter;
import com.raditha.unnest.syntax.CodeStyle;
import com.raditha.unnest.syntax.CodeStyles;
import com.raditha.unnest.syntax.TextBlocks;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Everything a transformer needs to rewrite one region of the current unit text.
 *
 * @param unit        the unit with its current text
 * @param tree        block tree of the current text
 * @param index       parent links of the tree
 * @param region      region being rewritten
 * @param chain       spine of the region
 * @param chains      chain analysis for the dialect
 * @param style       rendering rules for the dialect
 * @param suggestions subroutine name source
 * @param config      active configuration
 * @param baseIndent  indentation of the line the region starts on
 * @param indentUnit  one indentation step
 * @param newline     line terminator of the unit
 */
public record RegionContext(
        SourceUnit unit,
        Block tree,
        BlockIndex index,
        ConditionalRegion region,
        NestingChain chain,
        ChainAnalyzer chains,
        CodeStyle style,
        SuggestionProvider suggestions,
        DetectionConfig config,
        String baseIndent,
        String indentUnit,
        String newline) {

    /**
     * Build the context for a region of an indexed unit.
     */
    public static RegionContext of(SourceUnit unit, Block tree, BlockIndex index, ConditionalRegion region,
            SuggestionProvider suggestions, DetectionConfig config) {
        String text = unit.text();
        Block root = region.root();
        ChainAnalyzer chains = new ChainAnalyzer(unit.dialect());
        Block firstBody = root.branches().get(0).body();
        String indentUnit = firstBody.children().isEmpty()
                ? TextBlocks.indentUnit(text)
                : TextBlocks.indentUnit(text, root.span().start(), firstBody.children().get(0).span().start());
        return new RegionContext(unit, tree, index, region, chains.spine(root), chains,
                CodeStyles.forDialect(unit.dialect()), once(suggestions), config,
                TextBlocks.indentationAt(text, root.span().start()), indentUnit, TextBlocks.newline(text));
    }

    /**
     * Repairs re-run a transform, so each branch is looked up once per region.
     */
    private static SuggestionProvider once(SuggestionProvider provider) {
        Map<Integer, Optional<Suggestion>> seen = new HashMap<>();
        return (fingerprint, ordinal) -> seen.computeIfAbsent(ordinal, o -> provider.suggest(fingerprint, o));
    }

    public String text() {
        return unit.text();
    }

    public Dialect dialect() {
        return unit.dialect();
    }

    public Block root() {
        return region.root();
    }

    /**
     * A fresh emitter at the region's indentation.
     */
    public CodeEmitter emitter() {
        return new CodeEmitter(style, baseIndent, indentUnit, newline);
    }

    /**
     * The source of a block or body, re-indentable.
     */
    public TextBlocks.Segment segment(Block block) {
        return TextBlocks.segment(unit.text(), block.span().start(), block.span().end());
    }

    public TextBlocks.Segment segment(int start, int end) {
        return TextBlocks.segment(unit.text(), start, end);
    }
}
