package com.raditha.unnest.refactoring;

import com.raditha.unnest.adapter.LexicalScanner;
import com.raditha.unnest.adapter.Token;
import com.raditha.unnest.analysis.BlockIndex;
import com.raditha.unnest.analysis.ChainMeasure;
import com.raditha.unnest.analysis.FunctionHeader;
import com.raditha.unnest.analysis.ScopeAnalyzer;
import com.raditha.unnest.analysis.ScopeAnalyzer.VariableInfo;
import com.raditha.unnest.analysis.TerminalAnalyzer;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Branch;
import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.ExtractedSubroutine;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.RefactoringPattern;
import com.raditha.unnest.suggestion.Suggestion;
import com.raditha.unnest.syntax.CodeEmitter;
import com.raditha.unnest.syntax.TextBlocks;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Moves each root branch body of a region into a subroutine of its own and replaces the
 * region with a flat dispatch that calls them under the original conditions.
 * <p>
 * Variables the body reads from the enclosing scope become parameters. Bodies that would
 * behave differently once moved, such as ones assigning those variables or leaving an
 * enclosing loop, make the extraction infeasible.
 */
public class MethodExtractionTransformer extends AbstractFlatteningTransformer {

    private static final Logger logger = LoggerFactory.getLogger(MethodExtractionTransformer.class);

    private static final String PLACEHOLDER_PREFIX = "branch_";
    private static final Set<String> UNSUPPORTED_WORDS = Set.of("yield", "await", "goto");
    private static final Set<String> PYTHON_SCOPE_WORDS = Set.of("nonlocal", "global");
    private static final Pattern CLASS_NAME = Pattern.compile("\\bclass\\s+([A-Za-z_$][\\w$]*)");
    private static final Pattern THROWS_CLAUSE = Pattern.compile("\\bthrows\\b([^{]*)", Pattern.DOTALL);

    /**
     * Where subroutines go and how they are called.
     *
     * @param function nearest enclosing function, null for top-level code
     * @param header   parsed header of that function, null for top-level code
     * @param owner    type the function is declared in, null for free functions
     * @param topLevel outermost statement of the unit that contains the region
     */
    private record Site(Block function, FunctionHeader header, Block owner, Block topLevel) {

        boolean inFunction() {
            return function != null;
        }

        boolean inType() {
            return owner != null;
        }
    }

    /**
     * One root branch body that can be moved.
     *
     * @param ordinal    1-based index of the root branch
     * @param branch     the branch
     * @param parameters enclosing-scope variables the body reads, in order of first use
     * @param terminal   whether the body ends in a terminal statement
     */
    private record Extraction(int ordinal, Branch branch, List<VariableInfo> parameters, boolean terminal) {
    }

    private record Analysis(Site site, List<Extraction> extractions) {
    }

    @Override
    public RefactoringPattern pattern() {
        return RefactoringPattern.METHOD_EXTRACTION;
    }

    @Override
    public Optional<String> ineligibility(RegionContext context) {
        try {
            analyze(context);
            return Optional.empty();
        } catch (TransformInfeasibleException e) {
            return Optional.of(e.getMessage());
        }
    }

    @Override
    public int maxRevertedLevels(RegionContext context) {
        try {
            return analyze(context).extractions().size() - 1;
        } catch (TransformInfeasibleException e) {
            return 0;
        }
    }

    @Override
    public RefactoringCandidate transform(RegionContext context, int revertedLevels)
            throws TransformInfeasibleException {
        Analysis analysis = analyze(context);
        List<Extraction> all = analysis.extractions();
        int kept = all.size() - revertedLevels;
        if (revertedLevels < 0 || kept < 1) {
            throw new TransformInfeasibleException("cannot keep " + revertedLevels + " of " + all.size()
                    + " extracted branches");
        }

        // 1. name the subroutines
        Set<String> taken = wordsOf(context);
        Map<Integer, Extraction> byOrdinal = new HashMap<>();
        Map<Integer, String> names = new HashMap<>();
        Map<Integer, Suggestion> suggestions = new HashMap<>();
        Set<Integer> suggested = new HashSet<>();
        for (Extraction extraction : all.subList(0, kept)) {
            int ordinal = extraction.ordinal();
            Optional<Suggestion> suggestion = context.suggestions().suggest(context.region().fingerprint(), ordinal);
            suggestion.ifPresent(s -> suggestions.put(ordinal, s));
            Optional<String> name = suggestion.flatMap(Suggestion::nameIfPresent)
                    .filter(n -> context.style().isValidIdentifier(n))
                    .filter(n -> !taken.contains(n));
            String chosen = name.orElseGet(() -> placeholder(taken));
            if (name.isPresent()) {
                suggested.add(ordinal);
            } else if (suggestion.flatMap(Suggestion::nameIfPresent).isPresent()) {
                logger.debug("Ignoring suggested name for branch {}: invalid or already in use", ordinal);
            }
            taken.add(chosen);
            byOrdinal.put(ordinal, extraction);
            names.put(ordinal, chosen);
        }

        // 2. the dispatch keeps the root conditions
        Site site = analysis.site();
        Rewrite rewrite = new Rewrite(context);
        CodeEmitter out = rewrite.out();
        List<CodeEmitter.Arm> arms = new ArrayList<>();
        List<Branch> branches = context.root().branches();
        for (int i = 0; i < branches.size(); i++) {
            Branch branch = branches.get(i);
            Extraction extraction = byOrdinal.get(i + 1);
            CodeEmitter.BodyWriter body = extraction == null
                    ? level -> out.segment(level, context.segment(branch.body()))
                    : level -> writeCall(context, site, out, level, names.get(extraction.ordinal()), extraction);
            arms.add(branch.isElse() ? CodeEmitter.Arm.otherwise(body) : CodeEmitter.Arm.when(branch.condition(), body));
        }
        out.conditional(0, arms);

        // 3. the subroutines themselves
        List<ExtractedSubroutine> subroutines = new ArrayList<>();
        for (Extraction extraction : all.subList(0, kept)) {
            int ordinal = extraction.ordinal();
            subroutines.add(subroutine(context, site, extraction, names.get(ordinal),
                    Optional.ofNullable(suggestions.get(ordinal)).flatMap(Suggestion::commentIfPresent),
                    suggested.contains(ordinal)));
        }
        return candidate(context, context.region().span(), out.text(), subroutines, revertedLevels);
    }

    private Analysis analyze(RegionContext context) throws TransformInfeasibleException {
        Site site = site(context);
        Dialect dialect = context.dialect();
        ScopeAnalyzer scope = new ScopeAnalyzer(dialect);
        TerminalAnalyzer terminals = context.chains().terminals();
        List<VariableInfo> available = availableVariables(context, scope);

        List<Extraction> extractions = new ArrayList<>();
        List<Branch> branches = context.root().branches();
        for (int i = 0; i < branches.size(); i++) {
            Block body = branches.get(i).body();
            if (body.children().isEmpty()) {
                continue;
            }
            int ordinal = i + 1;
            String text = context.unit().slice(body.span());
            int kept = ChainMeasure.deepestChainIn(body);
            if (kept >= context.config().depthThreshold()) {
                throw new TransformInfeasibleException("branch " + ordinal + " keeps a chain of depth " + kept
                        + " (threshold " + context.config().depthThreshold() + ")");
            }
            if (escapes(body, false, false)) {
                throw new TransformInfeasibleException("branch " + ordinal + " leaves an enclosing loop or switch");
            }
            boolean terminal = terminals.endsTerminal(body);
            if (terminals.containsReturn(body) && !terminal) {
                throw new TransformInfeasibleException("branch " + ordinal + " returns on some paths only");
            }

            Set<String> read = scope.namesRead(text);
            for (String word : read) {
                if (UNSUPPORTED_WORDS.contains(word) || (dialect == Dialect.PYTHON && PYTHON_SCOPE_WORDS.contains(word))) {
                    throw new TransformInfeasibleException("branch " + ordinal + " uses '" + word + "'");
                }
            }
            if ((dialect == Dialect.JAVASCRIPT || dialect == Dialect.TYPESCRIPT) && read.contains("this")
                    && !site.inType()) {
                throw new TransformInfeasibleException("branch " + ordinal + " uses 'this' outside a class");
            }

            List<VariableInfo> parameters = scope.referencedVariables(available, text);
            Set<String> assigned = scope.assignedNames(text);
            for (VariableInfo parameter : parameters) {
                if (assigned.contains(parameter.name())) {
                    throw new TransformInfeasibleException(
                            "branch " + ordinal + " assigns '" + parameter.name() + "', which it would receive as a parameter");
                }
                if (dialect.isTyped() && !parameter.hasKnownType()) {
                    throw new TransformInfeasibleException("type of '" + parameter.name() + "' is unknown");
                }
            }
            if (dialect == Dialect.PYTHON) {
                checkBindingsUnused(context, site, scope, body, ordinal);
            }
            extractions.add(new Extraction(ordinal, branches.get(i), parameters, terminal));
        }
        if (extractions.isEmpty()) {
            throw new TransformInfeasibleException("no branch body to extract");
        }
        return new Analysis(site, extractions);
    }

    private Site site(RegionContext context) throws TransformInfeasibleException {
        Dialect dialect = context.dialect();
        BlockIndex index = context.index();
        Block root = context.root();
        Block topLevel = root;
        while (index.parentOf(topLevel).filter(p -> p != index.root()).isPresent()) {
            topLevel = index.parentOf(topLevel).get();
        }

        Optional<Block> function = index.enclosing(root, BlockKind.FUNCTION);
        if (function.isEmpty()) {
            if (dialect.isTyped()) {
                throw new TransformInfeasibleException("the region is not inside a function");
            }
            return new Site(null, null, null, topLevel);
        }
        FunctionHeader header = FunctionHeader.parse(dialect, function.get().header());
        if (dialect.isTyped() && !header.isNamed()) {
            throw new TransformInfeasibleException("the enclosing function has no name");
        }
        if (header.qualified()) {
            throw new TransformInfeasibleException("the enclosing function is defined outside its class");
        }
        Block owner = index.containingBody(function.get())
                .flatMap(index::ownerOf)
                .filter(b -> b.kind() == BlockKind.TYPE)
                .orElse(null);
        return new Site(function.get(), header, owner, topLevel);
    }

    /**
     * Variables visible at the region start, nearest function first, so closures see the
     * variables of every function around them.
     */
    private List<VariableInfo> availableVariables(RegionContext context, ScopeAnalyzer scope) {
        Map<String, VariableInfo> available = new LinkedHashMap<>();
        boolean inFunction = false;
        for (Block ancestor : context.index().ancestors(context.root())) {
            if (ancestor.kind() == BlockKind.FUNCTION) {
                inFunction = true;
                scope.getAvailableVariables(ancestor, context.root(), context.index())
                        .forEach(v -> available.putIfAbsent(v.name(), v));
            }
        }
        if (!inFunction) {
            scope.getAvailableVariables(null, context.root(), context.index())
                    .forEach(v -> available.putIfAbsent(v.name(), v));
        }
        return new ArrayList<>(available.values());
    }

    /**
     * Whether a break or continue inside a body targets a loop or switch outside it.
     */
    private static boolean escapes(Block block, boolean inLoop, boolean inSwitch) {
        if (block.kind() == BlockKind.STATEMENT) {
            String word = TerminalAnalyzer.leadingWord(block.header());
            boolean labelled = !block.header().strip().equals(word) && !block.header().strip().equals(word + ";");
            if (word.equals("break")) {
                return labelled || !(inLoop || inSwitch);
            }
            if (word.equals("continue")) {
                return labelled || !inLoop;
            }
            return false;
        }
        if (block.kind() == BlockKind.FUNCTION || block.kind() == BlockKind.TYPE) {
            return false;
        }
        boolean loop = inLoop || block.kind() == BlockKind.LOOP;
        String word = TerminalAnalyzer.leadingWord(block.header());
        boolean switchBlock = inSwitch || (block.kind() == BlockKind.OTHER && (word.equals("switch") || word.equals("match")));
        for (Block child : block.children()) {
            if (escapes(child, loop, switchBlock)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Python bodies bind names in the function scope, so names they bind must not be read
     * after the region.
     */
    private static void checkBindingsUnused(RegionContext context, Site site, ScopeAnalyzer scope, Block body,
            int ordinal) throws TransformInfeasibleException {
        Set<String> bound = scope.boundNames(body);
        if (bound.isEmpty()) {
            return;
        }
        int end = site.inFunction() && site.function().body() != null
                ? site.function().body().span().end()
                : context.text().length();
        int start = Math.min(context.root().span().end(), end);
        Set<String> readAfter = scope.namesRead(context.text().substring(start, end));
        for (String name : bound) {
            if (readAfter.contains(name)) {
                throw new TransformInfeasibleException(
                        "branch " + ordinal + " binds '" + name + "', which is read after the region");
            }
        }
    }

    private static Set<String> wordsOf(RegionContext context) {
        Set<String> words = new HashSet<>();
        for (Token token : new LexicalScanner(context.dialect()).scanFragment(context.text())) {
            if (token.isWord()) {
                words.add(token.text());
            }
        }
        return words;
    }

    private static String placeholder(Set<String> taken) {
        int n = 1;
        while (taken.contains(PLACEHOLDER_PREFIX + n)) {
            n++;
        }
        return PLACEHOLDER_PREFIX + n;
    }

    private static void writeCall(RegionContext context, Site site, CodeEmitter out, int level, String name,
            Extraction extraction) {
        Dialect dialect = context.dialect();
        String call = receiver(dialect, site) + name + "("
                + String.join(", ", extraction.parameters().stream().map(VariableInfo::name).toList()) + ")";
        if (!extraction.terminal() || !site.inFunction()) {
            out.statement(level, call);
        } else if (dialect.isTyped() && site.header().returnsNothing(dialect)) {
            out.statement(level, call);
            out.statement(level, "return");
        } else {
            out.statement(level, "return " + call);
        }
    }

    private static String receiver(Dialect dialect, Site site) {
        if (!site.inType()) {
            return "";
        }
        return switch (dialect) {
            case JAVASCRIPT, TYPESCRIPT -> "this.";
            case PYTHON -> {
                Matcher m = CLASS_NAME.matcher(site.owner().header());
                yield m.find() ? m.group(1) + "." : "";
            }
            default -> "";
        };
    }

    private ExtractedSubroutine subroutine(RegionContext context, Site site, Extraction extraction, String name,
            Optional<String> comment, boolean suggested) {
        Dialect dialect = context.dialect();
        String text = context.text();
        boolean before = placedBefore(dialect, site);
        Block anchor = site.inFunction() && !(dialect == Dialect.JAVASCRIPT || dialect == Dialect.TYPESCRIPT)
                || site.inType()
                ? site.function()
                : site.topLevel();
        String indent = TextBlocks.indentationAt(text, anchor.span().start());

        CodeEmitter out = new CodeEmitter(context.style(), indent, context.indentUnit(), context.newline());
        comment.ifPresent(c -> out.comment(0, c));
        if (dialect == Dialect.PYTHON) {
            if (site.inType()) {
                out.line(0, "@staticmethod");
            }
            out.line(0, signature(dialect, site, extraction, name) + ":");
            out.segment(1, context.segment(extraction.branch().body()));
        } else {
            out.line(0, signature(dialect, site, extraction, name) + " {");
            out.segment(1, context.segment(extraction.branch().body()));
            out.line(0, "}");
        }

        String newline = context.newline();
        String declaration = before
                ? out.block() + newline + newline
                : newline + newline + out.block();
        int offset = before ? TextBlocks.lineStart(text, anchor.span().start()) : anchor.span().end();
        List<String> parameters = extraction.parameters().stream().map(VariableInfo::name).toList();
        return new ExtractedSubroutine(name, extraction.ordinal(), parameters, declaration, offset, suggested);
    }

    private static boolean placedBefore(Dialect dialect, Site site) {
        boolean freeNative = (dialect == Dialect.C || dialect == Dialect.CPP) && !site.inType();
        boolean pythonTopLevel = dialect == Dialect.PYTHON && !site.inFunction();
        return freeNative || pythonTopLevel;
    }

    private static String signature(Dialect dialect, Site site, Extraction extraction, String name) {
        List<VariableInfo> parameters = extraction.parameters();
        String names = String.join(", ", parameters.stream().map(VariableInfo::name).toList());
        String declarations = String.join(", ", parameters.stream().map(VariableInfo::declaration).toList());
        boolean isStatic = site.inFunction() && site.header().isStatic();
        return switch (dialect) {
            case JAVA, CSHARP -> "private " + (isStatic ? "static " : "") + returnType(dialect, site, extraction)
                    + " " + name + "(" + declarations + ")" + throwsClause(dialect, site);
            case C, CPP -> (site.inType() ? (isStatic ? "static " : "") : "static ")
                    + returnType(dialect, site, extraction) + " " + name + "(" + declarations + ")";
            case JAVASCRIPT, TYPESCRIPT -> {
                if (!site.inType()) {
                    yield "function " + name + "(" + names + ")";
                }
                String access = dialect == Dialect.TYPESCRIPT ? "private " : "";
                yield access + (isStatic ? "static " : "") + name + "(" + names + ")";
            }
            case PYTHON -> "def " + name + "(" + names + ")";
            case GENERIC -> throw new IllegalArgumentException("No rendering syntax for dialect " + dialect);
        };
    }

    private static String returnType(Dialect dialect, Site site, Extraction extraction) {
        if (!extraction.terminal() || site.header().returnsNothing(dialect)) {
            return "void";
        }
        return site.header().returnType();
    }

    private static String throwsClause(Dialect dialect, Site site) {
        if (dialect != Dialect.JAVA) {
            return "";
        }
        Matcher m = THROWS_CLAUSE.matcher(site.function().header());
        if (!m.find()) {
            return "";
        }
        String types = m.group(1).strip().replaceAll("\\s+", " ");
        return types.isEmpty() ? "" : " throws " + types;
    }
}
