package com.raditha.unnest.adapter;

import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Dialect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Indentation-tracking adapter for Python and for text in unknown dialects.
 * <p>
 * Tokens are grouped into logical lines (brackets and backslashes continue a line), and
 * nesting follows the leading whitespace of each logical line. A unit that indents with both
 * tabs and spaces is rejected rather than guessed at.
 * <p>
 * For Python the statement keywords decide the block kinds. For {@link Dialect#GENERIC} any
 * line followed by deeper lines is a header, classified by its leading keyword.
 */
public class IndentationAdapter implements DialectAdapter {

    private static final Set<String> GENERIC_CONDITIONALS = Set.of("if", "unless", "elif", "elsif", "elseif");
    private static final Set<String> GENERIC_ELSE = Set.of("else", "elif", "elsif", "elseif");
    private static final Set<String> GENERIC_LOOPS = Set.of("for", "foreach", "while", "until", "loop", "do",
            "repeat");
    private static final Set<String> GENERIC_FUNCTIONS = Set.of("def", "function", "func", "fn", "fun", "sub",
            "proc", "procedure", "method");
    private static final Set<String> GENERIC_TYPES = Set.of("class", "module", "struct", "interface", "trait",
            "impl", "object", "enum");
    private static final Set<String> GENERIC_CLOSERS = Set.of("end", "fi", "done", "esac", "endif", "endwhile",
            "endfor", "endfunction", "wend", "next");
    private static final Set<String> GENERIC_HEADER_SUFFIXES = Set.of("{", ":", "then", "do");

    private final Dialect dialect;
    private final LexicalScanner scanner;
    private final boolean python;

    public IndentationAdapter(Dialect dialect) {
        if (dialect.strategy() != Dialect.AdapterStrategy.INDENTATION) {
            throw new IllegalArgumentException(dialect + " is not an indentation dialect");
        }
        this.dialect = dialect;
        this.scanner = new LexicalScanner(dialect);
        this.python = dialect == Dialect.PYTHON;
    }

    @Override
    public Dialect dialect() {
        return dialect;
    }

    @Override
    public Block index(String text) throws MalformedStructureException {
        LineIndex lines = new LineIndex(text);
        List<LogicalLine> logical = logicalLines(text, scanner.scan(text), lines);
        checkIndentation(logical);
        BlockBuilder root = BlockBuilder.body(0, text.length());
        if (!logical.isEmpty()) {
            Parser parser = new Parser(text, logical, lines);
            int base = logical.get(0).width();
            parser.suite(root, base);
            if (parser.index < logical.size()) {
                throw malformed("Unindent does not match any outer indentation level", logical.get(parser.index));
            }
        }
        return root.build(lines);
    }

    /**
     * A statement line: its tokens, which may span several physical lines, and the
     * indentation of the physical line it starts on.
     */
    private record LogicalLine(List<Token> tokens, String indent) {

        int width() {
            return indent.length();
        }

        Token first() {
            return tokens.get(0);
        }

        int start() {
            return tokens.get(0).start();
        }

        int end() {
            return tokens.get(tokens.size() - 1).end();
        }

        int line() {
            return tokens.get(0).line();
        }
    }

    private List<LogicalLine> logicalLines(String text, List<Token> tokens, LineIndex lines)
            throws MalformedStructureException {
        List<LogicalLine> result = new ArrayList<>();
        List<Token> current = new ArrayList<>();
        Deque<Token> open = new ArrayDeque<>();
        Token prev = null;
        for (Token t : tokens) {
            boolean startsLine = prev == null
                    || (open.isEmpty() && lines.lineOf(prev.end() - 1) != t.line() && !continued(text, prev, t));
            if (startsLine && !current.isEmpty()) {
                result.add(new LogicalLine(current, lines.indentationAt(current.get(0).start())));
                current = new ArrayList<>();
            }
            current.add(t);
            if (groups(t)) {
                if (t.type() == TokenType.OPEN) {
                    open.push(t);
                } else {
                    if (open.isEmpty()) {
                        throw new MalformedStructureException("Unbalanced '" + t.text() + "'", t.line(), t.start());
                    }
                    Token opener = open.pop();
                    if (!t.closes(opener)) {
                        throw new MalformedStructureException(
                                "Mismatched '" + opener.text() + "' and '" + t.text() + "'", t.line(), t.start());
                    }
                }
            }
            prev = t;
        }
        if (!open.isEmpty()) {
            Token opener = open.peek();
            throw new MalformedStructureException("Unclosed '" + opener.text() + "'", opener.line(), opener.start());
        }
        if (!current.isEmpty()) {
            result.add(new LogicalLine(current, lines.indentationAt(current.get(0).start())));
        }
        return result;
    }

    /**
     * Brackets that join physical lines. Braces do not in generic text, where they usually
     * delimit blocks that already follow the indentation.
     */
    private boolean groups(Token t) {
        if (t.type() != TokenType.OPEN && t.type() != TokenType.CLOSE) {
            return false;
        }
        return python || !(t.is("{") || t.is("}"));
    }

    private static boolean continued(String text, Token prev, Token next) {
        String gap = text.substring(prev.end(), next.start());
        int slash = gap.indexOf('\\');
        while (slash >= 0) {
            int after = slash + 1;
            if (after < gap.length() && gap.charAt(after) == '\r') {
                after++;
            }
            if (after < gap.length() && gap.charAt(after) == '\n' && gap.lastIndexOf('#', slash) < 0) {
                return true;
            }
            slash = gap.indexOf('\\', slash + 1);
        }
        return false;
    }

    private static void checkIndentation(List<LogicalLine> logical) throws MalformedStructureException {
        char unitIndent = 0;
        for (LogicalLine line : logical) {
            String indent = line.indent();
            if (indent.indexOf(' ') >= 0 && indent.indexOf('\t') >= 0) {
                throw malformed("Mixed tabs and spaces in indentation", line);
            }
            if (indent.isEmpty()) {
                continue;
            }
            if (unitIndent == 0) {
                unitIndent = indent.charAt(0);
            } else if (indent.charAt(0) != unitIndent) {
                throw malformed("Inconsistent use of tabs and spaces in indentation", line);
            }
        }
    }

    private static MalformedStructureException malformed(String message, LogicalLine line) {
        return new MalformedStructureException(message, line.line(), line.start());
    }

    /**
     * Nesting pass over the logical lines of one unit.
     */
    private final class Parser {
        private final String text;
        private final List<LogicalLine> lines;
        private final LineIndex lineIndex;
        private int index;

        Parser(String text, List<LogicalLine> lines, LineIndex lineIndex) {
            this.text = text;
            this.lines = lines;
            this.lineIndex = lineIndex;
        }

        /**
         * Parse lines at exactly {@code width} into a body, stopping at the first shallower line.
         */
        void suite(BlockBuilder body, int width) throws MalformedStructureException {
            while (index < lines.size()) {
                LogicalLine line = lines.get(index);
                if (line.width() < width) {
                    return;
                }
                if (line.width() > width) {
                    throw malformed("Unexpected indent", line);
                }
                if (python) {
                    pythonStatement(body, width);
                } else {
                    genericStatement(body, width);
                }
            }
        }

        private void pythonStatement(BlockBuilder body, int width) throws MalformedStructureException {
            LogicalLine line = lines.get(index);
            String keyword = keyword(line);
            int colon = headerColon(line);
            boolean softHeader = colon == line.tokens().size() - 1;
            switch (keyword) {
                case "if" -> body.add(pythonConditional(width));
                case "for", "while" -> body.add(pythonLoop(width));
                case "try" -> body.add(pythonTry(width));
                case "def" -> body.add(pythonCompound(BlockKind.FUNCTION, width));
                case "class" -> body.add(pythonCompound(BlockKind.TYPE, width));
                case "with" -> body.add(pythonCompound(BlockKind.OTHER, width));
                case "elif", "else", "except", "finally" ->
                        throw malformed("'" + keyword + "' without a matching block", line);
                case "match", "case" -> {
                    if (softHeader) {
                        body.add(pythonCompound(BlockKind.OTHER, width));
                    } else {
                        simple(body, line.tokens());
                        index++;
                    }
                }
                default -> {
                    simple(body, line.tokens());
                    index++;
                }
            }
        }

        private BlockBuilder pythonConditional(int width) throws MalformedStructureException {
            LogicalLine header = lines.get(index);
            int colon = requireColon(header);
            BlockBuilder block = new BlockBuilder(BlockKind.CONDITIONAL, header.start(), header.end(),
                    headerText(header, colon));
            block.addBranch(conditionText(header, colon), suiteAfter(header, colon, width));
            while (index < lines.size() && lines.get(index).width() == width) {
                LogicalLine next = lines.get(index);
                String keyword = keyword(next);
                if (keyword.equals("elif")) {
                    int elifColon = requireColon(next);
                    block.addBranch(conditionText(next, elifColon), suiteAfter(next, elifColon, width));
                } else if (keyword.equals("else")) {
                    block.addBranch(null, suiteAfter(next, requireColon(next), width));
                    break;
                } else {
                    break;
                }
            }
            block.end = lines.get(index - 1).end();
            return block;
        }

        private BlockBuilder pythonLoop(int width) throws MalformedStructureException {
            LogicalLine header = lines.get(index);
            int colon = requireColon(header);
            BlockBuilder block = new BlockBuilder(BlockKind.LOOP, header.start(), header.end(),
                    headerText(header, colon));
            block.add(suiteAfter(header, colon, width));
            if (index < lines.size() && lines.get(index).width() == width && keyword(lines.get(index)).equals("else")) {
                LogicalLine elseLine = lines.get(index);
                block.add(suiteAfter(elseLine, requireColon(elseLine), width));
            }
            block.end = lines.get(index - 1).end();
            return block;
        }

        private BlockBuilder pythonTry(int width) throws MalformedStructureException {
            LogicalLine header = lines.get(index);
            int colon = requireColon(header);
            BlockBuilder block = new BlockBuilder(BlockKind.OTHER, header.start(), header.end(),
                    headerText(header, colon));
            block.add(suiteAfter(header, colon, width));
            while (index < lines.size() && lines.get(index).width() == width
                    && Set.of("except", "else", "finally").contains(keyword(lines.get(index)))) {
                LogicalLine clause = lines.get(index);
                block.add(suiteAfter(clause, requireColon(clause), width));
            }
            block.end = lines.get(index - 1).end();
            return block;
        }

        private BlockBuilder pythonCompound(BlockKind kind, int width) throws MalformedStructureException {
            LogicalLine header = lines.get(index);
            int colon = requireColon(header);
            BlockBuilder block = new BlockBuilder(kind, header.start(), header.end(), headerText(header, colon));
            block.add(suiteAfter(header, colon, width));
            block.end = lines.get(index - 1).end();
            return block;
        }

        /**
         * Body after a header colon: the rest of the header line, or the following deeper lines.
         */
        private BlockBuilder suiteAfter(LogicalLine header, int colon, int width) throws MalformedStructureException {
            index++;
            List<Token> rest = header.tokens().subList(colon + 1, header.tokens().size());
            if (!rest.isEmpty()) {
                BlockBuilder body = BlockBuilder.body(rest.get(0).start(), header.end());
                simple(body, rest);
                return body;
            }
            return indentedSuite(header, width);
        }

        private BlockBuilder indentedSuite(LogicalLine header, int width) throws MalformedStructureException {
            if (index >= lines.size() || lines.get(index).width() <= width) {
                throw malformed("Expected an indented block", header);
            }
            LogicalLine first = lines.get(index);
            int start = lineIndex.lineStart(lineIndex.lineOf(first.start()));
            BlockBuilder body = BlockBuilder.body(start, start);
            suite(body, first.width());
            body.end = lines.get(index - 1).end();
            return body;
        }

        /**
         * Simple statements, one per semicolon-separated part.
         */
        private void simple(BlockBuilder body, List<Token> tokens) {
            int depth = 0;
            int partStart = 0;
            for (int i = 0; i <= tokens.size(); i++) {
                boolean boundary = i == tokens.size() || (depth == 0 && tokens.get(i).is(";"));
                if (boundary) {
                    if (i > partStart) {
                        int start = tokens.get(partStart).start();
                        int end = tokens.get(i - 1).end();
                        body.add(new BlockBuilder(BlockKind.STATEMENT, start, end, text.substring(start, end)));
                    }
                    partStart = i + 1;
                } else if (tokens.get(i).type() == TokenType.OPEN) {
                    depth++;
                } else if (tokens.get(i).type() == TokenType.CLOSE) {
                    depth--;
                }
            }
        }

        private void genericStatement(BlockBuilder body, int width) throws MalformedStructureException {
            LogicalLine line = lines.get(index);
            if (!hasDeeperBody(width)) {
                simple(body, line.tokens());
                index++;
                return;
            }
            BlockKind kind = genericKind(line);
            BlockBuilder block = new BlockBuilder(kind, line.start(), line.end(), lineText(line));
            if (kind == BlockKind.CONDITIONAL) {
                index++;
                block.addBranch(genericCondition(line), indentedSuite(line, width));
                absorbClosers(width);
                while (index < lines.size() && lines.get(index).width() == width && isGenericElse(lines.get(index))
                        && hasDeeperBody(width)) {
                    LogicalLine elseLine = lines.get(index);
                    String condition = genericCondition(elseLine);
                    index++;
                    block.addBranch(condition, indentedSuite(elseLine, width));
                    absorbClosers(width);
                    if (condition == null) {
                        break;
                    }
                }
            } else {
                index++;
                block.add(indentedSuite(line, width));
                absorbClosers(width);
            }
            block.end = lines.get(index - 1).end();
            body.add(block);
        }

        private boolean hasDeeperBody(int width) {
            return index + 1 < lines.size() && lines.get(index + 1).width() > width;
        }

        /**
         * Closing lines such as a lone brace or {@code end} belong to the block above them.
         */
        private void absorbClosers(int width) {
            while (index < lines.size() && lines.get(index).width() == width && isCloser(lines.get(index))) {
                index++;
            }
        }

        private boolean isCloser(LogicalLine line) {
            List<Token> tokens = line.tokens();
            boolean punctuation = tokens.stream()
                    .allMatch(t -> t.is("}") || t.is(")") || t.is("]") || t.is(";") || t.is(","));
            if (punctuation) {
                return true;
            }
            return tokens.size() <= 3 && tokens.get(0).isWord()
                    && GENERIC_CLOSERS.contains(tokens.get(0).text().toLowerCase(Locale.ROOT));
        }

        private boolean isGenericElse(LogicalLine line) {
            for (Token t : line.tokens()) {
                if (t.is("}")) {
                    continue;
                }
                return t.isWord() && GENERIC_ELSE.contains(t.text().toLowerCase(Locale.ROOT));
            }
            return false;
        }

        private BlockKind genericKind(LogicalLine line) {
            String first = line.first().isWord() ? line.first().text().toLowerCase(Locale.ROOT) : "";
            if (GENERIC_CONDITIONALS.contains(first)) {
                return BlockKind.CONDITIONAL;
            }
            if (GENERIC_LOOPS.contains(first)) {
                return BlockKind.LOOP;
            }
            for (Token t : line.tokens()) {
                if (t.is("(")) {
                    break;
                }
                String word = t.text().toLowerCase(Locale.ROOT);
                if (t.isWord() && GENERIC_FUNCTIONS.contains(word)) {
                    return BlockKind.FUNCTION;
                }
                if (t.isWord() && GENERIC_TYPES.contains(word)) {
                    return BlockKind.TYPE;
                }
            }
            return BlockKind.OTHER;
        }

        /**
         * Condition of a generic header line, or null for a plain else.
         */
        private String genericCondition(LogicalLine line) {
            List<Token> tokens = line.tokens();
            int from = 0;
            while (from < tokens.size() && tokens.get(from).is("}")) {
                from++;
            }
            if (from < tokens.size() && tokens.get(from).isWord("else")) {
                from++;
                if (from >= tokens.size() || !tokens.get(from).isWord("if")) {
                    return null;
                }
            }
            from++;
            int to = tokens.size();
            while (to > from && GENERIC_HEADER_SUFFIXES.contains(tokens.get(to - 1).text())) {
                to--;
            }
            if (to <= from) {
                return "";
            }
            String condition = text.substring(tokens.get(from).start(), tokens.get(to - 1).end()).strip();
            if (tokens.get(from).is("(") && tokens.get(to - 1).is(")") && closesAt(tokens, from, to - 1)) {
                condition = condition.substring(1, condition.length() - 1).strip();
            }
            return condition;
        }

        private boolean closesAt(List<Token> tokens, int open, int close) {
            int depth = 0;
            for (int i = open; i <= close; i++) {
                if (tokens.get(i).type() == TokenType.OPEN) {
                    depth++;
                } else if (tokens.get(i).type() == TokenType.CLOSE) {
                    depth--;
                    if (depth == 0) {
                        return i == close;
                    }
                }
            }
            return false;
        }

        private String keyword(LogicalLine line) {
            List<Token> tokens = line.tokens();
            Token first = tokens.get(0);
            if (first.isWord("async") && tokens.size() > 1) {
                return tokens.get(1).text();
            }
            return first.isWord() ? first.text() : "";
        }

        /**
         * Index of the first colon outside brackets, or -1.
         */
        private int headerColon(LogicalLine line) {
            int depth = 0;
            List<Token> tokens = line.tokens();
            for (int i = 0; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (t.type() == TokenType.OPEN) {
                    depth++;
                } else if (t.type() == TokenType.CLOSE) {
                    depth--;
                } else if (depth == 0 && t.is(":")) {
                    return i;
                }
            }
            return -1;
        }

        private int requireColon(LogicalLine line) throws MalformedStructureException {
            int colon = headerColon(line);
            if (colon < 0) {
                throw malformed("Expected ':' after '" + keyword(line) + "' header", line);
            }
            return colon;
        }

        private String headerText(LogicalLine line, int colon) {
            return text.substring(line.start(), line.tokens().get(colon).end());
        }

        private String conditionText(LogicalLine line, int colon) {
            int from = line.tokens().get(0).end();
            return text.substring(from, line.tokens().get(colon).start()).strip();
        }

        private String lineText(LogicalLine line) {
            return text.substring(line.start(), line.end());
        }
    }
}
