package com.raditha.unnest.adapter;

import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Dialect;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * Delimiter-tracking adapter for the brace dialects (C, C++, C#, JavaScript, TypeScript).
 * <p>
 * The lexical pre-pass removes comments and strings, then a small recursive-descent pass over
 * the tokens recognises control statements, declarations and bodies. Bodies without braces
 * become single-statement bodies. Unbalanced delimiters are reported as malformed structure.
 */
public class DelimiterAdapter implements DialectAdapter {

    private static final Set<String> TYPE_KEYWORDS = Set.of(
            "class", "struct", "interface", "enum", "namespace", "union", "record");

    /** words after which an opening brace starts an expression, not a block */
    private static final Set<String> EXPRESSION_KEYWORDS = Set.of(
            "return", "throw", "yield", "case", "in", "of", "typeof", "new", "await", "delete", "void",
            "instanceof", "default");

    private static final Set<String> ASSIGNMENTS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", ">>>=", "**=", "??=", ":=");

    /** words that cannot end a statement when automatic semicolon insertion is considered */
    private static final Set<String> OPEN_ENDED_WORDS = Set.of(
            "new", "typeof", "extends", "implements", "const", "let", "var", "function", "class", "export",
            "import", "async", "static", "in", "of", "instanceof", "as", "delete", "void", "case", "public",
            "private", "protected", "readonly", "abstract", "declare", "type", "interface", "enum",
            "namespace", "keyof", "satisfies");

    /** words that continue an expression from the previous line */
    private static final Set<String> CONTINUATION_WORDS = Set.of(
            "in", "of", "instanceof", "as", "satisfies", "extends", "implements");

    private final Dialect dialect;
    private final LexicalScanner scanner;

    public DelimiterAdapter(Dialect dialect) {
        if (dialect.strategy() != Dialect.AdapterStrategy.DELIMITER) {
            throw new IllegalArgumentException(dialect + " is not a delimiter dialect");
        }
        this.dialect = dialect;
        this.scanner = new LexicalScanner(dialect);
    }

    @Override
    public Dialect dialect() {
        return dialect;
    }

    @Override
    public Block index(String text) throws MalformedStructureException {
        List<Token> tokens = scanner.scan(text);
        LineIndex lines = new LineIndex(text);
        BlockBuilder root = BlockBuilder.body(0, text.length());
        new Parser(text, tokens, lines).statements(root, false);
        return root.build(lines);
    }

    /**
     * Recursive-descent pass over the token list of one unit.
     */
    private final class Parser {
        private final String text;
        private final List<Token> tokens;
        private final LineIndex lines;
        private final boolean semicolonInsertion;
        private int pos;

        Parser(String text, List<Token> tokens, LineIndex lines) {
            this.text = text;
            this.tokens = tokens;
            this.lines = lines;
            this.semicolonInsertion = dialect == Dialect.JAVASCRIPT || dialect == Dialect.TYPESCRIPT;
        }

        /**
         * Parse statements into a body until its closing brace, or until the end of the text
         * for the unit root. The closing brace is left for the caller.
         */
        void statements(BlockBuilder body, boolean braced) throws MalformedStructureException {
            while (pos < tokens.size()) {
                Token t = peek();
                if (t.is("}")) {
                    if (braced) {
                        return;
                    }
                    throw malformed("Unbalanced '}'", t);
                }
                if (t.type() == TokenType.CLOSE) {
                    throw malformed("Unbalanced '" + t.text() + "'", t);
                }
                if (t.is(";")) {
                    pos++;
                    continue;
                }
                BlockBuilder statement = statement();
                if (statement != null) {
                    body.add(statement);
                }
            }
        }

        /**
         * One statement, or null when only a label was consumed.
         */
        private BlockBuilder statement() throws MalformedStructureException {
            Token t = peek();
            if (t.is("{")) {
                pos++;
                BlockBuilder body = bracedBody(t);
                return new BlockBuilder(BlockKind.OTHER, t.start(), consumedEnd(), "").add(body);
            }
            if (t.isWord()) {
                switch (t.text()) {
                    case "if" -> {
                        return conditional();
                    }
                    case "for", "while" -> {
                        return loop();
                    }
                    case "do" -> {
                        return doLoop();
                    }
                    case "try" -> {
                        return tryBlock();
                    }
                    case "switch" -> {
                        return switchBlock();
                    }
                    case "else" -> throw malformed("'else' without 'if'", t);
                    case "case" -> {
                        skipLabel();
                        return null;
                    }
                    default -> {
                        // declarations and expression statements below
                    }
                }
                if (dialect == Dialect.CSHARP && t.is("foreach")) {
                    return loop();
                }
                if (dialect == Dialect.CSHARP && (t.is("using") || t.is("lock") || t.is("fixed"))
                        && peekIs(1, "(")) {
                    return scopedBlock();
                }
                if (peekIs(1, ":")) {
                    skipLabel();
                    return null;
                }
            }
            return simple();
        }

        private BlockBuilder conditional() throws MalformedStructureException {
            Token keyword = next();
            BlockBuilder block = new BlockBuilder(BlockKind.CONDITIONAL, keyword.start(), keyword.end(), "");
            int close = condition(keyword);
            block.header = text.substring(keyword.start(), tokens.get(close).end());
            block.addBranch(innerText(close), branchBody(keyword));
            while (pos < tokens.size() && peek().isWord("else")) {
                Token elseToken = next();
                if (pos < tokens.size() && peek().isWord("if")) {
                    Token elseIf = next();
                    block.addBranch(innerText(condition(elseIf)), branchBody(elseIf));
                } else {
                    block.addBranch(null, branchBody(elseToken));
                    break;
                }
            }
            block.end = consumedEnd();
            return block;
        }

        /**
         * Consume a parenthesized condition after a keyword and return the index of its
         * closing parenthesis.
         */
        private int condition(Token keyword) throws MalformedStructureException {
            if (pos < tokens.size() && peek().isWord("constexpr")) {
                pos++;
            }
            expect("(", keyword);
            int close = matchForward(pos - 1);
            pos = close + 1;
            return close;
        }

        private String innerText(int closeIndex) {
            Token open = tokens.get(matchBackward(closeIndex));
            return text.substring(open.end(), tokens.get(closeIndex).start()).strip();
        }

        private BlockBuilder loop() throws MalformedStructureException {
            Token keyword = next();
            if (pos < tokens.size() && peek().isWord("await")) {
                pos++;
            }
            expect("(", keyword);
            int close = matchForward(pos - 1);
            pos = close + 1;
            BlockBuilder block = new BlockBuilder(BlockKind.LOOP, keyword.start(), keyword.end(),
                    text.substring(keyword.start(), tokens.get(close).end()));
            block.add(branchBody(keyword));
            block.end = consumedEnd();
            return block;
        }

        private BlockBuilder doLoop() throws MalformedStructureException {
            Token keyword = next();
            BlockBuilder block = new BlockBuilder(BlockKind.LOOP, keyword.start(), keyword.end(), "do");
            block.add(branchBody(keyword));
            if (pos >= tokens.size() || !peek().isWord("while")) {
                throw malformed("Expected 'while' after 'do' body", keyword);
            }
            Token whileToken = next();
            expect("(", whileToken);
            pos = matchForward(pos - 1) + 1;
            if (pos < tokens.size() && peek().is(";")) {
                pos++;
            }
            block.end = consumedEnd();
            return block;
        }

        private BlockBuilder tryBlock() throws MalformedStructureException {
            Token keyword = next();
            BlockBuilder block = new BlockBuilder(BlockKind.OTHER, keyword.start(), keyword.end(), "try");
            block.add(bracedBody(expect("{", keyword)));
            while (pos < tokens.size() && (peek().isWord("catch") || peek().isWord("finally"))) {
                Token clause = next();
                if (clause.is("catch") && pos < tokens.size() && peek().is("(")) {
                    pos = matchForward(pos) + 1;
                    if (pos < tokens.size() && peek().isWord("when") && peekIs(1, "(")) {
                        pos = matchForward(pos + 1) + 1;
                    }
                }
                block.add(bracedBody(expect("{", clause)));
            }
            block.end = consumedEnd();
            return block;
        }

        private BlockBuilder switchBlock() throws MalformedStructureException {
            Token keyword = next();
            expect("(", keyword);
            pos = matchForward(pos - 1) + 1;
            Token open = expect("{", keyword);
            BlockBuilder block = new BlockBuilder(BlockKind.OTHER, keyword.start(), keyword.end(),
                    text.substring(keyword.start(), open.start()).strip());
            block.add(bracedBody(open));
            block.end = consumedEnd();
            return block;
        }

        /**
         * C# using, lock and fixed statements.
         */
        private BlockBuilder scopedBlock() throws MalformedStructureException {
            Token keyword = next();
            expect("(", keyword);
            int close = matchForward(pos - 1);
            pos = close + 1;
            BlockBuilder block = new BlockBuilder(BlockKind.OTHER, keyword.start(), keyword.end(),
                    text.substring(keyword.start(), tokens.get(close).end()));
            block.add(branchBody(keyword));
            block.end = consumedEnd();
            return block;
        }

        private void skipLabel() throws MalformedStructureException {
            Token start = peek();
            while (pos < tokens.size()) {
                Token t = peek();
                if (t.is(":")) {
                    pos++;
                    return;
                }
                if (t.type() == TokenType.OPEN) {
                    pos = matchForward(pos) + 1;
                } else {
                    pos++;
                }
            }
            throw malformed("Unterminated label", start);
        }

        /**
         * Body of a control statement: braces, an empty statement, or one statement.
         */
        private BlockBuilder branchBody(Token owner) throws MalformedStructureException {
            if (pos >= tokens.size()) {
                throw malformed("Missing body after '" + owner.text() + "'", owner);
            }
            Token t = peek();
            if (t.is("{")) {
                pos++;
                return bracedBody(t);
            }
            if (t.is(";")) {
                pos++;
                return BlockBuilder.body(t.start(), t.end());
            }
            BlockBuilder statement = null;
            while (statement == null && pos < tokens.size() && !peek().is("}")) {
                statement = statement();
            }
            if (statement == null) {
                throw malformed("Missing body after '" + owner.text() + "'", owner);
            }
            return BlockBuilder.body(statement.start, statement.end).add(statement);
        }

        /**
         * Parse a body whose opening brace was just consumed, through its closing brace.
         */
        private BlockBuilder bracedBody(Token open) throws MalformedStructureException {
            BlockBuilder body = BlockBuilder.body(open.end(), open.end());
            statements(body, true);
            if (pos >= tokens.size()) {
                throw malformed("Unclosed '{'", open);
            }
            Token close = next();
            body.end = close.start();
            return body;
        }

        /**
         * Expression statement or declaration. Declarations that own a body (functions,
         * types and other headed scopes) are returned as compound blocks; function literals
         * inside an expression become children of the statement.
         */
        private BlockBuilder simple() throws MalformedStructureException {
            int startIndex = pos;
            Token first = peek();
            Deque<Token> open = new ArrayDeque<>();
            boolean assigned = false;
            boolean parenGroup = false;
            boolean typeKeyword = false;
            List<BlockBuilder> embedded = new ArrayList<>();
            while (pos < tokens.size()) {
                Token t = peek();
                Token prev = pos > startIndex ? tokens.get(pos - 1) : null;
                if (open.isEmpty()) {
                    if (t.is(";")) {
                        pos++;
                        break;
                    }
                    if (t.is("}")) {
                        break;
                    }
                    if (prev != null && insertsSemicolon(prev, t)) {
                        break;
                    }
                }
                if (t.is("{")) {
                    if (prev != null && (prev.is(")") || prev.is("=>"))) {
                        if (open.isEmpty() && !assigned && prev.is(")")) {
                            return declaration(typeKeyword ? BlockKind.TYPE : BlockKind.FUNCTION, first, t);
                        }
                        embedded.add(functionLiteral(startIndex, t));
                        continue;
                    }
                    if (open.isEmpty() && !assigned && prev != null && opensDeclaration(prev)) {
                        BlockKind kind = typeKeyword ? BlockKind.TYPE
                                : parenGroup ? BlockKind.FUNCTION : BlockKind.OTHER;
                        return declaration(kind, first, t);
                    }
                    open.push(t);
                    pos++;
                    continue;
                }
                if (t.type() == TokenType.OPEN) {
                    open.push(t);
                } else if (t.type() == TokenType.CLOSE) {
                    if (open.isEmpty()) {
                        throw malformed("Unbalanced '" + t.text() + "'", t);
                    }
                    Token opener = open.pop();
                    if (!t.closes(opener)) {
                        throw malformed("Mismatched '" + opener.text() + "' and '" + t.text() + "'", t);
                    }
                    if (open.isEmpty() && t.is(")")) {
                        parenGroup = true;
                    }
                } else if (open.isEmpty()) {
                    typeKeyword |= t.isWord() && TYPE_KEYWORDS.contains(t.text());
                    assigned |= t.type() == TokenType.OPERATOR && ASSIGNMENTS.contains(t.text());
                }
                pos++;
            }
            if (!open.isEmpty()) {
                throw malformed("Unclosed '" + open.peek().text() + "'", open.peek());
            }
            int end = consumedEnd();
            BlockBuilder statement = new BlockBuilder(BlockKind.STATEMENT, first.start(), end,
                    text.substring(first.start(), end));
            embedded.forEach(statement::add);
            return statement;
        }

        private boolean opensDeclaration(Token prev) {
            if (prev.isWord()) {
                return !EXPRESSION_KEYWORDS.contains(prev.text());
            }
            return prev.type() == TokenType.STRING || prev.is(">") || prev.is("]");
        }

        private BlockBuilder declaration(BlockKind kind, Token first, Token open)
                throws MalformedStructureException {
            String header = text.substring(first.start(), open.start()).strip();
            pos++;
            BlockBuilder body = bracedBody(open);
            return new BlockBuilder(kind, first.start(), consumedEnd(), header).add(body);
        }

        /**
         * Function literal or lambda whose body opens at {@code open}: JavaScript function
         * expressions and arrow functions, C# lambdas and C++ lambdas.
         */
        private BlockBuilder functionLiteral(int statementStart, Token open) throws MalformedStructureException {
            int headerIndex = pos - 1;
            if (tokens.get(headerIndex).is("=>")) {
                headerIndex--;
            }
            if (tokens.get(headerIndex).is(")")) {
                headerIndex = matchBackward(headerIndex);
                if (headerIndex - 1 >= statementStart && tokens.get(headerIndex - 1).is("]")) {
                    headerIndex = matchBackward(headerIndex - 1);
                } else if (headerIndex - 1 >= statementStart && tokens.get(headerIndex - 1).isWord("function")) {
                    headerIndex--;
                } else if (headerIndex - 2 >= statementStart && tokens.get(headerIndex - 1).isWord()
                        && tokens.get(headerIndex - 2).isWord("function")) {
                    headerIndex -= 2;
                }
            }
            if (headerIndex - 1 >= statementStart && tokens.get(headerIndex - 1).isWord("async")) {
                headerIndex--;
            }
            Token headerStart = tokens.get(headerIndex);
            String header = text.substring(headerStart.start(), open.start()).strip();
            pos++;
            BlockBuilder body = bracedBody(open);
            return new BlockBuilder(BlockKind.FUNCTION, headerStart.start(), consumedEnd(), header).add(body);
        }

        /**
         * Newline-terminated statements in JavaScript and TypeScript.
         */
        private boolean insertsSemicolon(Token prev, Token next) {
            if (!semicolonInsertion || lines.lineOf(prev.end() - 1) == next.line()) {
                return false;
            }
            boolean prevEnds = switch (prev.type()) {
                case WORD -> !OPEN_ENDED_WORDS.contains(prev.text());
                case NUMBER, STRING -> true;
                case CLOSE -> true;
                case OPERATOR -> prev.is("++") || prev.is("--");
                default -> false;
            };
            boolean nextStarts = switch (next.type()) {
                case WORD -> !CONTINUATION_WORDS.contains(next.text());
                case NUMBER, STRING -> true;
                default -> false;
            };
            return prevEnds && nextStarts;
        }

        private int matchForward(int openIndex) throws MalformedStructureException {
            Deque<Token> open = new ArrayDeque<>();
            for (int i = openIndex; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                if (t.type() == TokenType.OPEN) {
                    open.push(t);
                } else if (t.type() == TokenType.CLOSE) {
                    Token opener = open.pop();
                    if (!t.closes(opener)) {
                        throw malformed("Mismatched '" + opener.text() + "' and '" + t.text() + "'", t);
                    }
                    if (open.isEmpty()) {
                        return i;
                    }
                }
            }
            Token opener = tokens.get(openIndex);
            throw malformed("Unclosed '" + opener.text() + "'", opener);
        }

        /**
         * Index of the opener matching an already balanced closer.
         */
        private int matchBackward(int closeIndex) {
            int depth = 0;
            for (int i = closeIndex; i >= 0; i--) {
                Token t = tokens.get(i);
                if (t.type() == TokenType.CLOSE) {
                    depth++;
                } else if (t.type() == TokenType.OPEN) {
                    depth--;
                    if (depth == 0) {
                        return i;
                    }
                }
            }
            return 0;
        }

        private Token expect(String value, Token context) throws MalformedStructureException {
            if (pos >= tokens.size() || !peek().is(value)) {
                Token at = pos < tokens.size() ? peek() : context;
                throw malformed("Expected '" + value + "' after '" + context.text() + "'", at);
            }
            return next();
        }

        private Token peek() {
            return tokens.get(pos);
        }

        private boolean peekIs(int ahead, String value) {
            return pos + ahead < tokens.size() && tokens.get(pos + ahead).is(value);
        }

        private Token next() {
            return tokens.get(pos++);
        }

        private int consumedEnd() {
            return tokens.get(pos - 1).end();
        }

        private MalformedStructureException malformed(String message, Token at) {
            return new MalformedStructureException(message, at.line(), at.start());
        }
    }
}
