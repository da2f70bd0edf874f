package com.raditha.unnest.adapter;

import com.raditha.unnest.model.Dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Lexical pre-pass that turns source text into tokens.
 * Comments, preprocessor lines and whitespace are skipped, and string literals become single
 * tokens, so delimiters inside them are never counted. JavaScript and TypeScript regular
 * expression literals are string tokens too.
 */
public class LexicalScanner {

    private static final String[] OPERATORS = {
            ">>>=", "<<=", ">>=", "...", "===", "!==", "**=", "//=", ">>>",
            "==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=",
            "->", "=>", "::", ":=", "**", "//", "<<", ">>", "?.", "??"
    };

    /** words after which a slash starts a regular expression rather than a division */
    private static final Set<String> REGEX_PRECEDING_WORDS = Set.of(
            "return", "typeof", "case", "do", "else", "in", "of", "new", "delete", "void", "throw",
            "instanceof", "yield", "await");

    private final Dialect dialect;
    private final boolean hashComments;
    private final boolean slashComments;
    private final boolean preprocessor;
    private final boolean templates;
    private final boolean pythonStrings;

    public LexicalScanner(Dialect dialect) {
        this.dialect = dialect;
        this.hashComments = dialect == Dialect.PYTHON || dialect == Dialect.GENERIC;
        this.slashComments = dialect != Dialect.PYTHON;
        this.preprocessor = dialect == Dialect.C || dialect == Dialect.CPP || dialect == Dialect.CSHARP;
        this.templates = dialect == Dialect.JAVASCRIPT || dialect == Dialect.TYPESCRIPT;
        this.pythonStrings = dialect == Dialect.PYTHON;
    }

    public Dialect dialect() {
        return dialect;
    }

    /**
     * Scan the whole text.
     *
     * @throws MalformedStructureException on an unterminated string or block comment
     */
    public List<Token> scan(String text) throws MalformedStructureException {
        return new Run(text).scan();
    }

    /**
     * Scan a fragment that is already known to be well formed, such as a statement or
     * condition taken from an indexed block. Returns an empty list if it does not scan.
     */
    public List<Token> scanFragment(String fragment) {
        try {
            return scan(fragment);
        } catch (MalformedStructureException e) {
            return List.of();
        }
    }

    /**
     * Scanning state for one text.
     */
    private final class Run {
        private final String text;
        private final List<Token> tokens = new ArrayList<>();
        private int pos;
        private int line = 1;
        private boolean lineHasToken;

        Run(String text) {
            this.text = text;
        }

        List<Token> scan() throws MalformedStructureException {
            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (c == '\n') {
                    line++;
                    pos++;
                    lineHasToken = false;
                } else if (Character.isWhitespace(c)) {
                    pos++;
                } else if (c == '\\' && pos + 1 < text.length() && isLineBreak(pos + 1)) {
                    pos++; // explicit line continuation
                } else if (slashComments && startsWith("//")) {
                    skipToLineEnd();
                } else if (slashComments && startsWith("/*")) {
                    skipBlockComment();
                } else if (hashComments && c == '#') {
                    skipToLineEnd();
                } else if (preprocessor && c == '#' && !lineHasToken) {
                    skipPreprocessorLine();
                } else if (isStringStart()) {
                    scanString();
                } else if (templates && c == '/' && regexAllowed()) {
                    scanRegex();
                } else if (Character.isDigit(c)) {
                    scanNumber();
                } else if (Character.isJavaIdentifierStart(c)) {
                    scanWord();
                } else {
                    scanPunctuation();
                }
            }
            return tokens;
        }

        private boolean isLineBreak(int at) {
            return text.charAt(at) == '\n'
                    || (text.charAt(at) == '\r' && at + 1 < text.length() && text.charAt(at + 1) == '\n');
        }

        private boolean startsWith(String s) {
            return text.startsWith(s, pos);
        }

        private void skipToLineEnd() {
            while (pos < text.length() && text.charAt(pos) != '\n') {
                pos++;
            }
        }

        private void skipPreprocessorLine() {
            while (pos < text.length() && text.charAt(pos) != '\n') {
                if (text.charAt(pos) == '\\' && pos + 1 < text.length() && isLineBreak(pos + 1)) {
                    pos++;
                    while (text.charAt(pos) != '\n') {
                        pos++;
                    }
                    line++;
                }
                pos++;
            }
        }

        private void skipBlockComment() throws MalformedStructureException {
            int startLine = line;
            int startPos = pos;
            int close = text.indexOf("*/", pos + 2);
            if (close < 0) {
                throw new MalformedStructureException("Unterminated block comment", startLine, startPos);
            }
            for (int i = pos; i < close; i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                }
            }
            pos = close + 2;
        }

        private boolean isStringStart() {
            char c = text.charAt(pos);
            if (c == '"' || c == '\'') {
                return true;
            }
            if (c == '`' && templates) {
                return true;
            }
            if (dialect == Dialect.CSHARP && (c == '@' || c == '$') && pos + 1 < text.length()) {
                char next = text.charAt(pos + 1);
                return next == '"' || ((next == '@' || next == '$') && pos + 2 < text.length()
                        && text.charAt(pos + 2) == '"');
            }
            if (pythonStrings || dialect == Dialect.CPP) {
                int i = pos;
                while (i < text.length() && i - pos < 3 && Character.isLetter(text.charAt(i))) {
                    i++;
                }
                if (i > pos && i < text.length() && (text.charAt(i) == '"' || text.charAt(i) == '\'')) {
                    String prefix = text.substring(pos, i).toLowerCase();
                    return pythonStrings ? prefix.matches("[rbuf]{1,2}") : prefix.matches("(u8|u|l)?r");
                }
            }
            return false;
        }

        private void scanString() throws MalformedStructureException {
            int start = pos;
            int startLine = line;
            boolean raw = false;
            boolean verbatim = false;
            while (Character.isLetter(text.charAt(pos)) || text.charAt(pos) == '@' || text.charAt(pos) == '$') {
                char p = Character.toLowerCase(text.charAt(pos));
                raw |= p == 'r';
                verbatim |= p == '@';
                pos++;
            }
            char quote = text.charAt(pos);
            if (dialect == Dialect.CPP && raw) {
                scanCppRawString(start, startLine);
                return;
            }
            boolean triple = (pythonStrings || dialect == Dialect.JAVA)
                    && text.startsWith(String.valueOf(quote).repeat(3), pos);
            String terminator = triple ? String.valueOf(quote).repeat(3) : String.valueOf(quote);
            pos += terminator.length();
            boolean multiline = triple || quote == '`' || verbatim;
            while (true) {
                if (pos >= text.length()) {
                    throw new MalformedStructureException("Unterminated string literal", startLine, start);
                }
                char c = text.charAt(pos);
                if (c == '\n') {
                    if (!multiline) {
                        throw new MalformedStructureException("Unterminated string literal", startLine, start);
                    }
                    line++;
                    pos++;
                } else if (c == '\\' && !verbatim) {
                    if (pos + 1 < text.length() && text.charAt(pos + 1) == '\n') {
                        line++;
                    }
                    pos += 2;
                } else if (verbatim && c == '"' && pos + 1 < text.length() && text.charAt(pos + 1) == '"') {
                    pos += 2;
                } else if (quote == '`' && c == '$' && pos + 1 < text.length() && text.charAt(pos + 1) == '{') {
                    skipTemplateExpression(startLine, start);
                } else if (text.startsWith(terminator, pos)) {
                    pos += terminator.length();
                    break;
                } else {
                    pos++;
                }
            }
            add(TokenType.STRING, start, startLine);
        }

        private void skipTemplateExpression(int startLine, int start) throws MalformedStructureException {
            pos += 2;
            int depth = 1;
            while (depth > 0) {
                if (pos >= text.length()) {
                    throw new MalformedStructureException("Unterminated template literal", startLine, start);
                }
                char c = text.charAt(pos);
                if (c == '{') {
                    depth++;
                } else if (c == '}') {
                    depth--;
                } else if (c == '\n') {
                    line++;
                } else if (c == '"' || c == '\'') {
                    int close = text.indexOf(c, pos + 1);
                    if (close < 0) {
                        throw new MalformedStructureException("Unterminated template literal", startLine, start);
                    }
                    pos = close;
                }
                pos++;
            }
        }

        private void scanCppRawString(int start, int startLine) throws MalformedStructureException {
            int open = text.indexOf('(', pos);
            if (open < 0) {
                throw new MalformedStructureException("Malformed raw string literal", startLine, start);
            }
            String delimiter = text.substring(pos + 1, open);
            String terminator = ")" + delimiter + "\"";
            int close = text.indexOf(terminator, open);
            if (close < 0) {
                throw new MalformedStructureException("Unterminated raw string literal", startLine, start);
            }
            for (int i = pos; i < close; i++) {
                if (text.charAt(i) == '\n') {
                    line++;
                }
            }
            pos = close + terminator.length();
            add(TokenType.STRING, start, startLine);
        }

        /**
         * A slash starts a regular expression where an operand is expected.
         */
        private boolean regexAllowed() {
            if (tokens.isEmpty()) {
                return true;
            }
            Token previous = tokens.get(tokens.size() - 1);
            return switch (previous.type()) {
                case OPEN, SEPARATOR -> true;
                case OPERATOR -> !previous.is("++") && !previous.is("--");
                case WORD -> REGEX_PRECEDING_WORDS.contains(previous.text());
                default -> false;
            };
        }

        private void scanRegex() throws MalformedStructureException {
            int start = pos;
            boolean inClass = false;
            pos++;
            while (true) {
                if (pos >= text.length() || text.charAt(pos) == '\n') {
                    throw new MalformedStructureException("Unterminated regular expression literal", line, start);
                }
                char c = text.charAt(pos);
                if (c == '\\') {
                    pos += 2;
                    continue;
                }
                if (c == '[') {
                    inClass = true;
                } else if (c == ']') {
                    inClass = false;
                } else if (c == '/' && !inClass) {
                    pos++;
                    break;
                }
                pos++;
            }
            while (pos < text.length() && Character.isLetter(text.charAt(pos))) {
                pos++;
            }
            add(TokenType.STRING, start, line);
        }

        private void scanNumber() {
            int start = pos;
            while (pos < text.length()
                    && (Character.isLetterOrDigit(text.charAt(pos)) || text.charAt(pos) == '.'
                            || text.charAt(pos) == '_')) {
                if (text.charAt(pos) == '.' && pos + 1 < text.length() && text.charAt(pos + 1) == '.') {
                    break;
                }
                pos++;
            }
            add(TokenType.NUMBER, start, line);
        }

        private void scanWord() {
            int start = pos;
            while (pos < text.length() && Character.isJavaIdentifierPart(text.charAt(pos))) {
                pos++;
            }
            add(TokenType.WORD, start, line);
        }

        private void scanPunctuation() {
            int start = pos;
            char c = text.charAt(pos);
            switch (c) {
                case '(', '[', '{' -> {
                    pos++;
                    add(TokenType.OPEN, start, line);
                    return;
                }
                case ')', ']', '}' -> {
                    pos++;
                    add(TokenType.CLOSE, start, line);
                    return;
                }
                case ';', ',' -> {
                    pos++;
                    add(TokenType.SEPARATOR, start, line);
                    return;
                }
                default -> {
                    // operators below
                }
            }
            for (String op : OPERATORS) {
                if (startsWith(op) && (!op.equals("//") || pythonStrings)) {
                    pos += op.length();
                    add(TokenType.OPERATOR, start, line);
                    return;
                }
            }
            pos++;
            add(TokenType.OPERATOR, start, line);
        }

        private void add(TokenType type, int start, int startLine) {
            tokens.add(new Token(type, text.substring(start, pos), start, pos, startLine));
            lineHasToken = true;
        }
    }
}
