package com.raditha.unnest.syntax;

import com.raditha.unnest.adapter.LexicalScanner;
import com.raditha.unnest.adapter.Token;
import com.raditha.unnest.adapter.TokenType;
import com.raditha.unnest.model.Dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Produces the logical negation of a condition text.
 * <p>
 * Uniform {@code &&} and {@code ||} chains are inverted with De Morgan's laws, single
 * equality and membership tests flip their operator, and negated simple operands lose their
 * negation. Anything else is wrapped as {@code !(...)} or {@code not (...)}.
 * <p>
 * Ordering comparisons are always wrapped: with a NaN operand both {@code a < b} and
 * {@code a >= b} are false.
 */
public class ConditionInverter {

    private static final Map<String, String> FLIPPED = Map.ofEntries(
            Map.entry("==", "!="), Map.entry("!=", "=="),
            Map.entry("===", "!=="), Map.entry("!==", "==="));

    private static final Set<String> ORDERING = Set.of("<", "<=", ">", ">=", "<>");

    /** operators that make a comparison flip unsafe because of their precedence */
    private static final Set<String> BLOCKING = Set.of(
            "?", "??", "&", "|", "^", "=", "<<", ">>", ">>>", "->", "=>", ",", ":", "instanceof", "lambda",
            "if", "else", "await", "typeof", "new");

    private static final Set<String> OPERATOR_WORDS = Set.of(
            "and", "or", "not", "is", "in", "if", "else", "lambda", "instanceof", "new", "typeof", "await",
            "as", "sizeof", "delete");

    /** operators allowed inside a simple operand */
    private static final Set<String> SIMPLE_OPERATORS = Set.of(".", "->", "::", "?.");

    private final Dialect dialect;
    private final LexicalScanner scanner;
    private final boolean python;

    public ConditionInverter(Dialect dialect) {
        this.dialect = dialect;
        this.scanner = new LexicalScanner(dialect);
        this.python = dialect == Dialect.PYTHON;
    }

    /**
     * Negate a condition.
     */
    public String invert(String condition) {
        String text = singleLine(condition).strip();
        List<Token> tokens = scanner.scanFragment(text);
        // 1. whole-condition parentheses carry no meaning
        while (tokens.size() > 2 && tokens.get(0).is("(") && matching(tokens, 0) == tokens.size() - 1) {
            text = text.substring(tokens.get(1).start(), tokens.get(tokens.size() - 2).end());
            tokens = scanner.scanFragment(text);
        }
        if (tokens.isEmpty()) {
            return wrap(text);
        }
        return invert(text, tokens);
    }

    private String invert(String text, List<Token> tokens) {
        // 2. De Morgan over a uniform chain of connectives
        List<Integer> connectives = topLevel(tokens, this::isConnective);
        if (!connectives.isEmpty()) {
            String kind = connectiveKind(tokens.get(connectives.get(0)));
            boolean uniform = connectives.stream().allMatch(i -> connectiveKind(tokens.get(i)).equals(kind));
            if (!uniform || !topLevel(tokens, t -> BLOCKING.contains(t.text())).isEmpty()) {
                return wrap(text);
            }
            List<String> parts = new ArrayList<>();
            int from = 0;
            for (int at : connectives) {
                parts.add(invertOperand(slice(text, tokens, from, at)));
                from = at + 1;
            }
            parts.add(invertOperand(slice(text, tokens, from, tokens.size())));
            return String.join(" " + dual(kind) + " ", parts);
        }

        boolean blocked = !topLevel(tokens, t -> BLOCKING.contains(t.text())).isEmpty();

        // 3. leading not in Python, unless a conditional expression or lambda binds looser
        if (python && tokens.get(0).isWord("not") && tokens.size() > 1 && !blocked) {
            return slice(text, tokens, 1, tokens.size());
        }

        // 4. a single equality or membership test flips its operator
        List<Integer> comparisons = topLevel(tokens, t -> FLIPPED.containsKey(t.text())
                || ORDERING.contains(t.text()) || (python && (t.isWord("is") || t.isWord("in"))));
        if (comparisons.size() == 1 && !ORDERING.contains(tokens.get(comparisons.get(0)).text()) && !blocked) {
            String flipped = flipComparison(text, tokens, comparisons.get(0));
            if (flipped != null) {
                return flipped;
            }
        }

        // 5. a negated simple operand
        if (tokens.get(0).is("!") && tokens.size() > 1 && isSimple(tokens.subList(1, tokens.size()))) {
            String operand = slice(text, tokens, 1, tokens.size());
            List<Token> operandTokens = scanner.scanFragment(operand);
            if (operandTokens.size() > 2 && operandTokens.get(0).is("(")
                    && matching(operandTokens, 0) == operandTokens.size() - 1) {
                return operand.substring(operandTokens.get(1).start(), operandTokens.get(operandTokens.size() - 2).end());
            }
            return operand;
        }

        // 6. a simple operand
        if (isSimple(tokens)) {
            return python ? "not " + text : "!" + text;
        }
        return wrap(text);
    }

    private String invertOperand(String operand) {
        String inverted = invert(operand);
        List<Token> tokens = scanner.scanFragment(inverted);
        boolean compound = !topLevel(tokens, this::isConnective).isEmpty()
                || !topLevel(tokens, t -> t.is("?") || t.is("??")).isEmpty();
        return compound ? "(" + inverted + ")" : inverted;
    }

    private String flipComparison(String text, List<Token> tokens, int at) {
        Token op = tokens.get(at);
        String before = text.substring(0, op.start());
        if (python && op.isWord("is")) {
            if (at + 1 < tokens.size() && tokens.get(at + 1).isWord("not")) {
                return before + "is" + text.substring(tokens.get(at + 1).end());
            }
            return before + "is not" + text.substring(op.end());
        }
        if (python && op.isWord("in")) {
            if (at > 0 && tokens.get(at - 1).isWord("not")) {
                return text.substring(0, tokens.get(at - 1).start()) + "in" + text.substring(op.end());
            }
            return before + "not in" + text.substring(op.end());
        }
        if (python && at > 0 && tokens.get(at - 1).isWord("not")) {
            return null;
        }
        return before + FLIPPED.get(op.text()) + text.substring(op.end());
    }

    /**
     * Identifiers, literals and calls joined by member access, with an optional leading
     * negation for brace dialects.
     */
    private boolean isSimple(List<Token> tokens) {
        int depth = 0;
        boolean afterOperand = false;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.type() == TokenType.OPEN) {
                depth++;
                continue;
            }
            if (t.type() == TokenType.CLOSE) {
                depth--;
                afterOperand = depth == 0;
                continue;
            }
            if (depth > 0) {
                continue;
            }
            boolean operand = t.type() == TokenType.WORD || t.type() == TokenType.NUMBER
                    || t.type() == TokenType.STRING;
            boolean access = t.type() == TokenType.OPERATOR && SIMPLE_OPERATORS.contains(t.text());
            boolean leadingBang = !python && i == 0 && t.is("!");
            if (!operand && !access && !leadingBang) {
                return false;
            }
            // two operands in a row are an operator word such as is, as or new
            if (operand && afterOperand) {
                return false;
            }
            if (t.isWord() && OPERATOR_WORDS.contains(t.text())) {
                return false;
            }
            afterOperand = operand;
        }
        return true;
    }

    private boolean isConnective(Token t) {
        if (python) {
            return t.isWord("and") || t.isWord("or");
        }
        return t.is("&&") || t.is("||");
    }

    private static String connectiveKind(Token t) {
        return t.is("&&") || t.isWord("and") ? "and" : "or";
    }

    private String dual(String kind) {
        if (python) {
            return kind.equals("and") ? "or" : "and";
        }
        return kind.equals("and") ? "||" : "&&";
    }

    private String wrap(String text) {
        return python ? "not (" + text + ")" : "!(" + text + ")";
    }

    private static List<Integer> topLevel(List<Token> tokens, Predicate<Token> test) {
        List<Integer> found = new ArrayList<>();
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.type() == TokenType.OPEN) {
                depth++;
            } else if (t.type() == TokenType.CLOSE) {
                depth--;
            } else if (depth == 0 && test.test(t)) {
                found.add(i);
            }
        }
        return found;
    }

    private static int matching(List<Token> tokens, int open) {
        int depth = 0;
        for (int i = open; i < tokens.size(); i++) {
            if (tokens.get(i).type() == TokenType.OPEN) {
                depth++;
            } else if (tokens.get(i).type() == TokenType.CLOSE) {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }

    private static String slice(String text, List<Token> tokens, int from, int to) {
        if (from >= to) {
            return "";
        }
        return text.substring(tokens.get(from).start(), tokens.get(to - 1).end()).strip();
    }

    /**
     * Join the physical lines of a condition into one line. Comments inside a multi-line
     * condition are dropped.
     */
    public String singleLine(String condition) {
        if (condition.indexOf('\n') < 0) {
            return condition.strip();
        }
        List<Token> tokens = scanner.scanFragment(condition);
        if (tokens.isEmpty()) {
            return condition.strip();
        }
        StringBuilder joined = new StringBuilder(tokens.get(0).text());
        for (int i = 1; i < tokens.size(); i++) {
            if (tokens.get(i).start() > tokens.get(i - 1).end()) {
                joined.append(' ');
            }
            joined.append(tokens.get(i).text());
        }
        return joined.toString();
    }

    public Dialect dialect() {
        return dialect;
    }
}
