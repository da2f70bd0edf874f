package com.raditha.unnest.analysis;

import com.raditha.unnest.adapter.LexicalScanner;
import com.raditha.unnest.adapter.Token;
import com.raditha.unnest.adapter.TokenType;
import com.raditha.unnest.model.Dialect;

import java.util.List;
import java.util.Set;

/**
 * Inspects condition texts: side effects and the subject they test.
 */
public class ConditionAnalyzer {

    private static final Set<String> MUTATING_OPERATORS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", ">>>=", "**=", "//=", ":=",
            "++", "--");

    private static final Set<String> COMPARISONS = Set.of(
            "==", "!=", "===", "!==", "<", ">", "<=", ">=", "is", "in", "instanceof");

    private static final Set<String> CONNECTIVES = Set.of("&&", "||", "and", "or", "?", "??");

    private final LexicalScanner scanner;

    public ConditionAnalyzer(Dialect dialect) {
        this.scanner = new LexicalScanner(dialect);
    }

    /**
     * Whether evaluating a condition can change state: assignments, increments and decrements.
     */
    public boolean hasSideEffects(String condition) {
        return scanner.scanFragment(condition).stream()
                .anyMatch(t -> t.type() == TokenType.OPERATOR && MUTATING_OPERATORS.contains(t.text()));
    }

    /**
     * The leading operand of a condition with whitespace removed, for example {@code score}
     * for {@code score >= 90 && bonus}. Leading negations and parentheses are skipped.
     */
    public String subject(String condition) {
        List<Token> tokens = scanner.scanFragment(condition);
        int i = 0;
        while (i < tokens.size() && (tokens.get(i).is("!") || tokens.get(i).isWord("not") || tokens.get(i).is("("))) {
            i++;
        }
        StringBuilder subject = new StringBuilder();
        int depth = 0;
        for (; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (depth == 0 && (COMPARISONS.contains(t.text()) || CONNECTIVES.contains(t.text()))) {
                break;
            }
            if (t.type() == TokenType.OPEN) {
                depth++;
            } else if (t.type() == TokenType.CLOSE) {
                if (depth == 0) {
                    break;
                }
                depth--;
            }
            subject.append(t.text());
        }
        return subject.toString();
    }
}
