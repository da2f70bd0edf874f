package com.raditha.unnest.refactoring;

import com.raditha.unnest.adapter.LexicalScanner;
import com.raditha.unnest.adapter.Token;
import com.raditha.unnest.adapter.TokenType;
import com.raditha.unnest.analysis.TerminalAnalyzer;
import com.raditha.unnest.model.Dialect;
import com.raditha.unnest.model.RefactoringCandidate;
import com.raditha.unnest.model.ValidationResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The fixed set of corrections tried on a candidate that failed validation.
 * Each call applies at most one of them.
 */
public class RepairHeuristics {

    private static final Logger logger = LoggerFactory.getLogger(RepairHeuristics.class);

    private static final Map<String, String> CLOSERS = Map.of("{", "}", "(", ")", "[", "]");

    private static final Set<String> PYTHON_HEADERS = Set.of(
            "if", "elif", "else", "for", "while", "def", "class", "try", "except", "finally", "with");

    /**
     * Corrective actions, in the order they are tried.
     */
    public enum Heuristic {
        DELIMITER_BALANCING,
        TRAILING_COLON,
        REVERT_LAST_LEVEL
    }

    /**
     * A repaired candidate and the action that produced it.
     */
    public record Repair(Heuristic heuristic, RefactoringCandidate candidate) {
    }

    /**
     * Try the heuristics that fit a failure and return the first repair that changes anything.
     *
     * @return the repair, empty when nothing applies
     */
    public Optional<Repair> repair(RefactoringCandidate candidate, ValidationResult failure, RegionContext context,
            RegionTransformer transformer) {
        return switch (failure.failure()) {
            case MALFORMED_STRUCTURE -> balanceDelimiters(candidate, context)
                    .or(() -> insertTrailingColons(candidate, context))
                    .or(() -> revertLastLevel(candidate, context, transformer));
            case EXTRACTION_ROUND_TRIP -> revertLastLevel(candidate, context, transformer);
            case DEPTH_NOT_REDUCED, NONE -> Optional.empty();
        };
    }

    Optional<Repair> balanceDelimiters(RefactoringCandidate candidate, RegionContext context) {
        if (context.dialect() == Dialect.PYTHON || context.dialect() == Dialect.GENERIC) {
            return Optional.empty();
        }
        String text = candidate.rewrittenText();
        List<Token> tokens = new LexicalScanner(context.dialect()).scanFragment(text);
        Deque<Token> open = new ArrayDeque<>();
        List<Token> stray = new ArrayList<>();
        for (Token token : tokens) {
            if (token.type() == TokenType.OPEN) {
                open.push(token);
            } else if (token.type() == TokenType.CLOSE) {
                if (!open.isEmpty() && token.closes(open.peek())) {
                    open.pop();
                } else {
                    stray.add(token);
                }
            }
        }
        if (open.isEmpty() && stray.isEmpty()) {
            return Optional.empty();
        }

        // 1. drop closers with no opener, last first so offsets stay valid
        StringBuilder repaired = new StringBuilder(text);
        for (int i = stray.size() - 1; i >= 0; i--) {
            Token token = stray.get(i);
            repaired.delete(token.start(), token.end());
        }
        // 2. close what is still open, innermost first
        while (!open.isEmpty()) {
            String opener = open.pop().text();
            String closer = CLOSERS.getOrDefault(opener, "}");
            if (opener.equals("{")) {
                repaired.append(context.newline()).append(context.baseIndent()).append(closer);
            } else {
                repaired.append(closer);
            }
        }
        logger.debug("Balanced delimiters: removed {} stray closers", stray.size());
        return Optional.of(new Repair(Heuristic.DELIMITER_BALANCING, withRewrite(candidate, context, repaired.toString())));
    }

    Optional<Repair> insertTrailingColons(RefactoringCandidate candidate, RegionContext context) {
        if (context.dialect() != Dialect.PYTHON) {
            return Optional.empty();
        }
        String newline = context.newline();
        String[] lines = candidate.rewrittenText().split(newline, -1);
        boolean changed = false;
        for (int i = 0; i < lines.length; i++) {
            String stripped = lines[i].strip();
            if (stripped.isEmpty() || stripped.endsWith(":") || stripped.contains("#")
                    || !PYTHON_HEADERS.contains(TerminalAnalyzer.leadingWord(stripped))) {
                continue;
            }
            int next = i + 1;
            while (next < lines.length && lines[next].isBlank()) {
                next++;
            }
            // the first line has no indentation of its own
            int width = i == 0 ? context.baseIndent().length() : indentWidth(lines[i]);
            if (next < lines.length && indentWidth(lines[next]) > width) {
                lines[i] = lines[i].stripTrailing() + ":";
                changed = true;
            }
        }
        if (!changed) {
            return Optional.empty();
        }
        return Optional.of(new Repair(Heuristic.TRAILING_COLON,
                withRewrite(candidate, context, String.join(newline, lines))));
    }

    Optional<Repair> revertLastLevel(RefactoringCandidate candidate, RegionContext context,
            RegionTransformer transformer) {
        int reverted = candidate.revertedLevels() + 1;
        if (reverted > transformer.maxRevertedLevels(context)) {
            return Optional.empty();
        }
        try {
            return Optional.of(new Repair(Heuristic.REVERT_LAST_LEVEL, transformer.transform(context, reverted)));
        } catch (TransformInfeasibleException e) {
            logger.debug("Cannot revert level {}: {}", reverted, e.getMessage());
            return Optional.empty();
        }
    }

    private static RefactoringCandidate withRewrite(RefactoringCandidate candidate, RegionContext context,
            String rewritten) {
        String fullText = TransformEngine.splice(context.text(), candidate.replacedSpan(), rewritten,
                candidate.subroutines());
        return candidate.withRepairedText(rewritten, fullText);
    }

    private static int indentWidth(String line) {
        return line.length() - line.stripLeading().length();
    }
}
