package com.raditha.unnest.analysis;

import com.raditha.unnest.adapter.LexicalScanner;
import com.raditha.unnest.adapter.Token;
import com.raditha.unnest.adapter.TokenType;
import com.raditha.unnest.model.Block;
import com.raditha.unnest.model.BlockKind;
import com.raditha.unnest.model.Dialect;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Analyzes variable scope to determine what variables are available
 * when a branch body is moved into a subroutine.
 * <p>
 * Declarations are recognised textually: parameters from the function header, locals from
 * statements and loop headers that precede the region in an enclosing body.
 */
public class ScopeAnalyzer {

    private static final Set<String> NOT_TYPES = Set.of(
            "return", "throw", "new", "delete", "case", "goto", "else", "do", "yield", "await", "break",
            "continue", "typeof", "sizeof", "raise", "del", "assert", "print", "import", "from", "pass");

    private static final Set<String> MODIFIERS = Set.of(
            "final", "const", "static", "volatile", "register", "readonly", "using");

    private static final Set<String> TYPE_OPERATORS = Set.of(".", "::", "<", ">", ">>", "*", "&", "?", "...");

    private static final Set<String> ASSIGNMENTS = Set.of(
            "=", "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "<<=", ">>=", ">>>=", "**=", "//=", ":=");

    private static final Set<String> MEMBER_ACCESS = Set.of(".", "->", "?.", "::");

    private final Dialect dialect;
    private final LexicalScanner scanner;

    public ScopeAnalyzer(Dialect dialect) {
        this.dialect = dialect;
        this.scanner = new LexicalScanner(dialect);
    }

    /**
     * Get all variables available at the start of a region.
     *
     * @param function enclosing function block, or null for top-level code
     * @param region   the region's root block
     * @param index    parent links of the tree
     * @return available variables, parameters first, in declaration order
     */
    public List<VariableInfo> getAvailableVariables(Block function, Block region, BlockIndex index) {
        Map<String, VariableInfo> available = new LinkedHashMap<>();

        // 1. Function parameters
        if (function != null) {
            for (FunctionHeader.Parameter parameter : FunctionHeader.parse(dialect, function.header()).parameters()) {
                available.putIfAbsent(parameter.name(),
                        new VariableInfo(parameter.name(), parameter.type(), parameter.declaration(), true));
            }
        }

        // 2. Locals declared before the region
        Block scope = function != null ? function.body() : index.root();
        if (scope != null) {
            for (VariableInfo local : localsBefore(scope, region, index)) {
                available.putIfAbsent(local.name(), local);
            }
        }
        return new ArrayList<>(available.values());
    }

    private List<VariableInfo> localsBefore(Block scope, Block region, BlockIndex index) {
        List<VariableInfo> locals = new ArrayList<>();
        if (dialect == Dialect.PYTHON) {
            // function scoped: every binding that precedes the region counts
            collectPython(scope, region.span().start(), locals);
            return locals;
        }
        List<Block> path = new ArrayList<>(index.ancestors(region));
        Collections.reverse(path);
        boolean inside = false;
        for (Block ancestor : path) {
            if (ancestor == scope) {
                inside = true;
            }
            if (!inside) {
                continue;
            }
            if (ancestor.kind() == BlockKind.LOOP) {
                locals.addAll(loopDeclarations(ancestor.header()));
            }
            if (ancestor.kind() == BlockKind.BODY) {
                for (Block statement : ancestor.children()) {
                    if (statement.span().end() > region.span().start()) {
                        break;
                    }
                    if (statement.kind() == BlockKind.STATEMENT) {
                        locals.addAll(declarations(statement.header()));
                    }
                }
            }
        }
        return locals;
    }

    private void collectPython(Block block, int before, List<VariableInfo> locals) {
        for (Block child : block.children()) {
            if (child.span().start() >= before || child.kind() == BlockKind.FUNCTION
                    || child.kind() == BlockKind.TYPE) {
                continue;
            }
            if (child.kind() == BlockKind.STATEMENT) {
                locals.addAll(declarations(child.header()));
            } else if (child.kind() == BlockKind.LOOP || child.kind() == BlockKind.OTHER) {
                locals.addAll(loopDeclarations(child.header()));
            }
            collectPython(child, before, locals);
        }
    }

    /**
     * Variables declared by one statement.
     */
    public List<VariableInfo> declarations(String statement) {
        List<Token> tokens = scanner.scanFragment(statement);
        if (tokens.isEmpty()) {
            return List.of();
        }
        if (dialect == Dialect.PYTHON) {
            return pythonTargets(tokens);
        }
        if (tokens.get(0).isWord("let") || tokens.get(0).isWord("const") || tokens.get(0).isWord("var")
                && !dialect.isTyped()) {
            return scriptDeclarations(tokens);
        }
        if (!dialect.isTyped()) {
            return List.of();
        }
        return typedDeclarations(statement, tokens);
    }

    /**
     * Variables declared in a loop, with, or catch header.
     */
    public List<VariableInfo> loopDeclarations(String header) {
        List<Token> tokens = scanner.scanFragment(header);
        if (dialect == Dialect.PYTHON) {
            return pythonHeaderTargets(tokens);
        }
        int open = -1;
        for (int i = 0; i < tokens.size(); i++) {
            if (tokens.get(i).is("(")) {
                open = i;
                break;
            }
        }
        if (open < 0) {
            return List.of();
        }
        int end = open + 1;
        int depth = 0;
        while (end < tokens.size()) {
            Token t = tokens.get(end);
            if (depth == 0 && (t.is(";") || t.is(")"))) {
                break;
            }
            if (t.type() == TokenType.OPEN) {
                depth++;
            } else if (t.type() == TokenType.CLOSE) {
                depth--;
            }
            end++;
        }
        if (end <= open + 1 || end > tokens.size()) {
            return List.of();
        }
        String init = header.substring(tokens.get(open + 1).start(), tokens.get(end - 1).end());
        return declarations(init);
    }

    private List<VariableInfo> typedDeclarations(String statement, List<Token> tokens) {
        int start = 0;
        while (start < tokens.size() && (tokens.get(start).is("@") || MODIFIERS.contains(tokens.get(start).text()))) {
            start += tokens.get(start).is("@") ? 2 : 1;
        }
        if (start >= tokens.size() || !tokens.get(start).isWord() || NOT_TYPES.contains(tokens.get(start).text())) {
            return List.of();
        }
        // first declarator ends at the first top-level '=', ';', ',', ':' or 'in'
        int angle = 0;
        int end = start;
        while (end < tokens.size()) {
            Token t = tokens.get(end);
            if (t.is("<")) {
                angle++;
            } else if (t.is(">")) {
                angle--;
            } else if (t.is(">>")) {
                angle -= 2;
            } else if (angle <= 0 && (t.is("=") || t.is(";") || t.is(",") || t.is(":") || t.isWord("in"))) {
                break;
            } else if (t.is("(") || t.is("{") || (t.type() == TokenType.OPERATOR && !TYPE_OPERATORS.contains(t.text()))) {
                return List.of();
            }
            end++;
        }
        int nameIndex = end - 1;
        while (nameIndex > start && tokens.get(nameIndex).is("]")) {
            nameIndex -= 2;
        }
        if (nameIndex <= start || !tokens.get(nameIndex).isWord()) {
            return List.of();
        }
        Token last = tokens.get(nameIndex - 1);
        if (!(last.isWord() || last.is(">") || last.is(">>") || last.is("]") || last.is("*") || last.is("&")
                || last.is("?") || last.is("..."))) {
            return List.of();
        }
        String type = statement.substring(tokens.get(start).start(), last.end()).strip();
        List<VariableInfo> result = new ArrayList<>();
        result.add(typed(tokens.get(nameIndex).text(), type, statement, tokens, nameIndex, end));
        // further declarators: int a = 1, b = 2;
        int i = end;
        while (i < tokens.size()) {
            i = skipToTopLevelComma(tokens, i);
            if (i + 1 >= tokens.size()) {
                break;
            }
            int nameAt = i + 1;
            while (nameAt < tokens.size() && (tokens.get(nameAt).is("*") || tokens.get(nameAt).is("&"))) {
                nameAt++;
            }
            if (nameAt < tokens.size() && tokens.get(nameAt).isWord()) {
                result.add(new VariableInfo(tokens.get(nameAt).text(), type,
                        type + " " + tokens.get(nameAt).text(), false));
            }
            i = nameAt + 1;
        }
        return result;
    }

    private VariableInfo typed(String name, String type, String statement, List<Token> tokens, int nameIndex,
            int end) {
        String arraySuffix = nameIndex + 1 < end
                ? statement.substring(tokens.get(nameIndex + 1).start(), tokens.get(end - 1).end()).replaceAll("\\s", "")
                : "";
        if (!arraySuffix.isEmpty()) {
            arraySuffix = arraySuffix.replaceAll("\\[[^]]*]", "[]");
        }
        return new VariableInfo(name, type, type + " " + name + arraySuffix, false);
    }

    private int skipToTopLevelComma(List<Token> tokens, int from) {
        int depth = 0;
        for (int i = from; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.type() == TokenType.OPEN) {
                depth++;
            } else if (t.type() == TokenType.CLOSE) {
                depth--;
            } else if (depth == 0 && t.is(",")) {
                return i;
            } else if (depth == 0 && t.is(";")) {
                return tokens.size();
            }
        }
        return tokens.size();
    }

    private List<VariableInfo> scriptDeclarations(List<Token> tokens) {
        List<VariableInfo> result = new ArrayList<>();
        int i = 1;
        boolean expectName = true;
        int depth = 0;
        while (i < tokens.size()) {
            Token t = tokens.get(i);
            if (t.type() == TokenType.OPEN) {
                depth++;
            } else if (t.type() == TokenType.CLOSE) {
                depth--;
            } else if (depth == 0 && t.is(",")) {
                expectName = true;
            } else if (depth == 0 && (t.is("=") || t.isWord("of") || t.isWord("in"))) {
                expectName = false;
            } else if (expectName && t.isWord()) {
                Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
                boolean key = depth > 0 && next != null && next.is(":");
                if (!key) {
                    result.add(new VariableInfo(t.text(), "", t.text(), false));
                }
                if (depth == 0) {
                    expectName = false;
                }
            }
            i++;
        }
        return result;
    }

    private List<VariableInfo> pythonTargets(List<Token> tokens) {
        int assign = -1;
        int depth = 0;
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.type() == TokenType.OPEN) {
                depth++;
            } else if (t.type() == TokenType.CLOSE) {
                depth--;
            } else if (depth == 0 && ASSIGNMENTS.contains(t.text())) {
                assign = i;
            } else if (depth == 0 && t.is(":") && assign < 0) {
                // annotated assignment
                assign = i;
                break;
            }
        }
        if (assign <= 0) {
            return List.of();
        }
        return boundWords(tokens.subList(0, assign));
    }

    private List<VariableInfo> pythonHeaderTargets(List<Token> tokens) {
        List<VariableInfo> result = new ArrayList<>();
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isWord("for")) {
                int in = i + 1;
                while (in < tokens.size() && !tokens.get(in).isWord("in")) {
                    in++;
                }
                result.addAll(boundWords(tokens.subList(i + 1, in)));
                i = in;
            } else if (t.isWord("as") && i + 1 < tokens.size() && tokens.get(i + 1).isWord()) {
                result.add(new VariableInfo(tokens.get(i + 1).text(), "", tokens.get(i + 1).text(), false));
            }
        }
        return result;
    }

    /**
     * Plain names in an assignment target; attribute and subscript targets bind nothing new.
     */
    private List<VariableInfo> boundWords(List<Token> target) {
        List<VariableInfo> result = new ArrayList<>();
        for (int i = 0; i < target.size(); i++) {
            Token t = target.get(i);
            if (!t.isWord() || (i > 0 && MEMBER_ACCESS.contains(target.get(i - 1).text()))) {
                continue;
            }
            Token next = i + 1 < target.size() ? target.get(i + 1) : null;
            if (next != null && (next.is(".") || next.is("[") || next.is("("))) {
                continue;
            }
            result.add(new VariableInfo(t.text(), "", t.text(), false));
        }
        return result;
    }

    /**
     * Available variables that a text refers to, in order of first reference.
     */
    public List<VariableInfo> referencedVariables(List<VariableInfo> available, String text) {
        Map<String, VariableInfo> byName = new LinkedHashMap<>();
        available.forEach(v -> byName.putIfAbsent(v.name(), v));
        List<VariableInfo> referenced = new ArrayList<>();
        for (String name : namesRead(text)) {
            VariableInfo variable = byName.remove(name);
            if (variable != null) {
                referenced.add(variable);
            }
        }
        return referenced;
    }

    /**
     * Identifiers used as plain names (not member selections), in order of first use.
     */
    public Set<String> namesRead(String text) {
        Set<String> names = new LinkedHashSet<>();
        List<Token> tokens = scanner.scanFragment(text);
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (t.isWord() && (i == 0 || !MEMBER_ACCESS.contains(tokens.get(i - 1).text()))) {
                names.add(t.text());
            }
        }
        return names;
    }

    /**
     * Plain names assigned, incremented or decremented anywhere in a text.
     */
    public Set<String> assignedNames(String text) {
        Set<String> names = new LinkedHashSet<>();
        List<Token> tokens = scanner.scanFragment(text);
        for (int i = 0; i < tokens.size(); i++) {
            Token t = tokens.get(i);
            if (!t.isWord() || (i > 0 && MEMBER_ACCESS.contains(tokens.get(i - 1).text()))) {
                continue;
            }
            Token next = i + 1 < tokens.size() ? tokens.get(i + 1) : null;
            Token prev = i > 0 ? tokens.get(i - 1) : null;
            boolean assigned = next != null && (ASSIGNMENTS.contains(next.text()) || next.is("++") || next.is("--"));
            boolean preIncrement = prev != null && (prev.is("++") || prev.is("--"));
            if (assigned || preIncrement) {
                names.add(t.text());
            }
        }
        return names;
    }

    /**
     * Names bound by the statements and headers of a block, for function-scoped dialects.
     */
    public Set<String> boundNames(Block block) {
        Set<String> names = new LinkedHashSet<>();
        block.walk().forEach(b -> {
            if (b.kind() == BlockKind.STATEMENT) {
                declarations(b.header()).forEach(v -> names.add(v.name()));
            } else if (b.kind() == BlockKind.LOOP || b.kind() == BlockKind.OTHER) {
                loopDeclarations(b.header()).forEach(v -> names.add(v.name()));
            } else if (b.kind() == BlockKind.FUNCTION || b.kind() == BlockKind.TYPE) {
                String name = FunctionHeader.parse(dialect, b.header()).name();
                if (!name.isEmpty()) {
                    names.add(name);
                }
            }
        });
        return names;
    }

    /**
     * Information about a variable in scope.
     *
     * @param name        variable name
     * @param type        declared type, empty when untyped or unknown
     * @param declaration text that declares it as a parameter
     * @param isParameter whether it is a parameter of the enclosing function
     */
    public record VariableInfo(
            String name,
            String type,
            String declaration,
            boolean isParameter) {

        /**
         * Whether the declared type is usable in a new signature.
         */
        public boolean hasKnownType() {
            return !type.isEmpty() && !type.equals("var") && !type.equals("auto");
        }

        /**
         * Check if this is a local variable.
         */
        public boolean isLocal() {
            return !isParameter;
        }

        @Override
        public String toString() {
            String kind = isParameter ? "param" : "local";
            return String.format("%s %s %s", kind, type, name);
        }
    }
}
