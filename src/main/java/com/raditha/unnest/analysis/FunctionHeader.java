package com.raditha.unnest.analysis;

import com.raditha.unnest.adapter.LexicalScanner;
import com.raditha.unnest.adapter.Token;
import com.raditha.unnest.adapter.TokenType;
import com.raditha.unnest.model.Dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Signature facts read from the header text of a function block.
 *
 * @param name       function name, empty for lambdas and anonymous functions
 * @param returnType declared return type, empty when there is none (constructors, untyped dialects)
 * @param parameters declared parameters in order
 * @param isStatic   whether the declaration carries a static modifier
 * @param qualified  whether the name is qualified ({@code Type::name}), as in C++ out-of-class definitions
 */
public record FunctionHeader(
        String name,
        String returnType,
        List<Parameter> parameters,
        boolean isStatic,
        boolean qualified) {

    private static final Set<String> MODIFIERS = Set.of(
            "public", "private", "protected", "internal", "static", "final", "abstract", "synchronized",
            "native", "default", "strictfp", "inline", "extern", "virtual", "override", "async", "sealed",
            "unsafe", "new", "partial", "readonly", "explicit", "constexpr", "friend", "export", "function",
            "get", "set");

    private static final Set<String> PARAMETER_MODIFIERS = Set.of(
            "final", "ref", "out", "in", "params", "this", "readonly", "public", "private", "protected");

    public FunctionHeader {
        parameters = List.copyOf(parameters);
    }

    /**
     * A declared parameter.
     *
     * @param name        parameter name
     * @param type        declared type, empty when untyped
     * @param declaration declaration text without any default value
     */
    public record Parameter(String name, String type, String declaration) {
    }

    public boolean isNamed() {
        return !name.isEmpty();
    }

    /**
     * Whether falling off the end of the function is the same as a bare return.
     */
    public boolean returnsNothing(Dialect dialect) {
        if (!dialect.isTyped()) {
            return true;
        }
        return isNamed() && (returnType.isEmpty() || returnType.equals("void"));
    }

    /**
     * Parse the header of a function block.
     */
    public static FunctionHeader parse(Dialect dialect, String header) {
        List<Token> tokens = new LexicalScanner(dialect).scanFragment(header);
        if (dialect == Dialect.PYTHON) {
            return parsePython(header, tokens);
        }
        int i = skipDecorations(tokens, 0);
        int firstSignificant = i;
        boolean isStatic = false;
        while (i < tokens.size() && tokens.get(i).isWord() && MODIFIERS.contains(tokens.get(i).text())
                && !(i + 1 < tokens.size() && tokens.get(i + 1).is("("))) {
            isStatic |= tokens.get(i).is("static");
            i++;
        }
        if (i < tokens.size() && tokens.get(i).is("<")) {
            i = skipAngles(tokens, i);
        }
        int typeStart = i;
        int open = -1;
        for (int k = i; k < tokens.size(); k++) {
            if (tokens.get(k).is("(")) {
                open = k;
                break;
            }
        }
        if (open <= firstSignificant || !tokens.get(open - 1).isWord() || tokens.get(open - 1).is("function")) {
            return new FunctionHeader("", "", parameters(dialect, header, tokens, open), isStatic, false);
        }
        String name = tokens.get(open - 1).text();
        boolean qualified = open - 2 >= 0 && tokens.get(open - 2).is("::");
        int nameIndex = open - 1;
        if (qualified) {
            nameIndex = open - 3;
            while (nameIndex - 1 >= typeStart && tokens.get(nameIndex - 1).is("::")) {
                nameIndex -= 2;
            }
        }
        String returnType = "";
        if (dialect.isTyped() && nameIndex > typeStart) {
            returnType = header.substring(tokens.get(typeStart).start(), tokens.get(nameIndex - 1).end()).strip();
        }
        return new FunctionHeader(name, returnType, parameters(dialect, header, tokens, open), isStatic, qualified);
    }

    private static FunctionHeader parsePython(String header, List<Token> tokens) {
        int def = -1;
        for (int k = 0; k < tokens.size(); k++) {
            if (tokens.get(k).isWord("def")) {
                def = k;
                break;
            }
        }
        if (def < 0 || def + 1 >= tokens.size()) {
            return new FunctionHeader("", "", List.of(), false, false);
        }
        int open = def + 2 < tokens.size() && tokens.get(def + 2).is("(") ? def + 2 : -1;
        return new FunctionHeader(tokens.get(def + 1).text(), "", parameters(Dialect.PYTHON, header, tokens, open),
                false, false);
    }

    /**
     * Skip annotations, attributes and decorators at the start of a header.
     */
    private static int skipDecorations(List<Token> tokens, int i) {
        while (i < tokens.size()) {
            Token t = tokens.get(i);
            if (t.is("@") && i + 1 < tokens.size() && tokens.get(i + 1).isWord()) {
                i += 2;
                while (i + 1 < tokens.size() && tokens.get(i).is(".") && tokens.get(i + 1).isWord()) {
                    i += 2;
                }
                if (i < tokens.size() && tokens.get(i).is("(") && !isParameterList(tokens, i)) {
                    i = skipGroup(tokens, i);
                }
            } else if (t.is("[")) {
                i = skipGroup(tokens, i);
            } else {
                return i;
            }
        }
        return i;
    }

    /**
     * An annotation argument list is followed by more header; a parameter list ends it or is
     * followed only by clauses such as throws.
     */
    private static boolean isParameterList(List<Token> tokens, int open) {
        int close = skipGroup(tokens, open);
        return close >= tokens.size();
    }

    private static int skipGroup(List<Token> tokens, int open) {
        int depth = 0;
        for (int k = open; k < tokens.size(); k++) {
            if (tokens.get(k).type() == TokenType.OPEN) {
                depth++;
            } else if (tokens.get(k).type() == TokenType.CLOSE) {
                depth--;
                if (depth == 0) {
                    return k + 1;
                }
            }
        }
        return tokens.size();
    }

    private static int skipAngles(List<Token> tokens, int open) {
        int depth = 0;
        for (int k = open; k < tokens.size(); k++) {
            if (tokens.get(k).is("<")) {
                depth++;
            } else if (tokens.get(k).is(">")) {
                depth--;
            } else if (tokens.get(k).is(">>")) {
                depth -= 2;
            }
            if (depth <= 0) {
                return k + 1;
            }
        }
        return tokens.size();
    }

    private static List<Parameter> parameters(Dialect dialect, String header, List<Token> tokens, int open) {
        List<Parameter> result = new ArrayList<>();
        if (open < 0) {
            return result;
        }
        int close = skipGroup(tokens, open) - 1;
        int depth = 0;
        int angle = 0;
        int partStart = open + 1;
        for (int k = open + 1; k <= close && k < tokens.size(); k++) {
            Token t = tokens.get(k);
            boolean boundary = k == close || (depth == 0 && angle == 0 && t.is(","));
            if (boundary) {
                if (k > partStart) {
                    Parameter parameter = parameter(dialect, header, tokens.subList(partStart, k));
                    if (parameter != null) {
                        result.add(parameter);
                    }
                }
                partStart = k + 1;
            } else if (t.type() == TokenType.OPEN) {
                depth++;
            } else if (t.type() == TokenType.CLOSE) {
                depth--;
            } else if (t.is("<")) {
                angle++;
            } else if (t.is(">")) {
                angle = Math.max(0, angle - 1);
            } else if (t.is(">>")) {
                angle = Math.max(0, angle - 2);
            }
        }
        return result;
    }

    private static Parameter parameter(Dialect dialect, String header, List<Token> part) {
        int end = part.size();
        for (int k = 0; k < part.size(); k++) {
            if (part.get(k).is("=")) {
                end = k;
                break;
            }
        }
        if (dialect == Dialect.PYTHON) {
            for (int k = 0; k < end; k++) {
                if (part.get(k).is(":")) {
                    end = k;
                    break;
                }
            }
        }
        List<Token> declaration = part.subList(0, end);
        int start = 0;
        while (start < declaration.size() && declaration.get(start).is("@")) {
            start = Math.min(declaration.size(), start + 2);
            if (start < declaration.size() && declaration.get(start).is("(")) {
                start = skipGroup(declaration, start);
            }
        }
        while (start < declaration.size() && declaration.get(start).isWord()
                && PARAMETER_MODIFIERS.contains(declaration.get(start).text()) && start + 1 < declaration.size()) {
            start++;
        }
        int nameIndex = -1;
        for (int k = declaration.size() - 1; k >= start; k--) {
            if (declaration.get(k).isWord()) {
                nameIndex = k;
                break;
            }
        }
        if (nameIndex < 0) {
            return null;
        }
        String name = declaration.get(nameIndex).text();
        if (name.equals("void") && declaration.size() == 1) {
            return null;
        }
        String text = header.substring(declaration.get(start).start(), declaration.get(declaration.size() - 1).end());
        String type = "";
        if (dialect.isTyped() && nameIndex > start) {
            type = header.substring(declaration.get(start).start(), declaration.get(nameIndex - 1).end()).strip();
        }
        return new Parameter(name, type, dialect.isTyped() ? text : name);
    }
}
