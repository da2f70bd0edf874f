package com.raditha.unnest.syntax;

import com.raditha.unnest.model.Dialect;

import java.util.HashSet;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Reserved words and identifier syntax per dialect.
 */
final class Keywords {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final Pattern SCRIPT_IDENTIFIER = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");

    private static final Set<String> C_FAMILY = Set.of(
            "auto", "break", "case", "char", "const", "continue", "default", "do", "double", "else", "enum",
            "extern", "float", "for", "goto", "if", "inline", "int", "long", "register", "restrict", "return",
            "short", "signed", "sizeof", "static", "struct", "switch", "typedef", "union", "unsigned", "void",
            "volatile", "while", "bool", "true", "false");

    private static final Set<String> CPP = Set.of(
            "class", "namespace", "template", "typename", "this", "new", "delete", "public", "private",
            "protected", "virtual", "friend", "operator", "try", "catch", "throw", "using", "nullptr",
            "constexpr", "decltype", "explicit", "mutable", "noexcept", "static_cast", "dynamic_cast",
            "reinterpret_cast", "const_cast", "override", "final");

    private static final Set<String> JAVA = Set.of(
            "abstract", "assert", "boolean", "break", "byte", "case", "catch", "char", "class", "const",
            "continue", "default", "do", "double", "else", "enum", "extends", "final", "finally", "float", "for",
            "goto", "if", "implements", "import", "instanceof", "int", "interface", "long", "native", "new",
            "package", "private", "protected", "public", "return", "short", "static", "strictfp", "super",
            "switch", "synchronized", "this", "throw", "throws", "transient", "try", "void", "volatile", "while",
            "true", "false", "null", "var", "yield", "record", "sealed", "permits");

    private static final Set<String> CSHARP = Set.of(
            "abstract", "as", "base", "bool", "break", "byte", "case", "catch", "char", "checked", "class",
            "const", "continue", "decimal", "default", "delegate", "do", "double", "else", "enum", "event",
            "explicit", "extern", "false", "finally", "fixed", "float", "for", "foreach", "goto", "if",
            "implicit", "in", "int", "interface", "internal", "is", "lock", "long", "namespace", "new", "null",
            "object", "operator", "out", "override", "params", "private", "protected", "public", "readonly",
            "ref", "return", "sbyte", "sealed", "short", "sizeof", "stackalloc", "static", "string", "struct",
            "switch", "this", "throw", "true", "try", "typeof", "uint", "ulong", "unchecked", "unsafe", "ushort",
            "using", "virtual", "void", "volatile", "while", "var", "async", "await");

    private static final Set<String> SCRIPT = Set.of(
            "break", "case", "catch", "class", "const", "continue", "debugger", "default", "delete", "do",
            "else", "export", "extends", "finally", "for", "function", "if", "import", "in", "instanceof",
            "new", "return", "super", "switch", "this", "throw", "try", "typeof", "var", "void", "while",
            "with", "yield", "let", "static", "enum", "await", "implements", "package", "protected",
            "interface", "private", "public", "null", "true", "false", "undefined", "arguments", "eval");

    private static final Set<String> PYTHON = Set.of(
            "False", "None", "True", "and", "as", "assert", "async", "await", "break", "class", "continue",
            "def", "del", "elif", "else", "except", "finally", "for", "from", "global", "if", "import", "in",
            "is", "lambda", "nonlocal", "not", "or", "pass", "raise", "return", "try", "while", "with",
            "yield", "match", "case", "print", "self", "cls");

    private Keywords() {
    }

    static Set<String> forDialect(Dialect dialect) {
        return switch (dialect) {
            case JAVA -> JAVA;
            case C -> C_FAMILY;
            case CPP -> union(C_FAMILY, CPP);
            case CSHARP -> CSHARP;
            case JAVASCRIPT, TYPESCRIPT -> SCRIPT;
            case PYTHON, GENERIC -> PYTHON;
        };
    }

    static boolean isValidIdentifier(Dialect dialect, String name) {
        if (name == null) {
            return false;
        }
        Pattern syntax = dialect == Dialect.JAVA || dialect == Dialect.JAVASCRIPT || dialect == Dialect.TYPESCRIPT
                ? SCRIPT_IDENTIFIER
                : IDENTIFIER;
        return syntax.matcher(name).matches() && !forDialect(dialect).contains(name);
    }

    private static Set<String> union(Set<String> a, Set<String> b) {
        Set<String> all = new HashSet<>(a);
        all.addAll(b);
        return Set.copyOf(all);
    }
}
