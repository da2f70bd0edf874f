package com.raditha.unnest.analysis;

import com.raditha.unnest.model.Block;

/**
 * Where control goes when a chain level completes without taking an exit of its own.
 *
 * @param kind         how the exit is reached
 * @param postfixLevel spine level whose postfix runs next, for {@link Kind#POSTFIX}
 * @param statement    the statement after the region, for {@link Kind#FOLLOWING_STATEMENT}
 */
public record FallThroughExit(Kind kind, int postfixLevel, Block statement) {

    public enum Kind {
        /** the nearest non-empty postfix of an enclosing level */
        POSTFIX,
        /** the terminal statement right after the region, absorbed into the rewrite */
        FOLLOWING_STATEMENT,
        /** the end of a function that returns nothing */
        IMPLICIT_RETURN,
        /** the end of a loop body */
        IMPLICIT_CONTINUE,
        /** control reaches code that cannot be duplicated into an exit */
        UNRESOLVED
    }

    public static FallThroughExit postfix(int level) {
        return new FallThroughExit(Kind.POSTFIX, level, null);
    }

    public static FallThroughExit following(Block statement) {
        return new FallThroughExit(Kind.FOLLOWING_STATEMENT, -1, statement);
    }

    public static FallThroughExit implicitReturn() {
        return new FallThroughExit(Kind.IMPLICIT_RETURN, -1, null);
    }

    public static FallThroughExit implicitContinue() {
        return new FallThroughExit(Kind.IMPLICIT_CONTINUE, -1, null);
    }

    public static FallThroughExit unresolved() {
        return new FallThroughExit(Kind.UNRESOLVED, -1, null);
    }

    public boolean isResolved() {
        return kind != Kind.UNRESOLVED;
    }

    /**
     * Whether reaching the exit at the very end of the rewritten region needs no statement.
     */
    public boolean isImplicit() {
        return kind == Kind.IMPLICIT_RETURN || kind == Kind.IMPLICIT_CONTINUE;
    }
}
