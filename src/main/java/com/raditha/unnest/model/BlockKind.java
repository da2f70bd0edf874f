package com.raditha.unnest.model;

/**
 * Structural category of a {@link Block}.
 */
public enum BlockKind {
    /** if / else if / else chain, one block per chain */
    CONDITIONAL,

    /** for, while, do-while and their variants */
    LOOP,

    /** method, function, constructor or lambda with a block body */
    FUNCTION,

    /** class, struct, interface, enum or record */
    TYPE,

    /** ordered statement list owned by a compound block, or the unit root */
    BODY,

    /** simple statement */
    STATEMENT,

    /** try, switch, synchronized, bare scope blocks */
    OTHER;

    public boolean isCompound() {
        return this != BODY && this != STATEMENT;
    }
}
