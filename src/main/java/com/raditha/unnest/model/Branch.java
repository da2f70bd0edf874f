package com.raditha.unnest.model;

/**
 * One arm of a conditional block.
 *
 * @param condition condition source text without the surrounding parentheses or
 *                  colon, {@code null} for an unconditional else
 * @param body      the branch body
 */
public record Branch(String condition, Block body) {

    public boolean isElse() {
        return condition == null;
    }
}
