package com.raditha.unnest.syntax;

import com.raditha.unnest.model.Dialect;

import java.util.List;
import java.util.Optional;

/**
 * Rendering rules for the control statements a rewrite emits.
 */
public interface CodeStyle {

    Dialect dialect();

    /**
     * Opening line of a conditional.
     */
    String openIf(String condition);

    /**
     * Line that closes the previous branch and opens a further conditioned branch.
     */
    String openElseIf(String condition);

    /**
     * Line that closes the previous branch and opens the unconditional else.
     */
    String openElse();

    /**
     * Line that closes a block, empty when indentation closes it.
     */
    Optional<String> close();

    /**
     * Statement that stands in for an empty body, empty when none is needed.
     */
    Optional<String> emptyBody();

    /**
     * A complete statement for an expression or keyword, such as {@code return x;}.
     */
    String statement(String text);

    /**
     * Logical negation of a condition.
     */
    String negate(String condition);

    /**
     * Comment lines for a free text comment.
     */
    List<String> comment(String text);

    /**
     * Whether a name can be declared as a subroutine in this dialect.
     */
    boolean isValidIdentifier(String name);
}
