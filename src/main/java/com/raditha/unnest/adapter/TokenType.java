package com.raditha.unnest.adapter;

/**
 * Category of a lexical token produced by the pre-pass.
 * Comments and whitespace never become tokens.
 */
public enum TokenType {
    /** identifier or keyword */
    WORD,

    /** numeric literal */
    NUMBER,

    /** string, character or template literal, quotes included */
    STRING,

    /** opening delimiter: ( [ { */
    OPEN,

    /** closing delimiter: ) ] } */
    CLOSE,

    /** statement or list separator: ; , */
    SEPARATOR,

    /** operator or other punctuation */
    OPERATOR
}
