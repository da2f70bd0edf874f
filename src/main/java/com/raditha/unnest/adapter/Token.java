package com.raditha.unnest.adapter;

/**
 * A lexical token with its position in the source text.
 *
 * @param type  token category
 * @param text  source text of the token
 * @param start start offset (inclusive)
 * @param end   end offset (exclusive)
 * @param line  line number of the first character (1-indexed)
 */
public record Token(
        TokenType type,
        String text,
        int start,
        int end,
        int line) {

    public boolean is(String value) {
        return text.equals(value);
    }

    public boolean isWord(String value) {
        return type == TokenType.WORD && text.equals(value);
    }

    public boolean isWord() {
        return type == TokenType.WORD;
    }

    /**
     * Whether this delimiter closes the given opening delimiter.
     */
    public boolean closes(Token open) {
        return switch (open.text()) {
            case "(" -> is(")");
            case "[" -> is("]");
            case "{" -> is("}");
            default -> false;
        };
    }
}
