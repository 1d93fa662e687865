package org.minic.compiler.frontend.cst;

/**
 * Represents a single terminal of the concrete syntax tree.
 *
 * @param type The type of the token.
 * @param text The exact text of the token as it appears in the source.
 * @param line The 1-based line number of the token.
 * @param column The 1-based column number of the token.
 */
public record Token(
        TokenType type,
        String text,
        int line,
        int column
) {
    public Token {
        if (type == null || text == null) {
            throw new IllegalArgumentException("Token type and text must not be null");
        }
    }
}
