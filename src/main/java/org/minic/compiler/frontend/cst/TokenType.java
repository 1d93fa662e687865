package org.minic.compiler.frontend.cst;

/**
 * Defines the types of all terminal tokens the MiniC grammar produces.
 */
public enum TokenType {
    // Keywords
    /** The {@code int} type keyword. */
    INT,
    /** The {@code return} keyword. */
    RETURN,
    /** The {@code if} keyword. */
    IF,
    /** The {@code else} keyword. */
    ELSE,
    /** The {@code while} keyword. */
    WHILE,
    /** The {@code break} keyword. */
    BREAK,
    /** The {@code continue} keyword. */
    CONTINUE,

    // Literals and names
    /** An identifier, e.g. a variable or function name. */
    IDENTIFIER,
    /** An integer literal in decimal, octal ({@code 0...}) or hexadecimal ({@code 0x...}) notation. */
    DIGIT,

    // Punctuation
    /** A left parenthesis '('. */
    L_PAREN,
    /** A right parenthesis ')'. */
    R_PAREN,
    /** A left brace '{'. */
    L_BRACE,
    /** A right brace '}'. */
    R_BRACE,
    /** A semicolon ';'. */
    SEMICOLON,
    /** A comma ','. */
    COMMA,

    // Operators
    /** An assignment '='. */
    ASSIGN,
    /** A plus '+'. */
    PLUS,
    /** A minus '-', binary or unary. */
    MINUS,
    /** A star '*'. */
    STAR,
    /** A slash '/'. */
    SLASH,
    /** A percent '%'. */
    PERCENT,
    /** A less-than '&lt;'. */
    LESS,
    /** A greater-than '&gt;'. */
    GREATER,
    /** A less-or-equal '&lt;='. */
    LESS_EQUAL,
    /** A greater-or-equal '&gt;='. */
    GREATER_EQUAL,
    /** An equality '=='. */
    EQUAL_EQUAL,
    /** An inequality '!='. */
    BANG_EQUAL,
    /** A logical and '&amp;&amp;'. */
    AND_AND,
    /** A logical or '||'. */
    OR_OR,
    /** A logical not '!'. */
    BANG,

    /** Marks the end of the input. */
    END_OF_FILE
}
