package org.minic.compiler.frontend.cst;

/**
 * The production {@code lVal : T_ID}.
 *
 * @param name The referenced identifier.
 */
public record LValContext(Token name) {
}
