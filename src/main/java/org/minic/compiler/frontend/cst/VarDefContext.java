package org.minic.compiler.frontend.cst;

/**
 * The production {@code varDef : T_ID}.
 *
 * @param name The declared identifier.
 */
public record VarDefContext(Token name) {
}
