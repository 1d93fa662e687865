package org.minic.compiler.frontend.cst;

/**
 * The production {@code basicType : T_INT}.
 *
 * @param typeToken The type keyword.
 */
public record BasicTypeContext(Token typeToken) {
}
