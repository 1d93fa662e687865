package org.minic.compiler.frontend.cst;

/**
 * A binary or prefix operator as it appears in an expression production.
 *
 * @param kind The operator, from the closed set of its precedence level.
 * @param token The operator token, used as the line of the resulting node.
 * @param <K> The operator enum of the level.
 */
public record OperatorContext<K extends Enum<K>>(K kind, Token token) {
}
