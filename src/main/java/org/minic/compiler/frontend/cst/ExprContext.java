package org.minic.compiler.frontend.cst;

/**
 * The production {@code expr : lOrExp}.
 *
 * @param lOrExp The lowest-precedence level of the expression.
 */
public record ExprContext(LOrExpContext lOrExp) {
}
