package org.minic.compiler.frontend.cst;

import java.util.List;

/**
 * The production {@code realParamList : expr (',' expr)*}.
 *
 * @param exprs The argument expressions in source order, at least one.
 */
public record RealParamListContext(List<ExprContext> exprs) {
    public RealParamListContext {
        exprs = List.copyOf(exprs);
        if (exprs.isEmpty()) {
            throw new IllegalArgumentException("realParamList requires at least one expression");
        }
    }
}
