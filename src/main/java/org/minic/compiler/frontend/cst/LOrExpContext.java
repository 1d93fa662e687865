package org.minic.compiler.frontend.cst;

import java.util.List;

/**
 * The production {@code lOrExp : lAndExp ('||' lAndExp)*}.
 *
 * @param operands The operands in source order.
 * @param operators The operators between the operands.
 */
public record LOrExpContext(List<LAndExpContext> operands, List<OperatorContext<LOrExpContext.Op>> operators)
        implements OperatorChainContext<LAndExpContext, LOrExpContext.Op> {

    public LOrExpContext {
        operands = List.copyOf(operands);
        operators = List.copyOf(operators);
        OperatorChainContext.checkShape("lOrExp", operands, operators);
    }

    /**
     * A chain without operators.
     * @param operand The single operand.
     * @return The degenerate chain.
     */
    public static LOrExpContext of(LAndExpContext operand) {
        return new LOrExpContext(List.of(operand), List.of());
    }

    /** Operators of this precedence level. */
    public enum Op {
        /** {@code ||} */
        OR
    }
}
