package org.minic.compiler.frontend.cst;

import java.util.List;

/**
 * The production {@code lAndExp : eqExp ('&&' eqExp)*}.
 *
 * @param operands The operands in source order.
 * @param operators The operators between the operands.
 */
public record LAndExpContext(List<EqExpContext> operands, List<OperatorContext<LAndExpContext.Op>> operators)
        implements OperatorChainContext<EqExpContext, LAndExpContext.Op> {

    public LAndExpContext {
        operands = List.copyOf(operands);
        operators = List.copyOf(operators);
        OperatorChainContext.checkShape("lAndExp", operands, operators);
    }

    /**
     * A chain without operators.
     * @param operand The single operand.
     * @return The degenerate chain.
     */
    public static LAndExpContext of(EqExpContext operand) {
        return new LAndExpContext(List.of(operand), List.of());
    }

    /** Operators of this precedence level. */
    public enum Op {
        /** {@code &&} */
        AND
    }
}
