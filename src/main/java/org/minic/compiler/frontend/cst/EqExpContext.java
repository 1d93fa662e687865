package org.minic.compiler.frontend.cst;

import java.util.List;

/**
 * The production {@code eqExp : relExp (('==' | '!=') relExp)*}.
 *
 * @param operands The operands in source order.
 * @param operators The operators between the operands.
 */
public record EqExpContext(List<RelExpContext> operands, List<OperatorContext<EqExpContext.Op>> operators)
        implements OperatorChainContext<RelExpContext, EqExpContext.Op> {

    public EqExpContext {
        operands = List.copyOf(operands);
        operators = List.copyOf(operators);
        OperatorChainContext.checkShape("eqExp", operands, operators);
    }

    /**
     * A chain without operators.
     * @param operand The single operand.
     * @return The degenerate chain.
     */
    public static EqExpContext of(RelExpContext operand) {
        return new EqExpContext(List.of(operand), List.of());
    }

    /** Operators of this precedence level. */
    public enum Op {
        /** {@code ==} */
        EQ,
        /** {@code !=} */
        NE
    }
}
