package org.minic.compiler.frontend.cst;

import java.util.List;

/**
 * The production {@code relExp : addExp (('<' | '>' | '<=' | '>=') addExp)*}.
 *
 * @param operands The operands in source order.
 * @param operators The operators between the operands.
 */
public record RelExpContext(List<AddExpContext> operands, List<OperatorContext<RelExpContext.Op>> operators)
        implements OperatorChainContext<AddExpContext, RelExpContext.Op> {

    public RelExpContext {
        operands = List.copyOf(operands);
        operators = List.copyOf(operators);
        OperatorChainContext.checkShape("relExp", operands, operators);
    }

    /**
     * A chain without operators.
     * @param operand The single operand.
     * @return The degenerate chain.
     */
    public static RelExpContext of(AddExpContext operand) {
        return new RelExpContext(List.of(operand), List.of());
    }

    /** Operators of this precedence level. */
    public enum Op {
        /** {@code <} */
        LT,
        /** {@code >} */
        GT,
        /** {@code <=} */
        LE,
        /** {@code >=} */
        GE
    }
}
