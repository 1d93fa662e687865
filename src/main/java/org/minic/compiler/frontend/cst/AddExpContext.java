package org.minic.compiler.frontend.cst;

import java.util.List;

/**
 * The production {@code addExp : mulExp (addOp mulExp)*}.
 *
 * @param operands The operands in source order.
 * @param operators The operators between the operands.
 */
public record AddExpContext(List<MulExpContext> operands, List<OperatorContext<AddExpContext.Op>> operators)
        implements OperatorChainContext<MulExpContext, AddExpContext.Op> {

    public AddExpContext {
        operands = List.copyOf(operands);
        operators = List.copyOf(operators);
        OperatorChainContext.checkShape("addExp", operands, operators);
    }

    /**
     * A chain without operators.
     * @param operand The single operand.
     * @return The degenerate chain.
     */
    public static AddExpContext of(MulExpContext operand) {
        return new AddExpContext(List.of(operand), List.of());
    }

    /** Operators of this precedence level. */
    public enum Op {
        /** {@code +} */
        ADD,
        /** {@code -} */
        SUB
    }
}
