package org.minic.compiler.frontend.cst;

import java.util.List;

/**
 * The production {@code mulExp : unaryExp (mulOp unaryExp)*}.
 *
 * @param operands The operands in source order.
 * @param operators The operators between the operands.
 */
public record MulExpContext(List<UnaryExpContext> operands, List<OperatorContext<MulExpContext.Op>> operators)
        implements OperatorChainContext<UnaryExpContext, MulExpContext.Op> {

    public MulExpContext {
        operands = List.copyOf(operands);
        operators = List.copyOf(operators);
        OperatorChainContext.checkShape("mulExp", operands, operators);
    }

    /**
     * A chain without operators.
     * @param operand The single operand.
     * @return The degenerate chain.
     */
    public static MulExpContext of(UnaryExpContext operand) {
        return new MulExpContext(List.of(operand), List.of());
    }

    /** Operators of this precedence level. */
    public enum Op {
        /** {@code *} */
        MUL,
        /** {@code /} */
        DIV,
        /** {@code %} */
        MOD
    }
}
