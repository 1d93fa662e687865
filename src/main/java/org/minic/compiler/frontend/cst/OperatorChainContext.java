package org.minic.compiler.frontend.cst;

import java.util.List;

/**
 * A binary precedence level {@code level : next (op next)*}.
 * <p>
 * A chain with {@code n} operators holds {@code n + 1} operands; operator {@code i} sits between
 * operand {@code i} and operand {@code i + 1}.
 *
 * @param <O> The production of the next higher precedence level.
 * @param <K> The operator enum of this level.
 */
public interface OperatorChainContext<O, K extends Enum<K>> {

    /**
     * @return The operands in source order, never empty.
     */
    List<O> operands();

    /**
     * @return The operators in source order, one fewer than the operands.
     */
    List<OperatorContext<K>> operators();

    /**
     * Checks the operand/operator shape of a chain. Used by the compact constructors of all levels.
     * @param production The production name for the error message.
     * @param operands The operands.
     * @param operators The operators.
     */
    static void checkShape(String production, List<?> operands, List<?> operators) {
        if (operands.isEmpty() || operands.size() != operators.size() + 1) {
            throw new IllegalArgumentException(String.format(
                    "%s requires one more operand than operators, got %d operands and %d operators",
                    production, operands.size(), operators.size()));
        }
    }
}
