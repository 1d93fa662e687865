package org.minic.compiler.frontend.cst;

import java.util.Optional;

/**
 * The production
 * <pre>
 * unaryExp : primaryExp                        # Primary
 *          | T_ID '(' realParamList? ')'       # Call
 *          | unaryOp unaryExp                  # Prefix
 * </pre>
 * {@code Primary} and {@code Call} both may start with an identifier; the parser has already
 * decided between them by looking for the opening parenthesis.
 */
public sealed interface UnaryExpContext {

    /**
     * Dispatches to the visitor method of the concrete alternative.
     * @param visitor The visitor.
     * @param <R> The result type.
     * @return The visitor's result.
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * Visitor over the unary expression alternatives.
     * @param <R> The result type.
     */
    interface Visitor<R> {
        R visitPrimary(Primary expression);

        R visitCall(Call expression);

        R visitPrefix(Prefix expression);
    }

    /** Prefix operators of {@code unaryOp}. */
    enum Op {
        /** Arithmetic negation {@code -}. */
        MINUS,
        /** Logical not {@code !}. */
        NOT
    }

    /**
     * A primary expression.
     * @param primary The wrapped production.
     */
    record Primary(PrimaryExpContext primary) implements UnaryExpContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrimary(this);
        }
    }

    /**
     * A function call.
     * @param name The callee identifier.
     * @param realParamList The arguments, empty for {@code f()}.
     */
    record Call(Token name, Optional<RealParamListContext> realParamList) implements UnaryExpContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitCall(this);
        }
    }

    /**
     * A prefix operator applied to a unary expression.
     * @param op The operator.
     * @param operand The operand.
     */
    record Prefix(OperatorContext<Op> op, UnaryExpContext operand) implements UnaryExpContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitPrefix(this);
        }
    }
}
