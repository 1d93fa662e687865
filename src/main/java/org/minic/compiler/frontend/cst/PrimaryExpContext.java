package org.minic.compiler.frontend.cst;

/**
 * The production {@code primaryExp : '(' expr ')' | T_DIGIT | lVal}.
 */
public sealed interface PrimaryExpContext {

    /**
     * Dispatches to the visitor method of the concrete alternative.
     * @param visitor The visitor.
     * @param <R> The result type.
     * @return The visitor's result.
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * Visitor over the primary expression alternatives.
     * @param <R> The result type.
     */
    interface Visitor<R> {
        R visitParenthesized(Parenthesized expression);

        R visitDigit(Digit expression);

        R visitLValue(LValue expression);
    }

    /**
     * {@code '(' expr ')'}
     * @param expr The inner expression.
     */
    record Parenthesized(ExprContext expr) implements PrimaryExpContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitParenthesized(this);
        }
    }

    /**
     * {@code T_DIGIT}
     * @param digit The literal token with its original spelling.
     */
    record Digit(Token digit) implements PrimaryExpContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitDigit(this);
        }
    }

    /**
     * {@code lVal}
     * @param lVal The referenced variable.
     */
    record LValue(LValContext lVal) implements PrimaryExpContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitLValue(this);
        }
    }
}
