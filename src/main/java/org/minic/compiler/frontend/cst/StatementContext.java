package org.minic.compiler.frontend.cst;

import java.util.Optional;

/**
 * The production {@code statement}. Each alternative of the grammar is one nested record:
 * <pre>
 * statement : lVal '=' expr ';'                        # Assign
 *           | T_RETURN expr ';'                        # Return
 *           | block                                    # Block
 *           | expr? ';'                                # Expression
 *           | T_IF '(' expr ')' statement (T_ELSE statement)?  # If
 *           | T_WHILE '(' expr ')' statement           # While
 *           | T_BREAK ';'                              # Break
 *           | T_CONTINUE ';'                           # Continue
 * </pre>
 * The parser resolves the dangling else: an {@code else} belongs to the innermost {@code if}
 * that has none yet, so it is always stored in the nearest {@link If}.
 */
public sealed interface StatementContext extends BlockItemContext {

    /**
     * Dispatches to the visitor method of the concrete alternative.
     * @param visitor The visitor.
     * @param <R> The result type.
     * @return The visitor's result.
     */
    <R> R accept(Visitor<R> visitor);

    @Override
    default <R> R accept(BlockItemContext.Visitor<R> visitor) {
        return visitor.visitStatement(this);
    }

    /**
     * Visitor over all statement alternatives.
     * @param <R> The result type.
     */
    interface Visitor<R> {
        R visitAssign(Assign statement);

        R visitReturn(Return statement);

        R visitBlock(Block statement);

        R visitExpression(Expression statement);

        R visitIf(If statement);

        R visitWhile(While statement);

        R visitBreak(Break statement);

        R visitContinue(Continue statement);
    }

    /**
     * {@code lVal '=' expr ';'}
     * @param target The assigned variable.
     * @param assign The '=' token.
     * @param value The assigned expression.
     */
    record Assign(LValContext target, Token assign, ExprContext value) implements StatementContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitAssign(this);
        }
    }

    /**
     * {@code T_RETURN expr ';'}
     * @param keyword The return keyword.
     * @param value The returned expression.
     */
    record Return(Token keyword, ExprContext value) implements StatementContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitReturn(this);
        }
    }

    /**
     * A nested block used as a statement.
     * @param block The block.
     */
    record Block(BlockContext block) implements StatementContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBlock(this);
        }
    }

    /**
     * {@code expr? ';'}. Without an expression this is the empty statement.
     * @param expr The expression, if present.
     * @param semicolon The terminating semicolon.
     */
    record Expression(Optional<ExprContext> expr, Token semicolon) implements StatementContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitExpression(this);
        }
    }

    /**
     * {@code T_IF '(' expr ')' statement (T_ELSE statement)?}
     * @param keyword The if keyword.
     * @param condition The condition.
     * @param thenBranch The statement executed when the condition holds.
     * @param elseBranch The else statement, if present.
     */
    record If(Token keyword, ExprContext condition, StatementContext thenBranch,
              Optional<StatementContext> elseBranch) implements StatementContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitIf(this);
        }
    }

    /**
     * {@code T_WHILE '(' expr ')' statement}
     * @param keyword The while keyword.
     * @param condition The loop condition.
     * @param body The loop body.
     */
    record While(Token keyword, ExprContext condition, StatementContext body) implements StatementContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitWhile(this);
        }
    }

    /**
     * {@code T_BREAK ';'}
     * @param keyword The break keyword.
     */
    record Break(Token keyword) implements StatementContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitBreak(this);
        }
    }

    /**
     * {@code T_CONTINUE ';'}
     * @param keyword The continue keyword.
     */
    record Continue(Token keyword) implements StatementContext {
        @Override
        public <R> R accept(Visitor<R> visitor) {
            return visitor.visitContinue(this);
        }
    }
}
