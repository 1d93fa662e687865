package org.minic.compiler.frontend.cst;

/**
 * The production {@code blockItem : statement | varDecl}.
 */
public sealed interface BlockItemContext permits StatementContext, VarDeclContext {

    /**
     * Dispatches to the visitor method of the concrete alternative.
     * @param visitor The visitor.
     * @param <R> The result type.
     * @return The visitor's result.
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * Visitor over the two block item alternatives.
     * @param <R> The result type.
     */
    interface Visitor<R> {
        R visitStatement(StatementContext statement);

        R visitVarDecl(VarDeclContext varDecl);
    }
}
