package org.minic.compiler.frontend.cst;

import java.util.List;

/**
 * The production {@code varDecl : basicType varDef (',' varDef)* ';'}.
 *
 * @param basicType The declared type, shared by all names of the declaration.
 * @param varDefs The declared names in source order, at least one.
 */
public record VarDeclContext(BasicTypeContext basicType, List<VarDefContext> varDefs) implements BlockItemContext {
    public VarDeclContext {
        varDefs = List.copyOf(varDefs);
        if (varDefs.isEmpty()) {
            throw new IllegalArgumentException("varDecl requires at least one varDef");
        }
    }

    @Override
    public <R> R accept(BlockItemContext.Visitor<R> visitor) {
        return visitor.visitVarDecl(this);
    }
}
