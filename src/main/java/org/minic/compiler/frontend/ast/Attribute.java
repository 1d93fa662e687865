package org.minic.compiler.frontend.ast;

/**
 * Lexical payload of a leaf node, paired with the line it was taken from.
 * Each variant determines the kind of leaf it produces.
 */
public sealed interface Attribute permits TypeAttr, IdentifierAttr, IntegerLiteralAttr {

    /**
     * @return The 1-based source line, or {@link AstNode#NO_LINE}.
     */
    int line();

    /**
     * @return The leaf kind a node built from this attribute has.
     */
    AstOperatorType leafKind();

    /**
     * @return The payload as it is shown in AST dumps.
     */
    String display();
}
