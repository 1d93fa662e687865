package org.minic.compiler.frontend.ast;

/**
 * An identifier and the line it appeared on.
 *
 * @param text The identifier spelling.
 * @param line The line of the identifier.
 */
public record IdentifierAttr(String text, int line) implements Attribute {

    public IdentifierAttr {
        if (text == null || text.isEmpty()) {
            throw new IllegalArgumentException("Identifier text must not be empty");
        }
    }

    @Override
    public AstOperatorType leafKind() {
        return AstOperatorType.LEAF_VAR_ID;
    }

    @Override
    public String display() {
        return text;
    }
}
