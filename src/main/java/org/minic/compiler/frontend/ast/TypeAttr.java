package org.minic.compiler.frontend.ast;

/**
 * A declared type and the line of its keyword.
 *
 * @param basicType The type.
 * @param line The line of the type keyword.
 */
public record TypeAttr(BasicType basicType, int line) implements Attribute {

    public TypeAttr {
        if (basicType == null) {
            throw new IllegalArgumentException("basicType must not be null");
        }
    }

    /**
     * @return A type attribute that has not been set from source, {@code void} without a line.
     */
    public static TypeAttr unset() {
        return new TypeAttr(BasicType.VOID, AstNode.NO_LINE);
    }

    @Override
    public AstOperatorType leafKind() {
        return AstOperatorType.LEAF_TYPE;
    }

    @Override
    public String display() {
        return basicType.keyword();
    }
}
