package org.minic.compiler.frontend.ast;

/**
 * The basic types a declaration can carry.
 */
public enum BasicType {
    /** Void, also used as the "not yet set" value of a type attribute. */
    VOID("void"),
    /** The 32-bit integer type. */
    INT("int");

    private final String keyword;

    BasicType(String keyword) {
        this.keyword = keyword;
    }

    /**
     * @return The source keyword of the type.
     */
    public String keyword() {
        return keyword;
    }
}
