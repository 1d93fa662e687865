package org.minic.compiler.frontend.ast;

/**
 * Thrown when a node would violate the structural rules of its kind.
 * This is an internal error: a correct transformer never triggers it.
 */
public class AstInvariantException extends IllegalStateException {

    private final int line;

    /**
     * @param message The violated rule.
     * @param line The line of the node that was being built.
     */
    public AstInvariantException(String message, int line) {
        super(message);
        this.line = line;
    }

    /**
     * @return The line of the node that was being built, or {@link AstNode#NO_LINE}.
     */
    public int getLine() {
        return line;
    }
}
