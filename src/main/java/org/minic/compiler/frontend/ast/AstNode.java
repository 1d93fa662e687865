package org.minic.compiler.frontend.ast;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A node of the abstract syntax tree.
 * <p>
 * All nodes share this one type; the {@link AstOperatorType} tells what a node means and how many
 * children it has. Leaves carry an {@link Attribute} instead of children. Nodes are immutable and
 * are created only through {@link AstFactory}, which enforces the shape of every kind.
 * <p>
 * Equality is structural: two independently built trees for the same source are equal while
 * sharing no node instance.
 */
public final class AstNode {

    /** Line value of nodes that have no source position of their own. */
    public static final int NO_LINE = -1;

    private final AstOperatorType kind;
    private final int line;
    private final Attribute attribute;
    private final List<AstNode> children;

    AstNode(AstOperatorType kind, int line, Attribute attribute, List<AstNode> children) {
        this.kind = kind;
        this.line = line;
        this.attribute = attribute;
        this.children = List.copyOf(children);
    }

    /**
     * @return The kind of this node.
     */
    public AstOperatorType kind() {
        return kind;
    }

    /**
     * @return The 1-based source line, or {@link #NO_LINE}.
     */
    public int line() {
        return line;
    }

    /**
     * @return The attribute of a leaf, empty for all other nodes.
     */
    public Optional<Attribute> attribute() {
        return Optional.ofNullable(attribute);
    }

    /**
     * Returns the attribute if it is of the requested variant.
     * @param type The attribute variant.
     * @param <T> The attribute type.
     * @return The attribute, or empty if this node has none or one of a different variant.
     */
    public <T extends Attribute> Optional<T> attributeAs(Class<T> type) {
        return type.isInstance(attribute) ? Optional.of(type.cast(attribute)) : Optional.empty();
    }

    /**
     * @return The unmodifiable, ordered list of children.
     */
    public List<AstNode> children() {
        return children;
    }

    /**
     * @param index The child position.
     * @return The child at that position.
     */
    public AstNode child(int index) {
        return children.get(index);
    }

    public int childCount() {
        return children.size();
    }

    public boolean isLeaf() {
        return kind.isLeaf();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof AstNode that)) return false;
        return kind == that.kind
                && line == that.line
                && Objects.equals(attribute, that.attribute)
                && children.equals(that.children);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, line, attribute, children);
    }

    @Override
    public String toString() {
        return AstPrinter.inline(this);
    }
}
