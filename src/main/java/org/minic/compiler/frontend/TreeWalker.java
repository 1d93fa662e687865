package org.minic.compiler.frontend;

import org.minic.compiler.frontend.ast.AstNode;
import org.minic.compiler.frontend.ast.AstOperatorType;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Consumer;

/**
 * A generic class for traversing an Abstract Syntax Tree.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between compiler phases and the AST structure.
 * <p>
 * Handlers are keyed by {@link AstOperatorType} and run in pre-order: a node's handler runs
 * before any of its children are visited.
 */
public class TreeWalker {

    private final Map<AstOperatorType, Consumer<AstNode>> handlers;
    private final Consumer<AstNode> everyNode;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node kinds to their corresponding handlers.
     */
    public TreeWalker(Map<AstOperatorType, Consumer<AstNode>> handlers) {
        this(handlers, n -> {});
    }

    /**
     * Constructs a new TreeWalker with an additional handler invoked for every node.
     * @param handlers A map from node kinds to their corresponding handlers.
     * @param everyNode Invoked for each node before its kind-specific handler.
     */
    public TreeWalker(Map<AstOperatorType, Consumer<AstNode>> handlers, Consumer<AstNode> everyNode) {
        this.handlers = handlers.isEmpty() ? new EnumMap<>(AstOperatorType.class) : new EnumMap<>(handlers);
        this.everyNode = everyNode;
    }

    /**
     * Walks a single AST node and its children recursively.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        everyNode.accept(node);
        handlers.getOrDefault(node.kind(), n -> {}).accept(node);

        // Descend recursively into ALL children without knowing their kind.
        for (AstNode child : node.children()) {
            walk(child);
        }
    }
}
