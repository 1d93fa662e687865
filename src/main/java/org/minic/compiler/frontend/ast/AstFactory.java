package org.minic.compiler.frontend.ast;

import java.util.Arrays;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Creates {@link AstNode}s and enforces the shape of every kind.
 * <p>
 * Violations raise {@link AstInvariantException}. The factory only sees the children of the node
 * being built, so it rejects a child passed twice to one node; sharing across different parents is
 * detected by {@link AstValidator}.
 */
public final class AstFactory {

    private AstFactory() {}

    /**
     * Creates a leaf from an attribute. The kind and line come from the attribute.
     * @param attribute The payload.
     * @return The leaf node.
     */
    public static AstNode leaf(Attribute attribute) {
        if (attribute == null) {
            throw new AstInvariantException("Leaf requires an attribute", AstNode.NO_LINE);
        }
        return new AstNode(attribute.leafKind(), attribute.line(), attribute, List.of());
    }

    /**
     * Creates a type leaf.
     * @param type The declared type.
     * @return The {@link AstOperatorType#LEAF_TYPE} node.
     */
    public static AstNode typeNode(TypeAttr type) {
        return leaf(type);
    }

    /**
     * Creates a node of a fixed-arity kind with exactly the given children.
     * @param kind A kind of shape {@link AstOperatorType.Shape#FIXED}.
     * @param line The line of the dominant token.
     * @param children The children in order.
     * @return The node.
     */
    public static AstNode operator(AstOperatorType kind, int line, AstNode... children) {
        if (kind.shape() != AstOperatorType.Shape.FIXED) {
            throw new AstInvariantException("Kind " + kind + " is not a fixed-arity operator", line);
        }
        List<AstNode> list = Arrays.asList(children);
        checkChildren(kind, line, list);
        return new AstNode(kind, line, null, list);
    }

    /**
     * Creates a node of a variadic kind. An empty list yields an empty container where the kind allows it.
     * @param kind A kind of shape {@link AstOperatorType.Shape#VARIADIC}.
     * @param line The line of the dominant token, or {@link AstNode#NO_LINE}.
     * @param children The children in order.
     * @return The node.
     */
    public static AstNode container(AstOperatorType kind, int line, List<AstNode> children) {
        if (kind.shape() != AstOperatorType.Shape.VARIADIC) {
            throw new AstInvariantException("Kind " + kind + " is not a container", line);
        }
        checkChildren(kind, line, children);
        return new AstNode(kind, line, null, children);
    }

    /**
     * Creates an empty container.
     * @param kind A variadic kind that allows zero children.
     * @param line The line of the node.
     * @return The empty node.
     */
    public static AstNode emptyContainer(AstOperatorType kind, int line) {
        return container(kind, line, Collections.emptyList());
    }

    /**
     * Creates a function definition. The node takes the line of the function name.
     * @param returnType The return type.
     * @param name The function name.
     * @param body The body, of kind {@link AstOperatorType#BLOCK}.
     * @param formalParams The formal parameters, or {@code null} for an empty list.
     * @return The {@link AstOperatorType#FUNC_DEF} node.
     */
    public static AstNode functionDefinition(TypeAttr returnType, IdentifierAttr name, AstNode body, AstNode formalParams) {
        requireKind(body, AstOperatorType.BLOCK, "function body", name.line());
        AstNode params = formalParams != null
                ? formalParams
                : emptyContainer(AstOperatorType.FUNC_FORMAL_PARAMS, name.line());
        requireKind(params, AstOperatorType.FUNC_FORMAL_PARAMS, "formal parameters", name.line());
        return operator(AstOperatorType.FUNC_DEF, name.line(), typeNode(returnType), leaf(name), body, params);
    }

    /**
     * Creates a function call. The node takes the line of the callee name.
     * @param callee The called function.
     * @param realParams The arguments, or {@code null} for a call without arguments.
     * @return The {@link AstOperatorType#FUNC_CALL} node.
     */
    public static AstNode functionCall(IdentifierAttr callee, AstNode realParams) {
        AstNode params = realParams != null
                ? realParams
                : emptyContainer(AstOperatorType.FUNC_REAL_PARAMS, callee.line());
        requireKind(params, AstOperatorType.FUNC_REAL_PARAMS, "call arguments", callee.line());
        return operator(AstOperatorType.FUNC_CALL, callee.line(), leaf(callee), params);
    }

    private static void requireKind(AstNode node, AstOperatorType expected, String role, int line) {
        if (node == null || node.kind() != expected) {
            throw new AstInvariantException(String.format("Expected %s of kind %s but got %s",
                    role, expected, node == null ? "null" : node.kind()), line);
        }
    }

    private static void checkChildren(AstOperatorType kind, int line, List<AstNode> children) {
        if (!kind.accepts(children.size())) {
            throw new AstInvariantException(String.format("Kind %s does not accept %d children",
                    kind, children.size()), line);
        }
        Set<AstNode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (AstNode child : children) {
            if (child == null) {
                throw new AstInvariantException("Null child for kind " + kind, line);
            }
            if (!seen.add(child)) {
                throw new AstInvariantException("Node instance attached twice to " + kind, line);
            }
        }
    }
}
