package org.minic.compiler.frontend.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Re-checks a finished tree against the structural rules of the node kinds.
 * <p>
 * Checks: child counts per kind, attributes present exactly on leaves and of the variant the
 * leaf kind expects, type leaves set to a real type, and no node instance reachable through two
 * parents. The validator never throws for a bad tree; it returns the violations found.
 */
public final class AstValidator {

    /**
     * Validates the tree below and including {@code root}.
     * @param root The root node.
     * @return The violations found, empty for a valid tree.
     */
    public List<String> validate(AstNode root) {
        List<String> violations = new ArrayList<>();
        Set<AstNode> visited = Collections.newSetFromMap(new IdentityHashMap<>());
        check(root, visited, violations);
        return violations;
    }

    private void check(AstNode node, Set<AstNode> visited, List<String> violations) {
        if (!visited.add(node)) {
            violations.add(describe(node) + ": node instance is shared between parents");
            return;
        }
        AstOperatorType kind = node.kind();
        if (!kind.accepts(node.childCount())) {
            violations.add(String.format("%s: %d children not allowed", describe(node), node.childCount()));
        }
        if (kind.isLeaf()) {
            checkLeaf(node, violations);
        } else if (node.attribute().isPresent()) {
            violations.add(describe(node) + ": only leaves carry attributes");
        }
        for (AstNode child : node.children()) {
            check(child, visited, violations);
        }
    }

    private void checkLeaf(AstNode node, List<String> violations) {
        if (node.attribute().isEmpty()) {
            violations.add(describe(node) + ": leaf without attribute");
            return;
        }
        Attribute attribute = node.attribute().get();
        if (attribute.leafKind() != node.kind()) {
            violations.add(String.format("%s: attribute %s does not match the kind",
                    describe(node), attribute.getClass().getSimpleName()));
        }
        if (attribute instanceof TypeAttr type && type.basicType() == BasicType.VOID) {
            violations.add(describe(node) + ": type was never set");
        }
    }

    private static String describe(AstNode node) {
        return node.kind().label() + "@" + node.line();
    }
}
