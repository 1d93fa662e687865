package org.minic.compiler.frontend.ast;

/**
 * Renders abstract syntax trees as text for logs and test failure messages.
 */
public final class AstPrinter {

    private AstPrinter() {}

    /**
     * Renders a tree on one line as an S-expression, e.g. {@code (+ 1 (* 2 3))}.
     * Leaves are shown by their payload only.
     * @param node The root of the tree.
     * @return The rendered tree.
     */
    public static String inline(AstNode node) {
        StringBuilder sb = new StringBuilder();
        appendInline(node, sb);
        return sb.toString();
    }

    /**
     * Renders a tree with one node per line, indented by depth, e.g.
     * <pre>
     * compile-unit
     *   func-def @1
     *     type int @1
     * </pre>
     * @param node The root of the tree.
     * @return The rendered tree, lines separated by {@code \n}.
     */
    public static String dump(AstNode node) {
        StringBuilder sb = new StringBuilder();
        appendDump(node, 0, sb);
        return sb.toString();
    }

    private static void appendInline(AstNode node, StringBuilder sb) {
        if (node.isLeaf()) {
            sb.append(node.attribute().map(Attribute::display).orElse("?"));
            return;
        }
        sb.append('(').append(node.kind().label());
        for (AstNode child : node.children()) {
            sb.append(' ');
            appendInline(child, sb);
        }
        sb.append(')');
    }

    private static void appendDump(AstNode node, int depth, StringBuilder sb) {
        if (depth > 0) {
            sb.append('\n');
        }
        sb.append("  ".repeat(depth)).append(node.kind().label());
        node.attribute().ifPresent(a -> sb.append(' ').append(a.display()));
        if (node.line() != AstNode.NO_LINE) {
            sb.append(" @").append(node.line());
        }
        for (AstNode child : node.children()) {
            appendDump(child, depth + 1, sb);
        }
    }
}
