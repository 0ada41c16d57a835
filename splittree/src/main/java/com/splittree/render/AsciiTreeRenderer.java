package com.splittree.render;

import com.splittree.common.errorsor.ErrorsOr;
import com.splittree.tree.Node;
import com.splittree.tree.ReconstructionResult;

import java.util.List;

/**
 * Indented drawing, one node per line:
 * <pre>
 *  |-a
 *  | \-b
 *  |-c
 *  | |-e
 *  | \-d
 * </pre>
 * Both roots are drawn as non-last siblings. A node without a local leaf is drawn as {@code *};
 * a node still holding several leaves (a partial tree) shows them comma separated.
 */
public final class AsciiTreeRenderer implements TreeRenderer {
    public static final String UNLABELLED = "*";

    @Override
    public ErrorsOr<String> render(ReconstructionResult result) {
        StringBuilder sb = new StringBuilder();
        for (Node root : result.roots()) draw(sb, root, " ", false);
        return ErrorsOr.lift(sb.toString());
    }

    private static void draw(StringBuilder sb, Node node, String indent, boolean last) {
        sb.append(indent);
        String childIndent;
        if (last) {
            sb.append("\\-");
            childIndent = indent + "  ";
        } else {
            sb.append("|-");
            childIndent = indent + "| ";
        }
        sb.append(text(node)).append('\n');

        List<Node> children = node.children();
        for (int i = 0; i < children.size(); i++) {
            draw(sb, children.get(i), childIndent, i == children.size() - 1);
        }
    }

    static String text(Node node) {
        List<String> local = node.localMembership();
        return local.isEmpty() ? UNLABELLED : String.join(",", local);
    }
}
