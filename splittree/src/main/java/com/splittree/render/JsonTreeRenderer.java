package com.splittree.render;

import com.splittree.common.codec.Codec;
import com.splittree.common.errorsor.ErrorsOr;
import com.splittree.tree.Node;
import com.splittree.tree.ReconstructionResult;
import com.splittree.tree.SplitDiagnostic;

import java.util.List;

public final class JsonTreeRenderer implements TreeRenderer {

    /** Serialized shape of one node. */
    public record NodeView(List<String> labels, List<NodeView> children) {
        static NodeView of(Node node) {
            return new NodeView(List.copyOf(node.localMembership()),
                    node.children().stream().map(NodeView::of).toList());
        }
    }

    public record TreeView(List<NodeView> roots, boolean partial, List<String> diagnostics) {
        static TreeView of(ReconstructionResult result) {
            return new TreeView(result.roots().stream().map(NodeView::of).toList(),
                    result.isPartial(),
                    result.diagnostics().stream().map(SplitDiagnostic::describe).toList());
        }
    }

    private final Codec<Object, String> json;

    public JsonTreeRenderer(boolean pretty) {
        this.json = pretty ? Codec.prettyJson() : Codec.json();
    }

    @Override
    public ErrorsOr<String> render(ReconstructionResult result) {
        return json.encode(TreeView.of(result));
    }
}
