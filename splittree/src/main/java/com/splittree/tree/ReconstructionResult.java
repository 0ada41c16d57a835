package com.splittree.tree;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * The two root branches of a reconstructed tree, joined by the root split's edge,
 * together with every problem reported while building it.
 */
public record ReconstructionResult(Split rootSplit, List<SplitDiagnostic> diagnostics) {
    public ReconstructionResult {
        Objects.requireNonNull(rootSplit, "rootSplit");
        diagnostics = List.copyOf(diagnostics);
    }

    public Node rootA() {
        return rootSplit.sideA();
    }

    public Node rootB() {
        return rootSplit.sideB();
    }

    public List<Node> roots() {
        return List.of(rootA(), rootB());
    }

    /** True when at least one split was left out of the tree. */
    public boolean isPartial() {
        return !diagnostics.isEmpty();
    }

    /** True when no node holds more than one local leaf. */
    public boolean isFullyResolved() {
        return nodes().stream().allMatch(n -> n.localMembership().size() <= 1);
    }

    /** Number of nodes left with exactly one local leaf. */
    public int leafCount() {
        return (int) nodes().stream().filter(n -> n.localMembership().size() == 1).count();
    }

    /** Pre-order walk of branch A then branch B. */
    public List<Node> nodes() {
        List<Node> out = new ArrayList<>();
        Deque<Node> stack = new ArrayDeque<>();
        stack.push(rootB());
        stack.push(rootA());
        while (!stack.isEmpty()) {
            Node n = stack.pop();
            out.add(n);
            List<Node> children = n.children();
            for (int i = children.size() - 1; i >= 0; i--) stack.push(children.get(i));
        }
        return out;
    }
}
