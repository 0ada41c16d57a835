package com.splittree.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * One vertex of the tree being reconstructed.
 * <p>
 * {@code fullMembership} holds every leaf that belongs to this node or any node that will ever be
 * attached below it; it is fixed once the split it came from has been parsed.
 * {@code localMembership} holds the leaves not yet explained by a deeper node, and shrinks as
 * children are attached. At all times {@code localMembership ⊆ fullMembership}.
 * <p>
 * A node owns its children; a node is owned by at most one parent. Not thread safe.
 */
public final class Node {
    private final Set<String> fullMembership = new LinkedHashSet<>();
    private final List<String> localMembership = new ArrayList<>();
    private final List<Node> children = new ArrayList<>();
    private Node parent;

    public Node() {
    }

    public static Node of(Iterable<String> leaves) {
        Node node = new Node();
        for (String leaf : leaves) node.addLocalLeaf(leaf);
        return node;
    }

    /** Construction only: the leaf becomes both local and full member. */
    public void addLocalLeaf(String leaf) {
        Objects.requireNonNull(leaf, "leaf");
        if (!fullMembership.add(leaf)) {
            throw new IllegalArgumentException("Leaf " + leaf + " already belongs to " + this);
        }
        localMembership.add(leaf);
    }

    /** True iff every leaf still local to {@code candidate} is a full member of this node. */
    public boolean isSupersetOf(Node candidate) {
        return fullMembership.containsAll(candidate.localMembership);
    }

    /**
     * Attaches {@code candidate} at the deepest node of this subtree whose full membership covers it,
     * and removes the candidate's leaves from the local membership of every node on the way down.
     * Inserting a candidate that is already attached below this node changes nothing further.
     *
     * @throws IllegalArgumentException if this node is not a superset of the candidate, or the candidate is
     *                                  one of its ancestors
     * @throws IllegalStateException    if the candidate is already owned by a node outside this subtree
     */
    public void insert(Node candidate) {
        Objects.requireNonNull(candidate, "candidate");
        if (candidate == this) return;
        if (candidate.parent != null) {
            reinsert(candidate);
            return;
        }
        for (Node n = parent; n != null; n = n.parent) {
            if (n == candidate) throw new IllegalArgumentException(candidate + " is an ancestor of " + this);
        }
        if (!isSupersetOf(candidate)) {
            throw new IllegalArgumentException(candidate + " is not covered by " + this);
        }
        Node target = firstChildCovering(candidate);
        if (target == null) {
            children.add(candidate);
            candidate.parent = this;
        } else {
            target.insert(candidate);
        }
        removeLocal(candidate.localMembership);
    }

    /** Candidate already has an owner: only the local removals are repeated along its ancestry. */
    private void reinsert(Node candidate) {
        List<Node> path = new ArrayList<>();
        for (Node n = candidate.parent; n != null; n = n.parent) {
            path.add(n);
            if (n == this) {
                for (Node onPath : path) onPath.removeLocal(candidate.localMembership);
                return;
            }
        }
        throw new IllegalStateException(candidate + " is already owned outside " + this);
    }

    private Node firstChildCovering(Node candidate) {
        for (Node child : children) {
            if (child.isSupersetOf(candidate)) return child;
        }
        return null;
    }

    private void removeLocal(List<String> leaves) {
        if (leaves.isEmpty() || localMembership.isEmpty()) return;
        localMembership.removeAll(new HashSet<>(leaves));
    }

    public LabelSet fullMembership() {
        return LabelSet.copyOf(fullMembership);
    }

    /** Read-only view, in insertion order. */
    public List<String> localMembership() {
        return Collections.unmodifiableList(localMembership);
    }

    /** Read-only view, in attachment order. */
    public List<Node> children() {
        return Collections.unmodifiableList(children);
    }

    /** The node this one was attached to, or {@code null} for a root or a node not yet attached. */
    public Node parent() {
        return parent;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** The sole remaining local leaf, or {@code null} if there are none or several. */
    public String label() {
        return localMembership.size() == 1 ? localMembership.get(0) : null;
    }

    /** Local leaves as written in a split record, e.g. {@code bd} or {@code human,chimp}. */
    public String describe() {
        return String.join(localMembership.stream().anyMatch(l -> l.length() != 1) ? "," : "", localMembership);
    }

    @Override
    public String toString() {
        return "Node" + localMembership + (children.isEmpty() ? "" : "+" + children.size());
    }
}
