package com.splittree;

import com.splittree.codec.SplitCodec;
import com.splittree.common.errorsor.ErrorsOr;
import com.splittree.tree.LabelSet;
import com.splittree.tree.Node;
import com.splittree.tree.ReconstructionResult;
import com.splittree.tree.Split;
import com.splittree.tree.SplitRecord;
import com.splittree.tree.TreeBuilder;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Reusable fixture for split-tree tests.
 * - Parses the compact {@code b/acde} notation
 * - Draws a tree as {@code a(b)} / {@code c(e,d)} for one-line assertions
 * - Generates random vertex-labelled trees and their complete split sets
 */
public final class SplitTreeFixture {

    public static final String[] SCENARIO_A = {"b/acde", "ba/cde", "bace/d", "bacd/e"};
    public static final String[] SCENARIO_CASE_2 = {"ABD/CEFG", "BD/ACEFG", "D/ABCEFG", "G/ABCDEF", "E/ABCDFG", "EF/ABCDG"};

    // ---------- Builders / helpers ----------
    public static List<SplitRecord> records(String... lines) {
        SplitCodec codec = new SplitCodec();
        return Arrays.stream(lines).map(l -> codec.decode(l).valueOrThrow()).toList();
    }

    public static List<Split> splits(String... lines) {
        return Split.fromRecords(records(lines));
    }

    public static ErrorsOr<ReconstructionResult> build(String... lines) {
        return new TreeBuilder().build(splits(lines));
    }

    /** Node whose leaves are the characters of {@code leaves}. */
    public static Node node(String leaves) {
        Node n = new Node();
        for (char c : leaves.toCharArray()) n.addLocalLeaf(String.valueOf(c));
        return n;
    }

    /** {@code label(child,child...)}; a node without local leaves is written {@code *}. */
    public static String draw(Node node) {
        String label = node.localMembership().isEmpty() ? "*" : String.join("", node.localMembership());
        if (node.children().isEmpty()) return label;
        return label + node.children().stream().map(SplitTreeFixture::draw).collect(Collectors.joining(",", "(", ")"));
    }

    /** Every label still local anywhere in the subtree. */
    public static List<String> localLeaves(Node node) {
        List<String> out = new ArrayList<>(node.localMembership());
        for (Node child : node.children()) out.addAll(localLeaves(child));
        return out;
    }

    // ---------- Random trees ----------

    /** A tree whose every vertex carries a label: vertex i (i > 0) hangs off {@code parent[i]}. */
    public record RandomTree(List<String> labels, int[] parent) {

        public static RandomTree generate(int vertices, Random random) {
            List<String> labels = new ArrayList<>(vertices);
            for (int i = 0; i < vertices; i++) labels.add("v" + i);
            Collections.shuffle(labels, random);
            int[] parent = new int[vertices];
            parent[0] = -1;
            for (int i = 1; i < vertices; i++) parent[i] = random.nextInt(i);
            return new RandomTree(labels, parent);
        }

        public LabelSet universe() {
            return LabelSet.copyOf(labels);
        }

        /** Undirected edges as unordered label pairs. */
        public Set<Set<String>> edges() {
            Set<Set<String>> edges = new HashSet<>();
            for (int i = 1; i < parent.length; i++) edges.add(Set.of(labels.get(i), labels.get(parent[i])));
            return edges;
        }

        /** One split per edge, in random order, each with randomly oriented sides. */
        public List<SplitRecord> splits(Random random) {
            List<SplitRecord> out = new ArrayList<>();
            for (int i = 1; i < parent.length; i++) {
                Set<String> below = below(i);
                Set<String> rest = new LinkedHashSet<>(labels);
                rest.removeAll(below);
                LabelSet a = LabelSet.copyOf(below);
                LabelSet b = LabelSet.copyOf(rest);
                String text = String.join(",", a) + "/" + String.join(",", b);
                out.add(random.nextBoolean() ? new SplitRecord(a, b, text) : new SplitRecord(b, a, text));
            }
            Collections.shuffle(out, random);
            return out;
        }

        private Set<String> below(int vertex) {
            Set<String> out = new LinkedHashSet<>();
            for (int i = 0; i < parent.length; i++) {
                for (int v = i; v >= 0; v = parent[v]) {
                    if (v == vertex) {
                        out.add(labels.get(i));
                        break;
                    }
                }
            }
            return out;
        }
    }

    private SplitTreeFixture() {}
}
