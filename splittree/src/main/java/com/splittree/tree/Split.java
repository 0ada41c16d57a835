package com.splittree.tree;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The two nodes created for one input bipartition.
 * <p>
 * A split only references its nodes; ownership passes to the tree while it is built.
 *
 * @param index  position in the input, used for stable ordering and diagnostics
 * @param source text of the bipartition, e.g. {@code b/acde}
 */
public record Split(int index, String source, Node sideA, Node sideB) {
    public Split {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sideA, "sideA");
        Objects.requireNonNull(sideB, "sideB");
    }

    public static Split of(int index, SplitRecord record) {
        return new Split(index, record.source(), Node.of(record.sideA()), Node.of(record.sideB()));
    }

    public static List<Split> fromRecords(List<SplitRecord> records) {
        List<Split> splits = new ArrayList<>(records.size());
        for (int i = 0; i < records.size(); i++) splits.add(of(i, records.get(i)));
        return splits;
    }

    /** Sort key: size of the smaller side. */
    public int minoritySize() {
        return Math.min(sideA.localMembership().size(), sideB.localMembership().size());
    }

    /** The smaller side; on a tie always {@code sideB}. */
    public Node minorityNode() {
        return sideA.localMembership().size() < sideB.localMembership().size() ? sideA : sideB;
    }

    public LabelSet universe() {
        return sideA.fullMembership().union(sideB.fullMembership());
    }

    @Override
    public String toString() {
        return "Split#" + index + "(" + source + ")";
    }
}
