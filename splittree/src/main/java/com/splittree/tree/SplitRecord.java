package com.splittree.tree;

import java.util.Objects;

/**
 * A parsed bipartition: the two leaf groups left after removing one edge.
 *
 * @param source the text the record was parsed from, used in diagnostics
 */
public record SplitRecord(LabelSet sideA, LabelSet sideB, String source) {
    public SplitRecord {
        Objects.requireNonNull(sideA, "sideA");
        Objects.requireNonNull(sideB, "sideB");
        Objects.requireNonNull(source, "source");
        if (sideA.isEmpty() || sideB.isEmpty()) {
            throw new IllegalArgumentException("Both sides of a split must be non-empty: " + source);
        }
        if (!sideA.isDisjointFrom(sideB)) {
            throw new IllegalArgumentException("Sides of a split must be disjoint: " + source);
        }
    }

    /** Every leaf named by the record. */
    public LabelSet universe() {
        return sideA.union(sideB);
    }
}
