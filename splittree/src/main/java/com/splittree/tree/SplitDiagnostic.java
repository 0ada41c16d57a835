package com.splittree.tree;

import java.util.Objects;

/**
 * A problem with one input split, reported instead of guessing a placement.
 *
 * @param splitIndex position of the split in the input
 * @param split      text of the split
 * @param candidate  leaves of the node that could not be placed, or empty when not applicable
 */
public record SplitDiagnostic(SplitErrorKind kind, int splitIndex, String split, String candidate, String message) {
    public SplitDiagnostic {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(split, "split");
        Objects.requireNonNull(candidate, "candidate");
        Objects.requireNonNull(message, "message");
    }

    static SplitDiagnostic inconsistent(Split split, Node candidate) {
        String text = "split #" + split.index() + " '" + split.source() + "': side " + candidate.describe()
                + " is not contained in either root branch";
        return new SplitDiagnostic(SplitErrorKind.INCONSISTENT_SPLIT, split.index(), split.source(), candidate.describe(), text);
    }

    static SplitDiagnostic universeMismatch(Split split, LabelSet expected, LabelSet actual) {
        String text = "split #" + split.index() + " '" + split.source() + "' covers leaves " + actual
                + " but most splits cover " + expected;
        return new SplitDiagnostic(SplitErrorKind.LEAF_UNIVERSE_MISMATCH, split.index(), split.source(), "", text);
    }

    /** Message prefixed with the error kind, e.g. {@code InconsistentSplit: split #1 ...}. */
    public String describe() {
        return kind.format(message);
    }
}
