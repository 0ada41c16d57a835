package com.splittree.tree;

public enum SplitErrorKind {
    /** A split record could not be parsed into two non-empty disjoint label groups. */
    MALFORMED_SPLIT("MalformedSplit"),
    /** Nothing to build from. */
    EMPTY_INPUT("EmptyInput"),
    /** The minority side of a split is covered by neither root branch. */
    INCONSISTENT_SPLIT("InconsistentSplit"),
    /** A split names a different set of leaves than most splits do. */
    LEAF_UNIVERSE_MISMATCH("LeafUniverseMismatch");

    private final String displayName;

    SplitErrorKind(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /** Message prefixed with the kind, the form used in every reported error string. */
    public String format(String message) {
        return displayName + ": " + message;
    }
}
