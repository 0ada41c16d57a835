package com.splittree.tree;

/** What {@link TreeBuilder} does with a split that cannot be placed. */
public enum InconsistencyPolicy {
    /** Skip the split, keep building, and mark the result as partial. */
    CONTINUE,
    /** Fail the whole build on the first problem. */
    ABORT
}
