package com.splittree.tree;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/** Immutable set of leaf labels. Iteration follows insertion order. */
public final class LabelSet implements Iterable<String> {
    private static final LabelSet EMPTY = new LabelSet(Set.of());

    private final Set<String> labels;

    private LabelSet(Set<String> labels) {
        this.labels = labels;
    }

    public static LabelSet empty() {
        return EMPTY;
    }

    public static LabelSet of(String... labels) {
        return copyOf(Arrays.asList(labels));
    }

    public static LabelSet copyOf(Collection<String> labels) {
        Objects.requireNonNull(labels, "labels");
        if (labels.isEmpty()) return EMPTY;
        Set<String> copy = new LinkedHashSet<>(labels.size() * 2);
        for (String label : labels) copy.add(Objects.requireNonNull(label, "label"));
        return new LabelSet(Collections.unmodifiableSet(copy));
    }

    public boolean contains(String leaf) {
        return labels.contains(leaf);
    }

    public boolean containsAll(Collection<String> other) {
        return labels.containsAll(other);
    }

    public boolean containsAll(LabelSet other) {
        return labels.containsAll(other.labels);
    }

    public boolean isDisjointFrom(LabelSet other) {
        return Collections.disjoint(labels, other.labels);
    }

    public LabelSet union(LabelSet other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        Set<String> merged = new LinkedHashSet<>(labels);
        merged.addAll(other.labels);
        return new LabelSet(Collections.unmodifiableSet(merged));
    }

    public int size() {
        return labels.size();
    }

    public boolean isEmpty() {
        return labels.isEmpty();
    }

    public Set<String> asSet() {
        return labels;
    }

    @Override
    public Iterator<String> iterator() {
        return labels.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof LabelSet other && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return labels.hashCode();
    }

    @Override
    public String toString() {
        return labels.stream().collect(Collectors.joining(",", "{", "}"));
    }
}
