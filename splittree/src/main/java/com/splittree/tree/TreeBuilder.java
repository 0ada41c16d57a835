package com.splittree.tree;

import com.splittree.common.errorsor.ErrorsOr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Rebuilds a tree from the complete set of its edge bipartitions.
 * <p>
 * Splits are ordered by the size of their smaller side. The most balanced split seeds the two root
 * branches; the smaller side of every other split, largest first, is then pushed down into the root
 * branch that covers it until it reaches the deepest node whose leaves contain it. Tree splits form a
 * laminar family, so that node is the unique correct parent.
 * <p>
 * A builder is stateless and may be shared; each call owns the nodes of the splits it is given.
 */
public final class TreeBuilder {
    private static final Logger log = LoggerFactory.getLogger(TreeBuilder.class);

    /** Ascending by minority size; {@link List#sort} is stable, so ties keep input order. */
    static final Comparator<Split> BY_MINORITY_SIZE = Comparator.comparingInt(Split::minoritySize);

    private final InconsistencyPolicy policy;
    private final boolean checkLeafUniverse;

    public TreeBuilder() {
        this(InconsistencyPolicy.CONTINUE, true);
    }

    public TreeBuilder(InconsistencyPolicy policy, boolean checkLeafUniverse) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.checkLeafUniverse = checkLeafUniverse;
    }

    public InconsistencyPolicy policy() {
        return policy;
    }

    public ErrorsOr<ReconstructionResult> buildFromRecords(List<SplitRecord> records) {
        return build(Split.fromRecords(records));
    }

    /**
     * @return the result (possibly partial, with diagnostics) or, for empty input or an aborted build,
     * the error messages
     */
    public ErrorsOr<ReconstructionResult> build(List<Split> splits) {
        Objects.requireNonNull(splits, "splits");
        if (splits.isEmpty()) {
            return ErrorsOr.error(SplitErrorKind.EMPTY_INPUT.format("no splits to build a tree from"));
        }

        List<SplitDiagnostic> diagnostics = new ArrayList<>();
        List<Split> usable = checkLeafUniverse ? withMatchingUniverse(splits, diagnostics) : splits;
        if (policy == InconsistencyPolicy.ABORT && !diagnostics.isEmpty()) {
            return aborted(diagnostics);
        }

        List<Split> sorted = new ArrayList<>(usable);
        sorted.sort(BY_MINORITY_SIZE);

        Split root = sorted.get(sorted.size() - 1);
        Node rootA = root.sideA();
        Node rootB = root.sideB();
        log.debug("Root split {} with branches {} and {}", root, rootA, rootB);

        for (int i = sorted.size() - 2; i >= 0; i--) {
            Split split = sorted.get(i);
            Node candidate = split.minorityNode();
            if (rootA.isSupersetOf(candidate)) {
                log.debug("Inserting {} from {} under branch A", candidate, split);
                rootA.insert(candidate);
            } else if (rootB.isSupersetOf(candidate)) {
                log.debug("Inserting {} from {} under branch B", candidate, split);
                rootB.insert(candidate);
            } else {
                SplitDiagnostic diagnostic = SplitDiagnostic.inconsistent(split, candidate);
                log.warn(diagnostic.describe());
                diagnostics.add(diagnostic);
                if (policy == InconsistencyPolicy.ABORT) return aborted(diagnostics);
            }
        }

        ReconstructionResult result = new ReconstructionResult(root, diagnostics);
        if (result.isPartial()) {
            log.warn("Built partial tree from {} splits, {} skipped", splits.size(), diagnostics.size());
        } else {
            log.debug("Built tree from {} splits with {} resolved leaves", splits.size(), result.leafCount());
        }
        return ErrorsOr.lift(result);
    }

    /**
     * Drops (and reports) every split whose leaves differ from the leaf set shared by most splits.
     * On a tie the leaf set seen first wins.
     */
    private static List<Split> withMatchingUniverse(List<Split> splits, List<SplitDiagnostic> diagnostics) {
        LabelSet expected = commonUniverse(splits);
        List<Split> matching = new ArrayList<>(splits.size());
        for (Split split : splits) {
            LabelSet actual = split.universe();
            if (actual.equals(expected)) {
                matching.add(split);
            } else {
                SplitDiagnostic diagnostic = SplitDiagnostic.universeMismatch(split, expected, actual);
                log.warn(diagnostic.describe());
                diagnostics.add(diagnostic);
            }
        }
        return matching;
    }

    static LabelSet commonUniverse(List<Split> splits) {
        Map<LabelSet, Integer> counts = new LinkedHashMap<>();
        for (Split split : splits) counts.merge(split.universe(), 1, Integer::sum);
        LabelSet best = null;
        int bestCount = 0;
        for (Map.Entry<LabelSet, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    private static ErrorsOr<ReconstructionResult> aborted(List<SplitDiagnostic> diagnostics) {
        return ErrorsOr.errors(diagnostics.stream().map(SplitDiagnostic::describe).toList());
    }
}
