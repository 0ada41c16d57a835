package com.splittree.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.splittree.SplitTreeFixture.records;
import static com.splittree.SplitTreeFixture.splits;
import static org.junit.jupiter.api.Assertions.*;

class SplitTest {

    @Test
    void minorityIsTheSmallerSide() {
        Split s = splits("b/acde").get(0);
        assertEquals(1, s.minoritySize());
        assertSame(s.sideA(), s.minorityNode());

        Split t = splits("bacd/e").get(0);
        assertSame(t.sideB(), t.minorityNode());
    }

    @Test
    void tiedSidesPreferSideB() {
        Split s = splits("ab/cd").get(0);
        assertEquals(2, s.minoritySize());
        assertSame(s.sideB(), s.minorityNode());
    }

    @Test
    void fromRecordsNumbersSplitsByInputPosition() {
        List<Split> splits = splits("a/bc", "b/ac", "c/ab");
        assertEquals(List.of(0, 1, 2), splits.stream().map(Split::index).toList());
        assertEquals("b/ac", splits.get(1).source());
        assertEquals(List.of("a", "c"), splits.get(1).sideB().localMembership());
    }

    @Test
    void eachSplitGetsFreshNodes() {
        SplitRecord record = records("a/bc").get(0);
        Split first = Split.of(0, record);
        Split second = Split.of(1, record);
        assertNotSame(first.sideA(), second.sideA());
    }

    @Test
    void universeIsTheUnionOfBothSides() {
        assertEquals(LabelSet.of("a", "b", "c"), splits("a/bc").get(0).universe());
    }

    @Test
    void recordRejectsOverlappingOrEmptySides() {
        assertThrows(IllegalArgumentException.class, () -> new SplitRecord(LabelSet.of("a"), LabelSet.of("a", "b"), "a/ab"));
        assertThrows(IllegalArgumentException.class, () -> new SplitRecord(LabelSet.empty(), LabelSet.of("a"), "/a"));
    }
}
