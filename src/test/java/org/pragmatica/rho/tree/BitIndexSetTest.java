package org.pragmatica.rho.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BitIndexSetTest {

    @Test
    void of_withIndices_containsExactlyThem() {
        var set = BitIndexSet.of(0, 2, 5);

        assertTrue(set.contains(0));
        assertFalse(set.contains(1));
        assertTrue(set.contains(5));
        assertFalse(set.contains(-1));
        assertEquals(3, set.size());
    }

    @Test
    void of_withoutIndices_isEmpty() {
        assertTrue(BitIndexSet.of().isEmpty());
        assertSame(BitIndexSet.empty(), BitIndexSet.of());
    }

    @Test
    void of_negativeIndex_rejected() {
        assertThrows(IllegalArgumentException.class, () -> BitIndexSet.of(-1));
    }

    // === until ===

    @Test
    void until_keepsMembersBelowBound() {
        assertEquals(BitIndexSet.of(0, 2), BitIndexSet.of(0, 2, 5).until(3));
    }

    @Test
    void until_zero_isEmpty() {
        assertTrue(BitIndexSet.of(0, 1).until(0).isEmpty());
    }

    @Test
    void until_boundAboveAllMembers_returnsSameSet() {
        var set = BitIndexSet.of(1, 4);

        assertSame(set, set.until(10));
    }

    @Test
    void until_doesNotModifyOriginal() {
        var set = BitIndexSet.of(0, 3);

        set.until(1);

        assertEquals(BitIndexSet.of(0, 3), set);
    }

    // === shiftDown ===

    @Test
    void shiftDown_dropsInnerBindersAndRenumbers() {
        assertEquals(BitIndexSet.of(0, 3), BitIndexSet.of(0, 2, 5).shiftDown(2));
    }

    @Test
    void shiftDown_pastAllMembers_isEmpty() {
        assertTrue(BitIndexSet.of(0, 2, 5).shiftDown(6).isEmpty());
    }

    @Test
    void shiftDown_zero_returnsSameSet() {
        var set = BitIndexSet.of(3);

        assertSame(set, set.shiftDown(0));
    }

    // === union / with ===

    @Test
    void union_combinesMembers() {
        assertEquals(BitIndexSet.of(0, 1, 7), BitIndexSet.of(0, 7).union(BitIndexSet.of(1, 7)));
    }

    @Test
    void with_addsMemberWithoutTouchingOriginal() {
        var set = BitIndexSet.of(2);
        var extended = set.with(4);

        assertEquals(BitIndexSet.of(2, 4), extended);
        assertEquals(BitIndexSet.of(2), set);
    }

    // === ordering ===

    @Test
    void compareTo_properPrefixSortsFirst() {
        assertTrue(BitIndexSet.of(0).compareTo(BitIndexSet.of(0, 1)) < 0);
        assertTrue(BitIndexSet.empty().compareTo(BitIndexSet.of(0)) < 0);
    }

    @Test
    void compareTo_firstDifferingMemberDecides() {
        assertTrue(BitIndexSet.of(1).compareTo(BitIndexSet.of(0, 5)) > 0);
        assertTrue(BitIndexSet.of(0, 2).compareTo(BitIndexSet.of(0, 3)) < 0);
    }

    @Test
    void compareTo_equalSets_isZero() {
        assertEquals(0, BitIndexSet.of(1, 3).compareTo(BitIndexSet.of(3, 1)));
        assertEquals(BitIndexSet.of(1, 3).hashCode(), BitIndexSet.of(3, 1).hashCode());
    }
}
