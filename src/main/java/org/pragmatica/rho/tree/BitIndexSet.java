package org.pragmatica.rho.tree;

import com.google.common.base.Preconditions;

import java.util.BitSet;
import java.util.stream.IntStream;

/**
 * Immutable set of small non-negative indices.
 * Used for the locally-free bookkeeping of every node: which enclosing binders the subtree references.
 */
public final class BitIndexSet implements Comparable<BitIndexSet> {
    private static final BitIndexSet EMPTY = new BitIndexSet(new BitSet());

    private final BitSet bits;

    private BitIndexSet(BitSet bits) {
        this.bits = bits;
    }

    public static BitIndexSet empty() {
        return EMPTY;
    }

    public static BitIndexSet of(int... indices) {
        if (indices.length == 0) {
            return EMPTY;
        }
        var bits = new BitSet();
        for (var index : indices) {
            Preconditions.checkArgument(index >= 0, "Negative index %s", index);
            bits.set(index);
        }
        return new BitIndexSet(bits);
    }

    public boolean contains(int index) {
        return index >= 0 && bits.get(index);
    }

    public boolean isEmpty() {
        return bits.isEmpty();
    }

    public int size() {
        return bits.cardinality();
    }

    public IntStream stream() {
        return bits.stream();
    }

    /**
     * Members strictly below {@code bound}.
     */
    public BitIndexSet until(int bound) {
        if (bound <= 0 || bits.isEmpty()) {
            return EMPTY;
        }
        if (bound >= bits.length()) {
            return this;
        }
        return wrap(bits.get(0, bound));
    }

    /**
     * Drops members below {@code count} and renumbers the rest as seen from outside {@code count} binders.
     */
    public BitIndexSet shiftDown(int count) {
        Preconditions.checkArgument(count >= 0, "Negative shift %s", count);
        if (count == 0 || bits.isEmpty()) {
            return this;
        }
        if (count >= bits.length()) {
            return EMPTY;
        }
        return wrap(bits.get(count, bits.length()));
    }

    public BitIndexSet union(BitIndexSet other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        var merged = (BitSet) bits.clone();
        merged.or(other.bits);
        return new BitIndexSet(merged);
    }

    public BitIndexSet with(int index) {
        Preconditions.checkArgument(index >= 0, "Negative index %s", index);
        if (bits.get(index)) {
            return this;
        }
        var extended = (BitSet) bits.clone();
        extended.set(index);
        return new BitIndexSet(extended);
    }

    /**
     * Orders sets by their members in ascending order; a proper prefix sorts first.
     */
    @Override
    public int compareTo(BitIndexSet other) {
        var left = bits.nextSetBit(0);
        var right = other.bits.nextSetBit(0);
        while (left >= 0 && right >= 0) {
            if (left != right) {
                return Integer.compare(left, right);
            }
            left = bits.nextSetBit(left + 1);
            right = other.bits.nextSetBit(right + 1);
        }
        if (left < 0 && right < 0) {
            return 0;
        }
        return left < 0 ? -1 : 1;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof BitIndexSet other && bits.equals(other.bits);
    }

    @Override
    public int hashCode() {
        return bits.hashCode();
    }

    @Override
    public String toString() {
        return bits.toString();
    }

    private static BitIndexSet wrap(BitSet bits) {
        return bits.isEmpty() ? EMPTY : new BitIndexSet(bits);
    }
}
