package org.pragmatica.rho.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Output {@code chan!(data...)}, or {@code chan!!(data...)} when persistent.
 */
public record Send(
    Channel chan,
    ImmutableList<Term> data,
    boolean persistent,
    int freeCount,
    BitIndexSet locallyFree
) {
    public Send {
        Objects.requireNonNull(chan, "chan");
        Objects.requireNonNull(data, "data");
        Objects.requireNonNull(locallyFree, "locallyFree");
    }

    public static Send of(Channel chan, Term... data) {
        return of(chan, List.of(data), false);
    }

    public static Send persistent(Channel chan, Term... data) {
        return of(chan, List.of(data), true);
    }

    public static Send of(Channel chan, List<Term> data, boolean persistent) {
        var freeCount = chan.freeCount();
        var locallyFree = chan.locallyFree();
        for (var datum : data) {
            freeCount += datum.freeCount();
            locallyFree = locallyFree.union(datum.locallyFree());
        }
        return new Send(chan, ImmutableList.copyOf(data), persistent, freeCount, locallyFree);
    }
}
