package org.pragmatica.rho.tree;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Input {@code for (binds) { body }}. The body sees the variables of all binds; {@code bindCount} is their total.
 */
public record Receive(
    ImmutableList<ReceiveBind> binds,
    Term body,
    boolean persistent,
    int bindCount,
    int freeCount,
    BitIndexSet locallyFree
) {
    public Receive {
        Objects.requireNonNull(binds, "binds");
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(locallyFree, "locallyFree");
        Preconditions.checkArgument(!binds.isEmpty(), "Receive needs at least one bind");
        Preconditions.checkArgument(bindCount >= 0, "Negative bind count %s", bindCount);
    }

    public static Receive of(List<ReceiveBind> binds, Term body, boolean persistent) {
        var bindCount = 0;
        var freeCount = 0;
        var locallyFree = BitIndexSet.empty();
        for (var bind : binds) {
            bindCount += bind.freeCount();
            freeCount += bind.source().freeCount();
            locallyFree = locallyFree.union(bind.source().locallyFree());
        }
        locallyFree = locallyFree.union(body.locallyFree().shiftDown(bindCount));
        return new Receive(ImmutableList.copyOf(binds), body, persistent, bindCount, freeCount + body.freeCount(), locallyFree);
    }

    public static Receive of(ReceiveBind bind, Term body) {
        return of(List.of(bind), body, false);
    }
}
