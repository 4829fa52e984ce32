package org.pragmatica.rho.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * {@code match target { cases }}. Cases are tried in order.
 */
public record Match(Term target, ImmutableList<MatchCase> cases, int freeCount, BitIndexSet locallyFree) {
    public Match {
        Objects.requireNonNull(target, "target");
        Objects.requireNonNull(cases, "cases");
        Objects.requireNonNull(locallyFree, "locallyFree");
    }

    public static Match of(Term target, List<MatchCase> cases) {
        var locallyFree = target.locallyFree();
        for (var matchCase : cases) {
            locallyFree = locallyFree.union(matchCase.pattern().locallyFree())
                                     .union(matchCase.body().locallyFree().shiftDown(matchCase.bindCount()));
        }
        return new Match(target, ImmutableList.copyOf(cases), target.freeCount(), locallyFree);
    }

    public static Match of(Term target, MatchCase... cases) {
        return of(target, List.of(cases));
    }
}
