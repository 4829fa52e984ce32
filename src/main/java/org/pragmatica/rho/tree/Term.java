package org.pragmatica.rho.tree;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

import java.util.Objects;

/**
 * Parallel composition of processes - the universal node of the tree.
 *
 * <p>{@code freeCount} counts the free-variable slots the term opens when used as a pattern.
 * {@code locallyFree} records which enclosing binders the term references; it is the union of the
 * children's sets, each shifted down past the binders that child introduces.
 */
public record Term(
    ImmutableList<Send> sends,
    ImmutableList<Receive> receives,
    ImmutableList<New> news,
    ImmutableList<Expr> exprs,
    ImmutableList<Match> matches,
    ImmutableList<Eval> evals,
    ImmutableList<GPrivate> ids,
    int freeCount,
    BitIndexSet locallyFree
) {
    public static final Term EMPTY = new Term(ImmutableList.of(),
                                              ImmutableList.of(),
                                              ImmutableList.of(),
                                              ImmutableList.of(),
                                              ImmutableList.of(),
                                              ImmutableList.of(),
                                              ImmutableList.of(),
                                              0,
                                              BitIndexSet.empty());

    public Term {
        Objects.requireNonNull(sends, "sends");
        Objects.requireNonNull(receives, "receives");
        Objects.requireNonNull(news, "news");
        Objects.requireNonNull(exprs, "exprs");
        Objects.requireNonNull(matches, "matches");
        Objects.requireNonNull(evals, "evals");
        Objects.requireNonNull(ids, "ids");
        Objects.requireNonNull(locallyFree, "locallyFree");
        Preconditions.checkArgument(freeCount >= 0, "Negative free count %s", freeCount);
    }

    // === Factories ===

    public static Term of(Send send) {
        return builder().add(send).build();
    }

    public static Term of(Receive receive) {
        return builder().add(receive).build();
    }

    public static Term of(New scope) {
        return builder().add(scope).build();
    }

    public static Term of(Expr expr) {
        return builder().add(expr).build();
    }

    public static Term of(Match match) {
        return builder().add(match).build();
    }

    public static Term of(Eval eval) {
        return builder().add(eval).build();
    }

    public static Term of(GPrivate id) {
        return builder().add(id).build();
    }

    public static Term integer(long value) {
        return of(Expr.integer(value));
    }

    public static Term string(String value) {
        return of(Expr.string(value));
    }

    public static Term bool(boolean value) {
        return of(Expr.bool(value));
    }

    /**
     * Process-position reference to the binder at {@code index}.
     */
    public static Term bound(int index) {
        return of(Expr.bound(index));
    }

    public static Builder builder() {
        return new Builder();
    }

    // === Composition ===

    /**
     * Parallel composition of this term and {@code other}.
     */
    public Term merge(Term other) {
        if (other.isEmpty() && other.freeCount == 0 && other.locallyFree.isEmpty()) {
            return this;
        }
        return new Term(concat(sends, other.sends),
                        concat(receives, other.receives),
                        concat(news, other.news),
                        concat(exprs, other.exprs),
                        concat(matches, other.matches),
                        concat(evals, other.evals),
                        concat(ids, other.ids),
                        freeCount + other.freeCount,
                        locallyFree.union(other.locallyFree));
    }

    /**
     * True when the term has no processes at all ({@code Nil}).
     */
    public boolean isEmpty() {
        return sends.isEmpty() && receives.isEmpty() && news.isEmpty() && exprs.isEmpty()
               && matches.isEmpty() && evals.isEmpty() && ids.isEmpty();
    }

    /**
     * True when a wildcard appears directly in this term or in one of its collection literals.
     */
    public boolean hasWildcard() {
        for (var expr : exprs) {
            if (expr instanceof Expr.EVar eVar && eVar.v() instanceof Var.Wildcard) {
                return true;
            }
            if (expr instanceof Expr.EList list && list.wildcard()
                || expr instanceof Expr.ETuple tuple && tuple.wildcard()
                || expr instanceof Expr.ESet set && set.wildcard()
                || expr instanceof Expr.EMap map && map.wildcard()) {
                return true;
            }
        }
        for (var eval : evals) {
            if (eval.channel() instanceof Channel.ChanVar chanVar && chanVar.var() instanceof Var.Wildcard) {
                return true;
            }
        }
        return false;
    }

    private static <T> ImmutableList<T> concat(ImmutableList<T> left, ImmutableList<T> right) {
        if (right.isEmpty()) {
            return left;
        }
        if (left.isEmpty()) {
            return right;
        }
        return ImmutableList.<T>builderWithExpectedSize(left.size() + right.size())
                            .addAll(left)
                            .addAll(right)
                            .build();
    }

    /**
     * Accumulates children and derives {@code freeCount} and {@code locallyFree} from them.
     */
    public static final class Builder {
        private final ImmutableList.Builder<Send> sends = ImmutableList.builder();
        private final ImmutableList.Builder<Receive> receives = ImmutableList.builder();
        private final ImmutableList.Builder<New> news = ImmutableList.builder();
        private final ImmutableList.Builder<Expr> exprs = ImmutableList.builder();
        private final ImmutableList.Builder<Match> matches = ImmutableList.builder();
        private final ImmutableList.Builder<Eval> evals = ImmutableList.builder();
        private final ImmutableList.Builder<GPrivate> ids = ImmutableList.builder();
        private int freeCount;
        private BitIndexSet locallyFree = BitIndexSet.empty();

        private Builder() {}

        public Builder add(Send send) {
            sends.add(send);
            return account(send.freeCount(), send.locallyFree());
        }

        public Builder add(Receive receive) {
            receives.add(receive);
            return account(receive.freeCount(), receive.locallyFree());
        }

        public Builder add(New scope) {
            news.add(scope);
            return account(0, scope.locallyFree());
        }

        public Builder add(Expr expr) {
            exprs.add(expr);
            return account(expr.freeCount(), expr.locallyFree());
        }

        public Builder add(Match match) {
            matches.add(match);
            return account(match.freeCount(), match.locallyFree());
        }

        public Builder add(Eval eval) {
            evals.add(eval);
            return account(eval.freeCount(), eval.locallyFree());
        }

        public Builder add(GPrivate id) {
            ids.add(id);
            return this;
        }

        public Term build() {
            return new Term(sends.build(),
                            receives.build(),
                            news.build(),
                            exprs.build(),
                            matches.build(),
                            evals.build(),
                            ids.build(),
                            freeCount,
                            locallyFree);
        }

        private Builder account(int childFreeCount, BitIndexSet childLocallyFree) {
            freeCount += childFreeCount;
            locallyFree = locallyFree.union(childLocallyFree);
            return this;
        }
    }
}
