package org.pragmatica.rho.tree;

import java.util.Objects;

/**
 * Channel position of sends, receive sources and dereferences.
 */
public sealed interface Channel {

    BitIndexSet locallyFree();

    int freeCount();

    static Channel quote(Term term) {
        return new Quote(term);
    }

    static Channel var(Var var) {
        return new ChanVar(var);
    }

    static Channel bound(int index) {
        return new ChanVar(Var.bound(index));
    }

    /**
     * Process used as a name: {@code @P}.
     */
    record Quote(Term term) implements Channel {
        public Quote {
            Objects.requireNonNull(term, "term");
        }

        @Override
        public BitIndexSet locallyFree() {
            return term.locallyFree();
        }

        @Override
        public int freeCount() {
            return term.freeCount();
        }
    }

    /**
     * Name held in a variable.
     */
    record ChanVar(Var var) implements Channel {
        public ChanVar {
            Objects.requireNonNull(var, "var");
        }

        @Override
        public BitIndexSet locallyFree() {
            return var.locallyFree();
        }

        @Override
        public int freeCount() {
            return var.freeCount();
        }
    }
}
