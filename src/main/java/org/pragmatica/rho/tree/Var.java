package org.pragmatica.rho.tree;

import com.google.common.base.Preconditions;

/**
 * Variable reference. Indices are de Bruijn levels counted outward: 0 is the innermost binder.
 */
public sealed interface Var {

    /**
     * Binders this variable references.
     */
    BitIndexSet locallyFree();

    /**
     * Free-variable slots this variable opens (only meaningful inside patterns).
     */
    int freeCount();

    static Var bound(int index) {
        return new BoundVar(index);
    }

    static Var free(int index) {
        return new FreeVar(index);
    }

    static Var wildcard() {
        return Wildcard.INSTANCE;
    }

    /**
     * Reference to an enclosing binder. The only kind substitution accepts.
     */
    record BoundVar(int index) implements Var {
        public BoundVar {
            Preconditions.checkArgument(index >= 0, "Negative de Bruijn index %s", index);
        }

        @Override
        public BitIndexSet locallyFree() {
            return BitIndexSet.of(index);
        }

        @Override
        public int freeCount() {
            return 0;
        }

        @Override
        public String toString() {
            return "_" + index;
        }
    }

    /**
     * Pattern variable that has not been bound yet.
     */
    record FreeVar(int index) implements Var {
        public FreeVar {
            Preconditions.checkArgument(index >= 0, "Negative free variable index %s", index);
        }

        @Override
        public BitIndexSet locallyFree() {
            return BitIndexSet.empty();
        }

        @Override
        public int freeCount() {
            return 1;
        }

        @Override
        public String toString() {
            return "?" + index;
        }
    }

    /**
     * Pattern wildcard {@code _}.
     */
    record Wildcard() implements Var {
        static final Wildcard INSTANCE = new Wildcard();

        @Override
        public BitIndexSet locallyFree() {
            return BitIndexSet.empty();
        }

        @Override
        public int freeCount() {
            return 0;
        }

        @Override
        public String toString() {
            return "_";
        }
    }
}
