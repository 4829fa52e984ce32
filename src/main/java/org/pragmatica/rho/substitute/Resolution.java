package org.pragmatica.rho.substitute;

import org.pragmatica.rho.tree.Term;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of resolving a reference against an environment - either the reference survives or a value replaces it.
 * Both outcomes are ordinary results; an absent binding is not an error.
 */
public sealed interface Resolution<T> {

    boolean isResolved();

    /**
     * Apply {@code unresolved} to the surviving reference or {@code resolved} to the substituted value.
     */
    <R> R fold(Function<? super T, ? extends R> unresolved, Function<? super Term, ? extends R> resolved);

    static <T> Resolution<T> unresolved(T node) {
        return new Unresolved<>(node);
    }

    static <T> Resolution<T> resolved(Term term) {
        return new Resolved<>(term);
    }

    /**
     * Reference still free at this depth, kept with its original index.
     */
    record Unresolved<T>(T node) implements Resolution<T> {
        public Unresolved {
            Objects.requireNonNull(node, "node");
        }

        @Override
        public boolean isResolved() {
            return false;
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> unresolved, Function<? super Term, ? extends R> resolved) {
            return unresolved.apply(node);
        }
    }

    /**
     * Reference replaced by a value from the environment. The caller splices it into place.
     */
    record Resolved<T>(Term term) implements Resolution<T> {
        public Resolved {
            Objects.requireNonNull(term, "term");
        }

        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public <R> R fold(Function<? super T, ? extends R> unresolved, Function<? super Term, ? extends R> resolved) {
            return resolved.apply(term);
        }
    }
}
