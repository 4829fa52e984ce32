package org.pragmatica.rho.tree;

import java.util.Objects;

/**
 * {@code pattern => body}. The body is scoped under the pattern's free variables.
 */
public record MatchCase(Term pattern, Term body) {
    public MatchCase {
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(body, "body");
    }

    public static MatchCase of(Term pattern, Term body) {
        return new MatchCase(pattern, body);
    }

    public int bindCount() {
        return pattern.freeCount();
    }
}
