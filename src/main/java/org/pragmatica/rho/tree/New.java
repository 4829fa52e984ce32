package org.pragmatica.rho.tree;

import com.google.common.base.Preconditions;

import java.util.Objects;

/**
 * Scope block {@code new x1, ..., xn in { body }}. Introduces {@code bindCount} fresh names for its body.
 */
public record New(int bindCount, Term body, BitIndexSet locallyFree) {
    public New {
        Preconditions.checkArgument(bindCount >= 0, "Negative bind count %s", bindCount);
        Objects.requireNonNull(body, "body");
        Objects.requireNonNull(locallyFree, "locallyFree");
    }

    public static New of(int bindCount, Term body) {
        return new New(bindCount, body, body.locallyFree().shiftDown(bindCount));
    }
}
