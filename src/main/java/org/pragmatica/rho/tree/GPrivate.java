package org.pragmatica.rho.tree;

import java.util.Objects;

/**
 * Unforgeable name. Ground, never substituted.
 */
public record GPrivate(String id) {
    public GPrivate {
        Objects.requireNonNull(id, "id");
    }

    public static GPrivate of(String id) {
        return new GPrivate(id);
    }
}
