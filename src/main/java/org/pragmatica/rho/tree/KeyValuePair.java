package org.pragmatica.rho.tree;

import java.util.Objects;

public record KeyValuePair(Term key, Term value) {
    public KeyValuePair {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static KeyValuePair of(Term key, Term value) {
        return new KeyValuePair(key, value);
    }
}
