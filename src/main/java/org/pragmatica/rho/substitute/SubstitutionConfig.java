package org.pragmatica.rho.substitute;

import org.pragmatica.rho.canonical.Canonicalizer;

import java.util.Objects;

/**
 * Substitution engine configuration options.
 */
public record SubstitutionConfig(
    Canonicalizer canonicalizer,
    boolean traceEnabled
) {
    public static final SubstitutionConfig DEFAULT = new SubstitutionConfig(
        Canonicalizer.sorting(),
        false
    );

    public SubstitutionConfig {
        Objects.requireNonNull(canonicalizer, "canonicalizer");
    }
}
