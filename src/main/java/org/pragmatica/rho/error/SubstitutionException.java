package org.pragmatica.rho.error;

import java.util.Objects;

/**
 * Fatal abort of a substitution call. Signals a bug in the stage that produced the tree; never retried.
 */
public final class SubstitutionException extends RuntimeException {
    private final SubstitutionError error;

    public SubstitutionException(SubstitutionError error) {
        super(Objects.requireNonNull(error, "error").message());
        this.error = error;
    }

    public SubstitutionError error() {
        return error;
    }
}
