package org.pragmatica.rho.error;

import org.pragmatica.rho.tree.Var;

import java.util.Objects;

/**
 * Contract violations detected during substitution.
 * Substitution assumes a fully elaborated tree, so every variant is fatal.
 */
public sealed interface SubstitutionError {
    String message();

    /**
     * A variable other than a bound reference reached the resolver.
     */
    record IllegalSubstitution(Var variable) implements SubstitutionError {
        public IllegalSubstitution {
            Objects.requireNonNull(variable, "variable");
        }

        @Override
        public String message() {
            return "Illegal Substitution [" + variable + "]: only bound variables can be substituted";
        }
    }

    /**
     * Abort the current substitution with this error.
     */
    default SubstitutionException toException() {
        return new SubstitutionException(this);
    }
}
