package org.pragmatica.rho;

import org.pragmatica.rho.canonical.Canonicalizer;
import org.pragmatica.rho.substitute.Substituter;
import org.pragmatica.rho.substitute.SubstitutionConfig;
import org.pragmatica.rho.substitute.SubstitutionEngine;

/**
 * Entry point for creating substituters.
 *
 * <p>Example usage:
 * <pre>{@code
 * var substituter = RhoSubstitute.create();
 *
 * var env = Environment.of(Term.of(Send.of(Channel.quote(Term.integer(0)), Term.integer(42))));
 * var result = substituter.substitute(Term.bound(0), env);
 * }</pre>
 */
public final class RhoSubstitute {
    private RhoSubstitute() {}

    /**
     * Create a substituter with the default sorting canonicalizer.
     */
    public static Substituter create() {
        return create(SubstitutionConfig.DEFAULT);
    }

    /**
     * Create a substituter with custom configuration.
     */
    public static Substituter create(SubstitutionConfig config) {
        return SubstitutionEngine.create(config);
    }

    /**
     * Create a builder for more complex configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private Canonicalizer canonicalizer = Canonicalizer.sorting();
        private boolean traceEnabled = false;

        private Builder() {}

        public Builder canonicalizer(Canonicalizer canonicalizer) {
            this.canonicalizer = canonicalizer;
            return this;
        }

        public Builder trace(boolean enabled) {
            this.traceEnabled = enabled;
            return this;
        }

        public Substituter build() {
            var config = new SubstitutionConfig(canonicalizer, traceEnabled);
            return create(config);
        }
    }
}
