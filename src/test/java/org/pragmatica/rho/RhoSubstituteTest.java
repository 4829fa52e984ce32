package org.pragmatica.rho;

import org.junit.jupiter.api.Test;
import org.pragmatica.rho.canonical.Canonicalizer;
import org.pragmatica.rho.env.Environment;
import org.pragmatica.rho.substitute.SubstitutionConfig;
import org.pragmatica.rho.substitute.SubstitutionEngine;
import org.pragmatica.rho.tree.Channel;
import org.pragmatica.rho.tree.Expr;
import org.pragmatica.rho.tree.Send;
import org.pragmatica.rho.tree.Term;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RhoSubstituteTest {

    @Test
    void create_usesDefaultConfig() {
        var substituter = (SubstitutionEngine) RhoSubstitute.create();

        assertEquals(SubstitutionConfig.DEFAULT, substituter.config());
        assertSame(Canonicalizer.sorting(), substituter.config().canonicalizer());
        assertFalse(substituter.config().traceEnabled());
    }

    @Test
    void builder_appliesOptions() {
        var substituter = (SubstitutionEngine) RhoSubstitute.builder()
                                                            .canonicalizer(Canonicalizer.identity())
                                                            .trace(true)
                                                            .build();

        assertSame(Canonicalizer.identity(), substituter.config().canonicalizer());
        assertTrue(substituter.config().traceEnabled());
    }

    @Test
    void config_requiresCanonicalizer() {
        assertThrows(NullPointerException.class, () -> new SubstitutionConfig(null, false));
    }

    @Test
    void substitute_endToEnd() {
        var value = Term.of(Send.of(Channel.quote(Term.integer(0)), Term.integer(42)));
        var term = Term.builder()
                       .add(Expr.bound(0))
                       .add(Expr.string("done"))
                       .build();

        var result = RhoSubstitute.create()
                                  .substitute(term, Environment.of(value));

        assertThat(result.sends()).containsExactly(Send.of(Channel.quote(Term.integer(0)), Term.integer(42)));
        assertThat(result.exprs()).containsExactly(Expr.string("done"));
        assertTrue(result.locallyFree().isEmpty());
    }

    @Test
    void substitute_withTraceEnabled_sameResult() {
        var env = Environment.of(Term.integer(1));
        var traced = RhoSubstitute.builder()
                                  .trace(true)
                                  .build();

        assertEquals(RhoSubstitute.create().substitute(Term.bound(0), env), traced.substitute(Term.bound(0), env));
    }
}
