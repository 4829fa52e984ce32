package org.pragmatica.rho.canonical;

import org.junit.jupiter.api.Test;
import org.pragmatica.rho.tree.Channel;
import org.pragmatica.rho.tree.Expr;
import org.pragmatica.rho.tree.KeyValuePair;
import org.pragmatica.rho.tree.Send;
import org.pragmatica.rho.tree.Term;
import org.pragmatica.rho.tree.Var;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TermOrderingTest {

    private static final List<Expr> SAMPLES = List.of(
        Expr.bool(false),
        Expr.bool(true),
        Expr.integer(-1),
        Expr.integer(1),
        Expr.string("a"),
        Expr.uri("rho:io:stdout"),
        Expr.bound(0),
        Expr.var(Var.free(0)),
        Expr.var(Var.wildcard()),
        Expr.not(Term.bool(true)),
        Expr.plus(Term.integer(1), Term.integer(2)),
        Expr.eq(Term.integer(1), Term.integer(2)),
        Expr.list(Term.integer(1)),
        Expr.tuple(Term.integer(1)),
        Expr.set(Term.integer(1)),
        Expr.map(KeyValuePair.of(Term.integer(1), Term.EMPTY))
    );

    @Test
    void expr_variantRankDecidesBeforeValue() {
        assertTrue(TermOrdering.EXPR.compare(Expr.bool(true), Expr.integer(-100)) < 0);
        assertTrue(TermOrdering.EXPR.compare(Expr.integer(100), Expr.string("")) < 0);
        assertTrue(TermOrdering.EXPR.compare(Expr.string("z"), Expr.bound(0)) < 0);
        assertTrue(TermOrdering.EXPR.compare(Expr.list(), Expr.map()) < 0);
    }

    @Test
    void expr_sameVariantComparedByValue() {
        assertTrue(TermOrdering.EXPR.compare(Expr.integer(-1), Expr.integer(1)) < 0);
        assertTrue(TermOrdering.EXPR.compare(Expr.string("b"), Expr.string("a")) > 0);
        assertTrue(TermOrdering.EXPR.compare(Expr.bound(3), Expr.bound(1)) > 0);
    }

    @Test
    void var_boundBeforeFreeBeforeWildcard() {
        assertThat(TermOrdering.VAR.sortedCopy(List.of(Var.wildcard(), Var.free(0), Var.bound(5))))
            .containsExactly(Var.bound(5), Var.free(0), Var.wildcard());
    }

    @Test
    void channel_quoteBeforeVariable() {
        assertTrue(TermOrdering.CHANNEL.compare(Channel.quote(Term.EMPTY), Channel.bound(0)) < 0);
    }

    @Test
    void ordering_isConsistentWithEquals() {
        for (var left : SAMPLES) {
            for (var right : SAMPLES) {
                var comparison = TermOrdering.EXPR.compare(left, right);
                assertEquals(left.equals(right), comparison == 0, left + " vs " + right);
                assertEquals(Integer.signum(comparison), -Integer.signum(TermOrdering.EXPR.compare(right, left)));
            }
        }
    }

    @Test
    void ordering_isTransitiveOverSamples() {
        var sorted = TermOrdering.EXPR.sortedCopy(SAMPLES);

        assertTrue(TermOrdering.EXPR.isStrictlyOrdered(sorted));
    }

    @Test
    void term_comparesChildListsAndBookkeeping() {
        var send = Term.of(Send.of(Channel.quote(Term.EMPTY), Term.integer(1)));
        var sameSend = Term.of(Send.of(Channel.quote(Term.EMPTY), Term.integer(1)));
        var otherSend = Term.of(Send.of(Channel.quote(Term.EMPTY), Term.integer(2)));

        assertEquals(0, TermOrdering.TERM.compare(send, sameSend));
        assertTrue(TermOrdering.TERM.compare(send, otherSend) < 0);
        assertNotEquals(0, TermOrdering.TERM.compare(Term.bound(0), Term.bound(1)));
        assertNotEquals(0, TermOrdering.TERM.compare(Term.EMPTY, Term.integer(0)));
    }
}
