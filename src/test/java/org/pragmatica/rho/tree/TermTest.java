package org.pragmatica.rho.tree;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Bookkeeping derived by the tree factories: free counts and locally-free sets.
 */
class TermTest {

    private static final Channel X = Channel.quote(Term.string("x"));

    @Test
    void empty_hasNoProcesses() {
        assertTrue(Term.EMPTY.isEmpty());
        assertEquals(0, Term.EMPTY.freeCount());
        assertTrue(Term.EMPTY.locallyFree().isEmpty());
    }

    @Test
    void bound_recordsItsIndex() {
        var term = Term.bound(2);

        assertEquals(BitIndexSet.of(2), term.locallyFree());
        assertEquals(0, term.freeCount());
    }

    @Test
    void freeVariable_countsAsFreeSlot() {
        var pattern = Term.of(Expr.var(Var.free(0)));

        assertEquals(1, pattern.freeCount());
        assertTrue(pattern.locallyFree().isEmpty());
    }

    @Test
    void builder_unionsChildren() {
        var term = Term.builder()
                       .add(Send.of(Channel.bound(1), Term.bound(3)))
                       .add(Expr.bound(0))
                       .add(Eval.of(Channel.bound(4)))
                       .build();

        assertEquals(BitIndexSet.of(0, 1, 3, 4), term.locallyFree());
        assertThat(term.sends()).hasSize(1);
        assertThat(term.exprs()).hasSize(1);
        assertThat(term.evals()).hasSize(1);
    }

    @Test
    void newScope_shiftsBodyReferencesPastItsBinders() {
        var scope = New.of(2, Term.builder()
                                  .add(Expr.bound(0))
                                  .add(Expr.bound(3))
                                  .build());

        assertEquals(BitIndexSet.of(1), scope.locallyFree());
        assertEquals(BitIndexSet.of(1), Term.of(scope).locallyFree());
    }

    @Test
    void receive_sourceIsOuterAndBodyIsShifted() {
        var bind = ReceiveBind.of(Channel.bound(4), Channel.var(Var.free(0)));
        var body = Term.builder()
                       .add(Expr.bound(0))
                       .add(Expr.bound(2))
                       .build();

        var receive = Receive.of(bind, body);

        assertEquals(1, receive.bindCount());
        assertEquals(BitIndexSet.of(1, 4), receive.locallyFree());
        assertFalse(receive.persistent());
    }

    @Test
    void receive_bindCountSumsAllClauses() {
        var first = ReceiveBind.of(X, Channel.var(Var.free(0)), Channel.var(Var.free(1)));
        var second = ReceiveBind.of(X, Channel.var(Var.free(0)));

        var receive = Receive.of(List.of(first, second), Term.bound(2), true);

        assertEquals(3, receive.bindCount());
        assertTrue(receive.locallyFree().isEmpty());
        assertTrue(receive.persistent());
    }

    @Test
    void receive_withoutBinds_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Receive.of(List.of(), Term.EMPTY, false));
    }

    @Test
    void match_caseBodiesShiftedByPatternFreeCount() {
        var match = Match.of(Term.bound(0),
                             MatchCase.of(Term.of(Expr.var(Var.free(0))), Term.bound(1)),
                             MatchCase.of(Term.integer(7), Term.bound(2)));

        assertEquals(BitIndexSet.of(0, 2), match.locallyFree());
        assertEquals(1, match.cases().get(0).bindCount());
        assertEquals(0, match.cases().get(1).bindCount());
    }

    @Test
    void merge_concatenatesChildrenAndCombinesBookkeeping() {
        var left = Term.builder()
                       .add(Send.of(X, Term.integer(1)))
                       .add(Expr.bound(0))
                       .build();
        var right = Term.builder()
                        .add(Send.of(X, Term.integer(2)))
                        .add(Expr.var(Var.free(0)))
                        .add(GPrivate.of("unforgeable"))
                        .build();

        var merged = left.merge(right);

        assertThat(merged.sends()).containsExactly(Send.of(X, Term.integer(1)), Send.of(X, Term.integer(2)));
        assertThat(merged.exprs()).containsExactly(Expr.bound(0), Expr.var(Var.free(0)));
        assertThat(merged.ids()).containsExactly(GPrivate.of("unforgeable"));
        assertEquals(1, merged.freeCount());
        assertEquals(BitIndexSet.of(0), merged.locallyFree());
    }

    @Test
    void merge_withEmpty_returnsSameTerm() {
        var term = Term.integer(3);

        assertSame(term, term.merge(Term.EMPTY));
    }

    @Test
    void hasWildcard_detectsDirectAndNestedWildcards() {
        var direct = Term.of(Expr.var(Var.wildcard()));
        var nested = Term.of(Expr.list(Term.integer(1), direct));

        assertTrue(direct.hasWildcard());
        assertTrue(nested.hasWildcard());
        assertFalse(Term.integer(1).hasWildcard());
        assertTrue(Term.of(Eval.of(Channel.var(Var.wildcard()))).hasWildcard());
    }

    @Test
    void collections_deriveBookkeepingFromElements() {
        var list = (Expr.EList) Expr.list(Term.bound(1), Term.of(Expr.var(Var.free(0))));
        var map = (Expr.EMap) Expr.map(KeyValuePair.of(Term.bound(2), Term.of(Expr.var(Var.wildcard()))));

        assertEquals(BitIndexSet.of(1), list.locallyFree());
        assertEquals(1, list.freeCount());
        assertFalse(list.wildcard());
        assertEquals(BitIndexSet.of(2), map.locallyFree());
        assertTrue(map.wildcard());
    }

    @Test
    void boundVar_negativeIndex_rejected() {
        assertThrows(IllegalArgumentException.class, () -> Var.bound(-1));
    }
}
