package org.pragmatica.rho.canonical;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import org.pragmatica.rho.tree.Channel;
import org.pragmatica.rho.tree.Eval;
import org.pragmatica.rho.tree.Expr;
import org.pragmatica.rho.tree.KeyValuePair;
import org.pragmatica.rho.tree.Match;
import org.pragmatica.rho.tree.MatchCase;
import org.pragmatica.rho.tree.New;
import org.pragmatica.rho.tree.Receive;
import org.pragmatica.rho.tree.ReceiveBind;
import org.pragmatica.rho.tree.Send;
import org.pragmatica.rho.tree.Term;

import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;
import java.util.function.UnaryOperator;

/**
 * Canonicalizer that sorts the order-independent collections of a node by {@link TermOrdering}.
 *
 * <p>Parallel composition is commutative, so every child list of a {@link Term} is sorted. Set literals are
 * sorted and deduplicated; map literals are sorted by key, the last entry winning on duplicate keys. Send data,
 * receive binds (their order fixes de Bruijn positions in the body), match cases and ordered collections keep
 * their order.
 */
public final class SortingCanonicalizer implements Canonicalizer {
    static final SortingCanonicalizer INSTANCE = new SortingCanonicalizer();

    private SortingCanonicalizer() {}

    public static SortingCanonicalizer instance() {
        return INSTANCE;
    }

    @Override
    public Term canonicalize(Term term) {
        return new Term(sorted(term.sends(), TermOrdering.SEND),
                        sorted(term.receives(), TermOrdering.RECEIVE),
                        sorted(term.news(), TermOrdering.NEW),
                        sorted(term.exprs(), TermOrdering.EXPR),
                        sorted(term.matches(), TermOrdering.MATCH),
                        sorted(term.evals(), TermOrdering.EVAL),
                        sorted(term.ids(), TermOrdering.ID),
                        term.freeCount(),
                        term.locallyFree());
    }

    @Override
    public Send canonicalize(Send send) {
        return send;
    }

    @Override
    public Receive canonicalize(Receive receive) {
        return receive;
    }

    @Override
    public New canonicalize(New scope) {
        return scope;
    }

    @Override
    public Match canonicalize(Match match) {
        return match;
    }

    @Override
    public Expr canonicalize(Expr expr) {
        if (expr instanceof Expr.ESet set) {
            var distinct = ImmutableSortedSet.copyOf(TermOrdering.TERM, set.elements())
                                             .asList();
            if (distinct.equals(set.elements())) {
                return set;
            }
            return new Expr.ESet(distinct, set.freeCount(), set.locallyFree(), set.wildcard());
        }
        if (expr instanceof Expr.EMap map) {
            var byKey = new TreeMap<Term, Term>(TermOrdering.TERM);
            for (var entry : map.entries()) {
                byKey.put(entry.key(), entry.value());
            }
            var entries = byKey.entrySet()
                               .stream()
                               .map(entry -> KeyValuePair.of(entry.getKey(), entry.getValue()))
                               .collect(ImmutableList.toImmutableList());
            if (entries.equals(map.entries())) {
                return map;
            }
            return new Expr.EMap(entries, map.freeCount(), map.locallyFree(), map.wildcard());
        }
        return expr;
    }

    @Override
    public Channel canonicalize(Channel channel) {
        return channel;
    }

    /**
     * Canonicalize a whole tree bottom-up. For trees built by hand rather than produced by substitution.
     */
    public Term canonicalizeDeep(Term term) {
        return canonicalize(new Term(map(term.sends(), this::deep),
                                     map(term.receives(), this::deep),
                                     map(term.news(), this::deep),
                                     map(term.exprs(), this::deep),
                                     map(term.matches(), this::deep),
                                     map(term.evals(), this::deep),
                                     term.ids(),
                                     term.freeCount(),
                                     term.locallyFree()));
    }

    private Send deep(Send send) {
        return canonicalize(new Send(deep(send.chan()),
                                     map(send.data(), this::canonicalizeDeep),
                                     send.persistent(),
                                     send.freeCount(),
                                     send.locallyFree()));
    }

    private Receive deep(Receive receive) {
        var binds = map(receive.binds(),
                        bind -> new ReceiveBind(map(bind.patterns(), this::deep), deep(bind.source()), bind.freeCount()));
        return canonicalize(new Receive(binds,
                                        canonicalizeDeep(receive.body()),
                                        receive.persistent(),
                                        receive.bindCount(),
                                        receive.freeCount(),
                                        receive.locallyFree()));
    }

    private New deep(New scope) {
        return canonicalize(new New(scope.bindCount(), canonicalizeDeep(scope.body()), scope.locallyFree()));
    }

    private Match deep(Match match) {
        var cases = map(match.cases(),
                        matchCase -> MatchCase.of(canonicalizeDeep(matchCase.pattern()), canonicalizeDeep(matchCase.body())));
        return canonicalize(new Match(canonicalizeDeep(match.target()), cases, match.freeCount(), match.locallyFree()));
    }

    private Eval deep(Eval eval) {
        return Eval.of(deep(eval.channel()));
    }

    private Channel deep(Channel channel) {
        if (channel instanceof Channel.Quote quote) {
            return canonicalize(Channel.quote(canonicalizeDeep(quote.term())));
        }
        return canonicalize(channel);
    }

    private Expr deep(Expr expr) {
        if (expr instanceof Expr.EUnary unary) {
            return canonicalize(new Expr.EUnary(unary.op(), canonicalizeDeep(unary.operand())));
        }
        if (expr instanceof Expr.EBinary binary) {
            return canonicalize(new Expr.EBinary(binary.op(),
                                                 canonicalizeDeep(binary.left()),
                                                 canonicalizeDeep(binary.right())));
        }
        if (expr instanceof Expr.EList list) {
            return canonicalize(new Expr.EList(map(list.elements(), this::canonicalizeDeep),
                                               list.freeCount(), list.locallyFree(), list.wildcard()));
        }
        if (expr instanceof Expr.ETuple tuple) {
            return canonicalize(new Expr.ETuple(map(tuple.elements(), this::canonicalizeDeep),
                                                tuple.freeCount(), tuple.locallyFree(), tuple.wildcard()));
        }
        if (expr instanceof Expr.ESet set) {
            return canonicalize(new Expr.ESet(map(set.elements(), this::canonicalizeDeep),
                                              set.freeCount(), set.locallyFree(), set.wildcard()));
        }
        if (expr instanceof Expr.EMap eMap) {
            var entries = map(eMap.entries(),
                              entry -> KeyValuePair.of(canonicalizeDeep(entry.key()), canonicalizeDeep(entry.value())));
            return canonicalize(new Expr.EMap(entries, eMap.freeCount(), eMap.locallyFree(), eMap.wildcard()));
        }
        return canonicalize(expr);
    }

    private static <T> ImmutableList<T> sorted(ImmutableList<T> items, Comparator<? super T> order) {
        if (items.size() < 2) {
            return items;
        }
        return ImmutableList.sortedCopyOf(order, items);
    }

    private static <T> ImmutableList<T> map(List<T> items, UnaryOperator<T> mapper) {
        return items.stream()
                    .map(mapper)
                    .collect(ImmutableList.toImmutableList());
    }
}
