package org.pragmatica.rho.canonical;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.Ordering;
import org.pragmatica.rho.tree.BitIndexSet;
import org.pragmatica.rho.tree.Channel;
import org.pragmatica.rho.tree.Eval;
import org.pragmatica.rho.tree.Expr;
import org.pragmatica.rho.tree.GPrivate;
import org.pragmatica.rho.tree.KeyValuePair;
import org.pragmatica.rho.tree.Match;
import org.pragmatica.rho.tree.MatchCase;
import org.pragmatica.rho.tree.New;
import org.pragmatica.rho.tree.Receive;
import org.pragmatica.rho.tree.ReceiveBind;
import org.pragmatica.rho.tree.Send;
import org.pragmatica.rho.tree.Term;
import org.pragmatica.rho.tree.Var;

/**
 * Total orderings over every node kind, consistent with {@code equals}.
 *
 * <p>Nodes of different variants compare by variant rank; nodes of the same variant compare field by field
 * in declaration order, child sequences lexicographically.
 */
public final class TermOrdering {
    public static final Ordering<Term> TERM = Ordering.from(TermOrdering::compareTerms);
    public static final Ordering<Send> SEND = Ordering.from(TermOrdering::compareSends);
    public static final Ordering<Receive> RECEIVE = Ordering.from(TermOrdering::compareReceives);
    public static final Ordering<New> NEW = Ordering.from(TermOrdering::compareNews);
    public static final Ordering<Match> MATCH = Ordering.from(TermOrdering::compareMatches);
    public static final Ordering<Expr> EXPR = Ordering.from(TermOrdering::compareExprs);
    public static final Ordering<Eval> EVAL = Ordering.from(TermOrdering::compareEvals);
    public static final Ordering<Channel> CHANNEL = Ordering.from(TermOrdering::compareChannels);
    public static final Ordering<Var> VAR = Ordering.from(TermOrdering::compareVars);
    public static final Ordering<GPrivate> ID = Ordering.<String>natural().onResultOf(GPrivate::id);
    public static final Ordering<KeyValuePair> KEY_VALUE = Ordering.from(TermOrdering::compareKeyValues);

    private static final Ordering<Iterable<Term>> TERMS = TERM.lexicographical();
    private static final Ordering<Iterable<Send>> SENDS = SEND.lexicographical();
    private static final Ordering<Iterable<Receive>> RECEIVES = RECEIVE.lexicographical();
    private static final Ordering<Iterable<New>> NEWS = NEW.lexicographical();
    private static final Ordering<Iterable<Match>> MATCHES = MATCH.lexicographical();
    private static final Ordering<Iterable<Expr>> EXPRS = EXPR.lexicographical();
    private static final Ordering<Iterable<Eval>> EVALS = EVAL.lexicographical();
    private static final Ordering<Iterable<Channel>> CHANNELS = CHANNEL.lexicographical();
    private static final Ordering<Iterable<GPrivate>> IDS = ID.lexicographical();
    private static final Ordering<Iterable<KeyValuePair>> KEY_VALUES = KEY_VALUE.lexicographical();
    private static final Ordering<Iterable<ReceiveBind>> BINDS = Ordering.from(TermOrdering::compareBinds)
                                                                         .lexicographical();
    private static final Ordering<Iterable<MatchCase>> CASES = Ordering.from(TermOrdering::compareCases)
                                                                       .lexicographical();

    private TermOrdering() {}

    private static int compareTerms(Term left, Term right) {
        if (left == right) {
            return 0;
        }
        return ComparisonChain.start()
                              .compare(left.sends(), right.sends(), SENDS)
                              .compare(left.receives(), right.receives(), RECEIVES)
                              .compare(left.news(), right.news(), NEWS)
                              .compare(left.exprs(), right.exprs(), EXPRS)
                              .compare(left.matches(), right.matches(), MATCHES)
                              .compare(left.evals(), right.evals(), EVALS)
                              .compare(left.ids(), right.ids(), IDS)
                              .compare(left.freeCount(), right.freeCount())
                              .compare(left.locallyFree(), right.locallyFree())
                              .result();
    }

    private static int compareSends(Send left, Send right) {
        return ComparisonChain.start()
                              .compare(left.chan(), right.chan(), CHANNEL)
                              .compare(left.data(), right.data(), TERMS)
                              .compareFalseFirst(left.persistent(), right.persistent())
                              .compare(left.freeCount(), right.freeCount())
                              .compare(left.locallyFree(), right.locallyFree())
                              .result();
    }

    private static int compareReceives(Receive left, Receive right) {
        return ComparisonChain.start()
                              .compare(left.binds(), right.binds(), BINDS)
                              .compare(left.body(), right.body(), TERM)
                              .compareFalseFirst(left.persistent(), right.persistent())
                              .compare(left.bindCount(), right.bindCount())
                              .compare(left.freeCount(), right.freeCount())
                              .compare(left.locallyFree(), right.locallyFree())
                              .result();
    }

    private static int compareBinds(ReceiveBind left, ReceiveBind right) {
        return ComparisonChain.start()
                              .compare(left.patterns(), right.patterns(), CHANNELS)
                              .compare(left.source(), right.source(), CHANNEL)
                              .compare(left.freeCount(), right.freeCount())
                              .result();
    }

    private static int compareNews(New left, New right) {
        return ComparisonChain.start()
                              .compare(left.bindCount(), right.bindCount())
                              .compare(left.body(), right.body(), TERM)
                              .compare(left.locallyFree(), right.locallyFree())
                              .result();
    }

    private static int compareMatches(Match left, Match right) {
        return ComparisonChain.start()
                              .compare(left.target(), right.target(), TERM)
                              .compare(left.cases(), right.cases(), CASES)
                              .compare(left.freeCount(), right.freeCount())
                              .compare(left.locallyFree(), right.locallyFree())
                              .result();
    }

    private static int compareCases(MatchCase left, MatchCase right) {
        return ComparisonChain.start()
                              .compare(left.pattern(), right.pattern(), TERM)
                              .compare(left.body(), right.body(), TERM)
                              .result();
    }

    private static int compareKeyValues(KeyValuePair left, KeyValuePair right) {
        return ComparisonChain.start()
                              .compare(left.key(), right.key(), TERM)
                              .compare(left.value(), right.value(), TERM)
                              .result();
    }

    private static int compareEvals(Eval left, Eval right) {
        return compareChannels(left.channel(), right.channel());
    }

    private static int compareChannels(Channel left, Channel right) {
        var byRank = Integer.compare(rank(left), rank(right));
        if (byRank != 0) {
            return byRank;
        }
        if (left instanceof Channel.Quote quote) {
            return TERM.compare(quote.term(), ((Channel.Quote) right).term());
        }
        return VAR.compare(((Channel.ChanVar) left).var(), ((Channel.ChanVar) right).var());
    }

    private static int compareVars(Var left, Var right) {
        var byRank = Integer.compare(rank(left), rank(right));
        if (byRank != 0) {
            return byRank;
        }
        if (left instanceof Var.BoundVar bound) {
            return Integer.compare(bound.index(), ((Var.BoundVar) right).index());
        }
        if (left instanceof Var.FreeVar free) {
            return Integer.compare(free.index(), ((Var.FreeVar) right).index());
        }
        return 0;
    }

    private static int compareExprs(Expr left, Expr right) {
        var byRank = Integer.compare(rank(left), rank(right));
        if (byRank != 0) {
            return byRank;
        }
        if (left instanceof Expr.GBool bool) {
            return Boolean.compare(bool.value(), ((Expr.GBool) right).value());
        }
        if (left instanceof Expr.GInt integer) {
            return Long.compare(integer.value(), ((Expr.GInt) right).value());
        }
        if (left instanceof Expr.GString string) {
            return string.value().compareTo(((Expr.GString) right).value());
        }
        if (left instanceof Expr.GUri uri) {
            return uri.value().compareTo(((Expr.GUri) right).value());
        }
        if (left instanceof Expr.EVar eVar) {
            return VAR.compare(eVar.v(), ((Expr.EVar) right).v());
        }
        if (left instanceof Expr.EUnary unary) {
            var other = (Expr.EUnary) right;
            return ComparisonChain.start()
                                  .compare(unary.op(), other.op())
                                  .compare(unary.operand(), other.operand(), TERM)
                                  .result();
        }
        if (left instanceof Expr.EBinary binary) {
            var other = (Expr.EBinary) right;
            return ComparisonChain.start()
                                  .compare(binary.op(), other.op())
                                  .compare(binary.left(), other.left(), TERM)
                                  .compare(binary.right(), other.right(), TERM)
                                  .result();
        }
        if (left instanceof Expr.EList list) {
            var other = (Expr.EList) right;
            return compareCollections(list.elements(), other.elements(), list.freeCount(), other.freeCount(),
                                      list.locallyFree(), other.locallyFree(),
                                      list.wildcard(), other.wildcard());
        }
        if (left instanceof Expr.ETuple tuple) {
            var other = (Expr.ETuple) right;
            return compareCollections(tuple.elements(), other.elements(), tuple.freeCount(), other.freeCount(),
                                      tuple.locallyFree(), other.locallyFree(),
                                      tuple.wildcard(), other.wildcard());
        }
        if (left instanceof Expr.ESet set) {
            var other = (Expr.ESet) right;
            return compareCollections(set.elements(), other.elements(), set.freeCount(), other.freeCount(),
                                      set.locallyFree(), other.locallyFree(),
                                      set.wildcard(), other.wildcard());
        }
        var map = (Expr.EMap) left;
        var other = (Expr.EMap) right;
        return ComparisonChain.start()
                              .compare(map.entries(), other.entries(), KEY_VALUES)
                              .compare(map.freeCount(), other.freeCount())
                              .compare(map.locallyFree(), other.locallyFree())
                              .compareFalseFirst(map.wildcard(), other.wildcard())
                              .result();
    }

    private static int compareCollections(Iterable<Term> left, Iterable<Term> right,
                                          int leftFree, int rightFree,
                                          BitIndexSet leftLocallyFree, BitIndexSet rightLocallyFree,
                                          boolean leftWildcard, boolean rightWildcard) {
        return ComparisonChain.start()
                              .compare(left, right, TERMS)
                              .compare(leftFree, rightFree)
                              .compare(leftLocallyFree, rightLocallyFree)
                              .compareFalseFirst(leftWildcard, rightWildcard)
                              .result();
    }

    private static int rank(Channel channel) {
        return channel instanceof Channel.Quote ? 0 : 1;
    }

    private static int rank(Var var) {
        if (var instanceof Var.BoundVar) {
            return 0;
        }
        if (var instanceof Var.FreeVar) {
            return 1;
        }
        return 2;
    }

    private static int rank(Expr expr) {
        if (expr instanceof Expr.GBool) {
            return 0;
        }
        if (expr instanceof Expr.GInt) {
            return 1;
        }
        if (expr instanceof Expr.GString) {
            return 2;
        }
        if (expr instanceof Expr.GUri) {
            return 3;
        }
        if (expr instanceof Expr.EVar) {
            return 4;
        }
        if (expr instanceof Expr.EUnary) {
            return 5;
        }
        if (expr instanceof Expr.EBinary) {
            return 6;
        }
        if (expr instanceof Expr.EList) {
            return 7;
        }
        if (expr instanceof Expr.ETuple) {
            return 8;
        }
        if (expr instanceof Expr.ESet) {
            return 9;
        }
        if (expr instanceof Expr.EMap) {
            return 10;
        }
        throw new IllegalStateException("Unknown expression kind: " + expr.getClass().getName());
    }
}
