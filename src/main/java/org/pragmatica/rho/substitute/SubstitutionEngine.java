package org.pragmatica.rho.substitute;

import com.google.common.collect.ImmutableList;
import org.pragmatica.rho.canonical.Canonicalizer;
import org.pragmatica.rho.env.Environment;
import org.pragmatica.rho.error.SubstitutionError;
import org.pragmatica.rho.tree.BitIndexSet;
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
import org.pragmatica.rho.tree.Var;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Substitution engine - rewrites a tree against an environment and canonicalizes every rebuilt node.
 *
 * <p>Binder-introducing nodes extend the environment before descending: a scope block and a receive body by
 * their bind count, a match case body by its pattern's free count. Bind sources and match targets stay in the
 * outer environment. Variables in process position that resolve to a value are spliced into the enclosing
 * parallel composition instead of being kept as leaves.
 *
 * <p>Stateless; one instance may be shared between threads.
 */
public final class SubstitutionEngine implements Substituter {
    private static final Logger log = LoggerFactory.getLogger(SubstitutionEngine.class);

    private final SubstitutionConfig config;
    private final Canonicalizer canonicalizer;

    private SubstitutionEngine(SubstitutionConfig config) {
        this.config = config;
        this.canonicalizer = config.canonicalizer();
    }

    public static SubstitutionEngine create(SubstitutionConfig config) {
        return new SubstitutionEngine(config);
    }

    public SubstitutionConfig config() {
        return config;
    }

    // === Reference resolution ===

    @Override
    public Resolution<Var> resolve(Var var, Environment env) {
        if (var instanceof Var.BoundVar bound) {
            return env.get(bound.index())
                      .<Resolution<Var>>map(Resolution::resolved)
                      .orElseGet(() -> Resolution.unresolved(bound));
        }
        var error = new SubstitutionError.IllegalSubstitution(var);
        log.error("Aborting substitution: {}", error.message());
        throw error.toException();
    }

    @Override
    public Resolution<Expr.EVar> resolve(Expr.EVar eVar, Environment env) {
        return resolve(eVar.v(), env).fold(v -> Resolution.unresolved(new Expr.EVar(v)),
                                           Resolution::resolved);
    }

    @Override
    public Resolution<Eval> resolve(Eval eval, Environment env) {
        if (eval.channel() instanceof Channel.Quote quote) {
            return Resolution.resolved(substitute(quote.term(), env));
        }
        var chanVar = (Channel.ChanVar) eval.channel();
        return resolve(chanVar.var(), env).fold(v -> Resolution.unresolved(Eval.of(Channel.var(v))),
                                                Resolution::resolved);
    }

    @Override
    public Channel substitute(Channel channel, Environment env) {
        if (channel instanceof Channel.Quote quote) {
            return canonicalizer.canonicalize(Channel.quote(substitute(quote.term(), env)));
        }
        var chanVar = (Channel.ChanVar) channel;
        Channel substituted = resolve(chanVar.var(), env).fold(Channel::var, Channel::quote);
        return canonicalizer.canonicalize(substituted);
    }

    // === Processes ===

    @Override
    public Term substitute(Term term, Environment env) {
        if (config.traceEnabled() && log.isTraceEnabled()) {
            log.trace("Substituting term (level {}, shift {}): {}", env.level(), env.currentShift(), term);
        }
        var exprs = ImmutableList.<Expr>builder();
        var evals = ImmutableList.<Eval>builder();
        var keptFree = BitIndexSet.empty();
        var spliced = new ArrayList<Term>();

        for (var expr : term.exprs()) {
            if (expr instanceof Expr.EVar eVar) {
                var resolution = resolve(eVar, env);
                if (resolution instanceof Resolution.Unresolved<Expr.EVar> unresolved) {
                    exprs.add(unresolved.node());
                    keptFree = keptFree.union(unresolved.node().locallyFree());
                } else {
                    spliced.add(((Resolution.Resolved<Expr.EVar>) resolution).term());
                }
            } else {
                var substituted = substitute(expr, env);
                exprs.add(substituted);
                keptFree = keptFree.union(substituted.locallyFree());
            }
        }

        for (var eval : term.evals()) {
            var resolution = resolve(eval, env);
            if (resolution instanceof Resolution.Unresolved<Eval> unresolved) {
                evals.add(unresolved.node());
                keptFree = keptFree.union(unresolved.node().locallyFree());
            } else {
                spliced.add(((Resolution.Resolved<Eval>) resolution).term());
            }
        }

        var rebuilt = new Term(map(term.sends(), send -> substitute(send, env)),
                               map(term.receives(), receive -> substitute(receive, env)),
                               map(term.news(), scope -> substitute(scope, env)),
                               exprs.build(),
                               map(term.matches(), match -> substitute(match, env)),
                               evals.build(),
                               term.ids(),
                               term.freeCount(),
                               term.locallyFree()
                                   .until(env.currentShift())
                                   .union(keptFree));
        for (var value : spliced) {
            rebuilt = rebuilt.merge(value);
        }
        return canonicalizer.canonicalize(rebuilt);
    }

    @Override
    public Send substitute(Send send, Environment env) {
        return canonicalizer.canonicalize(new Send(substitute(send.chan(), env),
                                                   map(send.data(), datum -> substitute(datum, env)),
                                                   send.persistent(),
                                                   send.freeCount(),
                                                   send.locallyFree().until(env.currentShift())));
    }

    @Override
    public Receive substitute(Receive receive, Environment env) {
        var binds = map(receive.binds(),
                        bind -> new ReceiveBind(bind.patterns(), substitute(bind.source(), env), bind.freeCount()));
        return canonicalizer.canonicalize(new Receive(binds,
                                                      substitute(receive.body(), env.shift(receive.bindCount())),
                                                      receive.persistent(),
                                                      receive.bindCount(),
                                                      receive.freeCount(),
                                                      receive.locallyFree().until(env.currentShift())));
    }

    @Override
    public New substitute(New scope, Environment env) {
        return canonicalizer.canonicalize(new New(scope.bindCount(),
                                                  substitute(scope.body(), env.shift(scope.bindCount())),
                                                  scope.locallyFree().until(env.currentShift())));
    }

    @Override
    public Match substitute(Match match, Environment env) {
        var cases = map(match.cases(),
                        matchCase -> MatchCase.of(matchCase.pattern(),
                                                  substitute(matchCase.body(), env.shift(matchCase.bindCount()))));
        return canonicalizer.canonicalize(new Match(substitute(match.target(), env),
                                                    cases,
                                                    match.freeCount(),
                                                    match.locallyFree().until(env.currentShift())));
    }

    // === Expressions ===

    @Override
    public Expr substitute(Expr expr, Environment env) {
        if (expr instanceof Expr.EUnary unary) {
            return canonicalizer.canonicalize(new Expr.EUnary(unary.op(), substitute(unary.operand(), env)));
        }
        if (expr instanceof Expr.EBinary binary) {
            return canonicalizer.canonicalize(new Expr.EBinary(binary.op(),
                                                               substitute(binary.left(), env),
                                                               substitute(binary.right(), env)));
        }
        if (expr instanceof Expr.EList list) {
            return canonicalizer.canonicalize(new Expr.EList(substituteAll(list.elements(), env),
                                                             list.freeCount(),
                                                             list.locallyFree().until(env.currentShift()),
                                                             list.wildcard()));
        }
        if (expr instanceof Expr.ETuple tuple) {
            return canonicalizer.canonicalize(new Expr.ETuple(substituteAll(tuple.elements(), env),
                                                              tuple.freeCount(),
                                                              tuple.locallyFree().until(env.currentShift()),
                                                              tuple.wildcard()));
        }
        if (expr instanceof Expr.ESet set) {
            return canonicalizer.canonicalize(new Expr.ESet(substituteAll(set.elements(), env),
                                                            set.freeCount(),
                                                            set.locallyFree().until(env.currentShift()),
                                                            set.wildcard()));
        }
        if (expr instanceof Expr.EMap eMap) {
            var entries = map(eMap.entries(),
                              entry -> KeyValuePair.of(substitute(entry.key(), env), substitute(entry.value(), env)));
            return canonicalizer.canonicalize(new Expr.EMap(entries,
                                                            eMap.freeCount(),
                                                            eMap.locallyFree().until(env.currentShift()),
                                                            eMap.wildcard()));
        }
        // Ground values and variables outside process position
        return expr;
    }

    private ImmutableList<Term> substituteAll(List<Term> terms, Environment env) {
        return map(terms, term -> substitute(term, env));
    }

    private static <T, R> ImmutableList<R> map(List<T> items, Function<? super T, ? extends R> mapper) {
        var result = ImmutableList.<R>builderWithExpectedSize(items.size());
        for (var item : items) {
            result.add(mapper.apply(item));
        }
        return result.build();
    }
}
