package org.pragmatica.rho.substitute;

import org.pragmatica.rho.env.Environment;
import org.pragmatica.rho.tree.Channel;
import org.pragmatica.rho.tree.Eval;
import org.pragmatica.rho.tree.Expr;
import org.pragmatica.rho.tree.Match;
import org.pragmatica.rho.tree.New;
import org.pragmatica.rho.tree.Receive;
import org.pragmatica.rho.tree.Send;
import org.pragmatica.rho.tree.Term;
import org.pragmatica.rho.tree.Var;

/**
 * Substitutes environment values for bound references and returns the canonical form of the result.
 *
 * <p>All operations are pure and deterministic. A variable other than a bound reference reaching
 * resolution aborts the call with {@link org.pragmatica.rho.error.SubstitutionException}.
 */
public interface Substituter {
    Term substitute(Term term, Environment env);

    Send substitute(Send send, Environment env);

    Receive substitute(Receive receive, Environment env);

    New substitute(New scope, Environment env);

    Match substitute(Match match, Environment env);

    Channel substitute(Channel channel, Environment env);

    Expr substitute(Expr expr, Environment env);

    Resolution<Var> resolve(Var var, Environment env);

    Resolution<Expr.EVar> resolve(Expr.EVar eVar, Environment env);

    Resolution<Eval> resolve(Eval eval, Environment env);
}
