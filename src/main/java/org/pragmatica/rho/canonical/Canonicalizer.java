package org.pragmatica.rho.canonical;

import org.pragmatica.rho.tree.Channel;
import org.pragmatica.rho.tree.Expr;
import org.pragmatica.rho.tree.Match;
import org.pragmatica.rho.tree.New;
import org.pragmatica.rho.tree.Receive;
import org.pragmatica.rho.tree.Send;
import org.pragmatica.rho.tree.Term;

/**
 * Produces the canonical representative of a freshly rebuilt node.
 *
 * <p>Implementations must be deterministic, total and idempotent. They may assume the node's
 * children are already canonical: the substitution engine calls them bottom-up on every node it rebuilds.
 */
public interface Canonicalizer {
    Term canonicalize(Term term);

    Send canonicalize(Send send);

    Receive canonicalize(Receive receive);

    New canonicalize(New scope);

    Match canonicalize(Match match);

    Expr canonicalize(Expr expr);

    Channel canonicalize(Channel channel);

    /**
     * Default canonicalizer: sorts every order-independent child collection.
     */
    static Canonicalizer sorting() {
        return SortingCanonicalizer.INSTANCE;
    }

    /**
     * Returns every node unchanged. Exposes the raw rebuild order.
     */
    static Canonicalizer identity() {
        return Identity.INSTANCE;
    }

    enum Identity implements Canonicalizer {
        INSTANCE;

        @Override
        public Term canonicalize(Term term) {
            return term;
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
            return expr;
        }

        @Override
        public Channel canonicalize(Channel channel) {
            return channel;
        }
    }
}
