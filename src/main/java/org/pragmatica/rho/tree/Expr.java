package org.pragmatica.rho.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * Expression nodes - ground values, variables, operators and collection literals.
 */
public sealed interface Expr {

    BitIndexSet locallyFree();

    int freeCount();

    // === Ground values ===

    record GBool(boolean value) implements Expr {
        @Override
        public BitIndexSet locallyFree() {
            return BitIndexSet.empty();
        }

        @Override
        public int freeCount() {
            return 0;
        }
    }

    record GInt(long value) implements Expr {
        @Override
        public BitIndexSet locallyFree() {
            return BitIndexSet.empty();
        }

        @Override
        public int freeCount() {
            return 0;
        }
    }

    record GString(String value) implements Expr {
        public GString {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public BitIndexSet locallyFree() {
            return BitIndexSet.empty();
        }

        @Override
        public int freeCount() {
            return 0;
        }
    }

    record GUri(String value) implements Expr {
        public GUri {
            Objects.requireNonNull(value, "value");
        }

        @Override
        public BitIndexSet locallyFree() {
            return BitIndexSet.empty();
        }

        @Override
        public int freeCount() {
            return 0;
        }
    }

    // === Variables ===

    /**
     * Variable in process position. Substitution may splice a whole term in its place.
     */
    record EVar(Var v) implements Expr {
        public EVar {
            Objects.requireNonNull(v, "v");
        }

        @Override
        public BitIndexSet locallyFree() {
            return v.locallyFree();
        }

        @Override
        public int freeCount() {
            return v.freeCount();
        }
    }

    // === Operators ===

    enum UnaryOp {
        NOT("not "),
        NEG("-");

        private final String symbol;

        UnaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    enum BinaryOp {
        MULT("*"),
        DIV("/"),
        PLUS("+"),
        MINUS("-"),
        LT("<"),
        LTE("<="),
        GT(">"),
        GTE(">="),
        EQ("=="),
        NEQ("!="),
        AND("and"),
        OR("or");

        private final String symbol;

        BinaryOp(String symbol) {
            this.symbol = symbol;
        }

        public String symbol() {
            return symbol;
        }
    }

    record EUnary(UnaryOp op, Term operand) implements Expr {
        public EUnary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(operand, "operand");
        }

        @Override
        public BitIndexSet locallyFree() {
            return operand.locallyFree();
        }

        @Override
        public int freeCount() {
            return operand.freeCount();
        }
    }

    record EBinary(BinaryOp op, Term left, Term right) implements Expr {
        public EBinary {
            Objects.requireNonNull(op, "op");
            Objects.requireNonNull(left, "left");
            Objects.requireNonNull(right, "right");
        }

        @Override
        public BitIndexSet locallyFree() {
            return left.locallyFree()
                       .union(right.locallyFree());
        }

        @Override
        public int freeCount() {
            return left.freeCount() + right.freeCount();
        }
    }

    // === Collections ===

    record EList(ImmutableList<Term> elements, int freeCount, BitIndexSet locallyFree, boolean wildcard) implements Expr {
        public EList {
            Objects.requireNonNull(elements, "elements");
            Objects.requireNonNull(locallyFree, "locallyFree");
        }
    }

    record ETuple(ImmutableList<Term> elements, int freeCount, BitIndexSet locallyFree, boolean wildcard) implements Expr {
        public ETuple {
            Objects.requireNonNull(elements, "elements");
            Objects.requireNonNull(locallyFree, "locallyFree");
        }
    }

    /**
     * Set literal. Canonical form keeps elements sorted and distinct.
     */
    record ESet(ImmutableList<Term> elements, int freeCount, BitIndexSet locallyFree, boolean wildcard) implements Expr {
        public ESet {
            Objects.requireNonNull(elements, "elements");
            Objects.requireNonNull(locallyFree, "locallyFree");
        }
    }

    /**
     * Map literal. Canonical form keeps entries sorted by key with distinct keys.
     */
    record EMap(ImmutableList<KeyValuePair> entries, int freeCount, BitIndexSet locallyFree, boolean wildcard) implements Expr {
        public EMap {
            Objects.requireNonNull(entries, "entries");
            Objects.requireNonNull(locallyFree, "locallyFree");
        }
    }

    // === Factories ===

    static Expr bool(boolean value) {
        return new GBool(value);
    }

    static Expr integer(long value) {
        return new GInt(value);
    }

    static Expr string(String value) {
        return new GString(value);
    }

    static Expr uri(String value) {
        return new GUri(value);
    }

    static Expr var(Var v) {
        return new EVar(v);
    }

    static Expr bound(int index) {
        return new EVar(Var.bound(index));
    }

    static Expr not(Term operand) {
        return new EUnary(UnaryOp.NOT, operand);
    }

    static Expr neg(Term operand) {
        return new EUnary(UnaryOp.NEG, operand);
    }

    static Expr binary(BinaryOp op, Term left, Term right) {
        return new EBinary(op, left, right);
    }

    static Expr plus(Term left, Term right) {
        return binary(BinaryOp.PLUS, left, right);
    }

    static Expr eq(Term left, Term right) {
        return binary(BinaryOp.EQ, left, right);
    }

    static Expr list(Term... elements) {
        return new EList(ImmutableList.copyOf(elements),
                         freeCountOf(List.of(elements)),
                         locallyFreeOf(List.of(elements)),
                         wildcardIn(List.of(elements)));
    }

    static Expr tuple(Term... elements) {
        return new ETuple(ImmutableList.copyOf(elements),
                          freeCountOf(List.of(elements)),
                          locallyFreeOf(List.of(elements)),
                          wildcardIn(List.of(elements)));
    }

    static Expr set(Term... elements) {
        return new ESet(ImmutableList.copyOf(elements),
                        freeCountOf(List.of(elements)),
                        locallyFreeOf(List.of(elements)),
                        wildcardIn(List.of(elements)));
    }

    static Expr map(KeyValuePair... entries) {
        var terms = ImmutableList.<Term>builder();
        for (var entry : entries) {
            terms.add(entry.key(), entry.value());
        }
        var flattened = terms.build();
        return new EMap(ImmutableList.copyOf(entries),
                        freeCountOf(flattened),
                        locallyFreeOf(flattened),
                        wildcardIn(flattened));
    }

    private static int freeCountOf(List<Term> terms) {
        return terms.stream()
                    .mapToInt(Term::freeCount)
                    .sum();
    }

    private static BitIndexSet locallyFreeOf(List<Term> terms) {
        return terms.stream()
                    .map(Term::locallyFree)
                    .reduce(BitIndexSet.empty(), BitIndexSet::union);
    }

    private static boolean wildcardIn(List<Term> terms) {
        return terms.stream()
                    .anyMatch(Term::hasWildcard);
    }
}
