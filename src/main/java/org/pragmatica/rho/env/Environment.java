package org.pragmatica.rho.env;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSortedMap;
import org.pragmatica.rho.tree.Term;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable scope environment mapping de Bruijn indices to substituted values.
 *
 * <p>Values are stored by the absolute level at which they were put. {@code shift} counts the binders
 * entered since the last put that have no value yet: indices below the shift are bound but unresolved.
 * Index {@code k} at or above the shift refers to the value put {@code k - shift} puts ago.
 *
 * <pre>{@code
 * var env = Environment.of(outer, inner);   // inner answers index 0, outer index 1
 * env.get(1);                               // outer
 * env.shift(2).get(3);                      // outer, seen from under two fresh binders
 * env.shift(2).get(1);                      // empty - bound by one of the fresh binders
 * }</pre>
 */
public record Environment(ImmutableSortedMap<Integer, Term> values, int level, int shift) {
    private static final Environment EMPTY = new Environment(ImmutableSortedMap.of(), 0, 0);

    public Environment {
        Objects.requireNonNull(values, "values");
        Preconditions.checkArgument(level >= 0, "Negative level %s", level);
        Preconditions.checkArgument(shift >= 0, "Negative shift %s", shift);
    }

    public static Environment empty() {
        return EMPTY;
    }

    /**
     * Environment holding {@code values} put in order; the last one answers index 0.
     */
    public static Environment of(Term... values) {
        return EMPTY.putAll(List.of(values));
    }

    /**
     * Look up the value bound at {@code index}, or empty when the slot is still free at this depth.
     */
    public Optional<Term> get(int index) {
        Preconditions.checkArgument(index >= 0, "Negative index %s", index);
        var key = level + shift - index - 1;
        if (key < 0 || key >= level) {
            return Optional.empty();
        }
        return Optional.ofNullable(values.get(key));
    }

    /**
     * Enter {@code count} binders that have no value yet.
     */
    public Environment shift(int count) {
        Preconditions.checkArgument(count >= 0, "Negative shift %s", count);
        if (count == 0) {
            return this;
        }
        return new Environment(values, level, shift + count);
    }

    public int currentShift() {
        return shift;
    }

    /**
     * Bind the next level to {@code value}. It answers index 0 when there is no pending shift.
     */
    public Environment put(Term value) {
        Objects.requireNonNull(value, "value");
        var extended = ImmutableSortedMap.<Integer, Term>naturalOrder()
                                         .putAll(values)
                                         .put(level, value)
                                         .build();
        return new Environment(extended, level + 1, shift);
    }

    public Environment putAll(List<Term> newValues) {
        var result = this;
        for (var value : newValues) {
            result = result.put(value);
        }
        return result;
    }

    public int size() {
        return values.size();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }
}
