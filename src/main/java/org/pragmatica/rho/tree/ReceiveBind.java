package org.pragmatica.rho.tree;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Objects;

/**
 * One clause {@code patterns <- source} of a receive. The patterns open {@code freeCount} variables.
 */
public record ReceiveBind(ImmutableList<Channel> patterns, Channel source, int freeCount) {
    public ReceiveBind {
        Objects.requireNonNull(patterns, "patterns");
        Objects.requireNonNull(source, "source");
    }

    public static ReceiveBind of(List<Channel> patterns, Channel source) {
        var freeCount = patterns.stream()
                                .mapToInt(Channel::freeCount)
                                .sum();
        return new ReceiveBind(ImmutableList.copyOf(patterns), source, freeCount);
    }

    public static ReceiveBind of(Channel source, Channel... patterns) {
        return of(List.of(patterns), source);
    }
}
