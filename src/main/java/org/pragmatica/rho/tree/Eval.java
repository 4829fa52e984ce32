package org.pragmatica.rho.tree;

import java.util.Objects;

/**
 * Dereference {@code *x}: runs the process a channel names.
 */
public record Eval(Channel channel) {
    public Eval {
        Objects.requireNonNull(channel, "channel");
    }

    public static Eval of(Channel channel) {
        return new Eval(channel);
    }

    public BitIndexSet locallyFree() {
        return channel.locallyFree();
    }

    public int freeCount() {
        return channel.freeCount();
    }
}
