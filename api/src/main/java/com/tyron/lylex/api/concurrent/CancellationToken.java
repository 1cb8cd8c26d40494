package com.tyron.lylex.api.concurrent;

import java.util.concurrent.CancellationException;

/**
 * Cooperative cancellation token.
 *
 * Long running loops, such as a lexer over a very large text, call {@link #throwIfCancelled()}
 * between steps.
 */
public interface CancellationToken {

    CancellationToken NONE = () -> false;

    boolean isCancelled();

    default void throwIfCancelled() {
        if (isCancelled()) {
            throw new CancellationException();
        }
    }
}
