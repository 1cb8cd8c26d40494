package com.tyron.lylex.api.lexer;

/**
 * Caller supplied condition that ends a token stream early.
 */
@FunctionalInterface
public interface StopCondition {

    StopCondition NEVER = (offset, state) -> false;

    /**
     * Evaluated before each token is produced.
     *
     * @param offset the offset the next token would start at
     * @param state  the stack in effect at that offset
     */
    boolean shouldStop(int offset, StateStack state);
}
