package com.tyron.lylex.api.lexer;

import java.util.Objects;

/**
 * A classified span of lexed text.
 *
 * Offsets are relative to the character sequence handed to the lexer. {@code state} is the
 * stack of the region the token belongs to: the stack after the token's transition when
 * that is at least as deep as the one before, otherwise the stack before. An opening
 * delimiter therefore belongs to the region it opens and a closing delimiter to the region
 * it closes. {@code endState} is the stack in effect after the token.
 */
public record Token(TokenKind kind, int start, int length, StateStack state, StateStack endState) implements TokenRef {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(endState, "endState");
        if (start < 0 || length <= 0) {
            throw new IllegalArgumentException("invalid token span start=" + start + " length=" + length);
        }
    }

    @Override
    public Token token() {
        return this;
    }

    @Override
    public int end() {
        return start + length;
    }

    @Override
    public String toString() {
        return kind.name() + "@" + start + ".." + end();
    }
}
