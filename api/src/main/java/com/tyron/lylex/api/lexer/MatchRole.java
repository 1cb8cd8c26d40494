package com.tyron.lylex.api.lexer;

/**
 * How a token kind takes part in bracket matching.
 *
 * A {@link #START} token pairs with the next unbalanced {@link #END} token of the same
 * {@link TokenKind#matchName()} forward in the text.
 */
public enum MatchRole {
    NONE,
    START,
    END
}
