package com.tyron.lylex.api.lexer;

import org.jetbrains.annotations.Nullable;

/**
 * The type of a {@link Token}.
 *
 * Implemented by one {@code enum} per grammar, so the set of kinds is fixed when the
 * grammar is defined.
 */
public interface TokenKind {

    String name();

    TokenCategory category();

    /**
     * @return the name shared by the start and end kinds of a bracket pair, or {@code null} if
     * this kind does not pair
     */
    @Nullable
    default String matchName() {
        return null;
    }

    default MatchRole matchRole() {
        return MatchRole.NONE;
    }

    default Indentation indentation() {
        return Indentation.NONE;
    }
}
