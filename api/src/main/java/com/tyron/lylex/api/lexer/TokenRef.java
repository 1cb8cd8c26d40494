package com.tyron.lylex.api.lexer;

import com.tyron.lylex.api.tree.TreeElement;

/**
 * Read-only view of a positioned token.
 *
 * A {@link Token} is its own view. Documents hand out views whose offsets are absolute in the
 * document; such views stay valid until the line holding the token is re-lexed.
 */
public interface TokenRef extends TreeElement {

    Token token();

    @Override
    int start();

    @Override
    int end();

    default int length() {
        return end() - start();
    }

    default TokenKind kind() {
        return token().kind();
    }

    /**
     * @return the state stack of the region this token belongs to
     */
    default StateStack state() {
        return token().state();
    }

    default String text(CharSequence source) {
        return source.subSequence(start(), end()).toString();
    }

    @Override
    default boolean isLeaf() {
        return true;
    }
}
