package com.tyron.lylex.api.lexer;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Lazy sequence of tokens produced by a lexer.
 */
public interface TokenStream extends Iterator<Token> {

    /**
     * @return the offset the next token starts at
     */
    int offset();

    /**
     * @return the stack in effect at {@link #offset()}
     */
    StateStack state();

    default List<Token> toList() {
        List<Token> tokens = new ArrayList<>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }
}
