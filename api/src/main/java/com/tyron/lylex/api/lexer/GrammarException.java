package com.tyron.lylex.api.lexer;

/**
 * Thrown when a grammar definition is invalid.
 *
 * Raised while a grammar is being built, never while lexing.
 */
public class GrammarException extends RuntimeException {

    public GrammarException(String message) {
        super(message);
    }

    public GrammarException(String message, Throwable cause) {
        super(message, cause);
    }
}
