package com.tyron.lylex.lang.lilypond;

import com.tyron.lylex.api.lexer.Grammar;

/**
 * Scheme files as used with LilyPond; {@code #{ #}} embeds LilyPond music.
 */
public final class SchemeGrammar {

    public static final String NAME = "scheme";

    private SchemeGrammar() {
    }

    public static Grammar create() {
        Grammar.Builder builder = Grammar.builder(NAME, LyTokenKind.class);
        LilyPondStates.define(builder);
        return builder.initialState(LilyPondStates.SCHEME).build();
    }
}
