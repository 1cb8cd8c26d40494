package com.tyron.lylex.lang.lilypond;

import com.tyron.lylex.api.lexer.Grammar;

/**
 * LilyPond source, with Scheme expressions after {@code #} and {@code $} and LilyPond again
 * inside {@code #{ #}}.
 */
public final class LilyPondGrammar {

    public static final String NAME = "lilypond";

    private LilyPondGrammar() {
    }

    public static Grammar create() {
        Grammar.Builder builder = Grammar.builder(NAME, LyTokenKind.class);
        LilyPondStates.define(builder);
        return builder.initialState(LilyPondStates.LILYPOND).build();
    }
}
