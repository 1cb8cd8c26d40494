package com.tyron.lylex.lang.lilypond;

import com.tyron.lylex.api.lexer.Grammar;
import com.tyron.lylex.api.lexer.Rule;

import java.util.List;

/**
 * Words and whitespace, for text that is neither LilyPond nor Scheme.
 */
public final class PlainTextGrammar {

    public static final String NAME = "text";

    private PlainTextGrammar() {
    }

    public static Grammar create() {
        return Grammar.builder(NAME, LyTokenKind.class)
                .defineState("text", List.of(
                        Rule.of("\\s+", LyTokenKind.WHITESPACE),
                        Rule.of("\\S+", LyTokenKind.TEXT)), LyTokenKind.TEXT)
                .build();
    }
}
