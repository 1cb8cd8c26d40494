package com.tyron.lylex.lang.lilypond;

import com.tyron.lylex.api.lexer.Indentation;
import com.tyron.lylex.api.lexer.MatchRole;
import com.tyron.lylex.api.lexer.TokenCategory;
import com.tyron.lylex.api.lexer.TokenKind;
import org.jetbrains.annotations.Nullable;

import static com.tyron.lylex.api.lexer.Indentation.DEDENT;
import static com.tyron.lylex.api.lexer.Indentation.INDENT;
import static com.tyron.lylex.api.lexer.MatchRole.END;
import static com.tyron.lylex.api.lexer.MatchRole.START;

/**
 * Token kinds produced by the LilyPond, Scheme and plain text grammars.
 */
public enum LyTokenKind implements TokenKind {
    WHITESPACE(TokenCategory.WHITESPACE),
    TEXT(TokenCategory.TEXT),

    LINE_COMMENT(TokenCategory.COMMENT),
    BLOCK_COMMENT_START(TokenCategory.COMMENT, null, MatchRole.NONE, INDENT),
    BLOCK_COMMENT(TokenCategory.COMMENT),
    BLOCK_COMMENT_END(TokenCategory.COMMENT, null, MatchRole.NONE, DEDENT),

    STRING_START(TokenCategory.STRING),
    STRING(TokenCategory.STRING),
    STRING_ESCAPE(TokenCategory.ESCAPE),
    STRING_END(TokenCategory.STRING),

    KEYWORD(TokenCategory.KEYWORD),
    COMMAND(TokenCategory.COMMAND),
    IDENTIFIER(TokenCategory.IDENTIFIER),
    EQUALS(TokenCategory.OPERATOR),

    NOTE(TokenCategory.MUSIC),
    REST(TokenCategory.MUSIC),
    OCTAVE(TokenCategory.MUSIC),
    DURATION(TokenCategory.MUSIC),
    ARTICULATION(TokenCategory.OPERATOR),
    NUMBER(TokenCategory.NUMBER),

    SEQUENTIAL_START(TokenCategory.DELIMITER, "bracket", START, INDENT),
    SEQUENTIAL_END(TokenCategory.DELIMITER, "bracket", END, DEDENT),
    SIMULTANEOUS_START(TokenCategory.DELIMITER, "simultaneous", START, INDENT),
    SIMULTANEOUS_END(TokenCategory.DELIMITER, "simultaneous", END, DEDENT),
    CHORD_START(TokenCategory.DELIMITER),
    CHORD_END(TokenCategory.DELIMITER),
    SLUR_START(TokenCategory.DELIMITER, "slur", START, Indentation.NONE),
    SLUR_END(TokenCategory.DELIMITER, "slur", END, Indentation.NONE),
    PHRASING_SLUR_START(TokenCategory.DELIMITER, "phrasingslur", START, Indentation.NONE),
    PHRASING_SLUR_END(TokenCategory.DELIMITER, "phrasingslur", END, Indentation.NONE),
    BEAM_START(TokenCategory.DELIMITER, "beam", START, Indentation.NONE),
    BEAM_END(TokenCategory.DELIMITER, "beam", END, Indentation.NONE),
    LIGATURE_START(TokenCategory.DELIMITER, "ligature", START, Indentation.NONE),
    LIGATURE_END(TokenCategory.DELIMITER, "ligature", END, Indentation.NONE),
    DELIMITER(TokenCategory.DELIMITER),

    MARKUP(TokenCategory.MARKUP),
    MARKUP_COMMAND(TokenCategory.MARKUP),
    MARKUP_WORD(TokenCategory.MARKUP),

    SCHEME_START(TokenCategory.EMBED_START),
    /** {@code #(} or {@code $(}, closed by {@link #SCHEME_CLOSE_PAREN} */
    SCHEME_LIST_START(TokenCategory.EMBED_START, "schemeparen", START, INDENT),
    SCHEME_OPEN_PAREN(TokenCategory.SCHEME, "schemeparen", START, INDENT),
    SCHEME_CLOSE_PAREN(TokenCategory.SCHEME, "schemeparen", END, DEDENT),
    SCHEME_QUOTE(TokenCategory.SCHEME),
    SCHEME_WORD(TokenCategory.SCHEME),
    SCHEME_BOOL(TokenCategory.KEYWORD),
    SCHEME_CHAR(TokenCategory.STRING),
    SCHEME_NUMBER(TokenCategory.NUMBER),
    SCHEME_COMMENT(TokenCategory.COMMENT),
    SCHEME_BLOCK_COMMENT_START(TokenCategory.COMMENT, null, MatchRole.NONE, INDENT),
    SCHEME_BLOCK_COMMENT_END(TokenCategory.COMMENT, null, MatchRole.NONE, DEDENT),

    LILYPOND_START(TokenCategory.EMBED_START, "schemelily", START, INDENT),
    LILYPOND_END(TokenCategory.EMBED_END, "schemelily", END, DEDENT),

    ERROR(TokenCategory.ERROR);

    private final TokenCategory category;
    private final String matchName;
    private final MatchRole matchRole;
    private final Indentation indentation;

    LyTokenKind(TokenCategory category) {
        this(category, null, MatchRole.NONE, Indentation.NONE);
    }

    LyTokenKind(TokenCategory category, @Nullable String matchName, MatchRole matchRole, Indentation indentation) {
        this.category = category;
        this.matchName = matchName;
        this.matchRole = matchRole;
        this.indentation = indentation;
    }

    @Override
    public TokenCategory category() {
        return category;
    }

    @Nullable
    @Override
    public String matchName() {
        return matchName;
    }

    @Override
    public MatchRole matchRole() {
        return matchRole;
    }

    @Override
    public Indentation indentation() {
        return indentation;
    }
}
