package com.tyron.lylex.api.lexer;

/**
 * Closed set of token classes shared by all grammars.
 *
 * Grammars declare their own {@link TokenKind} enums; consumers such as highlighters
 * only need to switch over this enum.
 */
public enum TokenCategory {
    TEXT,
    WHITESPACE,
    COMMENT,
    STRING,
    ESCAPE,
    NUMBER,
    KEYWORD,
    COMMAND,
    IDENTIFIER,
    MUSIC,
    DELIMITER,
    OPERATOR,
    MARKUP,
    SCHEME,
    EMBED_START,
    EMBED_END,
    ERROR
}
