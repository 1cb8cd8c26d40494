package com.tyron.lylex.api.lexer;

/**
 * The effect a token kind has on the indentation of the lines after it.
 */
public enum Indentation {
    NONE,
    /** the next line indents one level more */
    INDENT,
    /** the next line indents one level less */
    DEDENT
}
