package com.tyron.lylex.api.editor;

import com.tyron.lylex.api.lexer.TokenCategory;

/**
 * A data object representing a range of text to style.
 */
public record TokenSpan(int start, int length, TokenCategory category) {

    public int end() {
        return start + length;
    }
}
