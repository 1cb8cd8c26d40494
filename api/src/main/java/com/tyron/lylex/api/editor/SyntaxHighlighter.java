package com.tyron.lylex.api.editor;

import java.util.List;

/**
 * Turns the tokens of a document into styled ranges.
 */
public interface SyntaxHighlighter {

    /**
     * Called on the thread that owns the document, right after an edit or for a repaint.
     *
     * @return spans covering the styled parts of {@code [start, end)}, in order
     */
    List<TokenSpan> highlight(TokenizedDocument document, int start, int end);
}
