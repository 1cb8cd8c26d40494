package com.tyron.lylex.core.highlight;

import com.tyron.lylex.api.editor.SyntaxHighlighter;
import com.tyron.lylex.api.editor.TokenSpan;
import com.tyron.lylex.api.editor.TokenizedDocument;
import com.tyron.lylex.api.lexer.TokenCategory;
import com.tyron.lylex.api.lexer.TokenRef;

import java.util.ArrayList;
import java.util.List;

/**
 * Highlights straight from the document's token stream.
 *
 * Spans are clipped to the requested range. Whitespace gets no span, and touching tokens of the
 * same category are merged into one span.
 */
public class TokenSyntaxHighlighter implements SyntaxHighlighter {

    @Override
    public List<TokenSpan> highlight(TokenizedDocument document, int start, int end) {
        List<TokenSpan> spans = new ArrayList<>();
        if (start == end) {
            return spans;
        }

        int spanStart = -1;
        int spanEnd = -1;
        TokenCategory spanCategory = null;
        for (TokenRef token : document.tokensInRange(start, end)) {
            TokenCategory category = token.kind().category();
            if (category == TokenCategory.WHITESPACE) {
                continue;
            }
            int s = Math.max(start, token.start());
            int e = Math.min(end, token.end());
            if (category == spanCategory && s == spanEnd) {
                spanEnd = e;
                continue;
            }
            if (spanCategory != null) {
                spans.add(new TokenSpan(spanStart, spanEnd - spanStart, spanCategory));
            }
            spanStart = s;
            spanEnd = e;
            spanCategory = category;
        }
        if (spanCategory != null) {
            spans.add(new TokenSpan(spanStart, spanEnd - spanStart, spanCategory));
        }
        return spans;
    }
}
