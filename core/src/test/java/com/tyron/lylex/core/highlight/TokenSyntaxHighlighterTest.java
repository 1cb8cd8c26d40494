package com.tyron.lylex.core.highlight;

import com.tyron.lylex.api.editor.TokenSpan;
import com.tyron.lylex.api.lexer.TokenCategory;
import com.tyron.lylex.core.TestGrammars;
import com.tyron.lylex.core.document.TokenizedDocumentImpl;
import com.tyron.lylex.core.settings.DocumentSettings;
import com.tyron.lylex.testFramework.BaseLexerTest;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TokenSyntaxHighlighterTest extends BaseLexerTest {

    @Test
    public void spansSkipWhitespaceAndMergeNeighbours() {
        String text = "a /* one\ntwo */ {b}";
        TokenizedDocumentImpl doc = new TokenizedDocumentImpl(TestGrammars.blocks(), text, DocumentSettings.builtIn());

        List<TokenSpan> spans = new TokenSyntaxHighlighter().highlight(doc, 0, text.length());

        assertEquals(List.of(
                new TokenSpan(0, 1, TokenCategory.TEXT),
                new TokenSpan(2, 13, TokenCategory.COMMENT),
                new TokenSpan(16, 1, TokenCategory.DELIMITER),
                new TokenSpan(17, 1, TokenCategory.TEXT),
                new TokenSpan(18, 1, TokenCategory.DELIMITER)), spans);
    }

    @Test
    public void spansAreClippedToTheRange() {
        String text = "alpha beta";
        TokenizedDocumentImpl doc = new TokenizedDocumentImpl(TestGrammars.blocks(), text, DocumentSettings.builtIn());

        List<TokenSpan> spans = new TokenSyntaxHighlighter().highlight(doc, 2, 8);

        assertEquals(List.of(new TokenSpan(2, 3, TokenCategory.TEXT), new TokenSpan(6, 2, TokenCategory.TEXT)), spans);
        assertTrue(new TokenSyntaxHighlighter().highlight(doc, 3, 3).isEmpty());
    }
}
