package com.tyron.lylex.lang.lilypond;

import com.tyron.lylex.api.editor.TokenSpan;
import com.tyron.lylex.api.editor.TokenizedDocument;
import com.tyron.lylex.api.lexer.TokenCategory;
import com.tyron.lylex.core.settings.DocumentSettings;
import com.tyron.lylex.testFramework.BaseLexerTest;
import com.tyron.lylex.testFramework.TestLogging;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.logging.Level;

import static org.junit.jupiter.api.Assertions.*;

public class LilyPondLanguageSupportTest extends BaseLexerTest {

    private final LilyPondLanguageSupport support = new LilyPondLanguageSupport(DocumentSettings.builtIn());

    @Test
    public void handlesLilyPondAndSchemeFiles() {
        assertTrue(support.canHandle("score.ly"));
        assertTrue(support.canHandle("include/defs.ILY"));
        assertTrue(support.canHandle("music.lyi"));
        assertTrue(support.canHandle("init.scm"));
        assertFalse(support.canHandle("notes.txt"));
        assertEquals(Modes.names(), support.getModes());
        assertSame(Modes.grammar(Modes.SCHEME), support.getGrammar(Modes.SCHEME));
    }

    @Test
    public void createsDocumentsForTheGuessedMode() {
        assertEquals(Modes.LILYPOND, support.createDocument("{ c d e }").getGrammar().getName());
        assertEquals(Modes.SCHEME, support.createDocument("(define x 1)").getGrammar().getName());
        assertEquals(Modes.SCHEME, support.createDocument("init.scm", "x").getGrammar().getName());
        assertEquals(Modes.LILYPOND, support.createDocument("a.ly", "x").getGrammar().getName());
    }

    @Test
    public void configuredModeWins() {
        LilyPondLanguageSupport text = new LilyPondLanguageSupport(DocumentSettings.builder().mode("text").build());
        assertEquals(Modes.TEXT, text.createDocument("{ c }").getGrammar().getName());

        LilyPondLanguageSupport unknown = new LilyPondLanguageSupport(DocumentSettings.builder().mode("latex").build());
        try (TestLogging.LogCapture log = TestLogging.capture(LilyPondLanguageSupport.class, Level.WARNING)) {
            assertEquals(Modes.SCHEME, unknown.createDocument("(x)").getGrammar().getName());
            assertEquals(List.of("settings key=mode value=latex ignored reason=unknown mode"), log.getMessages());
        }
    }

    @Test
    public void highlightsDocumentTokens() {
        String text = "{ c4 % note\n}";
        TokenizedDocument document = support.createDocument(text);

        List<TokenSpan> spans = support.createHighlighter().highlight(document, 0, text.length());

        assertEquals(List.of(
                new TokenSpan(0, 1, TokenCategory.DELIMITER),
                new TokenSpan(2, 2, TokenCategory.MUSIC),
                new TokenSpan(5, 6, TokenCategory.COMMENT),
                new TokenSpan(12, 1, TokenCategory.DELIMITER)), spans);

        document.applyEdit(2, 0, "<c e>");
        List<TokenSpan> edited = support.createHighlighter().highlight(document, 0, document.getTextLength());
        assertEquals(new TokenSpan(2, 1, TokenCategory.DELIMITER), edited.get(1));
        assertEquals(new TokenSpan(3, 1, TokenCategory.MUSIC), edited.get(2));
    }

    @Test
    public void slursAndSchemeListsFindTheirPartner() {
        String text = "{ c8( d) #(x) }";
        TokenizedDocument document = support.createDocument(text);

        assertEquals(7, document.findMatch(document.tokenAt(4)).start());
        assertEquals(12, document.findMatch(document.tokenAt(9)).start());
        assertEquals(9, document.findMatch(document.tokenAt(12)).start());
        assertEquals(14, document.findMatch(document.tokenAt(0)).start());
        assertNull(document.findMatch(document.tokenAt(2)));
    }
}
