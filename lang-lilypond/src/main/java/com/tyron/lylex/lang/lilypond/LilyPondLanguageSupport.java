package com.tyron.lylex.lang.lilypond;

import com.tyron.lylex.api.editor.SyntaxHighlighter;
import com.tyron.lylex.api.editor.TokenizedDocument;
import com.tyron.lylex.api.language.LanguageSupport;
import com.tyron.lylex.api.lexer.Grammar;
import com.tyron.lylex.core.document.TokenizedDocumentImpl;
import com.tyron.lylex.core.highlight.TokenSyntaxHighlighter;
import com.tyron.lylex.core.settings.DocumentSettings;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;

public class LilyPondLanguageSupport implements LanguageSupport {

    private static final Logger LOG = Logger.getLogger(LilyPondLanguageSupport.class.getName());

    private static final List<String> EXTENSIONS = List.of(".ly", ".ily", ".lyi", ".scm");

    private final DocumentSettings settings;

    public LilyPondLanguageSupport() {
        this(DocumentSettings.defaults());
    }

    public LilyPondLanguageSupport(DocumentSettings settings) {
        this.settings = settings;
    }

    @Override
    public boolean canHandle(String fileName) {
        String name = fileName.toLowerCase(Locale.ROOT);
        for (String extension : EXTENSIONS) {
            if (name.endsWith(extension)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public Grammar getGrammar(String mode) {
        return Modes.grammar(mode);
    }

    @Override
    public Set<String> getModes() {
        return Modes.names();
    }

    /**
     * Uses the configured mode, or guesses one from the text when none is configured.
     */
    @Override
    public TokenizedDocument createDocument(String text) {
        return new TokenizedDocumentImpl(Modes.grammar(modeFor(text)), text, settings);
    }

    /**
     * Scheme files are always lexed as Scheme; other names go by {@link #createDocument(String)}.
     */
    public TokenizedDocument createDocument(String fileName, String text) {
        if (fileName.toLowerCase(Locale.ROOT).endsWith(".scm")) {
            return new TokenizedDocumentImpl(Modes.grammar(Modes.SCHEME), text, settings);
        }
        return createDocument(text);
    }

    @Override
    public SyntaxHighlighter createHighlighter() {
        return new TokenSyntaxHighlighter();
    }

    String modeFor(String text) {
        String configured = settings.getMode();
        if (configured != null) {
            if (Modes.isKnown(configured)) {
                return configured;
            }
            LOG.warning("settings key=mode value=" + configured + " ignored reason=unknown mode");
        }
        return Modes.guessMode(text != null ? text : "");
    }
}
