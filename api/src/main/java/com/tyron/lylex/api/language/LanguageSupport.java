package com.tyron.lylex.api.language;

import com.tyron.lylex.api.editor.SyntaxHighlighter;
import com.tyron.lylex.api.editor.TokenizedDocument;
import com.tyron.lylex.api.lexer.Grammar;

import java.util.Set;

/**
 * Factory interface for language services.
 */
public interface LanguageSupport {

    /**
     * @return true if this support handles the given file name (e.g. endsWith(".ly"))
     */
    boolean canHandle(String fileName);

    /**
     * @return the grammar used for text of the given mode, see {@link #getModes()}
     */
    Grammar getGrammar(String mode);

    /**
     * @return the mode names this support provides grammars for
     */
    Set<String> getModes();

    /**
     * Creates a tokenized document for the text, picking a mode for it.
     */
    TokenizedDocument createDocument(String text);

    SyntaxHighlighter createHighlighter();
}
