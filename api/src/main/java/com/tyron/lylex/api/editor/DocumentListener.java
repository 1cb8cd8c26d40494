package com.tyron.lylex.api.editor;

/**
 * Listener for {@link TokenizedDocument} changes.
 */
public interface DocumentListener {

    /**
     * Fired after the document has been modified and re-lexed.
     */
    void documentChanged(DocumentEvent event);
}
