package com.tyron.lylex.api.editor;

/**
 * Represents a single text change in a {@link TokenizedDocument}, delivered after the tokens
 * have been updated.
 *
 * The replaced range {@code [startOffset, startOffset + removedLength)} is in offsets of the
 * text before the change.
 */
public final class DocumentEvent {

    private final TokenizedDocument document;
    private final int startOffset;
    private final int removedLength;
    private final String insertedText;
    private final EditResult editResult;

    public DocumentEvent(TokenizedDocument document, int startOffset, int removedLength, String insertedText,
                         EditResult editResult) {
        this.document = document;
        this.startOffset = startOffset;
        this.removedLength = removedLength;
        this.insertedText = insertedText;
        this.editResult = editResult;
    }

    public TokenizedDocument getDocument() {
        return document;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public int getRemovedLength() {
        return removedLength;
    }

    public String getInsertedText() {
        return insertedText;
    }

    /**
     * @return end of the inserted text in the new document
     */
    public int getNewEndOffset() {
        return startOffset + insertedText.length();
    }

    public EditResult getEditResult() {
        return editResult;
    }
}
