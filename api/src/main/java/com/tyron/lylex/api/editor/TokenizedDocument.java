package com.tyron.lylex.api.editor;

import com.tyron.lylex.api.lexer.Grammar;
import com.tyron.lylex.api.lexer.StateStack;
import com.tyron.lylex.api.lexer.TokenRef;
import com.tyron.lylex.api.tree.TokenTree;
import org.jetbrains.annotations.Nullable;

import java.util.List;
import java.util.Objects;

/**
 * A text buffer that keeps a complete token stream and token tree of its contents.
 *
 * Tokens cover the text without gaps or overlaps. Every mutation goes through
 * {@link #applyEdit(int, int, String)}; the token stream and tree are consistent when it
 * returns. Token views and trees handed out are borrowed: they may not be used across edits
 * unless documented otherwise.
 *
 * Implementations are not thread-safe. The owner serializes edits and reads.
 */
public interface TokenizedDocument {

    Grammar getGrammar();

    String getText();

    int getTextLength();

    /**
     * @throws IndexOutOfBoundsException if the range is outside the text
     */
    String getText(int start, int length);

    /**
     * Removes {@code removedLength} characters at {@code startOffset}, inserts {@code insertedText}
     * there and re-lexes the affected region. An edit that changes nothing is ignored.
     *
     * @throws IndexOutOfBoundsException if the removed range is outside the text
     */
    void applyEdit(int startOffset, int removedLength, String insertedText);

    /**
     * Replaces the text in {@code [start, end)}.
     */
    default void replace(int start, int end, String text) {
        if (end < start) {
            throw new IndexOutOfBoundsException("replace range [" + start + ", " + end + ") is out of bounds for length="
                    + getTextLength());
        }
        applyEdit(start, end - start, text);
    }

    default void insertString(int offset, String text) {
        applyEdit(offset, 0, text);
    }

    default void deleteString(int start, int end) {
        replace(start, end, "");
    }

    /**
     * Replaces the whole text.
     */
    default void setText(String text) {
        applyEdit(0, getTextLength(), Objects.requireNonNull(text, "text"));
    }

    void addDocumentListener(DocumentListener listener);

    void removeDocumentListener(DocumentListener listener);

    /**
     * @return a stamp that increments on every edit
     */
    long getModificationStamp();

    /**
     * @return the token containing {@code offset}; the last token when {@code offset} is the text
     * length; {@code null} for an empty document
     */
    @Nullable
    TokenRef tokenAt(int offset);

    /**
     * A lazy, restartable sequence of the tokens intersecting {@code [start, end)}. An empty range
     * yields the token containing {@code start}, if any. Iterating after an edit fails.
     */
    Iterable<TokenRef> tokensInRange(int start, int end);

    /**
     * Like {@link #tokensInRange(int, int)}; when {@code partial} is false only the tokens lying
     * completely inside {@code [start, end)} are yielded, so an empty range yields nothing.
     */
    Iterable<TokenRef> tokensInRange(int start, int end, boolean partial);

    /**
     * A lazy, restartable sequence of the tokens starting before {@code offset}, nearest first.
     * The first one is the token containing {@code offset - 1}. Iterating after an edit fails.
     */
    Iterable<TokenRef> tokensBackward(int offset);

    /**
     * Finds the other token of a bracket pair: for a token whose kind has
     * {@link com.tyron.lylex.api.lexer.MatchRole#START} the next unbalanced end token of the same
     * {@link com.tyron.lylex.api.lexer.TokenKind#matchName()}, for an end token the previous
     * unbalanced start token.
     *
     * @return the matching token, or {@code null} if {@code token} does not pair or is unmatched
     */
    @Nullable
    TokenRef findMatch(TokenRef token);

    List<TokenRef> tokens();

    TokenTree tree();

    /**
     * @return the state stack of the token containing {@code offset}, or the state at the end
     * of the text
     */
    StateStack stateAt(int offset);

    int getLineCount();

    int getLineOfOffset(int offset);

    int getLineStartOffset(int line);

    List<TokenRef> getLineTokens(int line);

    /**
     * @return statistics of the last edit, or {@code null} if the document was never edited
     */
    @Nullable
    EditResult getLastEdit();
}
