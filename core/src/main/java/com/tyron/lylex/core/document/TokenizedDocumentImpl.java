package com.tyron.lylex.core.document;

import com.tyron.lylex.api.editor.DocumentEvent;
import com.tyron.lylex.api.editor.DocumentListener;
import com.tyron.lylex.api.editor.EditResult;
import com.tyron.lylex.api.editor.TokenizedDocument;
import com.tyron.lylex.api.lexer.Grammar;
import com.tyron.lylex.api.lexer.MatchRole;
import com.tyron.lylex.api.lexer.StateStack;
import com.tyron.lylex.api.lexer.Token;
import com.tyron.lylex.api.lexer.TokenKind;
import com.tyron.lylex.api.lexer.TokenRef;
import com.tyron.lylex.api.lexer.TokenStream;
import com.tyron.lylex.api.tree.TokenTree;
import com.tyron.lylex.api.tree.TreeElement;
import com.tyron.lylex.core.lexer.StatefulLexer;
import com.tyron.lylex.core.settings.DocumentSettings;
import com.tyron.lylex.core.tree.TokenTreeBuilder;
import com.tyron.lylex.core.tree.TreeNode;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.ConcurrentModificationException;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * In-memory {@link TokenizedDocument} that re-lexes only the lines disturbed by an edit.
 *
 * The text is kept as lines, each holding the state it starts in, the state it ends in and its
 * tokens. Lines are lexed independently given their start state, so after an edit lexing
 * restarts at the start of the first touched line and stops at the first following line whose
 * stored start state equals the newly computed one. From there on the old lines and their
 * {@link Token} objects are reused; only their offsets move.
 *
 * When no such line is found within {@link DocumentSettings#getResyncLineLimit()} lines, the
 * rest of the document is lexed without comparing states.
 *
 * Not thread-safe: the owner must serialize edits and reads.
 */
public final class TokenizedDocumentImpl implements TokenizedDocument {

    private static final Logger LOG = Logger.getLogger(TokenizedDocumentImpl.class.getName());

    private final Grammar grammar;
    private final StatefulLexer lexer;
    private final DocumentSettings settings;
    private final StringBuilder text;
    private final ArrayList<Line> lines = new ArrayList<>();
    private final CopyOnWriteArrayList<DocumentListener> listeners = new CopyOnWriteArrayList<>();

    private TreeNode root;
    private long modificationStamp;
    private EditResult lastEdit;

    public TokenizedDocumentImpl(@NotNull Grammar grammar) {
        this(grammar, "");
    }

    public TokenizedDocumentImpl(@NotNull Grammar grammar, @Nullable String initialText) {
        this(grammar, initialText, DocumentSettings.defaults());
    }

    public TokenizedDocumentImpl(@NotNull Grammar grammar, @Nullable String initialText, @NotNull DocumentSettings settings) {
        this(grammar, initialText, settings, grammar.initialStack());
    }

    /**
     * @param initialState the state stack the first line starts in
     */
    public TokenizedDocumentImpl(@NotNull Grammar grammar, @Nullable String initialText,
                                 @NotNull DocumentSettings settings, @NotNull StateStack initialState) {
        this.grammar = Objects.requireNonNull(grammar, "grammar");
        this.settings = Objects.requireNonNull(settings, "settings");
        Objects.requireNonNull(initialState, "initialState");
        this.lexer = new StatefulLexer(grammar);
        this.text = new StringBuilder(initialText != null ? initialText : "");

        lexRegion(0, text.length(), initialState, lines);
        for (int i = 0; i < lines.size(); i++) {
            lines.get(i).index = i;
        }
        TokenTreeBuilder builder = new TokenTreeBuilder(initialState.ancestor(1));
        for (Line line : lines) {
            for (int i = 0; i < line.tokens.size(); i++) {
                builder.add(line.view(i));
            }
        }
        root = builder.finish();
    }

    @Override
    public Grammar getGrammar() {
        return grammar;
    }

    public DocumentSettings getSettings() {
        return settings;
    }

    @Override
    public String getText() {
        return text.toString();
    }

    @Override
    public int getTextLength() {
        return text.length();
    }

    @Override
    public String getText(int start, int length) {
        int len = text.length();
        if (start < 0 || length < 0 || start > len - length) {
            throw new IndexOutOfBoundsException("getText start=" + start + " length=" + length + " is out of bounds for length=" + len);
        }
        return text.substring(start, start + length);
    }

    @Override
    public void applyEdit(int startOffset, int removedLength, String insertedText) {
        Objects.requireNonNull(insertedText, "insertedText");
        int len = text.length();
        if (startOffset < 0 || removedLength < 0 || startOffset > len - removedLength) {
            throw new IndexOutOfBoundsException("edit range [" + startOffset + ", " + (startOffset + removedLength)
                    + ") is out of bounds for length=" + len);
        }
        if (removedLength == 0 && insertedText.isEmpty()) {
            return;
        }

        int oldEnd = startOffset + removedLength;
        int anchorIndex = lineIndexAt(startOffset);
        int lastIndex = lineIndexAt(oldEnd);
        if (lines.get(lastIndex).end() == len) {
            // the region reaches the end of the text, so it also relexes the empty last line
            lastIndex = lines.size() - 1;
        }
        Line anchor = lines.get(anchorIndex);
        Line last = lines.get(lastIndex);
        int delta = insertedText.length() - removedLength;

        TokenTreeBuilder.Resumed resume = TokenTreeBuilder.resume(root, anchor.start);

        text.replace(startOffset, oldEnd, insertedText);

        List<Line> fresh = new ArrayList<>();
        int regionEnd = last.end() + delta;
        StateStack state = lexRegion(anchor.start, regionEnd, anchor.startState, fresh);

        int next = lastIndex + 1;
        int position = regionEnd;
        int limit = settings.getResyncLineLimit();
        int compared = 0;
        boolean comparing = true;
        boolean resynced = false;
        while (next < lines.size()) {
            Line old = lines.get(next);
            if (comparing) {
                if (state.equals(old.startState)) {
                    resynced = true;
                    break;
                }
                if (limit > 0 && ++compared >= limit) {
                    comparing = false;
                    LOG.fine("relex resync abandoned afterLines=" + compared + " line=" + next);
                }
            }
            Line relexed = lexLine(position, old.length, state);
            fresh.add(relexed);
            state = relexed.endState;
            position += old.length;
            next++;
        }

        List<Line> replaced = lines.subList(anchorIndex, next);
        for (Line line : replaced) {
            line.detached = true;
        }
        replaced.clear();
        lines.addAll(anchorIndex, fresh);

        int reusedFrom = anchorIndex + fresh.size();
        for (int i = anchorIndex; i < lines.size(); i++) {
            Line line = lines.get(i);
            line.index = i;
            if (i >= reusedFrom) {
                line.start += delta;
            }
        }

        updateTree(resume, anchorIndex, resynced ? reusedFrom : -1);

        modificationStamp++;
        lastEdit = new EditResult(anchorIndex, fresh.size(), resynced ? reusedFrom : -1,
                resynced ? lines.size() - reusedFrom : 0, delta);
        if (LOG.isLoggable(Level.FINE)) {
            LOG.fine("relex offset=" + startOffset + " removed=" + removedLength + " inserted=" + insertedText.length()
                    + " anchorLine=" + anchorIndex + " relexedLines=" + lastEdit.relexedLines()
                    + " resyncLine=" + lastEdit.resyncLine() + " reusedLines=" + lastEdit.reusedLines());
        }

        DocumentEvent event = new DocumentEvent(this, startOffset, removedLength, insertedText, lastEdit);
        for (DocumentListener listener : listeners) {
            listener.documentChanged(event);
        }
    }

    @Nullable
    @Override
    public TokenRef tokenAt(int offset) {
        int len = text.length();
        if (offset < 0 || offset > len) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + len);
        }
        if (len == 0) {
            return null;
        }
        int at = offset == len ? len - 1 : offset;
        Line line = lines.get(lineIndexAt(at));
        return line.view(line.tokenIndexAt(at - line.start));
    }

    @Override
    public Iterable<TokenRef> tokensInRange(int start, int end) {
        return tokensInRange(start, end, true);
    }

    @Override
    public Iterable<TokenRef> tokensInRange(int start, int end, boolean partial) {
        int len = text.length();
        if (start < 0 || end < start || end > len) {
            throw new IndexOutOfBoundsException("range [" + start + ", " + end + ") is out of bounds for length=" + len);
        }
        return () -> new RangeIterator(start, end, partial);
    }

    @Override
    public Iterable<TokenRef> tokensBackward(int offset) {
        int len = text.length();
        if (offset < 0 || offset > len) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + len);
        }
        return () -> new BackwardIterator(offset);
    }

    @Nullable
    @Override
    public TokenRef findMatch(TokenRef token) {
        TokenKind kind = token.kind();
        String name = kind.matchName();
        MatchRole role = kind.matchRole();
        if (name == null || role == MatchRole.NONE) {
            return null;
        }
        Iterable<TokenRef> candidates = role == MatchRole.START
                ? tokensInRange(token.end(), text.length())
                : tokensBackward(token.start());
        MatchRole opposite = role == MatchRole.START ? MatchRole.END : MatchRole.START;
        int nesting = 0;
        for (TokenRef candidate : candidates) {
            TokenKind k = candidate.kind();
            if (!name.equals(k.matchName())) {
                continue;
            }
            if (k.matchRole() == role) {
                nesting++;
            } else if (k.matchRole() == opposite) {
                if (nesting == 0) {
                    return candidate;
                }
                nesting--;
            }
        }
        return null;
    }

    @Override
    public List<TokenRef> tokens() {
        List<TokenRef> result = new ArrayList<>();
        for (Line line : lines) {
            for (int i = 0; i < line.tokens.size(); i++) {
                result.add(line.view(i));
            }
        }
        return result;
    }

    @Override
    public TokenTree tree() {
        return root;
    }

    @Override
    public StateStack stateAt(int offset) {
        int len = text.length();
        if (offset < 0 || offset > len) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + len);
        }
        if (offset == len) {
            return lines.get(lines.size() - 1).endState;
        }
        Line line = lines.get(lineIndexAt(offset));
        return line.tokens.get(line.tokenIndexAt(offset - line.start)).state();
    }

    @Override
    public int getLineCount() {
        return lines.size();
    }

    @Override
    public int getLineOfOffset(int offset) {
        int len = text.length();
        if (offset < 0 || offset > len) {
            throw new IndexOutOfBoundsException("offset " + offset + " is out of bounds for length=" + len);
        }
        return lineIndexAt(offset);
    }

    @Override
    public int getLineStartOffset(int line) {
        return lines.get(line).start;
    }

    @Override
    public List<TokenRef> getLineTokens(int lineIndex) {
        Line line = lines.get(lineIndex);
        List<TokenRef> result = new ArrayList<>(line.tokens.size());
        for (int i = 0; i < line.tokens.size(); i++) {
            result.add(line.view(i));
        }
        return result;
    }

    /**
     * @return the state the given line starts in
     */
    public StateStack getLineStartState(int line) {
        return lines.get(line).startState;
    }

    @Nullable
    @Override
    public EditResult getLastEdit() {
        return lastEdit;
    }

    @Override
    public void addDocumentListener(DocumentListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    @Override
    public void removeDocumentListener(DocumentListener listener) {
        listeners.remove(listener);
    }

    @Override
    public long getModificationStamp() {
        return modificationStamp;
    }

    /**
     * Lexes {@code [from, to)} line by line, appending to {@code out}.
     * A region ending at the end of the text always gets a last, possibly empty, line.
     *
     * @return the state at {@code to}
     */
    private StateStack lexRegion(int from, int to, StateStack state, List<Line> out) {
        int position = from;
        while (true) {
            int newline = indexOfNewline(position, to);
            if (newline < 0 && position == to && to != text.length()) {
                return state;
            }
            int lineEnd = newline < 0 ? to : newline + 1;
            Line line = lexLine(position, lineEnd - position, state);
            out.add(line);
            state = line.endState;
            position = lineEnd;
            if (newline < 0) {
                return state;
            }
        }
    }

    private Line lexLine(int start, int length, StateStack state) {
        if (length == 0) {
            return new Line(start, 0, state, state, Collections.emptyList());
        }
        TokenStream stream = lexer.tokenize(text.substring(start, start + length), 0, state);
        List<Token> tokens = stream.toList();
        return new Line(start, length, state, stream.state(), Collections.unmodifiableList(tokens));
    }

    private int indexOfNewline(int from, int to) {
        for (int i = from; i < to; i++) {
            if (text.charAt(i) == '\n') {
                return i;
            }
        }
        return -1;
    }

    /**
     * @return index of the last line starting at or before {@code offset}
     */
    private int lineIndexAt(int offset) {
        int lo = 0;
        int hi = lines.size() - 1;
        while (lo < hi) {
            int mid = (lo + hi + 1) >>> 1;
            if (lines.get(mid).start <= offset) {
                lo = mid;
            } else {
                hi = mid - 1;
            }
        }
        return lo;
    }

    /**
     * Feeds the lines from the anchor on to the resumed tree builder. Once a token is reached
     * that starts a cut off subtree on a reused line, the old subtrees are put back instead.
     */
    private void updateTree(TokenTreeBuilder.Resumed resume, int anchorIndex, int reusedFrom) {
        TokenTreeBuilder builder = resume.getBuilder();

        Map<DocumentToken, int[]> reusable = new IdentityHashMap<>();
        if (reusedFrom >= 0) {
            for (int level = 0; level < resume.getLevels(); level++) {
                List<TreeElement> detached = resume.getDetached(level);
                for (int j = detached.size() - 1; j >= 0; j--) {
                    DocumentToken first = firstLeaf(detached.get(j));
                    Line line = first.line();
                    if (line.detached || line.index < reusedFrom) {
                        break;
                    }
                    reusable.put(first, new int[]{level, j});
                }
            }
        }

        feed:
        for (int i = anchorIndex; i < lines.size(); i++) {
            Line line = lines.get(i);
            for (int t = 0; t < line.tokens.size(); t++) {
                DocumentToken view = line.view(t);
                int[] at = reusable.isEmpty() ? null : reusable.get(view);
                if (at != null && resume.reattach(at[0], at[1], view)) {
                    break feed;
                }
                builder.add(view);
            }
        }
        root = builder.finish();
    }

    private static DocumentToken firstLeaf(TreeElement element) {
        TreeElement e = element;
        while (!e.isLeaf()) {
            e = ((TokenTree) e).children().get(0);
        }
        return (DocumentToken) e;
    }

    private abstract class TokenIterator implements Iterator<TokenRef> {

        private final long stamp = modificationStamp;

        final void checkStamp() {
            if (stamp != modificationStamp) {
                throw new ConcurrentModificationException("document was edited while iterating tokens");
            }
        }
    }

    private final class RangeIterator extends TokenIterator {

        private final int end;
        private final boolean partial;
        private final boolean single;

        private int lineIndex;
        private int tokenIndex;
        private boolean finished;

        RangeIterator(int start, int end, boolean partial) {
            this.end = end;
            this.partial = partial;
            this.single = partial && start == end;
            if (start >= text.length() || (!partial && start == end)) {
                finished = true;
                return;
            }
            lineIndex = lineIndexAt(start);
            Line line = lines.get(lineIndex);
            tokenIndex = line.tokenIndexAt(start - line.start);
            if (!partial && line.start + line.tokens.get(tokenIndex).start() < start) {
                tokenIndex++;
            }
        }

        @Override
        public boolean hasNext() {
            checkStamp();
            if (finished) {
                return false;
            }
            while (lineIndex < lines.size() && tokenIndex >= lines.get(lineIndex).tokens.size()) {
                lineIndex++;
                tokenIndex = 0;
            }
            if (lineIndex >= lines.size()) {
                finished = true;
                return false;
            }
            Line line = lines.get(lineIndex);
            Token token = line.tokens.get(tokenIndex);
            boolean outside = partial ? line.start + token.start() >= end : line.start + token.end() > end;
            if (!single && outside) {
                finished = true;
                return false;
            }
            return true;
        }

        @Override
        public TokenRef next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            DocumentToken view = lines.get(lineIndex).view(tokenIndex++);
            if (single) {
                finished = true;
            }
            return view;
        }
    }

    private final class BackwardIterator extends TokenIterator {

        private int lineIndex;
        private int tokenIndex;

        BackwardIterator(int offset) {
            if (offset == 0) {
                lineIndex = -1;
                return;
            }
            lineIndex = lineIndexAt(offset - 1);
            Line line = lines.get(lineIndex);
            tokenIndex = line.tokenIndexAt(offset - 1 - line.start);
        }

        @Override
        public boolean hasNext() {
            checkStamp();
            while (lineIndex >= 0 && tokenIndex < 0) {
                lineIndex--;
                if (lineIndex >= 0) {
                    tokenIndex = lines.get(lineIndex).tokens.size() - 1;
                }
            }
            return lineIndex >= 0;
        }

        @Override
        public TokenRef next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            return lines.get(lineIndex).view(tokenIndex--);
        }
    }
}
