package com.tyron.lylex.core.document;

import com.tyron.lylex.api.lexer.StateStack;
import com.tyron.lylex.api.lexer.Token;

import java.util.List;

/**
 * One line of a document with its tokens.
 *
 * Token offsets are relative to the line start, so the tokens survive edits before the line;
 * only {@link #start} and {@link #index} move. A line includes its trailing line feed.
 */
final class Line {

    int start;
    int index;
    boolean detached;

    final int length;
    final StateStack startState;
    final StateStack endState;
    final List<Token> tokens;

    private DocumentToken[] views;

    Line(int start, int length, StateStack startState, StateStack endState, List<Token> tokens) {
        this.start = start;
        this.length = length;
        this.startState = startState;
        this.endState = endState;
        this.tokens = tokens;
    }

    int end() {
        return start + length;
    }

    /**
     * @return the shared live view of the token at {@code i}
     */
    DocumentToken view(int i) {
        if (views == null) {
            views = new DocumentToken[tokens.size()];
        }
        DocumentToken view = views[i];
        if (view == null) {
            view = new DocumentToken(this, tokens.get(i));
            views[i] = view;
        }
        return view;
    }

    /**
     * @return index of the token containing the line relative offset, or -1
     */
    int tokenIndexAt(int relative) {
        int lo = 0;
        int hi = tokens.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            Token t = tokens.get(mid);
            if (relative < t.start()) {
                hi = mid - 1;
            } else if (relative >= t.end()) {
                lo = mid + 1;
            } else {
                return mid;
            }
        }
        return -1;
    }

    @Override
    public String toString() {
        return "Line#" + index + "@" + start + "+" + length + " " + startState + "->" + endState;
    }
}
