package com.tyron.lylex.api.lexer;

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable stack of lexer states, the lexing context at a point in a text.
 *
 * Stacks share structure: pushing creates a new node pointing at its parent. Two stacks are
 * equal when their sequences of state names are equal, regardless of identity.
 */
public final class StateStack {

    private final LexerState top;
    private final StateStack parent;
    private final int depth;
    private final int hash;

    private StateStack(LexerState top, @Nullable StateStack parent) {
        this.top = top;
        this.parent = parent;
        this.depth = parent == null ? 1 : parent.depth + 1;
        this.hash = (parent == null ? 0 : parent.hash * 31) + top.getName().hashCode();
    }

    public static StateStack root(@NotNull LexerState state) {
        return new StateStack(Objects.requireNonNull(state, "state"), null);
    }

    public StateStack push(@NotNull LexerState state) {
        return new StateStack(Objects.requireNonNull(state, "state"), this);
    }

    /**
     * Leaves the current state; the root is kept.
     */
    public StateStack pop() {
        return parent == null ? this : parent;
    }

    public StateStack pop(int count) {
        StateStack result = this;
        for (int i = 0; i < count && result.parent != null; i++) {
            result = result.parent;
        }
        return result;
    }

    public StateStack switchTo(@NotNull LexerState state) {
        return parent == null ? root(state) : parent.push(state);
    }

    public LexerState getTop() {
        return top;
    }

    public String getTopName() {
        return top.getName();
    }

    @Nullable
    public StateStack getParent() {
        return parent;
    }

    /**
     * Number of states on the stack; a root stack has depth 1.
     */
    public int getDepth() {
        return depth;
    }

    public boolean isRoot() {
        return parent == null;
    }

    /**
     * @return the prefix of this stack with the given depth
     */
    public StateStack ancestor(int depth) {
        if (depth < 1 || depth > this.depth) {
            throw new IndexOutOfBoundsException("depth " + depth + " is out of bounds for stack depth " + this.depth);
        }
        StateStack result = this;
        while (result.depth > depth) {
            result = result.parent;
        }
        return result;
    }

    /**
     * @return state names from the bottom of the stack to the top
     */
    public List<String> getNames() {
        List<String> names = new ArrayList<>(depth);
        for (StateStack s = this; s != null; s = s.parent) {
            names.add(s.top.getName());
        }
        Collections.reverse(names);
        return names;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StateStack)) return false;
        StateStack a = this;
        StateStack b = (StateStack) o;
        if (a.depth != b.depth || a.hash != b.hash) return false;
        while (a != null && a != b) {
            if (!a.top.getName().equals(b.top.getName())) return false;
            a = a.parent;
            b = b.parent;
        }
        return true;
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return getNames().toString();
    }
}
