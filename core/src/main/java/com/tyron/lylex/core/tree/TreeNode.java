package com.tyron.lylex.core.tree;

import com.tyron.lylex.api.lexer.StateStack;
import com.tyron.lylex.api.lexer.TokenRef;
import com.tyron.lylex.api.tree.TokenTree;
import com.tyron.lylex.api.tree.TreeElement;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable {@link TokenTree} node, only changed by {@link TokenTreeBuilder}.
 *
 * Offsets are taken from the first and last leaf, so a node over live token views follows
 * the views when the text before it changes length.
 */
public final class TreeNode implements TokenTree {

    private final TreeNode parent;
    private final StateStack state;
    private final List<TreeElement> children = new ArrayList<>();
    private final List<TreeElement> readOnlyChildren = Collections.unmodifiableList(children);

    TreeNode(@Nullable TreeNode parent, StateStack state) {
        this.parent = parent;
        this.state = state;
    }

    @Override
    public int depth() {
        return state.getDepth();
    }

    @Override
    public StateStack state() {
        return state;
    }

    @Nullable
    @Override
    public TreeNode parent() {
        return parent;
    }

    @Override
    public List<TreeElement> children() {
        return readOnlyChildren;
    }

    @Override
    public int start() {
        return children.isEmpty() ? 0 : children.get(0).start();
    }

    @Override
    public int end() {
        return children.isEmpty() ? 0 : children.get(children.size() - 1).end();
    }

    @Override
    public List<TokenRef> tokens() {
        List<TokenRef> tokens = new ArrayList<>();
        collectTokens(this, tokens);
        return tokens;
    }

    @Override
    public int height() {
        int height = 0;
        for (TreeElement child : children) {
            if (!child.isLeaf()) {
                height = Math.max(height, ((TokenTree) child).height() + 1);
            }
        }
        return height;
    }

    @Nullable
    @Override
    public TokenTree nodeAt(int offset) {
        if (offset < start() || offset >= end()) {
            return null;
        }
        TokenTree node = this;
        while (true) {
            TreeElement child = childAt(node.children(), offset);
            if (child == null || child.isLeaf()) {
                return node;
            }
            node = (TokenTree) child;
        }
    }

    @Override
    public List<TokenTree> nodes() {
        List<TokenTree> nodes = new ArrayList<>();
        collectNodes(this, nodes);
        return nodes;
    }

    void add(TreeElement child) {
        children.add(child);
    }

    void addAll(List<? extends TreeElement> elements) {
        children.addAll(elements);
    }

    /**
     * Removes and returns the children from {@code index} on.
     */
    List<TreeElement> truncate(int index) {
        List<TreeElement> tail = children.subList(index, children.size());
        List<TreeElement> removed = new ArrayList<>(tail);
        tail.clear();
        return removed;
    }

    @Nullable
    private static TreeElement childAt(List<TreeElement> children, int offset) {
        int lo = 0;
        int hi = children.size() - 1;
        while (lo <= hi) {
            int mid = (lo + hi) >>> 1;
            TreeElement e = children.get(mid);
            if (offset < e.start()) {
                hi = mid - 1;
            } else if (offset >= e.end()) {
                lo = mid + 1;
            } else {
                return e;
            }
        }
        return null;
    }

    private static void collectTokens(TokenTree node, List<TokenRef> out) {
        for (TreeElement child : node.children()) {
            if (child.isLeaf()) {
                out.add((TokenRef) child);
            } else {
                collectTokens((TokenTree) child, out);
            }
        }
    }

    private static void collectNodes(TokenTree node, List<TokenTree> out) {
        out.add(node);
        for (TreeElement child : node.children()) {
            if (!child.isLeaf()) {
                collectNodes((TokenTree) child, out);
            }
        }
    }

    @Override
    public String toString() {
        return "TreeNode" + state + "@" + start() + ".." + end();
    }
}
